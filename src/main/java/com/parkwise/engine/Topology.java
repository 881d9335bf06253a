package com.parkwise.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * <p>
 * Static layout of the parking garage.
 * </p>
 *
 * <p>
 * A topology is a list of blocks, each describing a number of slots of one size
 * class in one section on one level. Slots are numbered per level starting at
 * one, in the order their blocks have been added.
 * </p>
 */
public class Topology {
    /**
     * A run of identical slots on one level.
     */
    public static class Block {
        private final int level;
        private final SizeClass size;
        private final Section section;
        private final int count;

        /**
         * Constructs a new block.
         *
         * @param level   Level of the slots.
         * @param size    Size class of the slots.
         * @param section Section of the slots.
         * @param count   Number of slots.
         */
        public Block(final int level, final SizeClass size, final Section section, final int count) {
            if (level < 1) {
                throw new IllegalArgumentException("Levels are numbered from 1");
            }
            if (count < 0) {
                throw new IllegalArgumentException("Slot count must not be negative");
            }
            this.level = level;
            this.size = Objects.requireNonNull(size);
            this.section = Objects.requireNonNull(section);
            this.count = count;
        }

        public int getLevel() {
            return this.level;
        }

        public SizeClass getSize() {
            return this.size;
        }

        public Section getSection() {
            return this.section;
        }

        public int getCount() {
            return this.count;
        }
    }

    private final List<Block> blocks;

    private Topology(final List<Block> blocks) {
        this.blocks = Collections.unmodifiableList(new ArrayList<>(blocks));
    }

    /**
     * Returns a new, empty {@link Builder}.
     *
     * @return A new builder.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * <p>
     * Returns the default layout with the given number of levels.
     * </p>
     *
     * <p>
     * Every level carries every size class in every section: 4/1/1 small,
     * 4/2/2 medium and 2/1/1 large slots in the regular/VIP/EV sections.
     * </p>
     *
     * @param levels Number of levels.
     * @return The default layout.
     */
    public static Topology standard(final int levels) {
        final var builder = builder();
        for (var level = 1; level <= levels; level++) {
            builder.add(level, SizeClass.SMALL, Section.REGULAR, 4)
                    .add(level, SizeClass.SMALL, Section.VIP, 1)
                    .add(level, SizeClass.SMALL, Section.EV, 1)
                    .add(level, SizeClass.MEDIUM, Section.REGULAR, 4)
                    .add(level, SizeClass.MEDIUM, Section.VIP, 2)
                    .add(level, SizeClass.MEDIUM, Section.EV, 2)
                    .add(level, SizeClass.LARGE, Section.REGULAR, 2)
                    .add(level, SizeClass.LARGE, Section.VIP, 1)
                    .add(level, SizeClass.LARGE, Section.EV, 1);
        }
        return builder.build();
    }

    /**
     * Returns the total number of slots in the layout.
     *
     * @return Number of slots.
     */
    public int getSlotCount() {
        return this.blocks.stream().mapToInt(Block::getCount).sum();
    }

    /**
     * Creates the slots described by the layout, ordered by level and index.
     *
     * @return Freshly created, free slots.
     */
    public List<Slot> createSlots() {
        final var slots = new ArrayList<Slot>(this.getSlotCount());
        final var levels = this.blocks.stream().mapToInt(Block::getLevel).distinct().sorted().toArray();
        for (final var level : levels) {
            var index = 1;
            for (final var block : this.blocks) {
                if (block.getLevel() != level) {
                    continue;
                }
                for (var i = 0; i < block.getCount(); i++) {
                    slots.add(new Slot(new SlotId(level, index++), block.getSize(), block.getSection()));
                }
            }
        }
        return slots;
    }

    /**
     * Builder for {@link Topology} instances.
     */
    public static class Builder {
        private final List<Block> blocks = new ArrayList<>();

        private Builder() {
        }

        /**
         * Adds a block of identical slots.
         *
         * @param level   Level of the slots.
         * @param size    Size class of the slots.
         * @param section Section of the slots.
         * @param count   Number of slots.
         * @return This builder.
         */
        public Builder add(final int level, final SizeClass size, final Section section, final int count) {
            this.blocks.add(new Block(level, size, section, count));
            return this;
        }

        /**
         * Builds the layout.
         *
         * @return The layout.
         */
        public Topology build() {
            return new Topology(this.blocks);
        }
    }
}
