package com.parkwise.engine;

/**
 * <p>
 * A <em>slot ID</em> uniquely identifies a slot by its level and its index on
 * that level.
 * </p>
 *
 * <p>
 * The textual form is {@code L<level>-<index>} with the index padded to two
 * digits, e.g. {@code L1-07}.
 * </p>
 */
public class SlotId implements Comparable<SlotId> {
    /**
     * Level the slot is on.
     */
    private final int level;

    /**
     * Index of the slot on its level.
     */
    private final int index;

    /**
     * Constructs a slot ID.
     *
     * @param level Level the slot is on.
     * @param index Index of the slot on its level.
     */
    public SlotId(final int level, final int index) {
        if (level < 0 || index < 0) {
            throw new IllegalArgumentException("Slot level and index must not be negative");
        }
        this.level = level;
        this.index = index;
    }

    /**
     * Returns the level the slot is on.
     *
     * @return Level of the slot.
     */
    public int getLevel() {
        return this.level;
    }

    /**
     * Returns the index of the slot on its level.
     *
     * @return Index of the slot.
     */
    public int getIndex() {
        return this.index;
    }

    @Override
    public int compareTo(final SlotId other) {
        final var byLevel = Integer.compare(this.level, other.level);
        return byLevel != 0 ? byLevel : Integer.compare(this.index, other.index);
    }

    @Override
    public int hashCode() {
        return 31 * this.level + this.index;
    }

    @Override
    public boolean equals(final Object other) {
        if (this == other) {
            return true;
        }
        if (other == null) {
            return false;
        }
        if (this.getClass() != other.getClass()) {
            return false;
        }
        final var that = (SlotId) other;
        return this.level == that.level && this.index == that.index;
    }

    @Override
    public String toString() {
        return String.format("L%d-%02d", this.level, this.index);
    }
}
