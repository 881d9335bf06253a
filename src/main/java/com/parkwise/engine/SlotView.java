package com.parkwise.engine;

import java.util.Optional;

/**
 * Immutable snapshot of a {@link Slot}, used for display and receipts.
 */
public class SlotView {
    private final SlotId id;
    private final SizeClass size;
    private final Section section;
    private final TicketId ticketId;

    /**
     * Constructs a new snapshot.
     *
     * @param id       ID of the slot.
     * @param size     Size class of the slot.
     * @param section  Section of the slot.
     * @param ticketId Occupying ticket or {@code null} for a free slot.
     */
    public SlotView(final SlotId id, final SizeClass size, final Section section, final TicketId ticketId) {
        this.id = id;
        this.size = size;
        this.section = section;
        this.ticketId = ticketId;
    }

    public SlotId getId() {
        return this.id;
    }

    public int getLevel() {
        return this.id.getLevel();
    }

    public SizeClass getSize() {
        return this.size;
    }

    public Section getSection() {
        return this.section;
    }

    public Slot.Status getStatus() {
        return this.ticketId == null ? Slot.Status.FREE : Slot.Status.OCCUPIED;
    }

    public boolean isFree() {
        return this.ticketId == null;
    }

    public Optional<TicketId> getTicketId() {
        return Optional.ofNullable(this.ticketId);
    }

    @Override
    public String toString() {
        return String.format("SlotView(%s, %s, %s, %s)", this.id, this.size, this.section, this.getStatus());
    }
}
