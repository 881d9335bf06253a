package com.parkwise.engine;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * <p>
 * Represents a single physical parking slot and its occupancy.
 * </p>
 *
 * <p>
 * Identity, size class and section never change. The occupancy is a
 * back-reference to the ticket holding the slot; the ticket, not the slot, owns
 * the right to release it. The back-reference is only ever changed with an
 * atomic compare-and-set.
 * </p>
 */
public class Slot {
    /**
     * Represents the status of a slot.
     */
    public static enum Status {
        /**
         * The slot can be allocated.
         */
        FREE,
        /**
         * The slot is held by exactly one active ticket.
         */
        OCCUPIED;
    }

    private final SlotId id;
    private final SizeClass size;
    private final Section section;

    /**
     * Ticket occupying the slot or {@code null} if the slot is free.
     */
    private final AtomicReference<TicketId> occupant = new AtomicReference<>();

    /**
     * Constructs a new free slot.
     *
     * @param id      ID of the slot.
     * @param size    Size class of the slot.
     * @param section Section the slot belongs to.
     */
    public Slot(final SlotId id, final SizeClass size, final Section section) {
        this.id = id;
        this.size = size;
        this.section = section;
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

    /**
     * Returns the current status of the slot.
     *
     * @return Status of the slot.
     */
    public Status getStatus() {
        return this.occupant.get() == null ? Status.FREE : Status.OCCUPIED;
    }

    /**
     * Returns the ticket currently occupying the slot.
     *
     * @return Occupying ticket, empty if the slot is free.
     */
    public Optional<TicketId> getOccupant() {
        return Optional.ofNullable(this.occupant.get());
    }

    /**
     * Occupies the slot if it is free.
     *
     * @param ticketId Ticket taking the slot.
     * @return Whether the slot has been occupied.
     */
    boolean occupy(final TicketId ticketId) {
        return this.occupant.compareAndSet(null, ticketId);
    }

    /**
     * Frees the slot if it is held by the given ticket.
     *
     * @param ticketId Ticket expected to hold the slot.
     * @return Whether the slot has been freed.
     */
    boolean vacate(final TicketId ticketId) {
        final var current = this.occupant.get();
        return current != null && current.equals(ticketId) && this.occupant.compareAndSet(current, null);
    }

    /**
     * Takes an immutable snapshot of the slot.
     *
     * @return Snapshot of the slot.
     */
    public SlotView view() {
        return new SlotView(this.id, this.size, this.section, this.occupant.get());
    }

    @Override
    public String toString() {
        return String.format("Slot(%s, %s, %s, %s)", this.id, this.size, this.section, this.getStatus());
    }
}
