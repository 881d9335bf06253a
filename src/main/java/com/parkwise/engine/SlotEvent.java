package com.parkwise.engine;

import java.time.Instant;
import java.util.Optional;

/**
 * <p>
 * An authoritative change of a slot's occupancy.
 * </p>
 *
 * <p>
 * Events are produced by the {@link ParkingEngine} after the change has been
 * committed and are delivered to listeners by the {@link EventBroadcaster}.
 * </p>
 */
public class SlotEvent {
    /**
     * Kinds of events.
     */
    public enum Kind {
        /**
         * A vehicle has taken a slot.
         */
        SLOT_OCCUPIED,
        /**
         * A vehicle has left a slot.
         */
        SLOT_FREED;
    }

    private final Kind kind;
    private final SlotId slotId;
    private final TicketId ticketId;
    private final Long fee;
    private final Instant timestamp;

    private SlotEvent(final Kind kind, final SlotId slotId, final TicketId ticketId, final Long fee,
            final Instant timestamp) {
        this.kind = kind;
        this.slotId = slotId;
        this.ticketId = ticketId;
        this.fee = fee;
        this.timestamp = timestamp;
    }

    /**
     * Constructs a {@link Kind#SLOT_OCCUPIED} event.
     *
     * @param slotId    Occupied slot.
     * @param ticketId  Ticket holding the slot.
     * @param timestamp Time of the change.
     * @return The event.
     */
    public static SlotEvent occupied(final SlotId slotId, final TicketId ticketId, final Instant timestamp) {
        return new SlotEvent(Kind.SLOT_OCCUPIED, slotId, ticketId, null, timestamp);
    }

    /**
     * Constructs a {@link Kind#SLOT_FREED} event.
     *
     * @param slotId    Freed slot.
     * @param ticketId  Released ticket.
     * @param fee       Fee charged for the ticket.
     * @param timestamp Time of the change.
     * @return The event.
     */
    public static SlotEvent freed(final SlotId slotId, final TicketId ticketId, final long fee,
            final Instant timestamp) {
        return new SlotEvent(Kind.SLOT_FREED, slotId, ticketId, fee, timestamp);
    }

    public Kind getKind() {
        return this.kind;
    }

    public SlotId getSlotId() {
        return this.slotId;
    }

    public TicketId getTicketId() {
        return this.ticketId;
    }

    /**
     * Returns the fee of a {@link Kind#SLOT_FREED} event.
     *
     * @return The fee, empty for {@link Kind#SLOT_OCCUPIED} events.
     */
    public Optional<Long> getFee() {
        return Optional.ofNullable(this.fee);
    }

    public Instant getTimestamp() {
        return this.timestamp;
    }

    @Override
    public String toString() {
        return String.format("SlotEvent(%s, %s, %s%s, %s)", this.kind, this.slotId, this.ticketId,
                this.fee == null ? "" : ", fee=" + this.fee, this.timestamp);
    }
}
