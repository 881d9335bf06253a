package com.parkwise.engine;

/**
 * <p>
 * Signals that an engine operation has been rejected.
 * </p>
 *
 * <p>
 * Every rejection carries a stable {@link Kind} so that callers (e.g. the HTTP
 * adapter) can map it to their own status codes. A rejected operation never
 * leaves a partial mutation behind.
 * </p>
 */
public class ParkingException extends Exception {
    private static final long serialVersionUID = 1L;

    /**
     * Kinds of rejections.
     */
    public enum Kind {
        /**
         * No compatible free slot exists, even after trying every fallback section.
         */
        NO_SLOT_AVAILABLE,
        /**
         * The licence plate already holds an active ticket.
         */
        DUPLICATE_VEHICLE,
        /**
         * The ticket is unknown or has already been released.
         */
        INVALID_TICKET,
        /**
         * A concurrent change to the chosen slot won the race, twice.
         */
        SLOT_CONFLICT,
        /**
         * The request is malformed, e.g. it names an unknown size class.
         */
        INVALID_REQUEST;
    }

    /**
     * Kind of the rejection.
     */
    private final Kind kind;

    /**
     * Constructs a new exception.
     *
     * @param kind    Kind of the rejection.
     * @param message Human readable message.
     */
    public ParkingException(final Kind kind, final String message) {
        super(message);
        this.kind = kind;
    }

    /**
     * Returns the kind of the rejection.
     *
     * @return Kind of the rejection.
     */
    public Kind getKind() {
        return this.kind;
    }

    static ParkingException noSlotAvailable(final SizeClass size) {
        return new ParkingException(Kind.NO_SLOT_AVAILABLE,
                String.format("No suitable slot available for a %s vehicle", size.name().toLowerCase()));
    }

    static ParkingException duplicateVehicle(final String plate) {
        return new ParkingException(Kind.DUPLICATE_VEHICLE,
                String.format("Vehicle %s is already parked", plate));
    }

    static ParkingException invalidTicket(final TicketId ticketId, final String reason) {
        return new ParkingException(Kind.INVALID_TICKET, String.format("Ticket %s %s", ticketId, reason));
    }

    static ParkingException slotConflict(final SlotId slotId) {
        return new ParkingException(Kind.SLOT_CONFLICT,
                String.format("Slot %s changed concurrently", slotId));
    }

    /**
     * Constructs an exception for a malformed request.
     *
     * @param message What is wrong with the request.
     * @return The exception.
     */
    public static ParkingException invalidRequest(final String message) {
        return new ParkingException(Kind.INVALID_REQUEST, message);
    }
}
