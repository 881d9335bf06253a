package com.parkwise.engine;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * <p>
 * Registry of issued tickets.
 * </p>
 *
 * <p>
 * Enforces that a licence plate holds at most one active ticket unless the
 * caller explicitly allows several, and that a ticket is released at most once.
 * Released tickets stay in the registry as history.
 * </p>
 *
 * <p>
 * The registry is not thread-safe; {@link ParkingEngine} serializes access.
 * </p>
 */
public class TicketRegistry {
    /**
     * All tickets ever issued in issue order.
     */
    private final Map<TicketId, Ticket> tickets = new LinkedHashMap<>();

    /**
     * Active tickets by licence plate.
     */
    private final Map<String, Set<TicketId>> activeByPlate = new HashMap<>();

    private int activeCount = 0;

    /**
     * Generates a ticket ID that has not been issued yet.
     *
     * @return A fresh ticket ID.
     */
    public TicketId newTicketId() {
        var id = TicketId.generate();
        while (this.tickets.containsKey(id)) {
            id = TicketId.generate();
        }
        return id;
    }

    /**
     * Returns whether the plate currently holds an active ticket.
     *
     * @param plate Licence plate.
     * @return Whether there is an active ticket for the plate.
     */
    public boolean hasActive(final String plate) {
        final var active = this.activeByPlate.get(plate);
        return active != null && !active.isEmpty();
    }

    /**
     * Issues a new active ticket.
     *
     * @param ticketId        ID of the new ticket.
     * @param request         Request the ticket is issued for; must carry a plate.
     * @param slotId          Slot assigned to the vehicle.
     * @param entryTime       Time the vehicle entered.
     * @param timeLimit       Time the vehicle may stay.
     * @param multipleAllowed Whether the plate may hold several active tickets.
     * @return The new ticket.
     * @throws ParkingException {@code DUPLICATE_VEHICLE} if the plate already holds an
     *                          active ticket and several are not allowed.
     */
    public Ticket create(final TicketId ticketId, final AllocationRequest request, final SlotId slotId,
            final Instant entryTime, final Duration timeLimit, final boolean multipleAllowed)
            throws ParkingException {
        if (this.tickets.containsKey(ticketId)) {
            throw new IllegalStateException("Ticket " + ticketId + " has already been issued!");
        }
        final var ticket = new Ticket(ticketId, request, slotId, entryTime, timeLimit);
        if (!multipleAllowed && this.hasActive(ticket.getPlate())) {
            throw ParkingException.duplicateVehicle(ticket.getPlate());
        }
        this.tickets.put(ticketId, ticket);
        this.activeByPlate.computeIfAbsent(ticket.getPlate(), plate -> new LinkedHashSet<>()).add(ticketId);
        this.activeCount++;
        return ticket;
    }

    /**
     * Looks up a ticket, active or released.
     *
     * @param ticketId ID of the ticket.
     * @return The ticket.
     * @throws ParkingException {@code INVALID_TICKET} if the ticket is unknown.
     */
    public Ticket lookup(final TicketId ticketId) throws ParkingException {
        final var ticket = this.tickets.get(ticketId);
        if (ticket == null) {
            throw ParkingException.invalidTicket(ticketId, "does not exist");
        }
        return ticket;
    }

    /**
     * Releases an active ticket.
     *
     * @param ticketId    ID of the ticket.
     * @param releasedAt  Time the vehicle left.
     * @param fee         Fee charged.
     * @param billedHours Started hours charged.
     * @param passApplied Whether a pass waived the fee.
     * @return The released ticket.
     * @throws ParkingException {@code INVALID_TICKET} if the ticket is unknown or
     *                          already released.
     */
    public Ticket release(final TicketId ticketId, final Instant releasedAt, final long fee, final long billedHours,
            final boolean passApplied) throws ParkingException {
        final var ticket = this.lookup(ticketId);
        if (!ticket.isActive()) {
            throw ParkingException.invalidTicket(ticketId, "has already been released");
        }
        ticket.release(releasedAt, fee, billedHours, passApplied);
        final var active = this.activeByPlate.get(ticket.getPlate());
        active.remove(ticketId);
        if (active.isEmpty()) {
            this.activeByPlate.remove(ticket.getPlate());
        }
        this.activeCount--;
        return ticket;
    }

    /**
     * Returns the active tickets in issue order.
     *
     * @return Snapshot list of active tickets.
     */
    public List<Ticket> activeTickets() {
        final var active = new ArrayList<Ticket>(this.activeCount);
        for (final var ticket : this.tickets.values()) {
            if (ticket.isActive()) {
                active.add(ticket);
            }
        }
        return Collections.unmodifiableList(active);
    }

    /**
     * Returns the active tickets of a licence plate.
     *
     * @param plate Licence plate.
     * @return Snapshot list of active tickets.
     */
    public List<Ticket> activeFor(final String plate) {
        final var ids = this.activeByPlate.getOrDefault(plate, Set.of());
        final var active = new ArrayList<Ticket>(ids.size());
        for (final var id : ids) {
            active.add(this.tickets.get(id));
        }
        return Collections.unmodifiableList(active);
    }

    public int activeCount() {
        return this.activeCount;
    }
}
