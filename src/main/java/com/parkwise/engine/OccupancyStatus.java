package com.parkwise.engine;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Occupancy counters and occupied slots taken at one point in time.
 */
public class OccupancyStatus {
    /**
     * An occupied slot together with the ticket occupying it.
     */
    public static class Occupant {
        private final SlotView slot;
        private final Ticket ticket;

        Occupant(final SlotView slot, final Ticket ticket) {
            this.slot = slot;
            this.ticket = ticket;
        }

        public SlotView getSlot() {
            return this.slot;
        }

        public Ticket getTicket() {
            return this.ticket;
        }
    }

    private final int total;
    private final int occupied;
    private final int expired;
    private final Map<SizeClass, Integer> freeBySize;
    private final List<Occupant> occupants;
    private final Instant timestamp;

    /**
     * Constructs new counters.
     *
     * @param total      Number of slots.
     * @param occupied   Number of occupied slots.
     * @param expired    Number of vehicles parked past their time limit.
     * @param freeBySize Free slots per size class.
     * @param occupants  Occupied slots in ticket issue order.
     * @param timestamp  Time the counters were taken.
     */
    OccupancyStatus(final int total, final int occupied, final int expired, final Map<SizeClass, Integer> freeBySize,
            final List<Occupant> occupants, final Instant timestamp) {
        this.total = total;
        this.occupied = occupied;
        this.expired = expired;
        this.freeBySize = Collections.unmodifiableMap(new EnumMap<>(freeBySize));
        this.occupants = List.copyOf(occupants);
        this.timestamp = timestamp;
    }

    public int getTotal() {
        return this.total;
    }

    public int getOccupied() {
        return this.occupied;
    }

    public int getAvailable() {
        return this.total - this.occupied;
    }

    /**
     * Returns the number of vehicles still parked past their time limit.
     *
     * @return Number of overdue tickets.
     */
    public int getExpired() {
        return this.expired;
    }

    public Map<SizeClass, Integer> getFreeBySize() {
        return this.freeBySize;
    }

    public List<Occupant> getOccupants() {
        return this.occupants;
    }

    public Instant getTimestamp() {
        return this.timestamp;
    }
}
