package com.parkwise.engine;

import java.time.Duration;
import java.time.Instant;

/**
 * Result of a successful release.
 */
public class Release {
    private final Ticket ticket;
    private final Duration duration;

    /**
     * Constructs a new result.
     *
     * @param ticket   Released ticket.
     * @param duration Time the vehicle was parked.
     */
    Release(final Ticket ticket, final Duration duration) {
        this.ticket = ticket;
        this.duration = duration;
    }

    public TicketId getTicketId() {
        return this.ticket.getId();
    }

    public SlotId getSlotId() {
        return this.ticket.getSlotId();
    }

    public String getPlate() {
        return this.ticket.getPlate();
    }

    public long getFee() {
        return this.ticket.getFee().orElseThrow();
    }

    public long getBilledHours() {
        return this.ticket.getBilledHours().orElseThrow();
    }

    public boolean isPassApplied() {
        return this.ticket.isPassApplied();
    }

    public Duration getDuration() {
        return this.duration;
    }

    /**
     * Returns the parking duration in fractional hours.
     *
     * @return Duration in hours.
     */
    public double getDurationHours() {
        return this.duration.toMillis() / 3_600_000.0;
    }

    public Instant getReleasedAt() {
        return this.ticket.getReleasedAt().orElseThrow();
    }

    public Ticket getTicket() {
        return this.ticket;
    }
}
