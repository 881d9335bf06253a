package com.parkwise.engine;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * <p>
 * Represents one vehicle's occupancy of a slot and its state transitions.
 * </p>
 *
 * <p>
 * A ticket is created {@link State#ACTIVE} and can only ever move to
 * {@link State#RELEASED}. While active it is the sole holder of the right to
 * release its slot.
 * </p>
 *
 * <p>
 * The state and the outcome of a release are kept in one reference, so a reader
 * never sees a released state without its fee or vice versa. Readers outside
 * the engine get {@link #snapshot() snapshots} which never change.
 * </p>
 */
public class Ticket {
    /**
     * Represents the state of a ticket.
     */
    public static enum State {
        /**
         * The vehicle is parked and holds its slot.
         */
        ACTIVE,
        /**
         * The vehicle has left; the ticket is kept for receipts only.
         */
        RELEASED;
    }

    private final TicketId id;
    private final String plate;
    private final String customerKey;
    private final SizeClass size;
    private final CustomerType customerType;
    private final boolean ev;
    private final SlotId slotId;
    private final Instant entryTime;
    private final Duration timeLimit;

    /**
     * Set when the ticket is released; {@code null} while active.
     */
    private volatile Settlement settlement;

    /**
     * Outcome of a release.
     */
    private static class Settlement {
        private final Instant releasedAt;
        private final long fee;
        private final long billedHours;
        private final boolean passApplied;

        Settlement(final Instant releasedAt, final long fee, final long billedHours, final boolean passApplied) {
            this.releasedAt = releasedAt;
            this.fee = fee;
            this.billedHours = billedHours;
            this.passApplied = passApplied;
        }
    }

    /**
     * Constructs a new active ticket.
     *
     * @param id        ID of the ticket.
     * @param request   Request the ticket has been issued for; must carry a plate.
     * @param slotId    Slot assigned to the vehicle.
     * @param entryTime Time the vehicle entered.
     * @param timeLimit Time the vehicle may stay.
     */
    public Ticket(final TicketId id, final AllocationRequest request, final SlotId slotId, final Instant entryTime,
            final Duration timeLimit) {
        this.id = id;
        this.plate = request.getPlate().orElseThrow(() -> new IllegalArgumentException("Ticket needs a plate"));
        this.customerKey = request.getCustomerKey().orElse(this.plate);
        this.size = request.getSize();
        this.customerType = request.getCustomerType();
        this.ev = request.isEv();
        this.slotId = slotId;
        this.entryTime = entryTime;
        this.timeLimit = timeLimit;
    }

    private Ticket(final Ticket other, final Settlement settlement) {
        this.id = other.id;
        this.plate = other.plate;
        this.customerKey = other.customerKey;
        this.size = other.size;
        this.customerType = other.customerType;
        this.ev = other.ev;
        this.slotId = other.slotId;
        this.entryTime = other.entryTime;
        this.timeLimit = other.timeLimit;
        this.settlement = settlement;
    }

    /**
     * Returns a copy of the ticket in its current state that is not affected by
     * a later release.
     *
     * @return The copy.
     */
    public Ticket snapshot() {
        return new Ticket(this, this.settlement);
    }

    public TicketId getId() {
        return this.id;
    }

    public String getPlate() {
        return this.plate;
    }

    public String getCustomerKey() {
        return this.customerKey;
    }

    public SizeClass getSize() {
        return this.size;
    }

    public CustomerType getCustomerType() {
        return this.customerType;
    }

    public boolean isEv() {
        return this.ev;
    }

    public SlotId getSlotId() {
        return this.slotId;
    }

    public Instant getEntryTime() {
        return this.entryTime;
    }

    public Duration getTimeLimit() {
        return this.timeLimit;
    }

    /**
     * Returns the time by which the vehicle should have left.
     *
     * @return Entry time plus the time limit.
     */
    public Instant getDeadline() {
        return this.entryTime.plus(this.timeLimit);
    }

    /**
     * Returns whether the vehicle is still parked past its deadline.
     *
     * @param now Current time.
     * @return Whether the ticket is active and overdue.
     */
    public boolean isOverdue(final Instant now) {
        return this.isActive() && !now.isBefore(this.getDeadline());
    }

    public State getState() {
        return this.settlement == null ? State.ACTIVE : State.RELEASED;
    }

    public boolean isActive() {
        return this.settlement == null;
    }

    public Optional<Instant> getReleasedAt() {
        final var done = this.settlement;
        return done == null ? Optional.empty() : Optional.of(done.releasedAt);
    }

    /**
     * Returns the fee charged at release.
     *
     * @return The fee, empty while the ticket is active.
     */
    public Optional<Long> getFee() {
        final var done = this.settlement;
        return done == null ? Optional.empty() : Optional.of(done.fee);
    }

    /**
     * Returns the number of started hours charged at release.
     *
     * @return Billed hours, empty while the ticket is active.
     */
    public Optional<Long> getBilledHours() {
        final var done = this.settlement;
        return done == null ? Optional.empty() : Optional.of(done.billedHours);
    }

    /**
     * Returns whether a VIP pass waived the fee.
     *
     * @return Whether a pass has been applied; {@code false} while active.
     */
    public boolean isPassApplied() {
        final var done = this.settlement;
        return done != null && done.passApplied;
    }

    /**
     * <em>Releases</em> the ticket.
     *
     * @param releasedAt  Time the vehicle left.
     * @param fee         Fee charged.
     * @param billedHours Started hours charged.
     * @param passApplied Whether a pass waived the fee.
     */
    void release(final Instant releasedAt, final long fee, final long billedHours, final boolean passApplied) {
        if (this.settlement != null) {
            throw new IllegalStateException("Ticket " + this.id + " is not active!");
        }
        this.settlement = new Settlement(releasedAt, fee, billedHours, passApplied);
    }

    @Override
    public String toString() {
        return String.format("Ticket(%s, %s, %s, %s)", this.id, this.plate, this.slotId, this.getState());
    }
}
