package com.parkwise.engine;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.logging.Logger;

import com.parkwise.Config;

/**
 * <p>
 * Facade that owns the slot inventory, the ticket and pass registries and the
 * event broadcaster.
 * </p>
 *
 * <p>
 * All mutations enter through {@link #allocate}, {@link #release} and
 * {@link #purchasePass}. They run under the write half of a single
 * read-write lock, so the selection of a slot and its commit (or the lookup of a
 * ticket and its release) are never interleaved with another mutation. Queries
 * run under the read half and return immutable copies. Events are enqueued
 * with the broadcaster while the write lock is still held, so listeners see
 * them in commit order; delivery happens on the broadcaster's own thread.
 * </p>
 *
 * <p>
 * The following invariants hold whenever the lock is free:
 * </p>
 *
 * <ul>
 * <li>the number of occupied slots equals the number of active tickets, and
 * every occupied slot refers to the active ticket that refers to it;</li>
 * <li>no two active tickets share a licence plate unless the customer holds an
 * active pass for the size class;</li>
 * <li>a rejected operation has changed nothing.</li>
 * </ul>
 */
public class ParkingEngine {
    private static final Logger LOGGER = Logger.getLogger(ParkingEngine.class.getName());

    private static final DateTimeFormatter PLATE_DATE = DateTimeFormatter.ofPattern("yyyyMMdd")
            .withZone(ZoneOffset.UTC);

    /**
     * Number of times a slot is selected before a lost race is reported.
     */
    private static final int SELECTION_ATTEMPTS = 2;

    private final Config config;
    private final Clock clock;
    private final PricingTable pricing;
    private final SlotInventory inventory;
    private final AllocationPolicy policy;
    private final TicketRegistry tickets = new TicketRegistry();
    private final PassRegistry passes = new PassRegistry();
    private final EventBroadcaster broadcaster = new EventBroadcaster();

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    /**
     * Constructs a new engine with all slots free. Events are queued but not
     * delivered until {@link #start()} has been called.
     *
     * @param config Configuration of the engine.
     * @param clock  Source of the current time.
     */
    public ParkingEngine(final Config config, final Clock clock) {
        this(config, clock, new AllocationPolicy());
    }

    /**
     * Constructs a new engine with a custom allocation policy.
     *
     * @param config Configuration of the engine.
     * @param clock  Source of the current time.
     * @param policy Policy selecting slots.
     */
    ParkingEngine(final Config config, final Clock clock, final AllocationPolicy policy) {
        this.config = Objects.requireNonNull(config);
        this.clock = Objects.requireNonNull(clock);
        this.policy = Objects.requireNonNull(policy);
        this.pricing = config.getPricing();
        this.inventory = new SlotInventory(config.getTopology());
    }

    /**
     * Constructs and starts an engine.
     *
     * @param config Configuration of the engine.
     * @param clock  Source of the current time.
     * @return The running engine.
     */
    public static ParkingEngine launch(final Config config, final Clock clock) {
        final var engine = new ParkingEngine(config, clock);
        engine.start();
        return engine;
    }

    /**
     * Starts delivering events to listeners.
     */
    public void start() {
        this.broadcaster.start();
        LOGGER.info(() -> String.format("Parking engine started with %d slots", this.inventory.size()));
    }

    /**
     * Delivers pending events and stops the event thread.
     *
     * @throws InterruptedException The calling thread has been interrupted while waiting.
     */
    public void shutdown() throws InterruptedException {
        this.broadcaster.shutdown();
        LOGGER.info("Parking engine stopped");
    }

    public PricingTable getPricing() {
        return this.pricing;
    }

    public void addListener(final SlotEventListener listener) {
        this.broadcaster.addListener(listener);
    }

    public void removeListener(final SlotEventListener listener) {
        this.broadcaster.removeListener(listener);
    }

    /**
     * <p>
     * Assigns a slot to a vehicle and issues a ticket.
     * </p>
     *
     * <p>
     * A request without a licence plate gets the generated plate
     * {@code AUTO-<yyyyMMdd>-<ticket ID>}. If VIP auto-enrolment is enabled, a VIP
     * customer without an active pass for the vehicle's size class buys one as
     * part of a successful allocation.
     * </p>
     *
     * @param request The request.
     * @return The issued ticket and the occupied slot.
     * @throws ParkingException {@code DUPLICATE_VEHICLE}, {@code NO_SLOT_AVAILABLE} or
     *                          {@code SLOT_CONFLICT}.
     */
    public Allocation allocate(final AllocationRequest request) throws ParkingException {
        Objects.requireNonNull(request);
        final Allocation allocation;
        this.lock.writeLock().lock();
        try {
            allocation = this.allocateLocked(request);
            this.broadcaster.publish(SlotEvent.occupied(allocation.getSlotId(), allocation.getTicketId(),
                    allocation.getEntryTime()));
        } catch (ParkingException error) {
            LOGGER.warning(() -> String.format("Allocation rejected for %s: %s", request, error.getMessage()));
            throw error;
        } finally {
            this.lock.writeLock().unlock();
        }
        LOGGER.info(() -> String.format("Allocated slot %s (%s) with ticket %s to %s", allocation.getSlotId(),
                allocation.getSection(), allocation.getTicketId(), allocation.getPlate()));
        return allocation;
    }

    private Allocation allocateLocked(final AllocationRequest request) throws ParkingException {
        final var now = this.clock.instant();
        final var ticketId = this.tickets.newTicketId();
        final var vehicle = request.getPlate().isPresent() ? request
                : request.withPlate(String.format("AUTO-%s-%s", PLATE_DATE.format(now), ticketId));
        final var plate = vehicle.getPlate().orElseThrow();
        final var customerKey = vehicle.getCustomerKey().orElseThrow();
        final var vip = vehicle.getCustomerType() == CustomerType.VIP;
        final var pass = vip ? this.passes.activePass(customerKey, vehicle.getSize(), now) : Optional.<VipPass>empty();

        final var multipleAllowed = pass.isPresent();
        if (!multipleAllowed && this.tickets.hasActive(plate)) {
            throw ParkingException.duplicateVehicle(plate);
        }

        final var slotId = this.occupy(vehicle, vip, ticketId);
        final Ticket ticket;
        try {
            ticket = this.tickets.create(ticketId, vehicle, slotId, now,
                    this.config.getTimeLimit(vehicle.getCustomerType()), multipleAllowed);
        } catch (ParkingException error) {
            this.inventory.trySet(slotId, Slot.Status.OCCUPIED, Slot.Status.FREE, ticketId);
            throw error;
        }

        VipPass enrolled = null;
        if (vip && pass.isEmpty() && this.config.isVipAutoEnroll()) {
            enrolled = this.passes.purchase(customerKey, vehicle.getSize(), now,
                    this.pricing.monthlyPassPrice(vehicle.getSize()));
            final var bought = enrolled;
            LOGGER.info(() -> String.format("Enrolled %s with pass %s until %s", customerKey, bought.getId(),
                    bought.getExpiresAt()));
        }
        return new Allocation(ticket.snapshot(), this.inventory.get(slotId).view(), enrolled);
    }

    /**
     * Selects a slot and occupies it, selecting once more if the slot has been
     * taken in between.
     */
    private SlotId occupy(final AllocationRequest request, final boolean vipEntitled, final TicketId ticketId)
            throws ParkingException {
        ParkingException conflict = null;
        for (var attempt = 0; attempt < SELECTION_ATTEMPTS; attempt++) {
            final var slotId = this.policy.selectSlot(request, vipEntitled, this.inventory.listSlots())
                    .orElseThrow(() -> ParkingException.noSlotAvailable(request.getSize()));
            try {
                this.inventory.trySet(slotId, Slot.Status.FREE, Slot.Status.OCCUPIED, ticketId);
                return slotId;
            } catch (ParkingException error) {
                if (error.getKind() != ParkingException.Kind.SLOT_CONFLICT) {
                    throw error;
                }
                LOGGER.fine(() -> String.format("Lost slot %s for %s", slotId, request));
                conflict = error;
            }
        }
        throw conflict;
    }

    /**
     * <p>
     * Releases a ticket, frees its slot and computes the fee.
     * </p>
     *
     * <p>
     * The fee is zero if the ticket's customer holds an active pass for the
     * ticket's size class. Otherwise every started hour is charged at the hourly
     * rate of the size class, but at least the minimum charge.
     * </p>
     *
     * @param ticketId ID of the ticket.
     * @return Fee and duration.
     * @throws ParkingException {@code INVALID_TICKET} if the ticket is unknown or has
     *                          already been released.
     */
    public Release release(final TicketId ticketId) throws ParkingException {
        Objects.requireNonNull(ticketId);
        final Release release;
        this.lock.writeLock().lock();
        try {
            release = this.releaseLocked(ticketId);
            this.broadcaster.publish(SlotEvent.freed(release.getSlotId(), release.getTicketId(), release.getFee(),
                    release.getReleasedAt()));
        } catch (ParkingException error) {
            LOGGER.warning(() -> String.format("Release rejected: %s", error.getMessage()));
            throw error;
        } finally {
            this.lock.writeLock().unlock();
        }
        LOGGER.info(() -> String.format("Released ticket %s from slot %s, fee %d for %.2f hours",
                release.getTicketId(), release.getSlotId(), release.getFee(), release.getDurationHours()));
        return release;
    }

    private Release releaseLocked(final TicketId ticketId) throws ParkingException {
        final var now = this.clock.instant();
        final var ticket = this.tickets.lookup(ticketId);
        if (!ticket.isActive()) {
            throw ParkingException.invalidTicket(ticketId, "has already been released");
        }
        var elapsed = Duration.between(ticket.getEntryTime(), now);
        if (elapsed.isNegative()) {
            elapsed = Duration.ZERO;
        }
        final var pass = this.passes.activePass(ticket.getCustomerKey(), ticket.getSize(), now);
        final var fee = pass.isPresent() ? 0L : this.pricing.parkingFee(ticket.getSize(), elapsed);

        this.inventory.trySet(ticket.getSlotId(), Slot.Status.OCCUPIED, Slot.Status.FREE, ticketId);
        final var released = this.tickets.release(ticketId, now, fee, PricingTable.billedHours(elapsed),
                pass.isPresent());
        return new Release(released.snapshot(), elapsed);
    }

    /**
     * <p>
     * Buys a 30-day pass for a customer and size class.
     * </p>
     *
     * <p>
     * Buying while a pass is still active extends it by 30 days from its current
     * expiry. The monthly pass price of the size class is charged either way.
     * </p>
     *
     * @param customerKey Key of the customer, usually the licence plate.
     * @param size        Size class to cover.
     * @return The new or extended pass.
     * @throws ParkingException {@code INVALID_REQUEST} for a blank customer key.
     */
    public VipPass purchasePass(final String customerKey, final SizeClass size) throws ParkingException {
        if (customerKey == null || customerKey.isBlank()) {
            throw ParkingException.invalidRequest("Customer key is required");
        }
        Objects.requireNonNull(size);
        final var key = customerKey.trim();
        final VipPass pass;
        this.lock.writeLock().lock();
        try {
            pass = this.passes.purchase(key, size, this.clock.instant(), this.pricing.monthlyPassPrice(size));
        } finally {
            this.lock.writeLock().unlock();
        }
        LOGGER.info(() -> String.format("Sold %s pass %s to %s, valid until %s", size, pass.getId(), key,
                pass.getExpiresAt()));
        return pass;
    }

    /**
     * Returns the customer's active pass for a size class.
     *
     * @param customerKey Key of the customer.
     * @param size        Size class.
     * @return The active pass, if any.
     */
    public Optional<VipPass> activePass(final String customerKey, final SizeClass size) {
        this.lock.readLock().lock();
        try {
            return this.passes.activePass(customerKey, size, this.clock.instant());
        } finally {
            this.lock.readLock().unlock();
        }
    }

    /**
     * Returns snapshots of all slots ordered by level and index.
     *
     * @return Immutable snapshots.
     */
    public List<SlotView> snapshot() {
        this.lock.readLock().lock();
        try {
            return this.inventory.listSlots();
        } finally {
            this.lock.readLock().unlock();
        }
    }

    /**
     * Returns the current occupancy counters together with the occupied slots,
     * all taken under one read lock.
     *
     * @return Occupancy counters and occupants.
     */
    public OccupancyStatus status() {
        this.lock.readLock().lock();
        try {
            final var now = this.clock.instant();
            final var slots = new HashMap<SlotId, SlotView>();
            for (final var slot : this.inventory.listSlots()) {
                slots.put(slot.getId(), slot);
            }
            final var occupants = new ArrayList<OccupancyStatus.Occupant>();
            var expired = 0;
            for (final var ticket : this.tickets.activeTickets()) {
                occupants.add(new OccupancyStatus.Occupant(slots.get(ticket.getSlotId()), ticket.snapshot()));
                if (ticket.isOverdue(now)) {
                    expired++;
                }
            }
            return new OccupancyStatus(this.inventory.size(), this.inventory.countOccupied(), expired,
                    this.inventory.countFreeBySize(), occupants, now);
        } finally {
            this.lock.readLock().unlock();
        }
    }

    /**
     * Looks up a ticket, active or released.
     *
     * @param ticketId ID of the ticket.
     * @return Snapshot of the ticket.
     * @throws ParkingException {@code INVALID_TICKET} if the ticket is unknown.
     */
    public Ticket lookupTicket(final TicketId ticketId) throws ParkingException {
        this.lock.readLock().lock();
        try {
            return this.tickets.lookup(ticketId).snapshot();
        } finally {
            this.lock.readLock().unlock();
        }
    }

    /**
     * Returns the active tickets in issue order.
     *
     * @return Snapshots of the active tickets.
     */
    public List<Ticket> activeTickets() {
        this.lock.readLock().lock();
        try {
            final var active = new ArrayList<Ticket>();
            for (final var ticket : this.tickets.activeTickets()) {
                active.add(ticket.snapshot());
            }
            return active;
        } finally {
            this.lock.readLock().unlock();
        }
    }

    /**
     * Returns the instant the engine considers to be now.
     *
     * @return The current instant.
     */
    public Instant now() {
        return this.clock.instant();
    }
}
