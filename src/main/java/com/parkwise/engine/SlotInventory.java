package com.parkwise.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * <p>
 * Registry of all slots of the garage.
 * </p>
 *
 * <p>
 * The set of slots is fixed at construction time. Only the occupancy of a slot
 * changes, and only through {@link #trySet}, which is an atomic compare-and-set
 * on that one slot.
 * </p>
 */
public class SlotInventory {
    /**
     * Slots ordered by level and index.
     */
    private final List<Slot> slots;

    /**
     * Slots by their ID.
     */
    private final Map<SlotId, Slot> byId = new LinkedHashMap<>();

    /**
     * Constructs a new {@link SlotInventory} with all slots free.
     *
     * @param topology Layout of the garage.
     */
    public SlotInventory(final Topology topology) {
        this.slots = Collections.unmodifiableList(topology.createSlots());
        for (final var slot : this.slots) {
            if (this.byId.put(slot.getId(), slot) != null) {
                throw new IllegalArgumentException("Duplicate slot " + slot.getId());
            }
        }
    }

    /**
     * Returns snapshots of all slots ordered by level and index.
     *
     * @return Immutable snapshots.
     */
    public List<SlotView> listSlots() {
        final var views = new ArrayList<SlotView>(this.slots.size());
        for (final var slot : this.slots) {
            views.add(slot.view());
        }
        return Collections.unmodifiableList(views);
    }

    /**
     * Returns the slot with the given ID.
     *
     * @param slotId ID of the slot.
     * @return The slot.
     * @throws ParkingException If there is no such slot.
     */
    public Slot get(final SlotId slotId) throws ParkingException {
        final var slot = this.byId.get(slotId);
        if (slot == null) {
            throw ParkingException.invalidRequest("Unknown slot " + slotId);
        }
        return slot;
    }

    /**
     * <p>
     * Atomically moves a slot from the expected status to the next status.
     * </p>
     *
     * <p>
     * Occupying requires the slot to be free. Freeing requires the slot to be held
     * by {@code ticketId}.
     * </p>
     *
     * @param slotId   ID of the slot.
     * @param expected Status the slot must currently have.
     * @param next     Status the slot should have afterwards.
     * @param ticketId Ticket occupying or releasing the slot.
     * @throws ParkingException {@code SLOT_CONFLICT} if the slot is not in the expected
     *                          state, {@code INVALID_REQUEST} for an unknown slot or an
     *                          unchanged status.
     */
    public void trySet(final SlotId slotId, final Slot.Status expected, final Slot.Status next,
            final TicketId ticketId) throws ParkingException {
        if (expected == next) {
            throw ParkingException.invalidRequest("Slot status must change");
        }
        final var slot = this.get(slotId);
        final var changed = switch (next) {
            case OCCUPIED -> slot.occupy(ticketId);
            case FREE -> slot.vacate(ticketId);
        };
        if (!changed) {
            throw ParkingException.slotConflict(slotId);
        }
    }

    /**
     * Returns the number of slots.
     *
     * @return Number of slots.
     */
    public int size() {
        return this.slots.size();
    }

    /**
     * Returns the number of occupied slots.
     *
     * @return Number of occupied slots.
     */
    public int countOccupied() {
        var occupied = 0;
        for (final var slot : this.slots) {
            if (slot.getStatus() == Slot.Status.OCCUPIED) {
                occupied++;
            }
        }
        return occupied;
    }

    /**
     * Returns the number of free slots per size class.
     *
     * @return Free slots per size class, including classes without free slots.
     */
    public Map<SizeClass, Integer> countFreeBySize() {
        final var free = new EnumMap<SizeClass, Integer>(SizeClass.class);
        for (final var size : SizeClass.values()) {
            free.put(size, 0);
        }
        for (final var slot : this.slots) {
            if (slot.getStatus() == Slot.Status.FREE) {
                free.merge(slot.getSize(), 1, Integer::sum);
            }
        }
        return free;
    }
}
