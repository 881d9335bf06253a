package com.parkwise.engine;

import java.time.Instant;
import java.util.Optional;

/**
 * Result of a successful allocation.
 */
public class Allocation {
    private final Ticket ticket;
    private final SlotView slot;
    private final VipPass pass;

    /**
     * Constructs a new result.
     *
     * @param ticket Issued ticket.
     * @param slot   Snapshot of the occupied slot.
     * @param pass   Pass bought during the allocation or {@code null}.
     */
    Allocation(final Ticket ticket, final SlotView slot, final VipPass pass) {
        this.ticket = ticket;
        this.slot = slot;
        this.pass = pass;
    }

    public TicketId getTicketId() {
        return this.ticket.getId();
    }

    public SlotId getSlotId() {
        return this.slot.getId();
    }

    public int getLevel() {
        return this.slot.getLevel();
    }

    public Section getSection() {
        return this.slot.getSection();
    }

    public SizeClass getSlotSize() {
        return this.slot.getSize();
    }

    public String getPlate() {
        return this.ticket.getPlate();
    }

    public Instant getEntryTime() {
        return this.ticket.getEntryTime();
    }

    public Ticket getTicket() {
        return this.ticket;
    }

    /**
     * Returns the pass bought by VIP auto-enrolment during this allocation.
     *
     * @return The pass, empty if none has been bought.
     */
    public Optional<VipPass> getEnrolledPass() {
        return Optional.ofNullable(this.pass);
    }
}
