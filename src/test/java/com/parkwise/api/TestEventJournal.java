package com.parkwise.api;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.time.Instant;

import org.junit.Test;

import com.parkwise.engine.SlotEvent;
import com.parkwise.engine.SlotId;
import com.parkwise.engine.TicketId;

public class TestEventJournal {
    private static SlotEvent event(final int index) {
        return SlotEvent.occupied(new SlotId(1, index), TicketId.generate(), Instant.EPOCH.plusSeconds(index));
    }

    @Test
    public void testSequenceNumbers() {
        final var journal = new EventJournal(10);
        assertEquals(0, journal.getLastSequence());
        assertTrue(journal.after(0).isEmpty());

        journal.onEvent(event(1));
        journal.onEvent(event(2));
        journal.onEvent(event(3));

        assertEquals(3, journal.getLastSequence());
        assertEquals(3, journal.after(0).size());
        final var tail = journal.after(2);
        assertEquals(1, tail.size());
        assertEquals(3, tail.get(0).getSequence());
        assertEquals(new SlotId(1, 3), tail.get(0).getEvent().getSlotId());
    }

    @Test
    public void testCapacity() {
        final var journal = new EventJournal(2);
        for (var i = 1; i <= 5; i++) {
            journal.onEvent(event(i));
        }
        final var kept = journal.after(0);
        assertEquals(2, kept.size());
        assertEquals(4, kept.get(0).getSequence());
        assertEquals(5, kept.get(1).getSequence());
        assertEquals(5, journal.getLastSequence());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testCapacityMustBePositive() {
        new EventJournal(0);
    }
}
