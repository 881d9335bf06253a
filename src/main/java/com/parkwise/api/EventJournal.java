package com.parkwise.api;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import com.parkwise.engine.SlotEvent;
import com.parkwise.engine.SlotEventListener;

/**
 * <p>
 * Keeps the most recent slot events so that viewers can poll for changes.
 * </p>
 *
 * <p>
 * Every event gets a sequence number starting at one. Viewers remember the last
 * number they have seen and ask for the events after it.
 * </p>
 */
public class EventJournal implements SlotEventListener {
    /**
     * A journaled event.
     */
    public static class Entry {
        private final long sequence;
        private final SlotEvent event;

        Entry(final long sequence, final SlotEvent event) {
            this.sequence = sequence;
            this.event = event;
        }

        public long getSequence() {
            return this.sequence;
        }

        public SlotEvent getEvent() {
            return this.event;
        }
    }

    private final int capacity;
    private final Deque<Entry> entries = new ArrayDeque<>();
    private long lastSequence = 0;

    /**
     * Constructs a new journal.
     *
     * @param capacity Number of events to keep.
     */
    public EventJournal(final int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Journal capacity must be positive");
        }
        this.capacity = capacity;
    }

    @Override
    public synchronized void onEvent(final SlotEvent event) {
        this.entries.addLast(new Entry(++this.lastSequence, event));
        while (this.entries.size() > this.capacity) {
            this.entries.removeFirst();
        }
    }

    /**
     * Returns the kept events with a sequence number greater than the given one.
     *
     * @param after Last sequence number the caller has seen, {@code 0} for all.
     * @return Events in sequence order.
     */
    public synchronized List<Entry> after(final long after) {
        final var result = new ArrayList<Entry>();
        for (final var entry : this.entries) {
            if (entry.sequence > after) {
                result.add(entry);
            }
        }
        return result;
    }

    /**
     * Returns the sequence number of the latest event.
     *
     * @return Latest sequence number, {@code 0} if nothing has happened yet.
     */
    public synchronized long getLastSequence() {
        return this.lastSequence;
    }
}
