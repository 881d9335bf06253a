package com.parkwise.engine;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * <p>
 * A channel for messages of type {@code M} with two priorities.
 * </p>
 *
 * <p>
 * High priority messages are always received before low priority ones; within
 * a priority messages are received in the order they were sent. Once closed, a
 * mailbox rejects new messages but still hands out the ones already queued.
 * </p>
 *
 * @param <M> Message type.
 */
public class Mailbox<M> {
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = this.lock.newCondition();
    private final Deque<M> high = new ArrayDeque<>();
    private final Deque<M> low = new ArrayDeque<>();
    private boolean closed = false;

    /**
     * Constructs a new empty {@link Mailbox}.
     */
    public Mailbox() {
    }

    /**
     * Returns whether the mailbox is empty.
     *
     * @return Whether the mailbox is empty.
     */
    public boolean isEmpty() {
        this.lock.lock();
        try {
            return this.high.isEmpty() && this.low.isEmpty();
        } finally {
            this.lock.unlock();
        }
    }

    /**
     * Tries to send a message with low priority.
     *
     * @param message The message.
     * @return Indicates whether the message has been sent.
     */
    public boolean sendLowPriority(final M message) {
        return this.send(this.low, message);
    }

    /**
     * Tries to send a message with high priority.
     *
     * @param message The message.
     * @return Indicates whether the message has been sent.
     */
    public boolean sendHighPriority(final M message) {
        return this.send(this.high, message);
    }

    private boolean send(final Deque<M> queue, final M message) {
        this.lock.lock();
        try {
            if (this.closed) {
                return false;
            }
            queue.addLast(message);
            this.notEmpty.signal();
            return true;
        } finally {
            this.lock.unlock();
        }
    }

    /**
     * Closes the mailbox for new messages.
     */
    public void close() {
        this.lock.lock();
        try {
            this.closed = true;
        } finally {
            this.lock.unlock();
        }
    }

    /**
     * Receives a message blocking the receiving thread.
     *
     * @return The received message.
     * @throws InterruptedException The thread has been interrupted.
     */
    public M recv() throws InterruptedException {
        this.lock.lock();
        try {
            while (this.high.isEmpty() && this.low.isEmpty()) {
                this.notEmpty.await();
            }
            return this.poll();
        } finally {
            this.lock.unlock();
        }
    }

    /**
     * Tries to receive a message without blocking.
     *
     * @return The received message or {@code null} in case the {@link Mailbox} is empty.
     */
    public M tryRecv() {
        this.lock.lock();
        try {
            return this.poll();
        } finally {
            this.lock.unlock();
        }
    }

    private M poll() {
        final var message = this.high.pollFirst();
        return message != null ? message : this.low.pollFirst();
    }
}
