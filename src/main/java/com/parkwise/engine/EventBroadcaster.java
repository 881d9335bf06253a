package com.parkwise.engine;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * <p>
 * Delivers {@link SlotEvent}s to listeners on a dedicated thread.
 * </p>
 *
 * <p>
 * Publishing only enqueues a message in the broadcaster's {@link Mailbox}, so the
 * engine never waits for listeners. Listeners see events in publication order.
 * A listener that throws is logged and does not affect other listeners.
 * </p>
 */
public class EventBroadcaster implements Runnable {
    private static final Logger LOGGER = Logger.getLogger(EventBroadcaster.class.getName());

    /**
     * Mailbox of the {@link EventBroadcaster}.
     */
    private final Mailbox<Command<EventBroadcaster>> mailbox = new Mailbox<>();

    private final List<SlotEventListener> listeners = new CopyOnWriteArrayList<>();

    /**
     * Thread running the broadcaster, {@code null} until started.
     */
    private Thread thread;

    /**
     * Cleared by {@link MsgShutdown}.
     */
    private boolean running = true;

    /**
     * Registers a listener.
     *
     * @param listener The listener.
     */
    public void addListener(final SlotEventListener listener) {
        this.listeners.add(listener);
    }

    /**
     * Unregisters a listener.
     *
     * @param listener The listener.
     */
    public void removeListener(final SlotEventListener listener) {
        this.listeners.remove(listener);
    }

    /**
     * Starts the delivery thread.
     */
    public synchronized void start() {
        if (this.thread != null) {
            throw new IllegalStateException("Broadcaster has already been started!");
        }
        this.thread = new Thread(this, "slot-event-broadcaster");
        this.thread.setDaemon(true);
        this.thread.start();
    }

    /**
     * Hands an event over for delivery without waiting for it.
     *
     * @param event The event.
     * @return Whether the event has been accepted; {@code false} after shutdown.
     */
    public boolean publish(final SlotEvent event) {
        final var sent = this.mailbox.sendLowPriority(new MsgDeliver(event));
        if (!sent) {
            LOGGER.fine(() -> "Dropped event after shutdown: " + event);
        }
        return sent;
    }

    /**
     * Delivers all events published so far, then stops the delivery thread and
     * waits for it to terminate.
     *
     * @throws InterruptedException The calling thread has been interrupted while waiting.
     */
    public void shutdown() throws InterruptedException {
        this.mailbox.sendLowPriority(new MsgShutdown());
        this.mailbox.close();
        final Thread worker;
        synchronized (this) {
            worker = this.thread;
        }
        if (worker != null) {
            worker.join();
        }
    }

    @Override
    public void run() {
        while (this.running) {
            try {
                this.mailbox.recv().execute(this);
            } catch (InterruptedException error) {
                Thread.currentThread().interrupt();
                return;
            }
        }
    }

    private void deliver(final SlotEvent event) {
        for (final var listener : this.listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException error) {
                LOGGER.log(Level.WARNING, "Listener failed on " + event, error);
            }
        }
    }

    /**
     * A message asking the broadcaster to deliver an event to all listeners.
     */
    public static class MsgDeliver implements Command<EventBroadcaster> {
        private final SlotEvent event;

        /**
         * Constructs a new {@link MsgDeliver} message.
         *
         * @param event Event to deliver.
         */
        public MsgDeliver(final SlotEvent event) {
            this.event = event;
        }

        @Override
        public void execute(final EventBroadcaster broadcaster) {
            broadcaster.deliver(this.event);
        }
    }

    /**
     * This message is sent to stop the broadcaster once earlier messages are done.
     */
    public static class MsgShutdown implements Command<EventBroadcaster> {
        @Override
        public void execute(final EventBroadcaster broadcaster) {
            broadcaster.running = false;
        }
    }
}
