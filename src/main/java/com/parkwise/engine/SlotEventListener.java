package com.parkwise.engine;

/**
 * <p>
 * Subscriber to slot events, e.g. a broadcaster pushing them to viewers.
 * </p>
 *
 * <p>
 * ⚠️ Listeners are called from the broadcaster thread, never from the thread
 * that changed the slot.
 * </p>
 */
@FunctionalInterface
public interface SlotEventListener {
    /**
     * Handles an event.
     *
     * @param event The event.
     */
    void onEvent(SlotEvent event);
}
