package com.parkwise.engine;

/**
 * <p>
 * Generic interface for the
 * <a href="https://en.wikipedia.org/wiki/Command_pattern">command pattern</a>.
 * </p>
 *
 * <p>
 * Messages sent to the {@link EventBroadcaster} are commands executed on the
 * broadcaster's own thread.
 * </p>
 *
 * @param <O> Object type to execute the command on.
 */
public interface Command<O> {
    /**
     * Executes the command on the provided object.
     *
     * @param obj Object to execute the command on.
     */
    void execute(O obj);
}
