package com.parkwise.request;

/**
 * Interface for handling requests from clients of the parking API.
 */
public interface RequestHandler {
    /**
     * <p>
     * Handle a request.
     * </p>
     *
     * <p>
     * ⚠️ This method may be called from different threads!
     * </p>
     *
     * @param request {@link Request} to be handled.
     */
    public void handle(Request request);

    /**
     * <p>
     * Shut the parking system down.
     * </p>
     *
     * <p>
     * When this method returns, all threads spawned by the handler must have
     * terminated.
     * </p>
     */
    public void shutdown();
}
