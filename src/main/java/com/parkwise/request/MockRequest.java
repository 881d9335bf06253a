package com.parkwise.request;

import java.util.Optional;

/**
 * <p>
 * Represents a request that does not come from the network, e.g. from a test
 * or an embedding application.
 * </p>
 *
 * <p>
 * The response is recorded and can be inspected afterwards.
 * </p>
 */
public class MockRequest extends Request {
    private final String query;
    private Optional<String> body;

    private int status = -1;
    private String response;

    /**
     * Constructs a new mock request for the given kind using its accepted method.
     *
     * @param kind  Kind of the request.
     * @param body  Request body or {@code null}.
     * @param query Raw query string or {@code null}.
     */
    public MockRequest(final Kind kind, final String body, final String query) {
        this(kind.getMethod(), kind, body, query);
    }

    /**
     * Constructs a new mock request from the provided parameters.
     *
     * @param method Method of the request.
     * @param kind   Kind of the request.
     * @param body   Request body or {@code null}.
     * @param query  Raw query string or {@code null}.
     */
    public MockRequest(final Method method, final Kind kind, final String body, final String query) {
        super(method, kind);
        this.body = Optional.ofNullable(body);
        this.query = query;
    }

    @Override
    protected Optional<String> getQuery() {
        return Optional.ofNullable(this.query);
    }

    @Override
    public Optional<String> readBody() {
        final var res = this.body;
        this.body = Optional.empty();
        return res;
    }

    @Override
    public synchronized void respondWithJson(final int status, final String json) {
        if (this.status >= 0) {
            throw new IllegalStateException("Request has already been answered");
        }
        this.status = status;
        this.response = json;
    }

    /**
     * Returns the status code of the response.
     *
     * @return Status code, {@code -1} if the request has not been answered.
     */
    public synchronized int getStatus() {
        return this.status;
    }

    /**
     * Returns the body of the response.
     *
     * @return JSON body or {@code null} if the request has not been answered.
     */
    public synchronized String getResponse() {
        return this.response;
    }
}
