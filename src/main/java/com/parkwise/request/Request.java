package com.parkwise.request;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * <p>
 * Represents a request from a client of the parking API.
 * </p>
 *
 * <p>
 * Every request has a {@link Method} and a {@link Kind}. The {@link Method}
 * indicates whether a request is merely for retrieving information or may have
 * side effects like allocating a slot or releasing a ticket.
 * </p>
 */
public abstract class Request {

    /**
     * The <em>method</em> of the request.
     */
    public enum Method {
        /**
         * <p>
         * The GET method is used to retrieve some information from the system.
         * </p>
         *
         * <p>
         * A GET request must not have any side effects.
         * </p>
         */
        GET,
        /**
         * <p>
         * The POST method is used to send some information to the system.
         * </p>
         *
         * <p>
         * A POST request may have side effects (e.g., occupying a slot).
         * </p>
         */
        POST;

        /**
         * Returns a {@link Method} based on its name.
         *
         * @param method Name of the method.
         *
         * @return An optional {@link Method} which is empty in case the string
         *         is invalid.
         */
        public static Optional<Method> fromName(final String method) {
            return switch (method) {
                case "GET" -> Optional.of(Method.GET);
                case "POST" -> Optional.of(Method.POST);
                default -> Optional.empty();
            };
        }
    }

    /**
     * There are seven kinds of requests.
     */
    public enum Kind {
        /**
         * Assigns a slot to a vehicle and issues a ticket.
         */
        ALLOCATE(Method.POST, "/api/allocate"),
        /**
         * Releases a ticket and reports the fee.
         */
        RELEASE(Method.POST, "/api/release"),
        /**
         * Buys or extends a VIP pass.
         */
        PURCHASE_PASS(Method.POST, "/api/passes"),
        /**
         * Lists every slot with its occupancy.
         */
        SLOTS(Method.GET, "/api/slots"),
        /**
         * Reports occupancy counters and occupied slots.
         */
        STATUS(Method.GET, "/api/status"),
        /**
         * Looks up a single ticket.
         */
        TICKET(Method.GET, "/api/ticket"),
        /**
         * Returns the most recent slot events.
         */
        EVENTS(Method.GET, "/api/events");

        private final Method method;
        private final String path;

        Kind(final Method method, final String path) {
            this.method = method;
            this.path = path;
        }

        /**
         * Returns the only {@link Method} accepted for this kind.
         *
         * @return Accepted method.
         */
        public Method getMethod() {
            return this.method;
        }

        /**
         * Returns the path of requests of this kind.
         *
         * @return The path.
         */
        public String getPath() {
            return this.path;
        }

        /**
         * Returns a {@link Kind} based on its path.
         *
         * @param path The path.
         *
         * @return An optional {@link Kind} which is empty in case the path is
         *         invalid.
         */
        public static Optional<Kind> fromPath(final String path) {
            for (final var kind : Kind.values()) {
                if (kind.path.equals(path)) {
                    return Optional.of(kind);
                }
            }
            return Optional.empty();
        }
    }

    /**
     * Method of the request.
     */
    protected final Method method;
    /**
     * Kind of the request.
     */
    protected final Kind kind;

    /**
     * Constructs a new request from the provided parameters.
     *
     * @param method Method of the request.
     * @param kind   Kind of the request.
     */
    public Request(final Method method, final Kind kind) {
        this.method = method;
        this.kind = kind;
    }

    /**
     * Returns the {@link Method} of the request.
     *
     * @return {@link Method} of the request.
     */
    public Method getMethod() {
        return this.method;
    }

    /**
     * Returns the {@link Kind} of the request.
     *
     * @return {@link Kind} of the request.
     */
    public Kind getKind() {
        return this.kind;
    }

    /**
     * Returns the path of the request.
     *
     * @return Path of the request.
     */
    public String getPath() {
        return this.kind.getPath();
    }

    /**
     * Returns the raw query string of the request.
     *
     * @return Query string without the leading {@code ?}, empty if there is none.
     */
    protected abstract Optional<String> getQuery();

    /**
     * Returns the first value of a query parameter.
     *
     * @param name Name of the parameter.
     * @return The decoded value, empty if the parameter is missing.
     */
    public Optional<String> getParameter(final String name) {
        final var query = this.getQuery();
        if (query.isEmpty()) {
            return Optional.empty();
        }
        for (final var pair : query.get().split("&")) {
            final var separator = pair.indexOf('=');
            final var key = separator < 0 ? pair : pair.substring(0, separator);
            if (URLDecoder.decode(key, StandardCharsets.UTF_8).equals(name)) {
                final var value = separator < 0 ? "" : pair.substring(separator + 1);
                return Optional.of(URLDecoder.decode(value, StandardCharsets.UTF_8));
            }
        }
        return Optional.empty();
    }

    /**
     * <p>
     * Reads the body sent by the client.
     * </p>
     *
     * <p>
     * This method has side effects and should be called only once on each
     * request.
     * </p>
     *
     * @return Body if there is any.
     */
    public abstract Optional<String> readBody();

    /**
     * <p>
     * Responds with a JSON document.
     * </p>
     *
     * <p>
     * This method blocks until the response has been sent.
     * </p>
     *
     * @param status HTTP status code of the response.
     * @param json   JSON document to send to the client.
     */
    public abstract void respondWithJson(final int status, final String json);
}
