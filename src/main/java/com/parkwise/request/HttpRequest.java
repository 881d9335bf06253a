package com.parkwise.request;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.sun.net.httpserver.HttpExchange;

/**
 * Represents a request received by the HTTP server.
 */
public class HttpRequest extends Request {
    private static final Logger LOGGER = Logger.getLogger(HttpRequest.class.getName());

    /**
     * Underlying {@link HttpExchange} used for communication.
     */
    private final HttpExchange exchange;

    /**
     * Constructs a new request from the provided parameters.
     *
     * @param method   Method of the request.
     * @param kind     Kind of the request.
     * @param exchange {@link HttpExchange} used for communication.
     */
    public HttpRequest(final Method method, final Kind kind, final HttpExchange exchange) {
        super(method, kind);
        this.exchange = exchange;
    }

    @Override
    public String getPath() {
        return this.exchange.getRequestURI().getPath();
    }

    @Override
    protected Optional<String> getQuery() {
        return Optional.ofNullable(this.exchange.getRequestURI().getRawQuery());
    }

    @Override
    public Optional<String> readBody() {
        try {
            final var body = new String(this.exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
            return body.isBlank() ? Optional.empty() : Optional.of(body);
        } catch (IOException error) {
            LOGGER.log(Level.WARNING, "Error reading request body", error);
            return Optional.empty();
        }
    }

    @Override
    public void respondWithJson(final int status, final String json) {
        final var bytes = json.getBytes(StandardCharsets.UTF_8);
        this.exchange.getResponseHeaders().set("Content-Type", "application/json; charset=utf-8");
        try {
            this.exchange.sendResponseHeaders(status, bytes.length);
            try (OutputStream stream = this.exchange.getResponseBody()) {
                stream.write(bytes);
            }
        } catch (IOException error) {
            LOGGER.log(Level.WARNING, "Error responding to client", error);
        }
    }
}
