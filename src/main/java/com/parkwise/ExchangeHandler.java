package com.parkwise;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.parkwise.request.HttpRequest;
import com.parkwise.request.Request;
import com.parkwise.request.RequestHandler;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;

/**
 * Handler for wrapping {@link HttpExchange}s and handing them over to a request handler.
 */
class ExchangeHandler implements HttpHandler {
    private static final Logger LOGGER = Logger.getLogger(ExchangeHandler.class.getName());

    /**
     * Request handler to hand requests over to.
     */
    private final RequestHandler requestHandler;

    /**
     * Constructs a new HTTP handler with the given request handler.
     *
     * @param requestHandler Request handler to hand requests over to.
     */
    public ExchangeHandler(final RequestHandler requestHandler) {
        this.requestHandler = requestHandler;
    }

    /**
     * Handles an HTTP request and hands it over to the request handler.
     */
    @Override
    public void handle(final HttpExchange exchange) throws IOException {
        // Set the CORS access control headers.
        final var headers = exchange.getResponseHeaders();
        headers.set("Access-Control-Request-Method", "*");
        headers.set("Access-Control-Allow-Origin", "*");
        headers.set("Access-Control-Allow-Headers", "*");
        headers.set("Access-Control-Expose-Headers", "*");
        // CORS pre-flight requests (OPTIONS) are handled directly with a 204 (No Content).
        if (exchange.getRequestMethod().equals("OPTIONS")) {
            exchange.sendResponseHeaders(204, -1);
            exchange.close();
            return;
        }
        final var method = Request.Method.fromName(exchange.getRequestMethod());
        if (method.isEmpty()) {
            // Tell the client which methods are allowed (405).
            exchange.getResponseHeaders().set("Allow", "GET, POST");
            exchange.sendResponseHeaders(405, -1);
            exchange.close();
            return;
        }
        final var kind = Request.Kind.fromPath(exchange.getRequestURI().getPath());
        if (kind.isEmpty()) {
            // Tell the client that the requested path does not exist (404).
            final var notFound = "{\"error\":\"NOT_FOUND\"}".getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().set("Content-Type", "application/json; charset=utf-8");
            exchange.sendResponseHeaders(404, notFound.length);
            exchange.getResponseBody().write(notFound);
            exchange.close();
            return;
        }
        final var request = new HttpRequest(method.get(), kind.get(), exchange);
        try {
            this.requestHandler.handle(request);
        } catch (RuntimeException error) {
            // Otherwise the HTTP server swallows the error silently.
            LOGGER.log(Level.SEVERE, "Runtime error while handling " + exchange.getRequestURI(), error);
            exchange.close();
        }
    }
}
