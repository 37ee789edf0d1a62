package io.jerry.core.slack;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.HttpServerExchange;
import io.undertow.server.handlers.PathHandler;
import io.undertow.util.Headers;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.ByteBuffer;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class SlackEventsServer implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(SlackEventsServer.class);
    static final String EVENTS_PATH = "/slack/events";
    static final String TIMESTAMP_HEADER = "X-Slack-Request-Timestamp";
    static final String SIGNATURE_HEADER = "X-Slack-Signature";

    private final String host;
    private final int requestedPort;
    private final SlackSignatureVerifier verifier;
    private final SlackMessageRouter router;
    private final ObjectMapper mapper;
    private final AtomicBoolean running;
    private Undertow server;
    private int actualPort;

    // A null verifier accepts unsigned requests (local development only).
    public SlackEventsServer(String host, int port, SlackSignatureVerifier verifier, SlackMessageRouter router) {
        this.host = host == null || host.isBlank() ? "0.0.0.0" : host;
        this.requestedPort = port;
        this.verifier = verifier;
        this.router = Objects.requireNonNull(router, "router must not be null");
        this.mapper = new ObjectMapper();
        this.running = new AtomicBoolean(false);
    }

    public void start() {
        if (running.getAndSet(true)) {
            return;
        }
        if (verifier == null) {
            LOG.warn("Slack signing secret not configured; request signatures are not verified");
        }

        PathHandler routes = Handlers.path()
            .addExactPath("/healthz", this::handleHealth)
            .addExactPath(EVENTS_PATH, this::handleEvents);

        server = Undertow.builder()
            .addHttpListener(requestedPort, host)
            .setHandler(routes)
            .build();
        server.start();
        this.actualPort = resolveBoundPort(server, requestedPort);
        LOG.info("Slack events endpoint listening on {}:{}{}", host, actualPort, EVENTS_PATH);
    }

    public int port() {
        return actualPort;
    }

    @Override
    public void close() {
        if (!running.getAndSet(false)) {
            return;
        }
        if (server != null) {
            server.stop();
        }
    }

    private void handleHealth(HttpServerExchange exchange) throws IOException {
        if (!"GET".equalsIgnoreCase(exchange.getRequestMethod().toString())) {
            sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
            return;
        }
        sendJson(exchange, 200, Map.of("status", "healthy"));
    }

    private void handleEvents(HttpServerExchange exchange) throws Exception {
        if (exchange.isInIoThread()) {
            exchange.dispatch(() -> {
                try {
                    handleEvents(exchange);
                } catch (Exception e) {
                    sendInternalError(exchange, e);
                }
            });
            return;
        }

        if (!"POST".equalsIgnoreCase(exchange.getRequestMethod().toString())) {
            sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
            return;
        }

        exchange.startBlocking();
        byte[] raw = exchange.getInputStream().readAllBytes();
        if (verifier != null
            && !verifier.verify(header(exchange, TIMESTAMP_HEADER), header(exchange, SIGNATURE_HEADER), raw)) {
            LOG.warn("Rejected Slack request with invalid signature");
            sendJson(exchange, 401, Map.of("error", "invalid_signature"));
            return;
        }

        JsonNode body;
        try {
            body = mapper.readTree(raw);
        } catch (IOException e) {
            sendJson(exchange, 400, Map.of("error", "invalid_json"));
            return;
        }
        if (body == null || !body.isObject()) {
            sendJson(exchange, 400, Map.of("error", "invalid_json"));
            return;
        }

        SlackEvent event = SlackEvent.from(body);
        if (event.isUrlVerification()) {
            sendJson(exchange, 200, Map.of("challenge", event.challenge()));
            return;
        }

        SlackMessageRouter.Routing routing = router.route(event);
        LOG.debug("Slack event {} ({}) routed as {}", event.eventId(), event.type(), routing);
        sendJson(exchange, 200, Map.of("ok", true));
    }

    private void sendJson(HttpServerExchange exchange, int status, Map<String, ?> payload) throws IOException {
        byte[] body = mapper.writeValueAsBytes(payload);
        exchange.setStatusCode(status);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=utf-8");
        exchange.getResponseHeaders().put(Headers.CONTENT_LENGTH, String.valueOf(body.length));
        exchange.getResponseSender().send(ByteBuffer.wrap(body));
    }

    private void sendInternalError(HttpServerExchange exchange, Exception error) {
        LOG.warn("Slack event handling failed", error);
        try {
            sendJson(exchange, 500, Map.of("error", "internal_error"));
        } catch (IOException | RuntimeException e) {
            LOG.debug("Could not send error response", e);
        }
    }

    private static String header(HttpServerExchange exchange, String name) {
        String value = exchange.getRequestHeaders().getFirst(name);
        return value == null ? "" : value;
    }

    private static int resolveBoundPort(Undertow undertow, int fallbackPort) {
        try {
            Object address = undertow.getListenerInfo().get(0).getAddress();
            if (address instanceof InetSocketAddress socketAddress) {
                return socketAddress.getPort();
            }
        } catch (RuntimeException e) {
            LOG.debug("Could not resolve bound port", e);
        }
        return fallbackPort;
    }
}
