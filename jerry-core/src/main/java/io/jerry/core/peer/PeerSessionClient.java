package io.jerry.core.peer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.jerry.core.concurrent.NamedThreadFactory;
import io.jerry.core.tool.PeerToolDescriptor;
import io.jerry.core.tool.ToolCallRequest;
import io.jerry.core.tool.ToolCallResult;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The single connection to the coordination network.
 *
 * <p>Callers never touch the socket. Outbound frames go through a queue drained by one
 * writer thread; inbound frames are demultiplexed by correlation id onto the pending
 * calls map. A pending entry is removed exactly once, by whichever of result, deadline or
 * session failure gets there first.
 *
 * <p>State: {@code CONNECTING -> OPEN} on {@code welcome}; {@code OPEN -> DEGRADED} on a
 * stream failure or missed heartbeat; {@code DEGRADED -> OPEN} after a successful
 * reconnect; {@code CLOSED} on {@link #close()}, rejected credentials or exhausted
 * reconnect attempts.
 */
public final class PeerSessionClient implements PeerCaller, AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(PeerSessionClient.class);
    private static final ObjectMapper JSON = new ObjectMapper();

    private final PeerSessionSettings settings;
    private final Supplier<List<Map<String, Object>>> exposedTools;
    private final PeerSessionListener listener;
    private final Clock clock;
    private final OkHttpClient client;
    private final ScheduledExecutorService scheduler;
    private final Thread writer;
    private final LinkedBlockingDeque<OutboundFrame> outbound = new LinkedBlockingDeque<>();
    private final ConcurrentHashMap<String, PendingCall> pending = new ConcurrentHashMap<>();
    private final AtomicInteger generation = new AtomicInteger();
    private final Object stateLock = new Object();

    private PeerSessionState state = PeerSessionState.CONNECTING;
    private volatile WebSocket socket;
    private int reconnectAttempts;

    public PeerSessionClient(
        PeerSessionSettings settings,
        Supplier<List<Map<String, Object>>> exposedTools,
        PeerSessionListener listener,
        Clock clock
    ) {
        this(settings, exposedTools, listener, clock,
            Executors.newSingleThreadScheduledExecutor(new NamedThreadFactory("jerry-peer-timer")));
    }

    PeerSessionClient(
        PeerSessionSettings settings,
        Supplier<List<Map<String, Object>>> exposedTools,
        PeerSessionListener listener,
        Clock clock,
        ScheduledExecutorService scheduler
    ) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.exposedTools = exposedTools == null ? List::of : exposedTools;
        this.listener = listener == null ? new PeerSessionListener() { } : listener;
        this.clock = clock;
        this.client = new OkHttpClient.Builder()
            .pingInterval(settings.heartbeat())
            .connectTimeout(settings.handshakeTimeout())
            .readTimeout(Duration.ZERO)
            .build();
        this.scheduler = scheduler;
        this.writer = new NamedThreadFactory("jerry-peer-writer").newThread(this::drainOutbound);
    }

    public void start() {
        writer.start();
        connect();
    }

    public PeerSessionState state() {
        synchronized (stateLock) {
            return state;
        }
    }

    public int pendingCount() {
        return pending.size();
    }

    public boolean awaitState(PeerSessionState expected, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        synchronized (stateLock) {
            while (state != expected) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    return false;
                }
                TimeUnit.NANOSECONDS.timedWait(stateLock, remaining);
            }
            return true;
        }
    }

    @Override
    public CompletableFuture<ToolCallResult> call(PeerToolDescriptor tool, ToolCallRequest request) {
        PeerSessionState current = state();
        if (current != PeerSessionState.OPEN) {
            throw new PeerUnavailableException("Peer session is " + current.name().toLowerCase());
        }
        Duration remaining = Duration.between(clock.instant(), request.deadline());
        if (remaining.isNegative() || remaining.isZero()) {
            return CompletableFuture.completedFuture(ToolCallResult.timeout(request.correlationId(), tool.name()));
        }

        PendingCall call = new PendingCall(tool.name(), new CompletableFuture<>());
        if (pending.putIfAbsent(request.correlationId(), call) != null) {
            throw new IllegalStateException("Correlation id already in flight: " + request.correlationId());
        }
        try {
            call.timer = scheduler.schedule(
                () -> resolve(request.correlationId(), ToolCallResult.timeout(request.correlationId(), tool.name())),
                remaining.toMillis(),
                TimeUnit.MILLISECONDS
            );
        } catch (RejectedExecutionException e) {
            pending.remove(request.correlationId(), call);
            throw new PeerUnavailableException("Peer session is closing");
        }
        // close() may have swept the pending map between the state check and the put
        if (state() == PeerSessionState.CLOSED) {
            resolve(request.correlationId(),
                ToolCallResult.failure(request.correlationId(), tool.name(), "peer session closed"));
            return call.future;
        }
        PeerFrame frame = PeerFrame.call(request.correlationId(), tool.agentId(), tool.name(), request.arguments());
        outbound.offer(new OutboundFrame(request.correlationId(), encode(frame), false));
        return call.future;
    }

    public void respond(String correlationId, String text) {
        PeerSessionState current = state();
        if (current != PeerSessionState.OPEN) {
            throw new PeerUnavailableException("Cannot answer " + correlationId + ", peer session is "
                + current.name().toLowerCase());
        }
        outbound.offer(new OutboundFrame(null, encode(PeerFrame.response(correlationId, text)), false));
    }

    @Override
    public void close() {
        if (!transition(PeerSessionState.CLOSED)) {
            return;
        }
        generation.incrementAndGet();
        failAllPending("peer session closed");
        WebSocket current = socket;
        if (current != null) {
            current.close(1000, "shutdown");
        }
        writer.interrupt();
        scheduler.shutdownNow();
        client.dispatcher().executorService().shutdown();
        LOG.info("Peer session {} closed", settings.agentId());
    }

    private void connect() {
        int gen = generation.incrementAndGet();
        Request request = new Request.Builder()
            .url(settings.url())
            .header("X-Agent-Id", settings.agentId())
            .build();
        LOG.info("Connecting to coordination network at {} as {}", settings.url(), settings.agentId());
        client.newWebSocket(request, new SocketListener(gen));
        scheduler.schedule(() -> {
            if (generation.get() == gen && state() != PeerSessionState.OPEN && state() != PeerSessionState.CLOSED) {
                connectionLost(gen, "handshake timed out", null);
            }
        }, settings.handshakeTimeout().toMillis(), TimeUnit.MILLISECONDS);
    }

    private void onFrame(int gen, String text) {
        PeerFrame frame;
        try {
            frame = JSON.readValue(text, PeerFrame.class);
        } catch (JsonProcessingException e) {
            LOG.warn("Dropping malformed peer frame: {}", e.getOriginalMessage());
            return;
        }
        String type = frame.type() == null ? "" : frame.type();
        switch (type) {
            case PeerFrame.WELCOME -> onWelcome(gen, frame);
            case PeerFrame.RESULT -> resolve(frame.correlationId(),
                ToolCallResult.success(frame.correlationId(), frame.tool(), frame.text()));
            case PeerFrame.ERROR -> onError(frame);
            case PeerFrame.REQUEST -> listener.onRequest(
                new PeerRequest(frame.agentId(), frame.correlationId(), frame.payload(), frame.tool()));
            case PeerFrame.PING -> outbound.offer(new OutboundFrame(null, encode(PeerFrame.pong()), true));
            case PeerFrame.PONG -> LOG.trace("pong");
            default -> LOG.debug("Ignoring peer frame of type '{}'", type);
        }
    }

    private void onWelcome(int gen, PeerFrame frame) {
        synchronized (stateLock) {
            if (generation.get() != gen || state == PeerSessionState.CLOSED) {
                return;
            }
            reconnectAttempts = 0;
        }
        transition(PeerSessionState.OPEN);
        LOG.info("Peer session {} open", settings.agentId());
        List<PeerToolDescriptor> catalog = new ArrayList<>();
        if (frame.tools() != null) {
            for (Map<String, Object> tool : frame.tools()) {
                Object name = tool.get("name");
                if (name == null) {
                    continue;
                }
                catalog.add(new PeerToolDescriptor(
                    name.toString(),
                    stringValue(tool.get("description")),
                    schemaOf(tool.get("schema")),
                    stringValue(tool.get("agent_id"))
                ));
            }
        }
        listener.onCatalog(catalog);
    }

    private void onError(PeerFrame frame) {
        if (frame.correlationId() == null) {
            if (PeerFrame.UNAUTHORIZED.equals(frame.error())) {
                fatal("coordination network rejected agent " + settings.agentId(), null);
            } else {
                LOG.warn("Peer session error: {}", frame.error());
            }
            return;
        }
        resolve(frame.correlationId(), ToolCallResult.failure(
            frame.correlationId(),
            frame.tool(),
            frame.error() == null ? "peer reported an error" : frame.error()
        ));
    }

    private void resolve(String correlationId, ToolCallResult result) {
        if (correlationId == null) {
            LOG.warn("Dropping peer {} frame without correlation id", result.outcome());
            return;
        }
        PendingCall call = pending.remove(correlationId);
        if (call == null) {
            LOG.warn("Dropping peer result for unknown or expired correlation id {}", correlationId);
            return;
        }
        if (call.timer != null) {
            call.timer.cancel(false);
        }
        ToolCallResult named = result.toolName().isEmpty()
            ? new ToolCallResult(result.correlationId(), call.toolName, result.outcome(), result.payload(), result.reason())
            : result;
        call.future.complete(named);
    }

    private void failAllPending(String reason) {
        for (String correlationId : List.copyOf(pending.keySet())) {
            PendingCall call = pending.remove(correlationId);
            if (call != null) {
                if (call.timer != null) {
                    call.timer.cancel(false);
                }
                call.future.complete(ToolCallResult.failure(correlationId, call.toolName, reason));
            }
        }
    }

    private void connectionLost(int gen, String reason, Throwable cause) {
        int attempt;
        synchronized (stateLock) {
            if (generation.get() != gen || state == PeerSessionState.CLOSED) {
                return;
            }
            attempt = ++reconnectAttempts;
            // events still in flight from the lost socket must not count as a second failure
            generation.incrementAndGet();
        }
        transition(PeerSessionState.DEGRADED);
        LOG.warn("Peer session degraded: {}", reason, cause);
        failAllPending("peer session degraded: " + reason);
        WebSocket current = socket;
        if (current != null) {
            current.cancel();
        }
        if (settings.reconnect().exhausted(attempt)) {
            fatal("gave up after " + settings.reconnect().maxAttempts() + " reconnect attempts (" + reason + ")", cause);
            return;
        }
        Duration delay = settings.reconnect().delayFor(attempt);
        LOG.info("Reconnecting to coordination network in {} ms (attempt {})", delay.toMillis(), attempt);
        scheduler.schedule(this::reconnectIfDegraded, delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void reconnectIfDegraded() {
        if (state() == PeerSessionState.DEGRADED) {
            connect();
        }
    }

    private void fatal(String reason, Throwable cause) {
        if (state() == PeerSessionState.CLOSED) {
            return;
        }
        LOG.error("Peer session failed permanently: {}", reason);
        close();
        listener.onFatal(new PeerSessionFatalException(reason, cause));
    }

    private boolean transition(PeerSessionState next) {
        synchronized (stateLock) {
            if (state == PeerSessionState.CLOSED || state == next) {
                return false;
            }
            state = next;
            stateLock.notifyAll();
            return true;
        }
    }

    private void drainOutbound() {
        while (!Thread.currentThread().isInterrupted()) {
            OutboundFrame frame;
            try {
                frame = outbound.poll(250, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            if (frame != null) {
                send(frame);
            }
        }
        for (OutboundFrame frame : outbound) {
            if (frame.correlationId() != null) {
                resolve(frame.correlationId(), ToolCallResult.failure(frame.correlationId(), null, "peer session closed"));
            }
        }
        outbound.clear();
    }

    private void send(OutboundFrame frame) {
        WebSocket current = socket;
        boolean usable = current != null && (frame.handshake() || state() == PeerSessionState.OPEN);
        if (usable && current.send(frame.json())) {
            return;
        }
        if (frame.correlationId() != null) {
            resolve(frame.correlationId(), ToolCallResult.failure(frame.correlationId(), null, "peer session unavailable"));
        } else {
            LOG.debug("Dropped outbound peer frame while session is {}", state());
        }
    }

    private static String encode(PeerFrame frame) {
        try {
            return JSON.writeValueAsString(frame);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Peer frame is not serializable: " + e.getOriginalMessage(), e);
        }
    }

    private static String stringValue(Object value) {
        return value == null ? "" : value.toString();
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> schemaOf(Object value) {
        return value instanceof Map<?, ?> map ? (Map<String, Object>) map : null;
    }

    private record OutboundFrame(String correlationId, String json, boolean handshake) {
    }

    private static final class PendingCall {
        private final String toolName;
        private final CompletableFuture<ToolCallResult> future;
        private volatile ScheduledFuture<?> timer;

        private PendingCall(String toolName, CompletableFuture<ToolCallResult> future) {
            this.toolName = toolName;
            this.future = future;
        }
    }

    private final class SocketListener extends WebSocketListener {
        private final int gen;

        private SocketListener(int gen) {
            this.gen = gen;
        }

        @Override
        public void onOpen(WebSocket webSocket, Response response) {
            if (generation.get() != gen) {
                webSocket.cancel();
                return;
            }
            socket = webSocket;
            String hello = encode(PeerFrame.hello(settings.agentId(), exposedTools.get()));
            outbound.offerFirst(new OutboundFrame(null, hello, true));
        }

        @Override
        public void onMessage(WebSocket webSocket, String text) {
            if (generation.get() == gen) {
                onFrame(gen, text);
            }
        }

        @Override
        public void onClosing(WebSocket webSocket, int code, String reason) {
            webSocket.close(1000, null);
            connectionLost(gen, "closed by peer (" + code + " " + reason + ")", null);
        }

        @Override
        public void onFailure(WebSocket webSocket, Throwable t, Response response) {
            if (response != null && (response.code() == 401 || response.code() == 403)) {
                if (generation.get() == gen) {
                    fatal("coordination network rejected credentials (HTTP " + response.code() + ")", t);
                }
                return;
            }
            connectionLost(gen, t.getMessage() == null ? t.getClass().getSimpleName() : t.getMessage(), t);
        }
    }
}
