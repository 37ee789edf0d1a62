package io.jerry.core.tool;

import io.jerry.core.concurrent.NamedThreadFactory;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class ToolRegistry implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(ToolRegistry.class);
    private static final int DEFAULT_WORKERS = 16;

    private final Map<String, Tool> tools = new ConcurrentHashMap<>();
    private final Map<String, PeerToolDescriptor> peerTools = new ConcurrentHashMap<>();
    private final ExecutorService executor;
    private final Clock clock;

    public ToolRegistry() {
        this(Clock.systemUTC(), DEFAULT_WORKERS);
    }

    public ToolRegistry(Clock clock, int workers) {
        this.clock = clock;
        int size = Math.max(1, workers);
        this.executor = new ThreadPoolExecutor(
            size,
            size,
            60,
            TimeUnit.SECONDS,
            new LinkedBlockingQueue<>(size * 16),
            new NamedThreadFactory("jerry-tool")
        );
    }

    public void register(Tool tool) {
        tools.put(tool.name(), tool);
    }

    public void registerPeerTool(PeerToolDescriptor descriptor) {
        peerTools.put(descriptor.name(), descriptor);
    }

    public synchronized void replacePeerTools(Collection<PeerToolDescriptor> descriptors) {
        peerTools.clear();
        for (PeerToolDescriptor descriptor : descriptors) {
            peerTools.put(descriptor.name(), descriptor);
        }
        LOG.info("Registered {} peer tools", descriptors.size());
    }

    public Optional<Tool> find(String name) {
        return Optional.ofNullable(tools.get(name));
    }

    public Collection<Tool> all() {
        return tools.values();
    }

    public ToolRoute lookup(String name) {
        Tool tool = name == null ? null : tools.get(name);
        if (tool != null) {
            return ToolRoute.local(tool);
        }
        PeerToolDescriptor peer = name == null ? null : peerTools.get(name);
        if (peer != null) {
            return ToolRoute.peer(peer);
        }
        throw new UnknownToolException(name);
    }

    public List<ToolRoute> routes() {
        List<ToolRoute> routes = new ArrayList<>();
        tools.values().stream()
            .sorted((a, b) -> a.name().compareTo(b.name()))
            .forEach(tool -> routes.add(ToolRoute.local(tool)));
        peerTools.values().stream()
            .filter(peer -> !tools.containsKey(peer.name()))
            .sorted((a, b) -> a.name().compareTo(b.name()))
            .forEach(peer -> routes.add(ToolRoute.peer(peer)));
        return routes;
    }

    public List<Map<String, Object>> definitions() {
        return routes().stream()
            .map(route -> Map.<String, Object>of(
                "type", "function",
                "function", Map.of(
                    "name", route.name(),
                    "description", route.description(),
                    "parameters", route.schema())))
            .toList();
    }

    public List<Map<String, Object>> localDefinitions() {
        return routes().stream()
            .filter(route -> route.kind() == ToolRoute.Kind.LOCAL)
            .map(route -> Map.<String, Object>of(
                "name", route.name(),
                "description", route.description(),
                "schema", route.schema()))
            .toList();
    }

    public CompletableFuture<ToolCallResult> invoke(ToolCallRequest request, ToolContext context) {
        Tool tool = tools.get(request.toolName());
        if (tool == null) {
            return CompletableFuture.completedFuture(ToolCallResult.failure(
                request.correlationId(),
                request.toolName(),
                new UnknownToolException(request.toolName()).getMessage()
            ));
        }
        return invoke(tool, request, context);
    }

    /**
     * Runs the tool on the registry's workers. The future always completes normally: a thrown
     * exception becomes a failure result and a missed deadline becomes a timeout result. A
     * tool that overruns keeps running in the background and its late result is dropped.
     */
    public CompletableFuture<ToolCallResult> invoke(Tool tool, ToolCallRequest request, ToolContext context) {
        Duration remaining = Duration.between(clock.instant(), request.deadline());
        if (remaining.isNegative() || remaining.isZero()) {
            return CompletableFuture.completedFuture(ToolCallResult.timeout(request.correlationId(), tool.name()));
        }
        CompletableFuture<ToolCallResult> future;
        try {
            future = CompletableFuture.supplyAsync(() -> execute(tool, request, context), executor);
        } catch (RejectedExecutionException e) {
            LOG.warn("Tool {} rejected, worker queue is full", tool.name());
            return CompletableFuture.completedFuture(
                ToolCallResult.failure(request.correlationId(), tool.name(), "tool workers are saturated"));
        }
        return future
            .exceptionally(ex -> ToolCallResult.failure(request.correlationId(), tool.name(), describe(ex)))
            .completeOnTimeout(
                ToolCallResult.timeout(request.correlationId(), tool.name()),
                remaining.toMillis(),
                TimeUnit.MILLISECONDS
            );
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

    private ToolCallResult execute(Tool tool, ToolCallRequest request, ToolContext context) {
        long started = System.currentTimeMillis();
        try {
            String output = tool.execute(request.arguments(), context);
            LOG.debug("Tool {} ({}) finished in {} ms", tool.name(), request.correlationId(),
                System.currentTimeMillis() - started);
            return ToolCallResult.success(request.correlationId(), tool.name(), output);
        } catch (RuntimeException ex) {
            LOG.warn("Tool {} failed", tool.name(), ex);
            return ToolCallResult.failure(request.correlationId(), tool.name(), describe(ex));
        }
    }

    private static String describe(Throwable ex) {
        Throwable cause = ex.getCause() != null && ex instanceof CompletionException
            ? ex.getCause()
            : ex;
        return cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
    }
}
