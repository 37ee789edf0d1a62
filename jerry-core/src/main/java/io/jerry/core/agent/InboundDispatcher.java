package io.jerry.core.agent;

import io.jerry.core.concurrent.NamedThreadFactory;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class InboundDispatcher implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(InboundDispatcher.class);
    static final String OVERLOADED_REPLY = "I'm handling a lot of conversations right now. Please try again shortly.";

    private final OrchestrationLoop loop;
    private final ThreadPoolExecutor executor;

    public InboundDispatcher(OrchestrationLoop loop, int workers, int queueCapacity) {
        this.loop = loop;
        int size = Math.max(1, workers);
        this.executor = new ThreadPoolExecutor(
            size,
            size,
            60,
            TimeUnit.SECONDS,
            new LinkedBlockingQueue<>(Math.max(1, queueCapacity)),
            new NamedThreadFactory("jerry-inbound")
        );
    }

    public CompletableFuture<CycleResult> submit(InboundEvent event, ReplySink sink) {
        try {
            return CompletableFuture.supplyAsync(() -> loop.handleInboundMessage(event, sink), executor);
        } catch (RejectedExecutionException e) {
            LOG.warn("Inbound queue full, rejecting event for {}", event.conversationKey());
            try {
                sink.deliver(event, OVERLOADED_REPLY);
            } catch (RuntimeException deliveryError) {
                LOG.warn("Could not deliver overload reply for {}", event.conversationKey(), deliveryError);
            }
            return CompletableFuture.completedFuture(new CycleResult(CycleOutcome.BUSY, OVERLOADED_REPLY, 0, 0, false));
        }
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
