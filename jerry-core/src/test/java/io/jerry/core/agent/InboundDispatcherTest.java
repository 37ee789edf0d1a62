package io.jerry.core.agent;

import static org.assertj.core.api.Assertions.assertThat;

import io.jerry.core.context.ContextAssembler;
import io.jerry.core.context.ContextBudget;
import io.jerry.core.context.SystemPromptBuilder;
import io.jerry.core.decision.Decision;
import io.jerry.core.decision.DecisionEngine;
import io.jerry.core.peer.PeerCaller;
import io.jerry.core.peer.PeerRequest;
import io.jerry.core.session.ConversationSessionManager;
import io.jerry.core.tool.CorrelationIdGenerator;
import io.jerry.core.tool.PeerToolDescriptor;
import io.jerry.core.tool.ToolRegistry;
import io.jerry.core.tool.ToolRoute;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class InboundDispatcherTest {
    private final ConversationSessionManager sessions = new ConversationSessionManager(
        Clock.systemUTC(), Duration.ofSeconds(5), Duration.ofMinutes(30));
    private final ToolRegistry registry = new ToolRegistry(Clock.systemUTC(), 2);

    @AfterEach
    void tearDown() {
        registry.close();
        sessions.close();
    }

    @Test
    void shouldAnswerEachSubmittedEvent() throws Exception {
        try (InboundDispatcher dispatcher = new InboundDispatcher(loop((context, tools) -> Decision.finalAnswer("ok")), 4, 16)) {
            List<CompletableFuture<CycleResult>> futures = new ArrayList<>();
            for (int i = 0; i < 5; i++) {
                futures.add(dispatcher.submit(InboundEvent.cli("cli:" + i, "hello"), ReplySink.discard()));
            }

            for (CompletableFuture<CycleResult> future : futures) {
                assertThat(future.get(5, TimeUnit.SECONDS).outcome()).isEqualTo(CycleOutcome.ANSWERED);
            }
        }
    }

    @Test
    void shouldRejectWithOverloadReplyWhenQueueIsFull() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch started = new CountDownLatch(1);
        DecisionEngine blocking = (context, tools) -> {
            started.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return Decision.finalAnswer("finally");
        };
        List<String> replies = Collections.synchronizedList(new ArrayList<>());

        try (InboundDispatcher dispatcher = new InboundDispatcher(loop(blocking), 1, 1)) {
            CompletableFuture<CycleResult> running = dispatcher.submit(InboundEvent.cli("cli:a", "one"), ReplySink.discard());
            assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
            CompletableFuture<CycleResult> queued = dispatcher.submit(InboundEvent.cli("cli:b", "two"), ReplySink.discard());
            CompletableFuture<CycleResult> rejected = dispatcher.submit(
                InboundEvent.cli("cli:c", "three"), (event, reply) -> replies.add(reply));

            assertThat(rejected.get(1, TimeUnit.SECONDS).outcome()).isEqualTo(CycleOutcome.BUSY);
            assertThat(replies).containsExactly(InboundDispatcher.OVERLOADED_REPLY);

            release.countDown();
            assertThat(running.get(5, TimeUnit.SECONDS).reply()).isEqualTo("finally");
            assertThat(queued.get(5, TimeUnit.SECONDS).reply()).isEqualTo("finally");
        }
    }

    @Test
    void peerBridgeShouldAnswerRequestUnderItsCorrelationId() throws Exception {
        CompletableFuture<String> answered = new CompletableFuture<>();
        List<String> correlationIds = Collections.synchronizedList(new ArrayList<>());
        try (InboundDispatcher dispatcher = new InboundDispatcher(
            loop((context, tools) -> Decision.finalAnswer("It is noon.")), 2, 8)) {
            PeerInboundBridge bridge = new PeerInboundBridge(dispatcher, registry, () -> (correlationId, text) -> {
                correlationIds.add(correlationId);
                answered.complete(text);
            }, null);

            bridge.onRequest(new PeerRequest("agent-b", "in-7", Map.of("message", "what time is it?"), null));

            assertThat(answered.get(5, TimeUnit.SECONDS)).isEqualTo("It is noon.");
            assertThat(correlationIds).containsExactly("in-7");
            assertThat(sessions.find("coral:agent-b")).isPresent();
        }
    }

    @Test
    void peerBridgeShouldReplaceCatalogAndDescribeToolRequests() {
        try (InboundDispatcher dispatcher = new InboundDispatcher(
            loop((context, tools) -> Decision.finalAnswer("unused")), 1, 1)) {
            PeerInboundBridge bridge = new PeerInboundBridge(dispatcher, registry, () -> (id, text) -> { }, null);

            bridge.onCatalog(List.of(new PeerToolDescriptor("translate", "Translate text", null, "agent-b")));

            assertThat(registry.lookup("translate").kind()).isEqualTo(ToolRoute.Kind.PEER);
        }

        InboundEvent event = PeerInboundBridge.toEvent(
            new PeerRequest("agent-b", "in-8", Map.of("query", "jdk 17"), "search"));
        assertThat(event.source()).isEqualTo(InboundEvent.Surface.PEER);
        assertThat(event.conversationKey()).isEqualTo("coral:agent-b");
        assertThat(event.correlationId()).isEqualTo("in-8");
        assertThat(event.text()).isEqualTo("Agent agent-b asked you to run 'search' with: jdk 17");
        assertThat(event.metadata("tool")).isEqualTo("search");
    }

    private OrchestrationLoop loop(DecisionEngine engine) {
        return new OrchestrationLoop(
            sessions,
            new ContextAssembler(new ContextBudget(20, 12_000)),
            new SystemPromptBuilder(Clock.systemUTC()),
            engine,
            registry,
            PeerCaller.unavailable(),
            new CorrelationIdGenerator("d-"),
            AgentSettings.defaults(),
            null,
            Clock.systemUTC()
        );
    }
}
