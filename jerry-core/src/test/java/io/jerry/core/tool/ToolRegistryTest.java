package io.jerry.core.tool;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class ToolRegistryTest {

    private final ToolRegistry registry = new ToolRegistry(Clock.systemUTC(), 4);

    @AfterEach
    void tearDown() {
        registry.close();
    }

    @Test
    void shouldRegisterAndResolveTool() throws Exception {
        registry.register(new EchoTool());

        ToolCallResult result = registry.invoke(request("c-1", "echo", Map.of("text", "ok")), ToolContext.detached())
            .get(5, TimeUnit.SECONDS);

        assertThat(registry.lookup("echo").kind()).isEqualTo(ToolRoute.Kind.LOCAL);
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.payload()).isEqualTo("ok");
        assertThat(result.correlationId()).isEqualTo("c-1");
    }

    @Test
    void shouldReportUnknownToolOnLookupAndAsFailedResult() throws Exception {
        assertThatThrownBy(() -> registry.lookup("missing"))
            .isInstanceOf(UnknownToolException.class)
            .hasMessageContaining("missing");

        ToolCallResult result = registry.invoke(request("c-2", "missing", Map.of()), ToolContext.detached())
            .get(5, TimeUnit.SECONDS);

        assertThat(result.outcome()).isEqualTo(ToolOutcome.FAILURE);
        assertThat(result.render()).contains("Tool 'missing' not found");
    }

    @Test
    void shouldTurnToolExceptionIntoFailureResult() throws Exception {
        registry.register(new FailingTool());

        ToolCallResult result = registry.invoke(request("c-3", "boom", Map.of()), ToolContext.detached())
            .get(5, TimeUnit.SECONDS);

        assertThat(result.outcome()).isEqualTo(ToolOutcome.FAILURE);
        assertThat(result.reason()).isEqualTo("kaboom");
        assertThat(result.render()).isEqualTo("Error executing tool 'boom': kaboom");
    }

    @Test
    void shouldCompleteWithTimeoutWhenToolOverrunsDeadline() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        registry.register(new BlockingTool(release));

        ToolCallRequest request = new ToolCallRequest(
            "c-4", "slow", Map.of(), "k", Instant.now().plus(Duration.ofMillis(150)));
        ToolCallResult result = registry.invoke(request, ToolContext.detached()).get(5, TimeUnit.SECONDS);
        release.countDown();

        assertThat(result.outcome()).isEqualTo(ToolOutcome.TIMEOUT);
        assertThat(result.correlationId()).isEqualTo("c-4");
    }

    @Test
    void shouldLetLocalToolShadowPeerToolOfSameName() {
        registry.register(new EchoTool());
        registry.replacePeerTools(List.of(
            new PeerToolDescriptor("echo", "peer echo", null, "other-agent"),
            new PeerToolDescriptor("translate", "Translate text", null, "translator")
        ));

        assertThat(registry.lookup("echo").kind()).isEqualTo(ToolRoute.Kind.LOCAL);
        assertThat(registry.lookup("translate").kind()).isEqualTo(ToolRoute.Kind.PEER);
        assertThat(registry.routes()).extracting(ToolRoute::name).containsExactly("echo", "translate");
        assertThat(registry.localDefinitions()).extracting(definition -> definition.get("name")).containsExactly("echo");
    }

    @Test
    void shouldReplaceWholePeerCatalog() {
        registry.replacePeerTools(List.of(new PeerToolDescriptor("a", "", null, "x")));
        registry.replacePeerTools(List.of(new PeerToolDescriptor("b", "", null, "x")));

        assertThatThrownBy(() -> registry.lookup("a")).isInstanceOf(UnknownToolException.class);
        assertThat(registry.lookup("b").peer().agentId()).isEqualTo("x");
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldRenderChatCompletionFunctionDefinitions() {
        registry.register(new EchoTool());

        Map<String, Object> definition = registry.definitions().get(0);
        Map<String, Object> function = (Map<String, Object>) definition.get("function");

        assertThat(definition).containsEntry("type", "function");
        assertThat(function).containsEntry("name", "echo").containsEntry("description", "Echo tool");
    }

    private static ToolCallRequest request(String id, String tool, Map<String, Object> args) {
        return new ToolCallRequest(id, tool, args, "k", Instant.now().plusSeconds(5));
    }

    private static final class EchoTool implements Tool {
        @Override
        public String name() {
            return "echo";
        }

        @Override
        public String description() {
            return "Echo tool";
        }

        @Override
        public String execute(Map<String, Object> input, ToolContext context) {
            return String.valueOf(input.getOrDefault("text", ""));
        }
    }

    private static final class FailingTool implements Tool {
        @Override
        public String name() {
            return "boom";
        }

        @Override
        public String description() {
            return "Always fails";
        }

        @Override
        public String execute(Map<String, Object> input, ToolContext context) {
            throw new IllegalStateException("kaboom");
        }
    }

    private static final class BlockingTool implements Tool {
        private final CountDownLatch release;

        private BlockingTool(CountDownLatch release) {
            this.release = release;
        }

        @Override
        public String name() {
            return "slow";
        }

        @Override
        public String description() {
            return "Blocks until released";
        }

        @Override
        public String execute(Map<String, Object> input, ToolContext context) {
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return "late";
        }
    }
}
