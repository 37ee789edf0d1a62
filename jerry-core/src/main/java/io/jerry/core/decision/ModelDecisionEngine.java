package io.jerry.core.decision;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.jerry.core.concurrent.NamedThreadFactory;
import io.jerry.core.model.ChatMessage;
import io.jerry.core.model.ToolCall;
import io.jerry.core.provider.LlmProvider;
import io.jerry.core.provider.LlmResponse;
import io.jerry.core.provider.ModelCatalog;
import io.jerry.core.provider.ModelRequest;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class ModelDecisionEngine implements DecisionEngine, AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(ModelDecisionEngine.class);
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};
    static final String EMPTY_ANSWER = "I wasn't able to come up with a response. Please try rephrasing your request.";

    private final LlmProvider provider;
    private final DecisionSettings settings;
    private final ExecutorService executor;

    public ModelDecisionEngine(LlmProvider provider, DecisionSettings settings) {
        this.provider = provider;
        this.settings = settings;
        this.executor = Executors.newCachedThreadPool(new NamedThreadFactory("jerry-model"));
    }

    @Override
    public Decision decide(List<ChatMessage> context, List<Map<String, Object>> tools) {
        return decide(context, tools, settings.timeout());
    }

    @Override
    public Decision decide(List<ChatMessage> context, List<Map<String, Object>> tools, Duration maxWait) {
        Duration timeout = maxWait == null || maxWait.compareTo(settings.timeout()) > 0 ? settings.timeout() : maxWait;
        ModelRequest request = new ModelRequest(
            settings.model(),
            context,
            tools,
            settings.temperature(),
            settings.maxTokens(),
            ModelCatalog.supportsParallelToolCalls(settings.model())
        );
        LlmResponse response = call(request, timeout);
        if (response.isError()) {
            throw new ModelUnavailableException(response.content());
        }
        return parse(response);
    }

    private LlmResponse call(ModelRequest request, Duration timeout) {
        Future<LlmResponse> future = executor.submit(() -> provider.chat(request));
        try {
            return future.get(Math.max(1, timeout.toMillis()), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new ModelUnavailableException(
                "Model " + settings.model() + " did not answer within " + timeout.toMillis() + " ms", e);
        } catch (ExecutionException e) {
            throw new ModelUnavailableException("Model call failed: " + e.getCause().getMessage(), e.getCause());
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ModelUnavailableException("Interrupted while waiting for the model", e);
        }
    }

    static Decision parse(LlmResponse response) {
        String content = response.content().trim();
        if (!response.toolCalls().isEmpty()) {
            List<ToolInvocation> invocations = new ArrayList<>();
            for (ToolCall call : response.toolCalls()) {
                if (!call.name().isBlank()) {
                    invocations.add(new ToolInvocation(call.name(), call.arguments()));
                }
            }
            boolean dropped = invocations.size() < response.toolCalls().size();
            if (invocations.isEmpty()) {
                LOG.warn("Model returned {} tool calls without names", response.toolCalls().size());
                return Decision.degradedAnswer(content.isEmpty() ? EMPTY_ANSWER : content);
            }
            return new Decision(Decision.Kind.TOOL_INVOCATIONS, content, invocations, dropped);
        }

        String json = unfence(content);
        if (json.startsWith("{")) {
            Decision structured = parseStructured(json);
            if (structured != null) {
                return structured;
            }
            LOG.warn("Model output looked structured but could not be parsed; using raw text");
            return Decision.degradedAnswer(content);
        }
        if (content.isEmpty()) {
            return Decision.degradedAnswer(EMPTY_ANSWER);
        }
        return Decision.finalAnswer(content);
    }

    private static Decision parseStructured(String json) {
        JsonNode root;
        try {
            root = JSON.readTree(json);
        } catch (IOException e) {
            return null;
        }
        if (root == null || !root.isObject()) {
            return null;
        }
        if (root.path("final_answer").isTextual()) {
            return Decision.finalAnswer(root.path("final_answer").asText());
        }
        JsonNode calls = root.path("tool_calls");
        if (!calls.isArray() || calls.isEmpty()) {
            return null;
        }
        List<ToolInvocation> invocations = new ArrayList<>();
        for (JsonNode call : calls) {
            String name = call.path("name").asText(call.path("tool").asText(""));
            JsonNode args = call.has("arguments") ? call.path("arguments") : call.path("args");
            if (name.isBlank() || !(args.isObject() || args.isMissingNode())) {
                return null;
            }
            Map<String, Object> arguments = args.isObject() ? JSON.convertValue(args, MAP_TYPE) : Map.of();
            invocations.add(new ToolInvocation(name, arguments));
        }
        return Decision.toolInvocations(invocations);
    }

    private static String unfence(String content) {
        if (!content.startsWith("```")) {
            return content;
        }
        int firstNewline = content.indexOf('\n');
        int closing = content.lastIndexOf("```");
        if (firstNewline < 0 || closing <= firstNewline) {
            return content;
        }
        return content.substring(firstNewline + 1, closing).trim();
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
