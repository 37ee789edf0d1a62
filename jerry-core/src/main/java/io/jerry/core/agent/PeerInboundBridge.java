package io.jerry.core.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.jerry.core.peer.PeerRequest;
import io.jerry.core.peer.PeerSessionFatalException;
import io.jerry.core.peer.PeerSessionListener;
import io.jerry.core.peer.PeerUnavailableException;
import io.jerry.core.tool.PeerToolDescriptor;
import io.jerry.core.tool.ToolRegistry;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class PeerInboundBridge implements PeerSessionListener {
    private static final Logger LOG = LoggerFactory.getLogger(PeerInboundBridge.class);
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final List<String> TEXT_FIELDS = List.of("message", "text", "query", "question");

    private final InboundDispatcher dispatcher;
    private final ToolRegistry toolRegistry;
    private final Supplier<PeerResponder> responder;
    private final Consumer<PeerSessionFatalException> fatalHandler;

    @FunctionalInterface
    public interface PeerResponder {
        void respond(String correlationId, String text);
    }

    public PeerInboundBridge(
        InboundDispatcher dispatcher,
        ToolRegistry toolRegistry,
        Supplier<PeerResponder> responder,
        Consumer<PeerSessionFatalException> fatalHandler
    ) {
        this.dispatcher = dispatcher;
        this.toolRegistry = toolRegistry;
        this.responder = responder;
        this.fatalHandler = fatalHandler == null ? error -> { } : fatalHandler;
    }

    @Override
    public void onCatalog(List<PeerToolDescriptor> tools) {
        toolRegistry.replacePeerTools(tools);
    }

    @Override
    public void onRequest(PeerRequest request) {
        if (request.correlationId() == null || request.senderAgentId() == null) {
            LOG.warn("Ignoring peer request without sender or correlation id");
            return;
        }
        InboundEvent event = toEvent(request);
        dispatcher.submit(event, (inbound, reply) -> {
            try {
                responder.get().respond(inbound.correlationId(), reply);
            } catch (PeerUnavailableException e) {
                LOG.warn("Reply to peer {} for {} lost: {}", inbound.senderId(), inbound.correlationId(), e.getMessage());
            }
        });
    }

    @Override
    public void onFatal(PeerSessionFatalException error) {
        fatalHandler.accept(error);
    }

    static InboundEvent toEvent(PeerRequest request) {
        Map<String, String> metadata = new HashMap<>();
        if (request.toolName() != null) {
            metadata.put("tool", request.toolName());
        }
        return new InboundEvent(
            InboundEvent.Surface.PEER,
            "coral:" + request.senderAgentId(),
            request.senderAgentId(),
            describe(request),
            request.correlationId(),
            metadata
        );
    }

    private static String describe(PeerRequest request) {
        String text = null;
        for (String field : TEXT_FIELDS) {
            Object value = request.payload().get(field);
            if (value != null && !value.toString().isBlank()) {
                text = value.toString();
                break;
            }
        }
        if (text == null) {
            text = request.payload().isEmpty() ? "" : toJson(request.payload());
        }
        if (request.toolName() == null || request.toolName().isBlank()) {
            return text;
        }
        return "Agent " + request.senderAgentId() + " asked you to run '" + request.toolName() + "' with: " + text;
    }

    private static String toJson(Map<String, Object> payload) {
        try {
            return JSON.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            return payload.toString();
        }
    }
}
