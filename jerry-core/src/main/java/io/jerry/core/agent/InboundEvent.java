package io.jerry.core.agent;

import java.util.Map;
import java.util.Objects;

public record InboundEvent(
    Surface source,
    String conversationKey,
    String senderId,
    String text,
    String correlationId,
    Map<String, String> metadata
) {
    public enum Surface {
        SLACK,
        PEER,
        CLI
    }

    public InboundEvent {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(conversationKey, "conversationKey must not be null");
        senderId = senderId == null ? "" : senderId;
        text = text == null ? "" : text;
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static InboundEvent cli(String conversationKey, String text) {
        return new InboundEvent(Surface.CLI, conversationKey, "cli", text, null, Map.of());
    }

    public String metadata(String key) {
        return metadata.get(key);
    }
}
