package io.jerry.core.context;

import io.jerry.core.model.ChatMessage;
import java.util.List;

public record AssembledContext(List<ChatMessage> messages, int includedTurns, int omittedTurns) {
    public AssembledContext {
        messages = List.copyOf(messages);
    }
}
