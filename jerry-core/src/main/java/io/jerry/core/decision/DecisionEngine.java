package io.jerry.core.decision;

import io.jerry.core.model.ChatMessage;
import java.time.Duration;
import java.util.List;
import java.util.Map;

public interface DecisionEngine {

    Decision decide(List<ChatMessage> context, List<Map<String, Object>> tools);

    // Engines with their own timeout should wait no longer than maxWait.
    default Decision decide(List<ChatMessage> context, List<Map<String, Object>> tools, Duration maxWait) {
        return decide(context, tools);
    }
}
