package io.jerry.core.slack;

public record ThreadMessage(String user, String botId, String text, String ts) {

    public boolean fromBot() {
        return !botId.isBlank();
    }
}
