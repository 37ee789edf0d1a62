package io.jerry.core.slack;

import com.fasterxml.jackson.databind.JsonNode;

public record SlackEvent(
    String envelopeType,
    String eventId,
    String challenge,
    String type,
    String subtype,
    String channel,
    String user,
    String botId,
    String text,
    String ts,
    String threadTs,
    String channelType,
    String authorizedUserId
) {
    public static final String URL_VERIFICATION = "url_verification";
    public static final String EVENT_CALLBACK = "event_callback";
    public static final String MESSAGE = "message";
    public static final String APP_MENTION = "app_mention";
    public static final String ASSISTANT_THREAD_STARTED = "assistant_thread_started";

    public static SlackEvent from(JsonNode body) {
        JsonNode event = body.path("event");
        // assistant thread events carry their coordinates in a nested object
        JsonNode thread = event.path("assistant_thread");
        JsonNode source = thread.isObject() ? thread : event;
        JsonNode authorizations = body.path("authorizations");
        String authorizedUser = authorizations.isArray() && !authorizations.isEmpty()
            ? authorizations.get(0).path("user_id").asText("")
            : "";
        return new SlackEvent(
            body.path("type").asText(""),
            body.path("event_id").asText(""),
            body.path("challenge").asText(""),
            event.path("type").asText(""),
            event.path("subtype").asText(""),
            source.path(thread.isObject() ? "channel_id" : "channel").asText(""),
            source.path(thread.isObject() ? "user_id" : "user").asText(""),
            event.path("bot_id").asText(""),
            event.path("text").asText(""),
            event.path("ts").asText(""),
            source.path("thread_ts").asText(""),
            event.path("channel_type").asText(""),
            authorizedUser
        );
    }

    public boolean isUrlVerification() {
        return URL_VERIFICATION.equals(envelopeType);
    }

    public boolean isMention() {
        return APP_MENTION.equals(type);
    }

    public boolean isAssistantThreadStarted() {
        return ASSISTANT_THREAD_STARTED.equals(type);
    }

    public boolean fromBot() {
        return !botId.isBlank() || (!authorizedUserId.isBlank() && authorizedUserId.equals(user));
    }

    public String replyThread() {
        return threadTs.isBlank() ? ts : threadTs;
    }

    public String conversationKey() {
        return "slack:" + channel + ":" + replyThread();
    }
}
