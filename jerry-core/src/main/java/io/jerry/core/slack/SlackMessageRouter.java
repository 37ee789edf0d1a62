package io.jerry.core.slack;

import io.jerry.core.agent.InboundEvent;
import io.jerry.core.agent.ReplySink;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class SlackMessageRouter {
    private static final Logger LOG = LoggerFactory.getLogger(SlackMessageRouter.class);
    private static final Pattern USER_MENTION = Pattern.compile("<@[A-Z0-9]+(?:\\|[^>]*)?>");

    static final String MENTION_WITHOUT_TEXT = """
        Hi there! You didn't provide a message with your mention.
            Mention me again in this thread so that I can help you out!""";

    static final String STARTUP_TROUBLE = ":warning: Looks like I had some trouble starting up. Please try again";

    public enum Routing {
        DISPATCHED,
        DUPLICATE,
        IGNORED,
        EMPTY_MENTION,
        GREETED
    }

    @FunctionalInterface
    public interface EventSubmitter {
        void submit(InboundEvent event, ReplySink sink);
    }

    @FunctionalInterface
    public interface ThreadGreeter {
        void greet(InboundEvent thread);
    }

    private final EventDeduplicator deduplicator;
    private final EventSubmitter submitter;
    private final ReplySink replies;
    private final ThreadGreeter greeter;

    public SlackMessageRouter(EventDeduplicator deduplicator, EventSubmitter submitter, ReplySink replies) {
        this(deduplicator, submitter, replies, thread -> replies.deliver(thread, SlackReplySink.INITIAL_GREETING));
    }

    public SlackMessageRouter(
        EventDeduplicator deduplicator,
        EventSubmitter submitter,
        ReplySink replies,
        ThreadGreeter greeter
    ) {
        this.deduplicator = Objects.requireNonNull(deduplicator, "deduplicator must not be null");
        this.submitter = Objects.requireNonNull(submitter, "submitter must not be null");
        this.replies = Objects.requireNonNull(replies, "replies must not be null");
        this.greeter = Objects.requireNonNull(greeter, "greeter must not be null");
    }

    public Routing route(SlackEvent event) {
        boolean threadStart = startsAssistantThread(event);
        if (!threadStart && !accepts(event)) {
            return Routing.IGNORED;
        }
        if (!deduplicator.firstSeen(event.eventId())) {
            LOG.info("Duplicate Slack event {} skipped", event.eventId());
            return Routing.DUPLICATE;
        }

        InboundEvent inbound = toInbound(event);
        if (threadStart) {
            greet(inbound);
            return Routing.GREETED;
        }
        if (event.isMention() && inbound.text().isBlank()) {
            try {
                replies.deliver(inbound, MENTION_WITHOUT_TEXT);
            } catch (RuntimeException e) {
                LOG.warn("Could not answer empty mention in {}", inbound.conversationKey(), e);
            }
            return Routing.EMPTY_MENTION;
        }
        if (inbound.text().isBlank()) {
            return Routing.IGNORED;
        }

        submitter.submit(inbound, replies);
        return Routing.DISPATCHED;
    }

    private void greet(InboundEvent thread) {
        try {
            greeter.greet(thread);
        } catch (RuntimeException e) {
            LOG.warn("Failed to greet new assistant thread {}", thread.conversationKey(), e);
            try {
                replies.deliver(thread, STARTUP_TROUBLE);
            } catch (RuntimeException again) {
                LOG.warn("Could not report startup trouble in {}", thread.conversationKey(), again);
            }
        }
    }

    static InboundEvent toInbound(SlackEvent event) {
        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put(SlackReplySink.CHANNEL, event.channel());
        metadata.put(SlackReplySink.THREAD_TS, event.replyThread());
        metadata.put(SlackReplySink.MESSAGE_TS, event.ts());
        metadata.put(SlackReplySink.CHANNEL_TYPE, event.channelType());
        metadata.put("slack.event_id", event.eventId());
        return new InboundEvent(
            InboundEvent.Surface.SLACK,
            event.conversationKey(),
            event.user(),
            stripMentions(event.text()),
            null,
            metadata
        );
    }

    static String stripMentions(String text) {
        return USER_MENTION.matcher(text == null ? "" : text).replaceAll("").trim();
    }

    private static boolean startsAssistantThread(SlackEvent event) {
        return SlackEvent.EVENT_CALLBACK.equals(event.envelopeType())
            && event.isAssistantThreadStarted()
            && !event.channel().isBlank()
            && !event.threadTs().isBlank();
    }

    private static boolean accepts(SlackEvent event) {
        if (!SlackEvent.EVENT_CALLBACK.equals(event.envelopeType())) {
            return false;
        }
        if (event.channel().isBlank() || event.fromBot() || !event.subtype().isBlank()) {
            return false;
        }
        if (event.isMention()) {
            return true;
        }
        return SlackEvent.MESSAGE.equals(event.type()) && "im".equals(event.channelType());
    }
}
