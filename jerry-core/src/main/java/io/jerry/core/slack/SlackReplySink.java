package io.jerry.core.slack;

import io.jerry.core.agent.InboundEvent;
import io.jerry.core.agent.ReplySink;
import io.jerry.core.session.Turn;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class SlackReplySink implements ReplySink {
    private static final Logger LOG = LoggerFactory.getLogger(SlackReplySink.class);

    static final String CHANNEL = "slack.channel";
    static final String THREAD_TS = "slack.thread_ts";
    static final String MESSAGE_TS = "slack.ts";
    static final String CHANNEL_TYPE = "slack.channel_type";

    static final String INITIAL_GREETING = "Hi! I'm Jerry! How can I help you today?";
    static final String LOADING_TEXT = "working on it...";
    static final int HISTORY_LIMIT = 10;
    static final List<SuggestedPrompt> SUGGESTED_PROMPTS = List.of(
        new SuggestedPrompt("Gmail Manager", "Read my last 10 emails and tell me about them"),
        new SuggestedPrompt("Calendar Planner", "What's on my calendar this week?"),
        new SuggestedPrompt("Developer Assistant", "Tell me about any recently opened PRs in arcadeai/arcade-ai")
    );

    private final SlackClient client;

    public SlackReplySink(SlackClient client) {
        this.client = client;
    }

    @Override
    public void deliver(InboundEvent event, String reply) {
        client.postMessage(channelOf(event), SlackMarkdown.toMrkdwn(reply), event.metadata(THREAD_TS));
    }

    public void greet(InboundEvent thread) {
        String channel = channelOf(thread);
        String threadTs = thread.metadata(THREAD_TS);
        client.postMessage(channel, INITIAL_GREETING, threadTs);
        client.setSuggestedPrompts(channel, threadTs, SUGGESTED_PROMPTS);
    }

    // Assistant threads live in direct messages; elsewhere Slack has no thread status.
    @Override
    public void working(InboundEvent event) {
        if ("im".equals(event.metadata(CHANNEL_TYPE)) && inThread(event)) {
            client.setStatus(channelOf(event), event.metadata(THREAD_TS), LOADING_TEXT);
        }
    }

    @Override
    public List<Turn> priorTurns(InboundEvent event) {
        if (!inThread(event)) {
            return List.of();
        }
        String current = event.metadata(MESSAGE_TS);
        List<Turn> turns = new ArrayList<>();
        for (ThreadMessage message : client.threadReplies(channelOf(event), event.metadata(THREAD_TS), HISTORY_LIMIT)) {
            if (message.ts().equals(current) || message.text().isBlank()) {
                continue;
            }
            Instant at = timestampOf(message.ts());
            turns.add(message.fromBot()
                ? Turn.agent(message.text(), at)
                : Turn.user(SlackMessageRouter.stripMentions(message.text()), at));
        }
        LOG.debug("Fetched {} earlier messages for {}", turns.size(), event.conversationKey());
        return turns;
    }

    private static String channelOf(InboundEvent event) {
        String channel = event.metadata(CHANNEL);
        if (channel == null || channel.isBlank()) {
            throw new SlackApiException("event for " + event.conversationKey() + " carries no Slack channel");
        }
        return channel;
    }

    // A reply inside an existing thread, as opposed to the message that starts one.
    private static boolean inThread(InboundEvent event) {
        String threadTs = event.metadata(THREAD_TS);
        return threadTs != null && !threadTs.isBlank() && !threadTs.equals(event.metadata(MESSAGE_TS));
    }

    static Instant timestampOf(String ts) {
        try {
            BigDecimal seconds = new BigDecimal(ts);
            long whole = seconds.longValue();
            long nanos = seconds.subtract(BigDecimal.valueOf(whole)).movePointRight(9).longValue();
            return Instant.ofEpochSecond(whole, nanos);
        } catch (NumberFormatException e) {
            LOG.debug("Unparseable Slack timestamp '{}'", ts);
            return Instant.EPOCH;
        }
    }
}
