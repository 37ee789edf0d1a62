package io.jerry.core.session;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public final class Conversation {
    private final String key;
    private final Instant createdAt;
    private final List<Turn> turns = new ArrayList<>();
    private ConversationStatus status = ConversationStatus.IDLE;
    private Instant lastActivity;

    public Conversation(String key, Instant createdAt) {
        this.key = Objects.requireNonNull(key, "key must not be null");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt must not be null");
        this.lastActivity = createdAt;
    }

    public String key() {
        return key;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public synchronized Instant lastActivity() {
        return lastActivity;
    }

    public synchronized ConversationStatus status() {
        return status;
    }

    public synchronized boolean isClosed() {
        return status == ConversationStatus.CLOSED;
    }

    public synchronized List<Turn> turns() {
        return List.copyOf(turns);
    }

    public synchronized int size() {
        return turns.size();
    }

    public synchronized void append(Turn turn) {
        Objects.requireNonNull(turn, "turn must not be null");
        if (status == ConversationStatus.CLOSED) {
            throw new IllegalStateException("Conversation " + key + " is closed");
        }
        turns.add(turn);
        if (turn.timestamp().isAfter(lastActivity)) {
            lastActivity = turn.timestamp();
        }
    }

    synchronized void markRunning(Instant now) {
        if (status != ConversationStatus.CLOSED) {
            status = ConversationStatus.RUNNING;
            touch(now);
        }
    }

    synchronized void markIdle(Instant now) {
        if (status != ConversationStatus.CLOSED) {
            status = ConversationStatus.IDLE;
            touch(now);
        }
    }

    synchronized void markClosed() {
        status = ConversationStatus.CLOSED;
    }

    public synchronized void transition(ConversationStatus next) {
        if (next == ConversationStatus.IDLE || next == ConversationStatus.CLOSED) {
            throw new IllegalArgumentException("Use the session manager to release or close a conversation");
        }
        if (status != ConversationStatus.CLOSED) {
            status = next;
        }
    }

    private void touch(Instant now) {
        if (now.isAfter(lastActivity)) {
            lastActivity = now;
        }
    }
}
