package io.jerry.core.session;

import io.jerry.core.concurrent.NamedThreadFactory;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns every live conversation and hands out exclusive handles to them.
 *
 * <p>Each key maps to a slot holding a fair single-permit semaphore, so a second event for
 * the same thread waits in arrival order until the running cycle releases. The slot's
 * user count (holder plus waiters) is only changed inside {@code compute} on the key,
 * which lets eviction skip any slot that is in use.
 */
public final class ConversationSessionManager implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(ConversationSessionManager.class);

    private final ConcurrentHashMap<String, Slot> slots = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration lockTimeout;
    private final Duration idleTimeout;
    private ScheduledExecutorService sweeper;

    public ConversationSessionManager(Clock clock, Duration lockTimeout, Duration idleTimeout) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.lockTimeout = requirePositive(lockTimeout, "lockTimeout");
        this.idleTimeout = requirePositive(idleTimeout, "idleTimeout");
    }

    public ConversationHandle acquire(String conversationKey) {
        return acquire(conversationKey, lockTimeout);
    }

    public ConversationHandle acquire(String conversationKey, Duration timeout) {
        if (conversationKey == null || conversationKey.isBlank()) {
            throw new IllegalArgumentException("conversationKey must not be blank");
        }
        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            Slot slot = join(conversationKey);
            boolean acquired;
            try {
                acquired = slot.permit.tryAcquire(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
            } catch (InterruptedException e) {
                leave(slot);
                Thread.currentThread().interrupt();
                throw new ConversationLockTimeoutException(conversationKey, timeout);
            }
            if (!acquired) {
                leave(slot);
                LOG.warn("Lock wait on conversation {} timed out after {} ms", conversationKey, timeout.toMillis());
                throw new ConversationLockTimeoutException(conversationKey, timeout);
            }
            if (slot.conversation.isClosed()) {
                // closed while we were queued; start over on a fresh conversation
                slot.permit.release();
                leave(slot);
                continue;
            }
            slot.conversation.markRunning(clock.instant());
            return new ConversationHandle(this, slot);
        }
    }

    void release(Slot slot) {
        slot.conversation.markIdle(clock.instant());
        slot.permit.release();
        leave(slot);
    }

    public Optional<Conversation> find(String conversationKey) {
        Slot slot = slots.get(conversationKey);
        return slot == null ? Optional.empty() : Optional.of(slot.conversation);
    }

    // A cycle still holding the conversation keeps running but its results are discarded.
    public boolean close(String conversationKey) {
        AtomicInteger closed = new AtomicInteger();
        slots.computeIfPresent(conversationKey, (key, slot) -> {
            slot.conversation.markClosed();
            closed.incrementAndGet();
            return slot.users == 0 ? null : slot;
        });
        return closed.get() > 0;
    }

    public int evictIdle() {
        Instant cutoff = clock.instant().minus(idleTimeout);
        AtomicInteger evicted = new AtomicInteger();
        for (String key : List.copyOf(slots.keySet())) {
            slots.computeIfPresent(key, (k, slot) -> {
                if (slot.users > 0 || slot.conversation.lastActivity().isAfter(cutoff)) {
                    return slot;
                }
                slot.conversation.markClosed();
                evicted.incrementAndGet();
                return null;
            });
        }
        if (evicted.get() > 0) {
            LOG.debug("Evicted {} idle conversations", evicted.get());
        }
        return evicted.get();
    }

    public synchronized void startEviction(Duration interval) {
        if (sweeper != null) {
            return;
        }
        sweeper = Executors.newSingleThreadScheduledExecutor(new NamedThreadFactory("jerry-session-sweeper"));
        long millis = interval.toMillis();
        sweeper.scheduleWithFixedDelay(this::sweepQuietly, millis, millis, TimeUnit.MILLISECONDS);
    }

    public int size() {
        return slots.size();
    }

    @Override
    public synchronized void close() {
        if (sweeper != null) {
            sweeper.shutdownNow();
            sweeper = null;
        }
    }

    private void sweepQuietly() {
        try {
            evictIdle();
        } catch (RuntimeException e) {
            LOG.warn("Idle conversation sweep failed", e);
        }
    }

    private Slot join(String conversationKey) {
        return slots.compute(conversationKey, (key, existing) -> {
            Slot slot = existing == null || existing.conversation.isClosed()
                ? new Slot(new Conversation(key, clock.instant()))
                : existing;
            slot.users++;
            return slot;
        });
    }

    private void leave(Slot slot) {
        String key = slot.conversation.key();
        slots.compute(key, (k, current) -> {
            slot.users--;
            if (current == slot && slot.users == 0 && slot.conversation.isClosed()) {
                return null;
            }
            return current;
        });
    }

    private static Duration requirePositive(Duration value, String name) {
        if (value == null || value.isNegative() || value.isZero()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
        return value;
    }

    static final class Slot {
        private final Semaphore permit = new Semaphore(1, true);
        private final Conversation conversation;
        private int users;

        private Slot(Conversation conversation) {
            this.conversation = conversation;
        }

        Conversation conversation() {
            return conversation;
        }
    }
}
