package io.jerry.core.session;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class ConversationSessionManagerTest {

    @Test
    void shouldSerializeCyclesOnTheSameConversation() throws Exception {
        ConversationSessionManager manager = new ConversationSessionManager(
            Clock.systemUTC(), Duration.ofSeconds(5), Duration.ofMinutes(30));
        AtomicInteger inside = new AtomicInteger();
        AtomicInteger maxInside = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 20; i++) {
                int n = i;
                futures.add(pool.submit(() -> {
                    try (ConversationHandle handle = manager.acquire("slack:C1:1.0")) {
                        int now = inside.incrementAndGet();
                        maxInside.accumulateAndGet(now, Math::max);
                        handle.conversation().append(Turn.user("message " + n, Instant.now()));
                        Thread.sleep(2);
                        inside.decrementAndGet();
                    }
                    return null;
                }));
            }
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(maxInside.get()).isEqualTo(1);
        assertThat(manager.find("slack:C1:1.0")).get()
            .satisfies(conversation -> {
                assertThat(conversation.size()).isEqualTo(20);
                assertThat(conversation.status()).isEqualTo(ConversationStatus.IDLE);
            });
    }

    @Test
    void shouldRunDifferentConversationsInParallel() throws Exception {
        ConversationSessionManager manager = new ConversationSessionManager(
            Clock.systemUTC(), Duration.ofSeconds(5), Duration.ofMinutes(30));
        CountDownLatch bothInside = new CountDownLatch(2);
        ExecutorService pool = Executors.newFixedThreadPool(2);
        List<Boolean> met = Collections.synchronizedList(new ArrayList<>());
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (String key : List.of("slack:C1:1.0", "slack:C2:2.0")) {
                futures.add(pool.submit(() -> {
                    try (ConversationHandle ignored = manager.acquire(key)) {
                        bothInside.countDown();
                        met.add(bothInside.await(2, TimeUnit.SECONDS));
                    }
                    return null;
                }));
            }
            for (Future<?> future : futures) {
                future.get(5, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(met).containsExactly(true, true);
        assertThat(manager.size()).isEqualTo(2);
    }

    @Test
    void shouldTimeOutWhenConversationStaysBusy() {
        ConversationSessionManager manager = new ConversationSessionManager(
            Clock.systemUTC(), Duration.ofSeconds(5), Duration.ofMinutes(30));
        ConversationHandle holder = manager.acquire("cli:default");

        assertThatThrownBy(() -> manager.acquire("cli:default", Duration.ofMillis(50)))
            .isInstanceOf(ConversationLockTimeoutException.class)
            .hasMessageContaining("cli:default");

        holder.release();
        try (ConversationHandle next = manager.acquire("cli:default", Duration.ofMillis(50))) {
            assertThat(next.conversation().status()).isEqualTo(ConversationStatus.RUNNING);
        }
    }

    @Test
    void releaseShouldBeIdempotent() {
        ConversationSessionManager manager = new ConversationSessionManager(
            Clock.systemUTC(), Duration.ofSeconds(5), Duration.ofMinutes(30));
        ConversationHandle handle = manager.acquire("cli:default");

        handle.release();
        handle.release();

        ConversationHandle second = manager.acquire("cli:default", Duration.ofMillis(50));
        assertThatThrownBy(() -> manager.acquire("cli:default", Duration.ofMillis(50)))
            .isInstanceOf(ConversationLockTimeoutException.class);
        second.release();
    }

    @Test
    void closedConversationShouldBeReplacedOnNextAcquire() {
        ConversationSessionManager manager = new ConversationSessionManager(
            Clock.systemUTC(), Duration.ofSeconds(5), Duration.ofMinutes(30));
        try (ConversationHandle handle = manager.acquire("coral:agent-b")) {
            handle.conversation().append(Turn.user("hello", Instant.now()));
        }

        assertThat(manager.close("coral:agent-b")).isTrue();
        assertThat(manager.close("coral:unknown")).isFalse();

        try (ConversationHandle handle = manager.acquire("coral:agent-b")) {
            assertThat(handle.conversation().turns()).isEmpty();
        }
    }

    @Test
    void closeWhileHeldShouldRejectFurtherAppends() {
        ConversationSessionManager manager = new ConversationSessionManager(
            Clock.systemUTC(), Duration.ofSeconds(5), Duration.ofMinutes(30));
        ConversationHandle handle = manager.acquire("cli:default");

        manager.close("cli:default");

        assertThat(handle.conversation().isClosed()).isTrue();
        assertThatThrownBy(() -> handle.conversation().append(Turn.user("late", Instant.now())))
            .isInstanceOf(IllegalStateException.class);
        handle.release();
        assertThat(manager.size()).isZero();
    }

    @Test
    void shouldEvictOnlyIdleConversations() {
        MutableClock clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        ConversationSessionManager manager = new ConversationSessionManager(
            clock, Duration.ofSeconds(5), Duration.ofMinutes(30));
        manager.acquire("slack:C1:old").release();
        ConversationHandle busy = manager.acquire("slack:C2:busy");

        clock.advance(Duration.ofMinutes(31));
        manager.acquire("slack:C3:fresh").release();

        assertThat(manager.evictIdle()).isEqualTo(1);
        assertThat(manager.find("slack:C1:old")).isEmpty();
        assertThat(manager.find("slack:C2:busy")).isPresent();
        assertThat(manager.find("slack:C3:fresh")).isPresent();

        busy.release();
        clock.advance(Duration.ofMinutes(31));
        assertThat(manager.evictIdle()).isEqualTo(2);
        assertThat(manager.size()).isZero();
    }

    @Test
    void shouldRejectBlankKeys() {
        ConversationSessionManager manager = new ConversationSessionManager(
            Clock.systemUTC(), Duration.ofSeconds(5), Duration.ofMinutes(30));

        assertThatThrownBy(() -> manager.acquire(" "))
            .isInstanceOf(IllegalArgumentException.class);
    }

    private static final class MutableClock extends Clock {
        private volatile Instant now;

        private MutableClock(Instant start) {
            this.now = start;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
