package io.jerry.core.peer;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

public record ReconnectPolicy(int maxAttempts, Duration initialDelay, Duration maxDelay, double jitter) {

    public static ReconnectPolicy defaults() {
        return new ReconnectPolicy(6, Duration.ofMillis(500), Duration.ofSeconds(30), 0.2);
    }

    public ReconnectPolicy {
        if (maxAttempts < 0) {
            throw new IllegalArgumentException("maxAttempts must be >= 0");
        }
        if (jitter < 0 || jitter > 1) {
            throw new IllegalArgumentException("jitter must be within [0, 1]");
        }
        if (initialDelay.isNegative() || maxDelay.compareTo(initialDelay) < 0) {
            throw new IllegalArgumentException("delays must satisfy 0 <= initialDelay <= maxDelay");
        }
    }

    public boolean exhausted(int attempt) {
        return attempt > maxAttempts;
    }

    // attempt counts from 1
    public Duration delayFor(int attempt) {
        long base = initialDelay.toMillis();
        long capped = maxDelay.toMillis();
        long delay = base;
        for (int i = 1; i < attempt && delay < capped; i++) {
            delay = Math.min(delay * 2, capped);
        }
        if (jitter > 0 && delay > 0) {
            double factor = 1 + ThreadLocalRandom.current().nextDouble(-jitter, jitter);
            delay = Math.round(delay * factor);
        }
        return Duration.ofMillis(Math.max(0, delay));
    }
}
