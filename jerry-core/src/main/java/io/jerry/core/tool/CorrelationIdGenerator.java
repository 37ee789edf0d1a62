package io.jerry.core.tool;

import java.security.SecureRandom;
import java.util.HexFormat;
import java.util.concurrent.atomic.AtomicLong;

public final class CorrelationIdGenerator {
    private final String prefix;
    private final AtomicLong sequence = new AtomicLong();

    public CorrelationIdGenerator() {
        byte[] nonce = new byte[4];
        new SecureRandom().nextBytes(nonce);
        this.prefix = "jr-" + HexFormat.of().formatHex(nonce) + "-";
    }

    public CorrelationIdGenerator(String prefix) {
        this.prefix = prefix;
    }

    public String next() {
        return prefix + sequence.incrementAndGet();
    }
}
