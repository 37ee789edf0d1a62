package io.jerry.core.middleware;

import java.util.regex.Pattern;

public final class PiiRedactor {
    private static final Pattern EMAIL = Pattern.compile("(?i)\\b[a-z0-9._%+-]+@[a-z0-9.-]+\\.[a-z]{2,}\\b");
    private static final Pattern CREDIT_CARD = Pattern.compile("\\b\\d{4}[- ]?\\d{4}[- ]?\\d{4}[- ]?\\d{4}\\b");
    private static final Pattern SSN = Pattern.compile("\\b\\d{3}-\\d{2}-\\d{4}\\b");
    private static final Pattern PHONE = Pattern.compile("(\\+\\d{1,2}\\s)?\\(?\\d{3}\\)?[\\s.-]\\d{3}[\\s.-]\\d{4}\\b");
    private static final Pattern IPV4 = Pattern.compile("\\b(?:\\d{1,3}\\.){3}\\d{1,3}\\b");

    private final Pattern custom;

    public PiiRedactor() {
        this(null);
    }

    public PiiRedactor(String customPattern) {
        this.custom = customPattern == null || customPattern.isBlank() ? null : Pattern.compile(customPattern);
    }

    public String redact(String input) {
        if (input == null || input.isBlank()) {
            return input == null ? "" : input;
        }
        String out = EMAIL.matcher(input).replaceAll("[REDACTED_EMAIL]");
        out = CREDIT_CARD.matcher(out).replaceAll("[REDACTED_CARD]");
        out = SSN.matcher(out).replaceAll("[REDACTED_SSN]");
        out = PHONE.matcher(out).replaceAll("[REDACTED_PHONE]");
        out = IPV4.matcher(out).replaceAll("[REDACTED_IP]");
        if (custom != null) {
            out = custom.matcher(out).replaceAll("[REDACTED]");
        }
        return out;
    }
}
