package io.jerry.core.tool.impl;

import java.util.Map;

final class ToolArguments {
    private ToolArguments() {
    }

    static String action(Map<String, Object> input) {
        return text(input, "action", "");
    }

    static String text(Map<String, Object> input, String key, String fallback) {
        Object value = input.get(key);
        if (value == null) {
            return fallback;
        }
        String text = String.valueOf(value).trim();
        return text.isEmpty() ? fallback : text;
    }

    static String required(Map<String, Object> input, String key) {
        String value = text(input, key, "");
        if (value.isEmpty()) {
            throw new IllegalArgumentException(key + " is required");
        }
        return value;
    }

    static int integer(Map<String, Object> input, String key, int fallback, int min, int max) {
        Object value = input.get(key);
        int parsed;
        if (value instanceof Number number) {
            parsed = number.intValue();
        } else if (value == null || String.valueOf(value).isBlank()) {
            parsed = fallback;
        } else {
            try {
                parsed = Integer.parseInt(String.valueOf(value).trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(key + " must be a number", e);
            }
        }
        return Math.max(min, Math.min(max, parsed));
    }
}
