package io.jerry.core.slack;

public record SuggestedPrompt(String title, String message) {
}
