package io.jerry.core.provider;

// Failures come back as an error response, never as an exception.
public interface LlmProvider {
    String name();

    LlmResponse chat(ModelRequest request);
}
