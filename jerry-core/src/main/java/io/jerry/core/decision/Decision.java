package io.jerry.core.decision;

import java.util.List;
import java.util.Objects;

public record Decision(Kind kind, String text, List<ToolInvocation> invocations, boolean parseDegraded) {

    public enum Kind {
        FINAL_ANSWER,
        TOOL_INVOCATIONS
    }

    public Decision {
        Objects.requireNonNull(kind, "kind must not be null");
        text = text == null ? "" : text;
        invocations = invocations == null ? List.of() : List.copyOf(invocations);
        if (kind == Kind.TOOL_INVOCATIONS && invocations.isEmpty()) {
            throw new IllegalArgumentException("tool invocation decision needs at least one invocation");
        }
    }

    public static Decision finalAnswer(String text) {
        return new Decision(Kind.FINAL_ANSWER, text, List.of(), false);
    }

    public static Decision degradedAnswer(String text) {
        return new Decision(Kind.FINAL_ANSWER, text, List.of(), true);
    }

    public static Decision toolInvocations(List<ToolInvocation> invocations) {
        return new Decision(Kind.TOOL_INVOCATIONS, "", invocations, false);
    }

    public boolean isFinalAnswer() {
        return kind == Kind.FINAL_ANSWER;
    }
}
