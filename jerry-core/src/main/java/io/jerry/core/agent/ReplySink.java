package io.jerry.core.agent;

import io.jerry.core.session.Turn;
import java.util.List;

@FunctionalInterface
public interface ReplySink {
    void deliver(InboundEvent event, String reply);

    default void working(InboundEvent event) {
    }

    // Consulted only when the conversation has no turns yet, e.g. after idle eviction.
    default List<Turn> priorTurns(InboundEvent event) {
        return List.of();
    }

    static ReplySink discard() {
        return (event, reply) -> {
        };
    }
}
