package io.jerry.core.tool;

import java.util.Map;
import java.util.Objects;

public record PeerToolDescriptor(String name, String description, Map<String, Object> schema, String agentId) {
    public PeerToolDescriptor {
        Objects.requireNonNull(name, "name must not be null");
        description = description == null ? "" : description;
        schema = schema == null ? Map.of("type", "object", "properties", Map.of()) : Map.copyOf(schema);
        agentId = agentId == null ? "" : agentId;
    }
}
