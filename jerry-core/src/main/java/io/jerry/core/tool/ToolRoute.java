package io.jerry.core.tool;

import java.util.Map;
import java.util.Objects;

public record ToolRoute(Kind kind, Tool tool, PeerToolDescriptor peer) {

    public enum Kind {
        LOCAL,
        PEER
    }

    public ToolRoute {
        Objects.requireNonNull(kind, "kind must not be null");
        if (kind == Kind.LOCAL && tool == null) {
            throw new IllegalArgumentException("local route requires a tool");
        }
        if (kind == Kind.PEER && peer == null) {
            throw new IllegalArgumentException("peer route requires a descriptor");
        }
    }

    public static ToolRoute local(Tool tool) {
        return new ToolRoute(Kind.LOCAL, tool, null);
    }

    public static ToolRoute peer(PeerToolDescriptor peer) {
        return new ToolRoute(Kind.PEER, null, peer);
    }

    public String name() {
        return kind == Kind.LOCAL ? tool.name() : peer.name();
    }

    public String description() {
        return kind == Kind.LOCAL ? tool.description() : peer.description();
    }

    public Map<String, Object> schema() {
        return kind == Kind.LOCAL ? tool.schema() : peer.schema();
    }
}
