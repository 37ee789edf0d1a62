package io.jerry.core.peer;

import io.jerry.core.tool.PeerToolDescriptor;
import io.jerry.core.tool.ToolCallRequest;
import io.jerry.core.tool.ToolCallResult;
import java.util.concurrent.CompletableFuture;

public interface PeerCaller {

    CompletableFuture<ToolCallResult> call(PeerToolDescriptor tool, ToolCallRequest request);

    static PeerCaller unavailable() {
        return (tool, request) -> {
            throw new PeerUnavailableException("No coordination network session is configured");
        };
    }
}
