package io.jerry.core.peer;

import io.jerry.core.tool.PeerToolDescriptor;
import java.util.List;

public interface PeerSessionListener {

    default void onCatalog(List<PeerToolDescriptor> tools) {
    }

    default void onRequest(PeerRequest request) {
    }

    default void onFatal(PeerSessionFatalException error) {
    }
}
