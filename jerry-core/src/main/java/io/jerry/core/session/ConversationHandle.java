package io.jerry.core.session;

import java.util.concurrent.atomic.AtomicBoolean;

public final class ConversationHandle implements AutoCloseable {
    private final ConversationSessionManager owner;
    private final ConversationSessionManager.Slot slot;
    private final AtomicBoolean released = new AtomicBoolean(false);

    ConversationHandle(ConversationSessionManager owner, ConversationSessionManager.Slot slot) {
        this.owner = owner;
        this.slot = slot;
    }

    public Conversation conversation() {
        return slot.conversation();
    }

    public boolean isReleased() {
        return released.get();
    }

    public void release() {
        if (released.compareAndSet(false, true)) {
            owner.release(slot);
        }
    }

    @Override
    public void close() {
        release();
    }
}
