package io.jerry.core.slack;

import java.util.LinkedHashSet;
import java.util.Iterator;

public final class EventDeduplicator {
    public static final int DEFAULT_CAPACITY = 1000;

    private final int capacity;
    private final LinkedHashSet<String> seen = new LinkedHashSet<>();

    public EventDeduplicator() {
        this(DEFAULT_CAPACITY);
    }

    public EventDeduplicator(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1");
        }
        this.capacity = capacity;
    }

    // Blank ids are never duplicates.
    public synchronized boolean firstSeen(String eventId) {
        if (eventId == null || eventId.isBlank()) {
            return true;
        }
        if (!seen.add(eventId)) {
            return false;
        }
        if (seen.size() > capacity) {
            Iterator<String> oldest = seen.iterator();
            oldest.next();
            oldest.remove();
        }
        return true;
    }

    public synchronized int size() {
        return seen.size();
    }
}
