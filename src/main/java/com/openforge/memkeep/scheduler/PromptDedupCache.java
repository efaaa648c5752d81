package com.openforge.memkeep.scheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Short-lived memory of recently dispatched payload fingerprints.
 * Bounded; once full the oldest inserted fingerprint is evicted.
 *
 * Not thread-safe: only touched under the scheduler's dispatch lock.
 */
class PromptDedupCache {

    private final Duration window;
    private final Map<String, Instant> seen;

    PromptDedupCache(Duration window, int capacity) {
        this.window = window;
        this.seen = new LinkedHashMap<>(capacity + 1, 0.75f, false) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Instant> eldest) {
                return size() > capacity;
            }
        };
    }

    boolean isRecent(String fingerprint, Instant now) {
        Instant last = seen.get(fingerprint);
        return last != null && Duration.between(last, now).compareTo(window) < 0;
    }

    void record(String fingerprint, Instant at) {
        seen.put(fingerprint, at);
    }

    int size() {
        return seen.size();
    }
}
