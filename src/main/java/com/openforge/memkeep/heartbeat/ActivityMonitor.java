package com.openforge.memkeep.heartbeat;

import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Timestamp of the last foreground interaction, read by the heartbeat's
 * idle detection.
 */
@Component
public class ActivityMonitor {

    private final Clock clock;
    private final AtomicReference<Instant> lastInteraction = new AtomicReference<>(Instant.EPOCH);

    public ActivityMonitor(Clock clock) {
        this.clock = clock;
    }

    public void markActive() {
        lastInteraction.set(clock.instant());
    }

    public Instant lastInteraction() {
        return lastInteraction.get();
    }

    public boolean isActiveWithin(Duration window) {
        return Duration.between(lastInteraction.get(), clock.instant()).compareTo(window) < 0;
    }
}
