package com.openforge.memkeep.scheduler;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Single-flight lock for foreground inference.
 *
 * A holder older than the lock timeout is treated as crashed: the next waiter
 * force-releases it and logs a warning.  Every acquisition returns a stamp, and
 * {@link #release(long)} with a stale stamp is a no-op, so a force-released
 * holder that finally finishes cannot unlock its successor.
 */
@Slf4j
public class InferenceLock {

    private static final long POLL_MILLIS = 100;

    private final Clock    clock;
    private final Duration timeout;

    private Instant acquiredAt;
    private String  holderName;
    private long    generation;

    public InferenceLock(Clock clock, Duration timeout) {
        this.clock   = clock;
        this.timeout = timeout;
    }

    /**
     * Blocks until the lock is free or the current holder has outlived the timeout.
     *
     * @return stamp to hand back to {@link #release(long)}
     */
    public synchronized long acquire() throws InterruptedException {
        while (acquiredAt != null) {
            Duration held = Duration.between(acquiredAt, clock.instant());
            if (held.compareTo(timeout) > 0) {
                log.warn("[InferenceLock] Force-releasing lock held by {} for {} ms (timeout {} ms).",
                        holderName, held.toMillis(), timeout.toMillis());
                break;
            }
            wait(POLL_MILLIS);
        }
        acquiredAt = clock.instant();
        holderName = Thread.currentThread().getName();
        return ++generation;
    }

    public synchronized void release(long stamp) {
        if (stamp != generation || acquiredAt == null) {
            log.debug("[InferenceLock] Ignoring stale release (stamp {}, current {}).", stamp, generation);
            return;
        }
        acquiredAt = null;
        holderName = null;
        notifyAll();
    }

    public synchronized boolean isHeld() {
        return acquiredAt != null;
    }
}
