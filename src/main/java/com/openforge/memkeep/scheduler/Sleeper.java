package com.openforge.memkeep.scheduler;

import java.time.Duration;

/**
 * Blocking pause used for inter-call spacing.  Tests swap in a recording sleeper
 * that advances a mutable clock instead of waiting.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;

    static Sleeper threadSleep() {
        return duration -> {
            if (!duration.isNegative() && !duration.isZero()) {
                Thread.sleep(duration.toMillis());
            }
        };
    }
}
