package com.openforge.memkeep.scheduler;

import com.openforge.memkeep.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class InferenceLockTest {

    private final MutableClock clock = MutableClock.startingAt("2025-01-01T10:00:00Z");
    private final InferenceLock lock = new InferenceLock(clock, Duration.ofSeconds(60));

    @Test
    void acquireAndRelease() throws Exception {
        long stamp = lock.acquire();
        assertThat(lock.isHeld()).isTrue();

        lock.release(stamp);
        assertThat(lock.isHeld()).isFalse();
    }

    @Test
    void secondCallerWaitsForRelease() throws Exception {
        long stamp = lock.acquire();
        CompletableFuture<Long> waiter = CompletableFuture.supplyAsync(() -> {
            try {
                return lock.acquire();
            } catch (InterruptedException e) {
                throw new IllegalStateException(e);
            }
        });

        Thread.sleep(250);
        assertThat(waiter).isNotDone();

        lock.release(stamp);
        long second = waiter.get(2, TimeUnit.SECONDS);
        assertThat(second).isGreaterThan(stamp);
        assertThat(lock.isHeld()).isTrue();
    }

    @Test
    void staleHolderIsForceReleasedAfterTimeout() throws Exception {
        long crashed = lock.acquire();
        clock.advance(Duration.ofSeconds(61));

        long fresh = lock.acquire();

        // the crashed holder finally returns; it must not unlock the new holder
        lock.release(crashed);
        assertThat(lock.isHeld()).isTrue();

        lock.release(fresh);
        assertThat(lock.isHeld()).isFalse();
    }
}
