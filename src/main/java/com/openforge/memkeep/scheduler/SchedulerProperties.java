package com.openforge.memkeep.scheduler;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Bound from application.yml under "agent.scheduler".
 *
 * <pre>
 * agent:
 *   scheduler:
 *     min-spacing: 2s
 *     dedup-window: 1500ms
 *     dedup-capacity: 20
 *     fingerprint-length: 200
 *     call-timeout: 55s
 *     lock-timeout: 60s
 * </pre>
 */
@ConfigurationProperties(prefix = "agent.scheduler")
public record SchedulerProperties(
        @DefaultValue("2s")     Duration minSpacing,
        @DefaultValue("1500ms") Duration dedupWindow,
        @DefaultValue("20")     int dedupCapacity,
        @DefaultValue("200")    int fingerprintLength,
        @DefaultValue("55s")    Duration callTimeout,
        @DefaultValue("60s")    Duration lockTimeout
) {

    public static SchedulerProperties defaults() {
        return new SchedulerProperties(Duration.ofSeconds(2), Duration.ofMillis(1500), 20, 200,
                Duration.ofSeconds(55), Duration.ofSeconds(60));
    }
}
