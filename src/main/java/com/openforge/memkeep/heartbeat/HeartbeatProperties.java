package com.openforge.memkeep.heartbeat;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Bound from application.yml under "agent.heartbeat".
 *
 * The timer itself reads agent.heartbeat.interval and initial-delay through
 * {@code @Scheduled}, so both must be ISO-8601 durations (PT30M).
 */
@ConfigurationProperties(prefix = "agent.heartbeat")
public record HeartbeatProperties(
        @DefaultValue("true")  boolean enabled,
        @DefaultValue("PT30M") Duration interval,
        @DefaultValue("PT30M") Duration initialDelay,
        @DefaultValue("PT2M")  Duration idleWindow
) {}
