package com.openforge.memkeep.gateway;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Bound from application.yml under "agent.search".
 */
@ConfigurationProperties(prefix = "agent.search")
public record SearchProperties(
        @DefaultValue("https://api.duckduckgo.com") String baseUrl,
        @DefaultValue("3")                          int maxRelatedTopics,
        @DefaultValue("15s")                        Duration timeout
) {}
