package com.openforge.memkeep.gateway;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Bound from application.yml under "agent.telegram".
 *
 * chat-id is both the default outbound channel and the only chat whose
 * inbound messages are answered.
 */
@ConfigurationProperties(prefix = "agent.telegram")
public record TelegramProperties(
        @DefaultValue("true")                     boolean enabled,
        String botToken,
        String chatId,
        @DefaultValue("https://api.telegram.org") String apiBaseUrl,
        @DefaultValue("30s")                      Duration pollInterval,
        @DefaultValue("20s")                      Duration requestTimeout
) {

    public boolean isConfigured() {
        return enabled
                && botToken != null && !botToken.isBlank()
                && chatId != null && !chatId.isBlank();
    }
}
