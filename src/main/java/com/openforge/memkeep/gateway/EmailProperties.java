package com.openforge.memkeep.gateway;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Bound from application.yml under "agent.email".  The SMTP connection itself
 * is configured through the standard spring.mail.* keys.
 */
@ConfigurationProperties(prefix = "agent.email")
public record EmailProperties(
        String from,
        @DefaultValue("MemKeep") String fromName
) {}
