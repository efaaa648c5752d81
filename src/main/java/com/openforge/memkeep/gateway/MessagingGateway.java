package com.openforge.memkeep.gateway;

/**
 * Outbound chat messages to the agent's owner.
 */
public interface MessagingGateway {

    boolean isConfigured();

    /** The channel messages go to when the caller does not name one. */
    String defaultChannel();

    /** @throws GatewayException when not configured or delivery fails */
    void sendMessage(String channel, String text);
}
