package com.openforge.memkeep.gateway;

public interface EmailTransport {

    /** True when credentials are present and a send can be attempted. */
    boolean isConfigured();

    /**
     * @return the message id assigned by the transport
     * @throws GatewayException when not configured or the send fails
     */
    String send(EmailMessage message);

    record EmailMessage(String to, String subject, String body) {}
}
