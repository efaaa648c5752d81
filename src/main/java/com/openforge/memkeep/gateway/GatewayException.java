package com.openforge.memkeep.gateway;

/**
 * A collaborator (search engine, mail server, messaging API, web page) failed
 * or is not configured.
 */
public class GatewayException extends RuntimeException {

    public GatewayException(String message) {
        super(message);
    }

    public GatewayException(String message, Throwable cause) {
        super(message, cause);
    }
}
