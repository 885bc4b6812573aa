package com.agentfederation.core.exception;

/**
 * Base unchecked failure raised by the federation core.
 *
 * <p>Only caller bugs surface as exceptions (malformed trust vectors). Unknown peers,
 * rejected handshakes and drift are ordinary results, never exceptions.
 */
public class FederationException extends RuntimeException {
    private final String component;

    public FederationException(String component, String message) {
        super("[" + component + "] " + message);
        this.component = component;
    }

    public FederationException(String component, String message, Throwable cause) {
        super("[" + component + "] " + message, cause);
        this.component = component;
    }

    public String getComponent() {
        return component;
    }
}
