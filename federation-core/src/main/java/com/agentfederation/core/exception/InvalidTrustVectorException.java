package com.agentfederation.core.exception;

public class InvalidTrustVectorException extends FederationException {

    public InvalidTrustVectorException(String message) {
        super("Geometry", message);
    }
}
