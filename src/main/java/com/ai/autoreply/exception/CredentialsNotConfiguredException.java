package com.ai.autoreply.exception;

/**
 * No credentials for a collaborator at any level (agent, properties, settings table). Not retryable.
 */
public class CredentialsNotConfiguredException extends RuntimeException {

    public CredentialsNotConfiguredException(String message) {
        super(message);
    }
}
