package com.example.authz.exception;

/**
 * A route's policy references something the application did not wire, such as
 * an unregistered entity lookup. Reported as forbidden at the boundary.
 */
public class GuardConfigurationException extends RuntimeException {

    public GuardConfigurationException(String message) {
        super(message);
    }

    public GuardConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
