package com.geochat.routing.exception;

/**
 * Malformed or incomplete domain configuration. Fatal at startup; on reload the
 * previously active configuration stays in place.
 */
public class DomainConfigException extends RuntimeException {

    public DomainConfigException(String message) {
        super(message);
    }

    public DomainConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
