package com.edgeroute.proxy.core.exceptions;

/**
 * Thrown when the configuration store cannot be reached, refuses a command, or
 * does not answer within its round-trip bound.
 * Distinct from a missing key, which is reported as an empty result.
 */
public class StoreUnavailableException extends ProxyException {
    /**
     * Constructs a new StoreUnavailableException with the specified detail message.
     * 
     * @param message the detail message.
     */
    public StoreUnavailableException(String message) {
        super(message);
    }

    /**
     * Constructs a new StoreUnavailableException with the specified detail message
     * and cause.
     * 
     * @param message the detail message.
     * @param cause   the underlying client failure.
     */
    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
