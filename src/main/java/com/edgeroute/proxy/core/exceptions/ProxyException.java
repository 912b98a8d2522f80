package com.edgeroute.proxy.core.exceptions;

/**
 * Base exception for all routing-decision errors.
 * Every subclass is scoped to a single request or handshake and never brings
 * down the process.
 */
public class ProxyException extends RuntimeException {
    /**
     * Constructs a new ProxyException with the specified detail message.
     * 
     * @param message the detail message.
     */
    public ProxyException(String message) {
        super(message);
    }

    /**
     * Constructs a new ProxyException with the specified detail message and cause.
     * 
     * @param message the detail message.
     * @param cause   the cause of the exception.
     */
    public ProxyException(String message, Throwable cause) {
        super(message, cause);
    }
}
