package com.edgeroute.proxy.core.exceptions;

/**
 * Thrown when backend selection is attempted against an empty pool, either
 * because the route has no upstreams or because all of them are marked
 * unhealthy.
 */
public class NoUpstreamException extends ProxyException {
    /**
     * Constructs a new NoUpstreamException with the specified detail message.
     * 
     * @param message the detail message.
     */
    public NoUpstreamException(String message) {
        super(message);
    }
}
