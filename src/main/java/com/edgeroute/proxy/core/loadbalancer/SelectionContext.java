package com.edgeroute.proxy.core.loadbalancer;

/**
 * Per-connection inputs available to a load balancing strategy.
 *
 * @param clientIp           Remote address of the client, may be null.
 * @param connectionSequence Engine-assigned sequence number of the connection.
 * @param workerId           Identifier of this process instance.
 */
public record SelectionContext(String clientIp, long connectionSequence, int workerId) {
}
