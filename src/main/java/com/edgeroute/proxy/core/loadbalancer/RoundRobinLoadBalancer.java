package com.edgeroute.proxy.core.loadbalancer;

import com.edgeroute.proxy.core.routing.BackendTarget;
import com.edgeroute.proxy.core.routing.ResolvedPool;
import com.edgeroute.proxy.spi.LoadBalancer;

/**
 * Round robin without a shared counter: the index is derived from the worker
 * id and the connection sequence, so consecutive connections walk the pool.
 */
public class RoundRobinLoadBalancer implements LoadBalancer {
    @Override
    public BackendTarget select(ResolvedPool pool, SelectionContext context) {
        long offset = (long) context.workerId() + context.connectionSequence();
        int index = (int) Math.floorMod(offset, (long) pool.size());
        return pool.get(index);
    }
}
