package com.edgeroute.proxy.spi;

import com.edgeroute.proxy.core.loadbalancer.SelectionContext;
import com.edgeroute.proxy.core.routing.BackendTarget;
import com.edgeroute.proxy.core.routing.ResolvedPool;

/**
 * Strategy interface for picking one backend out of a resolved pool.
 * Implementations work on the in-memory pool only and never touch the store.
 */
public interface LoadBalancer {
    /**
     * Selects a target from a non-empty pool.
     * @param pool Weight-expanded pool of healthy targets.
     * @param context Client address, connection sequence and worker id.
     * @return Selected target.
     */
    BackendTarget select(ResolvedPool pool, SelectionContext context);
}
