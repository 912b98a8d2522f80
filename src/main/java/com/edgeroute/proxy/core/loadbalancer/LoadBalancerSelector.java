package com.edgeroute.proxy.core.loadbalancer;

import com.edgeroute.proxy.config.BalancerConfig;
import com.edgeroute.proxy.core.constants.LoadBalancingType;
import com.edgeroute.proxy.core.exceptions.NoUpstreamException;
import com.edgeroute.proxy.core.routing.BackendTarget;
import com.edgeroute.proxy.core.routing.ResolvedPool;
import com.edgeroute.proxy.spi.LoadBalancer;
import java.util.EnumMap;
import java.util.Map;

/**
 * Maps a route's strategy name to its {@link LoadBalancer} and performs the
 * selection. Pure: works on the precomputed pool only, no retries.
 */
public class LoadBalancerSelector {

    private final Map<LoadBalancingType, LoadBalancer> balancers = new EnumMap<>(LoadBalancingType.class);

    public LoadBalancerSelector(BalancerConfig config) {
        balancers.put(LoadBalancingType.ROUND_ROBIN, new RoundRobinLoadBalancer());
        balancers.put(LoadBalancingType.RANDOM, new RandomLoadBalancer(config.getRandomSeeding()));
        balancers.put(LoadBalancingType.IP_HASH, new IpHashLoadBalancer());
    }

    /**
     * Selects a backend for a connection.
     *
     * @param pool     The resolved pool.
     * @param type     Strategy of the matched route.
     * @param context  Per-connection inputs.
     * @return The selected target.
     * @throws NoUpstreamException if the pool is empty.
     */
    public BackendTarget select(ResolvedPool pool, LoadBalancingType type, SelectionContext context) {
        if (pool == null || pool.isEmpty()) {
            throw new NoUpstreamException("No healthy upstream available");
        }
        LoadBalancingType strategy = type == null ? LoadBalancingType.ROUND_ROBIN : type;
        return balancers.get(strategy).select(pool, context);
    }

    /**
     * Returns the strategy implementation for a type.
     *
     * @param type The strategy.
     * @return Its balancer.
     */
    public LoadBalancer balancerFor(LoadBalancingType type) {
        return balancers.get(type);
    }
}
