package com.edgeroute.proxy.core.loadbalancer;

import com.edgeroute.proxy.config.BalancerConfig.RandomSeeding;
import com.edgeroute.proxy.core.routing.BackendTarget;
import com.edgeroute.proxy.core.routing.ResolvedPool;
import com.edgeroute.proxy.spi.LoadBalancer;
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Uniformly random selection.
 *
 * <p>
 * With {@link RandomSeeding#PER_SELECTION} a fresh generator is seeded from
 * the wall clock and the process id for every pick. Selections within the same
 * millisecond therefore land on the same index; this strategy spreads load and
 * is not a source of unpredictability. {@link RandomSeeding#PROCESS} uses a
 * generator seeded once per thread instead.
 * </p>
 */
public class RandomLoadBalancer implements LoadBalancer {

    private static final long PID = ProcessHandle.current().pid();

    private final RandomSeeding seeding;

    public RandomLoadBalancer(RandomSeeding seeding) {
        this.seeding = seeding == null ? RandomSeeding.PER_SELECTION : seeding;
    }

    @Override
    public BackendTarget select(ResolvedPool pool, SelectionContext context) {
        return pool.get(nextIndex(pool.size()));
    }

    int nextIndex(int bound) {
        if (seeding == RandomSeeding.PROCESS) {
            return ThreadLocalRandom.current().nextInt(bound);
        }
        return new Random(System.currentTimeMillis() + PID).nextInt(bound);
    }

    public RandomSeeding getSeeding() {
        return seeding;
    }
}
