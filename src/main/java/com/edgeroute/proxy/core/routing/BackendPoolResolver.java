package com.edgeroute.proxy.core.routing;

import com.edgeroute.proxy.core.constants.StoreKeys;
import com.edgeroute.proxy.core.store.ConfigStore;
import com.edgeroute.proxy.core.store.StoreSession;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the backend pool of a route from its upstream list and health markers.
 * Targets are healthy unless their marker is exactly {@value #UNHEALTHY}.
 */
public class BackendPoolResolver {

    private static final Logger log = LoggerFactory.getLogger(BackendPoolResolver.class);

    /** The only health marker value that removes a target from the pool. */
    public static final String UNHEALTHY = "unhealthy";

    private final ConfigStore store;

    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public BackendPoolResolver(ConfigStore store) {
        this.store = store;
    }

    /**
     * Resolves the pool of a route in its own store session.
     *
     * @param routeId Route identifier.
     * @return The pool; empty if the route has no healthy upstreams.
     */
    public ResolvedPool resolvePool(String routeId) {
        try (StoreSession session = store.openSession()) {
            return resolvePool(session, routeId);
        }
    }

    /**
     * Resolves the pool of a route using a session the caller already holds.
     *
     * @param session Open store session.
     * @param routeId Route identifier.
     * @return The pool; empty if the route has no healthy upstreams.
     */
    public ResolvedPool resolvePool(StoreSession session, String routeId) {
        List<String> entries = session.range(StoreKeys.UPSTREAMS.key(routeId));
        List<BackendTarget> healthy = new ArrayList<>(entries.size());
        for (String entry : entries) {
            Optional<BackendTarget> parsed = BackendTarget.parse(entry);
            if (parsed.isEmpty()) {
                log.warn("Skipping malformed upstream '{}' of route {}", entry, routeId);
                continue;
            }
            BackendTarget target = parsed.get();
            Optional<String> marker = session.get(
                    StoreKeys.UPSTREAM_HEALTH.key(routeId, target.address(), target.port()));
            if (marker.filter(UNHEALTHY::equals).isPresent()) {
                log.debug("Upstream {} of route {} is marked unhealthy", target, routeId);
                continue;
            }
            healthy.add(target);
        }
        return ResolvedPool.expand(healthy);
    }
}
