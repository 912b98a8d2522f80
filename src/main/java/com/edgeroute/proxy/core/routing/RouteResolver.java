package com.edgeroute.proxy.core.routing;

import com.edgeroute.proxy.core.constants.StoreKeys;
import com.edgeroute.proxy.core.store.ConfigStore;
import com.edgeroute.proxy.core.store.StoreSession;
import com.edgeroute.proxy.core.utils.JsonDocuments;
import com.edgeroute.proxy.entity.Route;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves the route and backend pool for a request, reading the store on
 * every call.
 *
 * <p>
 * Route ids are looked up under the normalized host first, then under the raw
 * host when that index is empty and the two differ. All store reads of one
 * resolution share a single session. Store failures propagate as
 * {@link com.edgeroute.proxy.core.exceptions.StoreUnavailableException}.
 * </p>
 */
public class RouteResolver {

    private static final Logger log = LoggerFactory.getLogger(RouteResolver.class);

    private final ConfigStore store;
    private final HostNormalizer normalizer;
    private final BackendPoolResolver poolResolver;

    /**
     * Creates a resolver.
     *
     * @param store        The configuration store.
     * @param normalizer   Host normalizer.
     * @param poolResolver Pool resolver used for the winning route.
     */
    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public RouteResolver(ConfigStore store, HostNormalizer normalizer, BackendPoolResolver poolResolver) {
        this.store = store;
        this.normalizer = normalizer;
        this.poolResolver = poolResolver;
    }

    /**
     * Finds the best route for a host and path and precomputes its pool.
     *
     * @param host Canonical request host (lowercase, no port).
     * @param path Request path without query string.
     * @return The decision, or empty if no enabled route matches.
     */
    public Optional<RoutingDecision> resolve(String host, String path) {
        String requestPath = path == null || path.isEmpty() ? Route.DEFAULT_PATH : path;
        String normalized = normalizer.normalize(host);

        try (StoreSession session = store.openSession()) {
            Set<String> routeIds = session.members(StoreKeys.ROUTE_HOST_INDEX.key(normalized));
            if (routeIds.isEmpty() && host != null && !host.equals(normalized)) {
                routeIds = session.members(StoreKeys.ROUTE_HOST_INDEX.key(host));
            }
            if (routeIds.isEmpty()) {
                log.debug("No routes indexed for host {} (normalized {})", host, normalized);
                return Optional.empty();
            }

            Map<String, Route> candidates = new HashMap<>();
            for (String routeId : routeIds) {
                String key = StoreKeys.ROUTE.key(routeId);
                session.get(key)
                        .flatMap(json -> JsonDocuments.read(json, Route.class, key))
                        .ifPresent(route -> candidates.put(routeId, route));
            }

            Optional<RouteMatcher.Match> match = RouteMatcher.match(candidates, requestPath);
            if (match.isEmpty()) {
                log.debug("No enabled route of host {} matches path {}", host, requestPath);
                return Optional.empty();
            }

            RouteMatcher.Match winner = match.get();
            ResolvedPool pool = poolResolver.resolvePool(session, winner.routeId());
            String forwardPath = RoutingDecision.forwardPath(winner.route(), requestPath);
            log.debug("Host {} path {} resolved to route {} ({} pool slots)", host, requestPath,
                    winner.routeId(), pool.size());
            return Optional.of(new RoutingDecision(winner.routeId(), winner.route(), pool, forwardPath));
        }
    }
}
