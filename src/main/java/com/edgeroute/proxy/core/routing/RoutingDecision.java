package com.edgeroute.proxy.core.routing;

import com.edgeroute.proxy.entity.Route;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;

/**
 * Immutable output of the resolve stage: everything the later, store-free
 * selection stage needs for one request.
 */
public final class RoutingDecision {

    private final String routeId;
    private final Route route;
    private final ResolvedPool pool;
    private final String forwardPath;

    /**
     * Creates a decision.
     *
     * @param routeId     Id of the winning route.
     * @param route       The winning route document.
     * @param pool        Health-filtered, weight-expanded pool.
     * @param forwardPath Path to send upstream after optional prefix stripping.
     */
    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public RoutingDecision(String routeId, Route route, ResolvedPool pool, String forwardPath) {
        this.routeId = routeId;
        this.route = route;
        this.pool = pool;
        this.forwardPath = forwardPath;
    }

    /**
     * Computes the upstream path for a request path matched by {@code route}.
     * The prefix is removed only when the route strips paths and the prefix is
     * longer than one character; an empty remainder becomes {@code /}.
     *
     * @param route       The matched route.
     * @param requestPath The original request path.
     * @return The path to forward.
     */
    public static String forwardPath(Route route, String requestPath) {
        String prefix = route.getPathPrefix();
        if (!route.isStripPath() || prefix.length() <= 1 || !requestPath.startsWith(prefix)) {
            return requestPath;
        }
        String rest = requestPath.substring(prefix.length());
        return rest.isEmpty() ? Route.DEFAULT_PATH : rest;
    }

    public String getRouteId() {
        return routeId;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public Route getRoute() {
        return route;
    }

    public ResolvedPool getPool() {
        return pool;
    }

    public String getForwardPath() {
        return forwardPath;
    }

    @Override
    public String toString() {
        return "RoutingDecision{route=" + routeId + ", forwardPath=" + forwardPath + ", pool=" + pool + "}";
    }
}
