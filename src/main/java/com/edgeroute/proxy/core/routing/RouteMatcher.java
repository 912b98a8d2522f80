package com.edgeroute.proxy.core.routing;

import com.edgeroute.proxy.entity.Route;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Utility class for picking the route whose path prefix best matches a request
 * path.
 */
public final class RouteMatcher {

    private RouteMatcher() {
        // Private constructor for utility class
    }

    /**
     * A winning route together with the id it was indexed under.
     *
     * @param routeId Id from the host index; keys the upstream list.
     * @param route   The route document.
     */
    public record Match(String routeId, Route route) {
        /**
         * Returns the length of the matched prefix.
         *
         * @return Prefix length, at least 1.
         */
        public int prefixLength() {
            return route.getPathPrefix().length();
        }
    }

    /**
     * Finds the enabled route with the longest path prefix of {@code path}.
     *
     * <p>
     * Matching is a plain string prefix test, so {@code /app} also matches
     * {@code /apple}. Disabled routes never match. Candidates are visited in
     * lexical id order and only a strictly longer prefix replaces the current
     * winner, so equal-length prefixes resolve to the smallest id.
     * </p>
     *
     * @param candidates Route documents by id.
     * @param path       The request path.
     * @return The best match, or empty if no enabled route's prefix matches.
     */
    public static Optional<Match> match(Map<String, Route> candidates, String path) {
        if (candidates == null || candidates.isEmpty() || path == null) {
            return Optional.empty();
        }
        Match best = null;
        for (Map.Entry<String, Route> entry : new TreeMap<>(candidates).entrySet()) {
            Route route = entry.getValue();
            if (route == null || !route.isActive()) {
                continue;
            }
            String prefix = route.getPathPrefix();
            if (path.startsWith(prefix) && (best == null || prefix.length() > best.prefixLength())) {
                best = new Match(entry.getKey(), route);
            }
        }
        return Optional.ofNullable(best);
    }
}
