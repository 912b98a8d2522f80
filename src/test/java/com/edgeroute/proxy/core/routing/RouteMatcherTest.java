package com.edgeroute.proxy.core.routing;

import com.edgeroute.proxy.entity.Route;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class RouteMatcherTest {

    private static Route route(String path, Boolean enabled) {
        Route route = new Route();
        route.setPath(path);
        route.setEnabled(enabled);
        return route;
    }

    @Test
    void match_withNoCandidates_isEmpty() {
        assertThat(RouteMatcher.match(null, "/")).isEmpty();
        assertThat(RouteMatcher.match(Map.of(), "/")).isEmpty();
    }

    @Test
    void match_prefersLongestPrefix() {
        Map<String, Route> candidates = Map.of(
                "root", route("/", null),
                "api", route("/api", null),
                "v1", route("/api/v1", null));

        assertThat(RouteMatcher.match(candidates, "/api/v1/users")).get()
                .extracting(RouteMatcher.Match::routeId).isEqualTo("v1");
        assertThat(RouteMatcher.match(candidates, "/api/v2/users")).get()
                .extracting(RouteMatcher.Match::routeId).isEqualTo("api");
        assertThat(RouteMatcher.match(candidates, "/static/app.js")).get()
                .extracting(RouteMatcher.Match::routeId).isEqualTo("root");
    }

    @Test
    void match_isPlainStringPrefix() {
        Map<String, Route> candidates = Map.of("app", route("/app", null));

        assertThat(RouteMatcher.match(candidates, "/apple")).isPresent();
        assertThat(RouteMatcher.match(candidates, "/ap")).isEmpty();
    }

    @Test
    void match_disabledRouteNeverWins() {
        Map<String, Route> candidates = Map.of(
                "root", route("/", true),
                "api", route("/api", false));

        assertThat(RouteMatcher.match(candidates, "/api/x")).get()
                .extracting(RouteMatcher.Match::routeId).isEqualTo("root");
    }

    @Test
    void match_onlyDisabledRoutes_isEmpty() {
        assertThat(RouteMatcher.match(Map.of("api", route("/api", false)), "/api")).isEmpty();
    }

    @Test
    void match_emptyOrMissingPathActsAsRoot() {
        assertThat(RouteMatcher.match(Map.of("a", route(null, null)), "/anything")).isPresent();
        assertThat(RouteMatcher.match(Map.of("b", route("", null)), "/anything")).isPresent();
    }

    @Test
    void match_equalPrefixes_smallestIdWins() {
        Map<String, Route> candidates = new HashMap<>();
        candidates.put("route-b", route("/api", null));
        candidates.put("route-a", route("/api", null));
        candidates.put("route-c", route("/api", null));

        for (int i = 0; i < 5; i++) {
            assertThat(RouteMatcher.match(candidates, "/api/x")).get()
                    .extracting(RouteMatcher.Match::routeId).isEqualTo("route-a");
        }
    }

    @Test
    void match_reportsPrefixLength() {
        assertThat(RouteMatcher.match(Map.of("api", route("/api", null)), "/api/x")).get()
                .extracting(RouteMatcher.Match::prefixLength).isEqualTo(4);
    }
}
