package com.edgeroute.proxy.core.routing;

import com.edgeroute.proxy.entity.Route;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RoutingDecisionTest {

    private static Route route(String path, boolean strip) {
        Route route = new Route();
        route.setPath(path);
        route.setStripPath(strip);
        return route;
    }

    @Test
    void forwardPath_withoutStrip_keepsRequestPath() {
        assertThat(RoutingDecision.forwardPath(route("/api", false), "/api/users")).isEqualTo("/api/users");
    }

    @Test
    void forwardPath_stripsPrefix() {
        assertThat(RoutingDecision.forwardPath(route("/api", true), "/api/users")).isEqualTo("/users");
    }

    @Test
    void forwardPath_exactPrefix_becomesRoot() {
        assertThat(RoutingDecision.forwardPath(route("/api", true), "/api")).isEqualTo("/");
    }

    @Test
    void forwardPath_prefixWithTrailingSlash_leavesRelativeRemainder() {
        assertThat(RoutingDecision.forwardPath(route("/api/", true), "/api/users")).isEqualTo("users");
    }

    @Test
    void forwardPath_stripIsCharacterBased() {
        assertThat(RoutingDecision.forwardPath(route("/app", true), "/apple")).isEqualTo("le");
    }

    @Test
    void forwardPath_rootPrefix_neverStripped() {
        assertThat(RoutingDecision.forwardPath(route("/", true), "/x")).isEqualTo("/x");
        assertThat(RoutingDecision.forwardPath(route(null, true), "/x")).isEqualTo("/x");
    }
}
