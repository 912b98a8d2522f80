package com.edgeroute.proxy.core.routing;

import com.edgeroute.proxy.core.store.InMemoryConfigStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class BackendPoolResolverTest {

    private InMemoryConfigStore store;
    private BackendPoolResolver resolver;

    @BeforeEach
    void setUp() {
        store = new InMemoryConfigStore();
        resolver = new BackendPoolResolver(store);
    }

    @Test
    void resolvePool_expandsByWeightInListOrder() {
        store.append("upstreams:r1", "a:80:2", "b:80:1");

        ResolvedPool pool = resolver.resolvePool("r1");

        assertThat(pool.slots()).extracting(BackendTarget::address).containsExactly("a", "a", "b");
    }

    @Test
    void resolvePool_excludesOnlyExactUnhealthyMarker() {
        store.append("upstreams:r1", "a:80", "b:80", "c:80", "d:80")
                .put("upstreams:health:r1:a:80", "unhealthy")
                .put("upstreams:health:r1:b:80", "healthy")
                .put("upstreams:health:r1:c:80", "UNHEALTHY");

        ResolvedPool pool = resolver.resolvePool("r1");

        assertThat(pool.slots()).extracting(BackendTarget::address).containsExactly("b", "c", "d");
    }

    @Test
    void resolvePool_skipsMalformedEntries() {
        store.append("upstreams:r1", "broken", "a:notaport", "b:9000");

        assertThat(resolver.resolvePool("r1").slots()).containsExactly(new BackendTarget("b", 9000, 1));
    }

    @Test
    void resolvePool_allUnhealthy_isEmpty() {
        store.append("upstreams:r1", "a:80")
                .put("upstreams:health:r1:a:80", "unhealthy");

        assertThat(resolver.resolvePool("r1").isEmpty()).isTrue();
    }

    @Test
    void resolvePool_unknownRoute_isEmpty() {
        assertThat(resolver.resolvePool("missing").size()).isZero();
    }

    @Test
    void resolvePool_healthMarkerIsScopedToRoute() {
        store.append("upstreams:r1", "a:80")
                .put("upstreams:health:r2:a:80", "unhealthy");

        assertThat(resolver.resolvePool("r1").size()).isEqualTo(1);
    }
}
