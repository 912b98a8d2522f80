package com.edgeroute.proxy.core.constants;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LoadBalancingTypeTest {

    @Test
    void fromName_knownNames() {
        assertThat(LoadBalancingType.fromName("round_robin")).isEqualTo(LoadBalancingType.ROUND_ROBIN);
        assertThat(LoadBalancingType.fromName("random")).isEqualTo(LoadBalancingType.RANDOM);
        assertThat(LoadBalancingType.fromName("ip_hash")).isEqualTo(LoadBalancingType.IP_HASH);
        assertThat(LoadBalancingType.fromName("IP-HASH")).isEqualTo(LoadBalancingType.IP_HASH);
    }

    @Test
    void fromName_unknownOrAbsent_defaultsToRoundRobin() {
        assertThat(LoadBalancingType.fromName(null)).isEqualTo(LoadBalancingType.ROUND_ROBIN);
        assertThat(LoadBalancingType.fromName(" ")).isEqualTo(LoadBalancingType.ROUND_ROBIN);
        assertThat(LoadBalancingType.fromName("least_conn")).isEqualTo(LoadBalancingType.ROUND_ROBIN);
    }

    @Test
    void getValue_isSnakeCase() {
        assertThat(LoadBalancingType.IP_HASH.getValue()).isEqualTo("ip_hash");
    }

    @Test
    void storeKeys_joinPartsWithColon() {
        assertThat(StoreKeys.UPSTREAM_HEALTH.key("r1", "10.0.0.5", 8080)).isEqualTo("upstreams:health:r1:10.0.0.5:8080");
        assertThat(StoreKeys.ROUTE_HOST_INDEX.key("app.example.com")).isEqualTo("routes:index:host:app.example.com");
        assertThat(StoreKeys.ACME_CHALLENGE.key("tok")).isEqualTo("acme:challenge:tok");
    }
}
