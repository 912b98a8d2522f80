package com.edgeroute.proxy.core.services;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

/**
 * Counters for the per-request decisions.
 */
public class DecisionMetrics {

    public static final String ROUTES_RESOLVED = "edge.routes.resolved";
    public static final String UPSTREAMS_SELECTED = "edge.upstreams.selected";
    public static final String UPSTREAMS_UNAVAILABLE = "edge.upstreams.unavailable";
    public static final String CERT_LOOKUPS = "edge.certs.lookups";
    public static final String ACME_CHALLENGES = "edge.acme.challenges";

    private final MeterRegistry registry;

    public DecisionMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records a route resolution.
     *
     * @param outcome {@code matched}, {@code not_found} or {@code store_error}.
     */
    public void routeResolved(String outcome) {
        Counter.builder(ROUTES_RESOLVED)
                .description("Route resolutions by outcome")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void upstreamSelected(String strategy) {
        Counter.builder(UPSTREAMS_SELECTED)
                .description("Backend selections by strategy")
                .tag("strategy", strategy)
                .register(registry)
                .increment();
    }

    public void upstreamUnavailable() {
        Counter.builder(UPSTREAMS_UNAVAILABLE)
                .description("Selections attempted against an empty pool")
                .register(registry)
                .increment();
    }

    /**
     * Records a certificate lookup.
     *
     * @param outcome {@code found}, {@code missing}, {@code no_sni} or {@code error}.
     */
    public void certificateLookup(String outcome) {
        Counter.builder(CERT_LOOKUPS)
                .description("SNI certificate lookups by outcome")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    /**
     * Records a challenge answer.
     *
     * @param outcome {@code served}, {@code not_found} or {@code store_error}.
     */
    public void challengeAnswered(String outcome) {
        Counter.builder(ACME_CHALLENGES)
                .description("ACME HTTP-01 challenge requests by outcome")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }
}
