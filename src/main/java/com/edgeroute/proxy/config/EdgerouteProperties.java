package com.edgeroute.proxy.config;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;

/**
 * Root configuration object for Edgeroute.
 * Maps to the top-level structure of application.yml.
 */
public class EdgerouteProperties {
    /**
     * Configuration store connection settings.
     */
    private StoreConfig store = new StoreConfig();

    /**
     * Load balancer settings shared by all routes.
     */
    private BalancerConfig balancer = new BalancerConfig();

    /**
     * Host normalization settings.
     */
    private RoutingConfig routing = new RoutingConfig();

    /**
     * ACME HTTP-01 listener settings.
     */
    private ChallengeConfig challenge = new ChallengeConfig();

    /**
     * Administration and metrics configuration.
     */
    private AdminConfig admin = new AdminConfig();

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public StoreConfig getStore() {
        return store;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public void setStore(StoreConfig store) {
        this.store = store;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public BalancerConfig getBalancer() {
        return balancer;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public void setBalancer(BalancerConfig balancer) {
        this.balancer = balancer;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public RoutingConfig getRouting() {
        return routing;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public void setRouting(RoutingConfig routing) {
        this.routing = routing;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public ChallengeConfig getChallenge() {
        return challenge;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public void setChallenge(ChallengeConfig challenge) {
        this.challenge = challenge;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public AdminConfig getAdmin() {
        return admin;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public void setAdmin(AdminConfig admin) {
        this.admin = admin;
    }
}
