package com.edgeroute.proxy.entity;

import com.edgeroute.proxy.core.constants.LoadBalancingType;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Objects;

/**
 * A host + path rule mapping inbound requests to a backend pool.
 * Read from the {@code routes:{id}} document written by the control plane;
 * fields this layer does not act on (protocol, middlewares, health check
 * settings, embedded upstreams) are ignored.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class Route {
    /** Root prefix used when a route has no path. */
    public static final String DEFAULT_PATH = "/";

    /** Route identifier; also keys the upstream list of the route. */
    private String id;

    /** The host name the route is registered under. */
    private String host;

    /** The path prefix to match (e.g., /api). */
    private String path;

    /** Absent means enabled; only an explicit false disables the route. */
    private Boolean enabled;

    /** Whether the matched prefix is removed before forwarding. */
    @JsonProperty("strip_path")
    private boolean stripPath;

    /** Strategy name, e.g. {@code round_robin}, {@code random}, {@code ip_hash}. */
    @JsonProperty("load_balancer")
    private String loadBalancer;

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getHost() {
        return host;
    }

    public void setHost(String host) {
        this.host = host;
    }

    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
    }

    public Boolean getEnabled() {
        return enabled;
    }

    public void setEnabled(Boolean enabled) {
        this.enabled = enabled;
    }

    public boolean isStripPath() {
        return stripPath;
    }

    public void setStripPath(boolean stripPath) {
        this.stripPath = stripPath;
    }

    public String getLoadBalancer() {
        return loadBalancer;
    }

    public void setLoadBalancer(String loadBalancer) {
        this.loadBalancer = loadBalancer;
    }

    /**
     * Checks whether the route takes part in matching.
     *
     * @return false only when the document explicitly sets {@code enabled: false}.
     */
    public boolean isActive() {
        return !Boolean.FALSE.equals(enabled);
    }

    /**
     * Returns the prefix used for matching, defaulting to {@code /}.
     *
     * @return The non-empty path prefix.
     */
    public String getPathPrefix() {
        return path == null || path.isEmpty() ? DEFAULT_PATH : path;
    }

    /**
     * Resolves the configured load balancing strategy.
     *
     * @return The strategy, {@link LoadBalancingType#ROUND_ROBIN} when unset or
     *         unknown.
     */
    public LoadBalancingType getLoadBalancingType() {
        return LoadBalancingType.fromName(loadBalancer);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Route route = (Route) o;
        return stripPath == route.stripPath &&
               Objects.equals(id, route.id) &&
               Objects.equals(host, route.host) &&
               Objects.equals(path, route.path) &&
               Objects.equals(enabled, route.enabled) &&
               Objects.equals(loadBalancer, route.loadBalancer);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, host, path, enabled, stripPath, loadBalancer);
    }

    @Override
    public String toString() {
        return "Route{id=" + id + ", host=" + host + ", path=" + getPathPrefix() + "}";
    }
}
