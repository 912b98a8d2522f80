package com.edgeroute.proxy.core.engine;

import com.edgeroute.proxy.core.routing.RoutingDecision;
import java.util.Locale;

/**
 * State of a single request as it moves through the access and balancer
 * phases. Owned by one request; not thread safe.
 */
public class RequestContext {
    private final String host;
    private final String originalPath;
    private String path;
    private final String remoteAddr;
    private final long connectionSequence;
    private RoutingDecision decision;

    /**
     * @param hostHeader         Host header or authority, with or without port.
     * @param path               Request path; a query string is dropped.
     * @param remoteAddr         Client address, may be null.
     * @param connectionSequence Engine-assigned connection number.
     */
    public RequestContext(String hostHeader, String path, String remoteAddr, long connectionSequence) {
        this.host = canonicalHost(hostHeader);
        this.originalPath = stripQuery(path);
        this.path = originalPath;
        this.remoteAddr = remoteAddr;
        this.connectionSequence = connectionSequence;
    }

    /**
     * Lowercases a host header and removes its port, keeping IPv6 literals
     * bracketed.
     *
     * @param hostHeader Raw header value.
     * @return Canonical host, empty if the header is absent.
     */
    static String canonicalHost(String hostHeader) {
        if (hostHeader == null) {
            return "";
        }
        String value = hostHeader.trim().toLowerCase(Locale.ROOT);
        if (value.startsWith("[")) {
            int close = value.indexOf(']');
            return close > 0 ? value.substring(0, close + 1) : value;
        }
        int colon = value.indexOf(':');
        if (colon >= 0 && value.indexOf(':', colon + 1) < 0) {
            value = value.substring(0, colon);
        }
        if (value.endsWith(".")) {
            value = value.substring(0, value.length() - 1);
        }
        return value;
    }

    private static String stripQuery(String path) {
        if (path == null || path.isEmpty()) {
            return "/";
        }
        int query = path.indexOf('?');
        String clean = query >= 0 ? path.substring(0, query) : path;
        return clean.isEmpty() ? "/" : clean;
    }

    public String getHost() {
        return host;
    }

    /** Path as received, before any prefix stripping. */
    public String getOriginalPath() {
        return originalPath;
    }

    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
    }

    public String getRemoteAddr() {
        return remoteAddr;
    }

    public long getConnectionSequence() {
        return connectionSequence;
    }

    public RoutingDecision getDecision() {
        return decision;
    }

    public void setDecision(RoutingDecision decision) {
        this.decision = decision;
    }
}
