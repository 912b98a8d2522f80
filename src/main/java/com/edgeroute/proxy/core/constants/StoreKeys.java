package com.edgeroute.proxy.core.constants;

/**
 * Key layout of the configuration store.
 * The control plane writes these keys; the decision layer only reads them.
 */
public enum StoreKeys {
    /** Set of route ids registered for a host. */
    ROUTE_HOST_INDEX("routes:index:host:"),
    /** JSON route document by id. */
    ROUTE("routes:"),
    /** Ordered list of {@code address:port[:weight]} entries for a route. */
    UPSTREAMS("upstreams:"),
    /** Health marker for one upstream of a route. */
    UPSTREAM_HEALTH("upstreams:health:"),
    /** JSON certificate record by domain. */
    CERTIFICATE("certs:"),
    /** ACME HTTP-01 key authorization by token. */
    ACME_CHALLENGE("acme:challenge:");

    private final String prefix;

    StoreKeys(String prefix) {
        this.prefix = prefix;
    }

    /**
     * Retrieves the raw key prefix.
     * 
     * @return The prefix including the trailing separator.
     */
    public String getPrefix() {
        return prefix;
    }

    /**
     * Builds a concrete key by joining the parts with {@code ':'} after the
     * prefix.
     *
     * @param parts Key components, e.g. route id, address and port.
     * @return The full store key.
     */
    public String key(Object... parts) {
        StringBuilder sb = new StringBuilder(prefix);
        for (int i = 0; i < parts.length; i++) {
            if (i > 0) {
                sb.append(':');
            }
            sb.append(parts[i]);
        }
        return sb.toString();
    }
}
