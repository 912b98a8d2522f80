package com.edgeroute.proxy.core.constants;

import java.util.Locale;

/**
 * Supported load balancing algorithms for backend target selection.
 * Route documents name the strategy in snake case (e.g. {@code ip_hash}).
 */
public enum LoadBalancingType {
    /**
     * Spread connections across the pool by worker id and connection sequence.
     * Default.
     */
    ROUND_ROBIN,

    /**
     * Uniformly random index into the pool.
     */
    RANDOM,

    /**
     * CRC32 of the client IP address.
     * Ensures a client sticks to the same backend while the pool is unchanged.
     */
    IP_HASH;

    /**
     * Resolves the strategy named by a route document.
     * Unknown, blank or absent names fall back to {@link #ROUND_ROBIN}.
     *
     * @param name The configured name, e.g. {@code "random"}.
     * @return The matching strategy.
     */
    public static LoadBalancingType fromName(String name) {
        if (name == null || name.isBlank()) {
            return ROUND_ROBIN;
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (LoadBalancingType type : values()) {
            if (type.name().equals(normalized)) {
                return type;
            }
        }
        return ROUND_ROBIN;
    }

    /**
     * Retrieves the name used in route documents and metric tags.
     *
     * @return Lower snake case name.
     */
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
