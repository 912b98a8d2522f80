package com.edgeroute.proxy.core.routing;

import java.util.Arrays;
import java.util.Optional;

/**
 * A backend instance eligible to receive traffic for a route.
 *
 * @param address Host name or IP address.
 * @param port    TCP port.
 * @param weight  Relative share of traffic, between 1 and {@link #MAX_WEIGHT}.
 */
public record BackendTarget(String address, int port, int weight) {

    /** Upper bound on the slots a single target may occupy in an expanded pool. */
    public static final int MAX_WEIGHT = 1000;

    public BackendTarget {
        if (weight < 1) {
            weight = 1;
        } else if (weight > MAX_WEIGHT) {
            weight = MAX_WEIGHT;
        }
    }

    /**
     * Parses an upstream list entry of the form {@code address:port[:weight]}.
     * Empty segments are ignored. A missing, non-numeric or non-positive weight
     * becomes 1; a weight above {@link #MAX_WEIGHT} is capped.
     *
     * @param entry Raw list element.
     * @return The target, or empty if the entry has no address and numeric port.
     */
    public static Optional<BackendTarget> parse(String entry) {
        if (entry == null) {
            return Optional.empty();
        }
        String[] parts = Arrays.stream(entry.split(":"))
                .filter(p -> !p.isEmpty())
                .toArray(String[]::new);
        if (parts.length < 2) {
            return Optional.empty();
        }
        int port;
        try {
            port = Integer.parseInt(parts[1].trim());
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
        int weight = 1;
        if (parts.length >= 3) {
            try {
                weight = Integer.parseInt(parts[2].trim());
            } catch (NumberFormatException e) {
                // out of int range counts as oversized, anything else as malformed
                weight = parts[2].trim().matches("\\d+") ? MAX_WEIGHT : 1;
            }
        }
        return Optional.of(new BackendTarget(parts[0], port, weight));
    }

    /**
     * Returns the {@code address:port} form handed to the engine.
     *
     * @return The peer address.
     */
    public String authority() {
        return address + ":" + port;
    }

    @Override
    public String toString() {
        return authority();
    }
}
