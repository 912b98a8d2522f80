package com.edgeroute.proxy.core.routing;

import java.util.List;
import java.util.Optional;

/**
 * Maps a request host or TLS server name to the canonical name used for route
 * and certificate lookups.
 *
 * <p>
 * Hosts under a wildcard DNS service embed the server IP as labels
 * ({@code app.1.2.3.4.nip.io}, {@code app.1-2-3-4.sslip.io}); the IP changes per
 * environment while the leading labels stay stable. The first rule whose suffix
 * matches and whose stripping changes the host decides the result; a matching
 * rule that strips nothing falls through to the next one. Hosts that match no
 * rule are returned unchanged.
 * </p>
 *
 * <p>
 * Normalization is repeated until the host stops changing, so the result is
 * always a fixed point.
 * </p>
 */
public class HostNormalizer {

    /** Wildcard DNS services recognised out of the box, in match order. */
    public static final List<String> DEFAULT_SUFFIXES = List.of(".nip.io", ".sslip.io", ".lvh.me", ".localtest.me");

    private final List<WildcardDomainRule> rules;

    /**
     * Creates a normalizer with an explicit rule table.
     *
     * @param rules Rules in match order.
     */
    public HostNormalizer(List<WildcardDomainRule> rules) {
        this.rules = List.copyOf(rules);
    }

    /**
     * Creates a normalizer for the given suffixes using the standard IP strippers.
     *
     * @param suffixes Suffixes in match order; null selects the defaults.
     * @return A new normalizer.
     */
    public static HostNormalizer forSuffixes(List<String> suffixes) {
        List<String> effective = suffixes == null ? DEFAULT_SUFFIXES : suffixes;
        return new HostNormalizer(effective.stream().map(WildcardDomainRule::forSuffix).toList());
    }

    /**
     * Creates a normalizer with the default suffix table.
     *
     * @return A new normalizer.
     */
    public static HostNormalizer defaults() {
        return forSuffixes(DEFAULT_SUFFIXES);
    }

    /**
     * Normalizes a host.
     *
     * @param host Raw host or server name; may be null or empty.
     * @return The canonical host; the input itself when nothing applies.
     */
    public String normalize(String host) {
        if (host == null || host.isEmpty()) {
            return host;
        }
        String current = host;
        Optional<String> next = normalizeOnce(current);
        while (next.isPresent()) {
            current = next.get();
            next = normalizeOnce(current);
        }
        return current;
    }

    private Optional<String> normalizeOnce(String host) {
        for (WildcardDomainRule rule : rules) {
            if (rule.matches(host)) {
                Optional<String> base = rule.strip(host);
                if (base.isPresent()) {
                    return base;
                }
            }
        }
        return Optional.empty();
    }
}
