package com.edgeroute.proxy.core.routing;

import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;
import java.util.regex.Pattern;

/**
 * One row of the host normalization table: a wildcard DNS suffix and the
 * ordered stripping functions tried on hosts that end with it.
 *
 * @param suffix    Domain suffix including the leading dot, e.g. {@code .nip.io}.
 * @param strippers Functions that remove an embedded IP segment; tried in order.
 */
public record WildcardDomainRule(String suffix, List<UnaryOperator<String>> strippers) {

    /** {@code app.10.0.0.1.nip.io} → {@code app}. */
    private static final Pattern DOTTED_IP = Pattern
            .compile("\\.\\d+\\.\\d+\\.\\d+\\.\\d+\\.[A-Za-z0-9]+\\.[A-Za-z0-9]+$");

    /** {@code app.10-0-0-1.sslip.io} → {@code app}. */
    private static final Pattern DASHED_IP = Pattern
            .compile("\\.\\d+-\\d+-\\d+-\\d+\\.[A-Za-z0-9]+\\.[A-Za-z0-9]+$");

    /** Dotted form first, then dashed form. */
    public static final List<UnaryOperator<String>> IP_STRIPPERS = List.of(
            host -> DOTTED_IP.matcher(host).replaceFirst(""),
            host -> DASHED_IP.matcher(host).replaceFirst(""));

    public WildcardDomainRule {
        strippers = List.copyOf(strippers);
    }

    /**
     * Creates a rule for the given suffix using the standard IP strippers.
     *
     * @param suffix Domain suffix including the leading dot.
     * @return A new rule.
     */
    public static WildcardDomainRule forSuffix(String suffix) {
        return new WildcardDomainRule(suffix, IP_STRIPPERS);
    }

    /**
     * Checks whether the host belongs to this wildcard domain.
     *
     * @param host Host name.
     * @return true if the host ends with the suffix.
     */
    public boolean matches(String host) {
        return host.endsWith(suffix);
    }

    /**
     * Applies the strippers in order and returns the first result that differs
     * from the input.
     *
     * @param host Host name that {@link #matches(String) matches} this rule.
     * @return The stripped host, or empty if no stripper changed it.
     */
    public Optional<String> strip(String host) {
        for (UnaryOperator<String> stripper : strippers) {
            String base = stripper.apply(host);
            if (!base.equals(host)) {
                return Optional.of(base);
            }
        }
        return Optional.empty();
    }
}
