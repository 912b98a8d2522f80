package com.edgeroute.proxy.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Settings for host normalization.
 */
public class RoutingConfig {
    /**
     * Wildcard DNS suffixes whose embedded IP labels are stripped, in match
     * order.
     */
    private List<String> wildcardSuffixes = new ArrayList<>(
            List.of(".nip.io", ".sslip.io", ".lvh.me", ".localtest.me"));

    public List<String> getWildcardSuffixes() {
        return wildcardSuffixes == null ? null : Collections.unmodifiableList(wildcardSuffixes);
    }

    public void setWildcardSuffixes(List<String> wildcardSuffixes) {
        this.wildcardSuffixes = wildcardSuffixes == null ? null : new ArrayList<>(wildcardSuffixes);
    }
}
