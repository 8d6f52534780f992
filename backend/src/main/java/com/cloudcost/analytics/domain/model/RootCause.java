package com.cloudcost.analytics.domain.model;

/**
 * Catalog of causal factors an anomaly can be attributed to.
 *
 * The base weight is the prior for the factor before any signal from the
 * cost pattern is taken into account.
 */
public enum RootCause {
    UNTAGGED_RESOURCES(0.30, "Cost spike due to untagged %s resources"),
    UNUSUAL_USAGE(0.25, "Unusual usage pattern detected in %s"),
    MISCONFIGURATION(0.20, "Misconfigured %s resources causing increased costs"),
    PRICE_CHANGE(0.15, "Recent price changes affecting %s costs"),
    DATA_TRANSFER(0.10, "Increased data transfer costs in %s");

    private final double baseWeight;
    private final String descriptionTemplate;

    RootCause(double baseWeight, String descriptionTemplate) {
        this.baseWeight = baseWeight;
        this.descriptionTemplate = descriptionTemplate;
    }

    public double getBaseWeight() {
        return baseWeight;
    }

    public String describe(String service) {
        return String.format(descriptionTemplate, service);
    }
}
