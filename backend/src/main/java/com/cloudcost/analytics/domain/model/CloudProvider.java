package com.cloudcost.analytics.domain.model;

import java.util.Locale;

/**
 * Supported cloud providers.
 *
 * Billing records arrive already normalized by the ingestion side; the provider
 * is one of the three components of a cost dimension key.
 */
public enum CloudProvider {
    AWS("Amazon Web Services"),
    AZURE("Azure"),
    GCP("Google Cloud Platform");

    private final String displayName;

    CloudProvider(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Parse a provider code such as {@code aws} or {@code Azure}.
     *
     * @throws IllegalArgumentException for unknown codes
     */
    public static CloudProvider fromCode(String code) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("Provider code must not be blank");
        }
        for (CloudProvider provider : values()) {
            if (provider.name().equals(code.trim().toUpperCase(Locale.ROOT))) {
                return provider;
            }
        }
        throw new IllegalArgumentException("Unknown cloud provider: " + code);
    }
}
