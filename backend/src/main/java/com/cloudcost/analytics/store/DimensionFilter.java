package com.cloudcost.analytics.store;

import com.cloudcost.analytics.domain.model.CloudProvider;

/**
 * Optional restriction of a query to one provider, service and/or project.
 * Null components match everything.
 */
public record DimensionFilter(
        CloudProvider provider,
        String service,
        String project
) {
    private static final DimensionFilter ALL = new DimensionFilter(null, null, null);

    public static DimensionFilter all() {
        return ALL;
    }

    @Override
    public String toString() {
        return (provider == null ? "*" : provider.name().toLowerCase()) + ":" +
               (service == null ? "*" : service) + ":" +
               (project == null ? "*" : project);
    }
}
