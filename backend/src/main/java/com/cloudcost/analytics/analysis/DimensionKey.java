package com.cloudcost.analytics.analysis;

import com.cloudcost.analytics.domain.model.CloudProvider;
import com.cloudcost.analytics.domain.model.CostRecord;

import java.util.Objects;

/**
 * Identifies one cost series: provider, service and project.
 * Records without a project tag share the {@value #DEFAULT_PROJECT} bucket.
 */
public record DimensionKey(
        CloudProvider provider,
        String service,
        String project
) {
    public static final String DEFAULT_PROJECT = "default";

    public DimensionKey {
        Objects.requireNonNull(provider, "provider");
        Objects.requireNonNull(service, "service");
        project = (project == null || project.isBlank()) ? DEFAULT_PROJECT : project;
    }

    public static DimensionKey of(CostRecord record) {
        return new DimensionKey(record.getProvider(), record.getService(), record.getProject());
    }

    public boolean isDefaultProject() {
        return DEFAULT_PROJECT.equals(project);
    }

    @Override
    public String toString() {
        return provider.name().toLowerCase() + ":" + service + ":" + project;
    }
}
