package com.cloudcost.analytics.anomaly;

import com.cloudcost.analytics.domain.model.RootCause;

/**
 * Winning root-cause factor for an anomaly together with its score and display text.
 */
public record RootCauseAssessment(
        RootCause cause,
        double score,
        String description
) {}
