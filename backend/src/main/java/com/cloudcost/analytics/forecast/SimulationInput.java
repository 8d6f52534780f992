package com.cloudcost.analytics.forecast;

import com.cloudcost.analytics.error.ValidationException;

/**
 * What-if adjustments applied on top of the extrapolated forecast.
 *
 * @param newDeployments number of planned new deployments
 * @param expectedGrowthPercent expected organic growth in percent
 * @param plannedChanges free-text note, carried through for display only
 */
public record SimulationInput(
        int newDeployments,
        double expectedGrowthPercent,
        String plannedChanges
) {
    private static final SimulationInput NONE = new SimulationInput(0, 0, null);

    public SimulationInput {
        if (newDeployments < 0) {
            throw new ValidationException("newDeployments must be >= 0, got " + newDeployments);
        }
        if (Double.isNaN(expectedGrowthPercent) || expectedGrowthPercent < 0) {
            throw new ValidationException("expectedGrowthPercent must be >= 0, got " + expectedGrowthPercent);
        }
    }

    public static SimulationInput none() {
        return NONE;
    }

    /**
     * Multiplier applied to every forecast day.
     *
     * @param deploymentImpact cost share added per new deployment
     */
    public double multiplier(double deploymentImpact) {
        double factor = 1.0;
        if (newDeployments > 0) {
            factor *= 1 + newDeployments * deploymentImpact;
        }
        if (expectedGrowthPercent > 0) {
            factor *= 1 + expectedGrowthPercent / 100;
        }
        return factor;
    }
}
