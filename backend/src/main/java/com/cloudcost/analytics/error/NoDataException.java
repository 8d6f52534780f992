package com.cloudcost.analytics.error;

/**
 * No cost history exists for the requested user, dimension and time window.
 * Recoverable: retry later or widen the window.
 */
public class NoDataException extends CostAnalyticsException {

    public NoDataException(String message) {
        super(message);
    }
}
