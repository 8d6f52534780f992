package com.cloudcost.analytics.error;

/**
 * Malformed input or configuration supplied by the caller.
 */
public class ValidationException extends CostAnalyticsException {

    public ValidationException(String message) {
        super(message);
    }
}
