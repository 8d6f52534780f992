package com.cloudcost.analytics.error;

/**
 * Base type for failures raised by the analytics pipeline.
 */
public abstract class CostAnalyticsException extends RuntimeException {

    protected CostAnalyticsException(String message) {
        super(message);
    }

    protected CostAnalyticsException(String message, Throwable cause) {
        super(message, cause);
    }
}
