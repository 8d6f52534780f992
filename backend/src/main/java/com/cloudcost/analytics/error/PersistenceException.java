package com.cloudcost.analytics.error;

/**
 * A store write failed. Always propagated to the caller.
 */
public class PersistenceException extends CostAnalyticsException {

    public PersistenceException(String message) {
        super(message);
    }

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
