package com.cloudcost.analytics.domain.model;

/**
 * Delivery status of an alert. PENDING moves to exactly one of SENT or FAILED, never back.
 */
public enum AlertStatus {
    /**
     * Created, not yet dispatched.
     */
    PENDING,

    /**
     * All enabled channels were attempted. Individual channels may still have failed.
     */
    SENT,

    /**
     * Dispatch failed before fan-out or while recording the final status.
     */
    FAILED;

    public boolean isTerminal() {
        return this != PENDING;
    }
}
