package com.cloudcost.analytics.alerting;

import java.util.List;

/**
 * Result of dispatching one alert.
 *
 * A SUPPRESSED dispatch contacted no channel and left the alert status unchanged.
 * A SENT dispatch attempted every enabled channel; see {@link #failures()} for the ones
 * that did not deliver.
 */
public record DispatchReport(
        String alertId,
        Outcome outcome,
        List<ChannelDeliveryResult> results
) {
    public enum Outcome {
        SUPPRESSED,
        SENT
    }

    public DispatchReport {
        results = List.copyOf(results);
    }

    static DispatchReport suppressed(String alertId) {
        return new DispatchReport(alertId, Outcome.SUPPRESSED, List.of());
    }

    static DispatchReport sent(String alertId, List<ChannelDeliveryResult> results) {
        return new DispatchReport(alertId, Outcome.SENT, results);
    }

    public boolean isSuppressed() {
        return outcome == Outcome.SUPPRESSED;
    }

    public List<ChannelDeliveryResult> failures() {
        return results.stream().filter(r -> !r.delivered()).toList();
    }
}
