package com.cloudcost.analytics.api;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * Alert settings as exchanged with the dashboard.
 */
public record AlertSettingsRequest(
        @NotNull @Valid Channels channels,
        @NotNull @Valid Thresholds thresholds,
        @NotNull @Valid Preferences preferences,
        @Email String emailAddress,
        String chatChannel
) {
    public record Channels(boolean email, boolean chat, boolean inApp) {}

    public record Thresholds(
            @PositiveOrZero double critical,
            @PositiveOrZero double high,
            @PositiveOrZero double medium,
            @PositiveOrZero double low
    ) {}

    public record Preferences(
            boolean notifyOnCritical,
            boolean notifyOnHigh,
            boolean notifyOnMedium,
            boolean notifyOnLow
    ) {}
}
