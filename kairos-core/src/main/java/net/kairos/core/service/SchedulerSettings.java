package net.kairos.core.service;

import net.kairos.core.model.JobDefaults;

import java.time.Duration;
import java.time.ZoneId;

/**
 * @param zone            zone cron expressions are evaluated in
 * @param defaults        fallbacks for out-of-range timeout/retry values
 * @param callbackTimeout bound on one callback delivery
 */
public record SchedulerSettings(ZoneId zone, JobDefaults defaults, Duration callbackTimeout) {
    public SchedulerSettings {
        if (zone == null) zone = ZoneId.of("UTC");
        if (defaults == null) defaults = JobDefaults.STANDARD;
        if (callbackTimeout == null || callbackTimeout.isNegative() || callbackTimeout.isZero()) {
            callbackTimeout = CallbackNotifier.DEFAULT_TIMEOUT;
        }
    }

    public static SchedulerSettings standard() {
        return new SchedulerSettings(ZoneId.of("UTC"), JobDefaults.STANDARD, CallbackNotifier.DEFAULT_TIMEOUT);
    }
}
