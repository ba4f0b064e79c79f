package net.kairos.core.service;

import net.kairos.core.exec.HttpCommandRunner;
import net.kairos.core.model.ExecutionKind;
import net.kairos.core.model.Job;
import net.kairos.core.model.JobDefaults;
import net.kairos.core.model.RecurrenceKind;
import net.kairos.core.spi.Clock;
import net.kairos.core.spi.CronCalculator;

import java.net.URI;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Locale;
import java.util.Set;

/** Checks a job definition and returns it normalized (defaults applied, methods upper-cased). */
public final class JobValidator {
    private static final Set<String> CALLBACK_METHODS = Set.of("GET", "POST");

    private final CronCalculator cron;
    private final Clock clock;
    private final JobDefaults defaults;
    private final ZoneId zone;

    public JobValidator(CronCalculator cron, Clock clock, JobDefaults defaults, ZoneId zone) {
        this.cron = cron;
        this.clock = clock;
        this.defaults = defaults;
        this.zone = zone;
    }

    public Job validate(Job job) {
        if (job == null) throw new JobValidationException("job is required");
        if (isBlank(job.name())) throw new JobValidationException("job name is required");
        if (job.recurrence() == null || job.recurrence() == RecurrenceKind.UNKNOWN) {
            throw new JobValidationException("unsupported recurrence, expected ONCE or CRON");
        }
        if (job.execution() == null || job.execution() == ExecutionKind.UNKNOWN) {
            throw new JobValidationException("unsupported execution, expected SHELL or HTTP");
        }
        if (isBlank(job.command())) throw new JobValidationException("command is required");
        if (isBlank(job.schedule())) throw new JobValidationException("schedule is required");

        Job out = defaults.applyTo(job.withName(job.name().trim()));

        if (out.execution() == ExecutionKind.HTTP) {
            requireHttpUrl(out.command(), "command");
            String method = isBlank(out.httpMethod()) ? HttpCommandRunner.DEFAULT_METHOD : upper(out.httpMethod());
            out = out.withHttp(method, out.httpHeaders(), out.httpBody());
        }

        if (out.hasCallback()) {
            requireHttpUrl(out.callbackUrl(), "callback url");
            String method = isBlank(out.callbackMethod()) ? CallbackNotifier.DEFAULT_METHOD : upper(out.callbackMethod());
            if (!CALLBACK_METHODS.contains(method)) {
                throw new JobValidationException("callback method must be GET or POST: " + out.callbackMethod());
            }
            CallbackTemplate.validate(out.callbackBodyTemplate());
            out = out.withCallback(out.callbackUrl().trim(), method, out.callbackHeaders(), out.callbackBodyTemplate());
        }

        if (out.recurrence() == RecurrenceKind.ONCE) {
            Instant at = RecurrenceRegistry.parseOnce(out.schedule());
            // a disabled one-shot may keep a past time, it is never armed
            if (out.enabled() && !at.isAfter(clock.now())) {
                throw new JobValidationException("schedule time is in the past: " + out.schedule());
            }
            out = out.withSchedule(RecurrenceKind.ONCE, out.schedule().trim()).withNextRunAt(at);
        } else {
            String expr = out.schedule().trim();
            try {
                cron.validate(expr);
                // parses but never matches, e.g. the 30th of February
                cron.next(clock.now(), expr, zone);
            } catch (RuntimeException e) {
                throw new JobValidationException("invalid cron expression '" + expr + "': " + e.getMessage(), e);
            }
            out = out.withSchedule(RecurrenceKind.CRON, expr).withNextRunAt(null);
        }
        return out;
    }

    private static void requireHttpUrl(String url, String what) {
        URI uri;
        try {
            uri = URI.create(url.trim());
        } catch (IllegalArgumentException e) {
            throw new JobValidationException("invalid " + what + ": " + url, e);
        }
        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https") || uri.getHost() == null) {
            throw new JobValidationException("invalid " + what + ", expected an http(s) url: " + url);
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    private static String upper(String s) {
        return s.trim().toUpperCase(Locale.ROOT);
    }
}
