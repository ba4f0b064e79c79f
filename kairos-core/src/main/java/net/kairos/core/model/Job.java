package net.kairos.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record Job(
        Long id,
        String name,
        RecurrenceKind recurrence,
        String schedule,            // cron expression, or an ISO-8601 offset timestamp for ONCE
        ExecutionKind execution,
        String command,             // shell text, or the target URL for HTTP
        String httpMethod,
        Map<String, String> httpHeaders,
        String httpBody,
        boolean enabled,
        Instant lastRunAt,
        Instant nextRunAt,
        int timeoutSeconds,
        int retryTimes,
        int retryDelaySeconds,
        String description,
        String callbackUrl,
        String callbackMethod,
        Map<String, String> callbackHeaders,
        String callbackBodyTemplate,
        Instant createdAt,
        Instant updatedAt
) {
    public Job {
        httpHeaders = copyOf(httpHeaders);
        callbackHeaders = copyOf(callbackHeaders);
    }

    public static Job ofNew(String name, RecurrenceKind recurrence, String schedule,
                            ExecutionKind execution, String command) {
        return new Job(null, name, recurrence, schedule, execution, command,
                null, Map.of(), null, true, null, null,
                JobDefaults.STANDARD.timeoutSeconds(),
                JobDefaults.STANDARD.retryTimes(),
                JobDefaults.STANDARD.retryDelaySeconds(),
                null, null, null, Map.of(), null, null, null);
    }

    public boolean hasCallback() {
        return callbackUrl != null && !callbackUrl.isBlank();
    }

    public Job withId(Long id) {
        return new Job(id, name, recurrence, schedule, execution, command, httpMethod, httpHeaders, httpBody,
                enabled, lastRunAt, nextRunAt, timeoutSeconds, retryTimes, retryDelaySeconds, description,
                callbackUrl, callbackMethod, callbackHeaders, callbackBodyTemplate, createdAt, updatedAt);
    }

    public Job withName(String name) {
        return new Job(id, name, recurrence, schedule, execution, command, httpMethod, httpHeaders, httpBody,
                enabled, lastRunAt, nextRunAt, timeoutSeconds, retryTimes, retryDelaySeconds, description,
                callbackUrl, callbackMethod, callbackHeaders, callbackBodyTemplate, createdAt, updatedAt);
    }

    public Job withSchedule(RecurrenceKind recurrence, String schedule) {
        return new Job(id, name, recurrence, schedule, execution, command, httpMethod, httpHeaders, httpBody,
                enabled, lastRunAt, nextRunAt, timeoutSeconds, retryTimes, retryDelaySeconds, description,
                callbackUrl, callbackMethod, callbackHeaders, callbackBodyTemplate, createdAt, updatedAt);
    }

    public Job withCommand(ExecutionKind execution, String command) {
        return new Job(id, name, recurrence, schedule, execution, command, httpMethod, httpHeaders, httpBody,
                enabled, lastRunAt, nextRunAt, timeoutSeconds, retryTimes, retryDelaySeconds, description,
                callbackUrl, callbackMethod, callbackHeaders, callbackBodyTemplate, createdAt, updatedAt);
    }

    public Job withHttp(String httpMethod, Map<String, String> httpHeaders, String httpBody) {
        return new Job(id, name, recurrence, schedule, execution, command, httpMethod, httpHeaders, httpBody,
                enabled, lastRunAt, nextRunAt, timeoutSeconds, retryTimes, retryDelaySeconds, description,
                callbackUrl, callbackMethod, callbackHeaders, callbackBodyTemplate, createdAt, updatedAt);
    }

    public Job withEnabled(boolean enabled) {
        return new Job(id, name, recurrence, schedule, execution, command, httpMethod, httpHeaders, httpBody,
                enabled, lastRunAt, nextRunAt, timeoutSeconds, retryTimes, retryDelaySeconds, description,
                callbackUrl, callbackMethod, callbackHeaders, callbackBodyTemplate, createdAt, updatedAt);
    }

    public Job withLastRunAt(Instant lastRunAt) {
        return new Job(id, name, recurrence, schedule, execution, command, httpMethod, httpHeaders, httpBody,
                enabled, lastRunAt, nextRunAt, timeoutSeconds, retryTimes, retryDelaySeconds, description,
                callbackUrl, callbackMethod, callbackHeaders, callbackBodyTemplate, createdAt, updatedAt);
    }

    public Job withNextRunAt(Instant nextRunAt) {
        return new Job(id, name, recurrence, schedule, execution, command, httpMethod, httpHeaders, httpBody,
                enabled, lastRunAt, nextRunAt, timeoutSeconds, retryTimes, retryDelaySeconds, description,
                callbackUrl, callbackMethod, callbackHeaders, callbackBodyTemplate, createdAt, updatedAt);
    }

    public Job withTimeout(int timeoutSeconds) {
        return new Job(id, name, recurrence, schedule, execution, command, httpMethod, httpHeaders, httpBody,
                enabled, lastRunAt, nextRunAt, timeoutSeconds, retryTimes, retryDelaySeconds, description,
                callbackUrl, callbackMethod, callbackHeaders, callbackBodyTemplate, createdAt, updatedAt);
    }

    public Job withRetry(int retryTimes, int retryDelaySeconds) {
        return new Job(id, name, recurrence, schedule, execution, command, httpMethod, httpHeaders, httpBody,
                enabled, lastRunAt, nextRunAt, timeoutSeconds, retryTimes, retryDelaySeconds, description,
                callbackUrl, callbackMethod, callbackHeaders, callbackBodyTemplate, createdAt, updatedAt);
    }

    public Job withDescription(String description) {
        return new Job(id, name, recurrence, schedule, execution, command, httpMethod, httpHeaders, httpBody,
                enabled, lastRunAt, nextRunAt, timeoutSeconds, retryTimes, retryDelaySeconds, description,
                callbackUrl, callbackMethod, callbackHeaders, callbackBodyTemplate, createdAt, updatedAt);
    }

    public Job withCallback(String callbackUrl, String callbackMethod,
                            Map<String, String> callbackHeaders, String callbackBodyTemplate) {
        return new Job(id, name, recurrence, schedule, execution, command, httpMethod, httpHeaders, httpBody,
                enabled, lastRunAt, nextRunAt, timeoutSeconds, retryTimes, retryDelaySeconds, description,
                callbackUrl, callbackMethod, callbackHeaders, callbackBodyTemplate, createdAt, updatedAt);
    }

    public Job withTimestamps(Instant createdAt, Instant updatedAt) {
        return new Job(id, name, recurrence, schedule, execution, command, httpMethod, httpHeaders, httpBody,
                enabled, lastRunAt, nextRunAt, timeoutSeconds, retryTimes, retryDelaySeconds, description,
                callbackUrl, callbackMethod, callbackHeaders, callbackBodyTemplate, createdAt, updatedAt);
    }

    private static Map<String, String> copyOf(Map<String, String> m) {
        if (m == null || m.isEmpty()) return Map.of();
        return Collections.unmodifiableMap(new LinkedHashMap<>(m));
    }
}
