package net.kairos.core.service;

import net.kairos.core.model.ExecutionLog;
import net.kairos.core.model.Job;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Literal {@code ${name}} substitution for callback bodies. No escaping is applied:
 * a value containing quotes ends up in the body as-is.
 */
public final class CallbackTemplate {
    public static final List<String> SUPPORTED = List.of(
            "task_id", "name", "status", "output", "error", "start_time", "end_time", "duration");

    private static final Pattern PLACEHOLDER = Pattern.compile("\\$\\{([^}]+)}");

    private CallbackTemplate() {}

    /** @throws JobValidationException on the first unsupported placeholder */
    public static void validate(String template) {
        if (template == null || template.isEmpty()) return;
        Matcher m = PLACEHOLDER.matcher(template);
        while (m.find()) {
            if (!SUPPORTED.contains(m.group(1))) {
                throw new JobValidationException("unsupported callback placeholder: " + m.group());
            }
        }
    }

    public static String render(String template, Job job, ExecutionLog log) {
        if (template == null || template.isEmpty()) return "";
        String out = template;
        for (Map.Entry<String, String> e : values(job, log).entrySet()) {
            out = out.replace("${" + e.getKey() + "}", e.getValue());
        }
        return out;
    }

    static Map<String, String> values(Job job, ExecutionLog log) {
        Map<String, String> v = new LinkedHashMap<>();
        v.put("task_id", text(job.id()));
        v.put("name", text(job.name()));
        v.put("status", log.status() == null ? "" : String.valueOf(log.status().code()));
        v.put("output", text(log.output()));
        v.put("error", text(log.error()));
        v.put("start_time", time(log.startedAt()));
        v.put("end_time", time(log.endedAt()));
        v.put("duration", String.valueOf(log.durationSeconds()));
        return v;
    }

    private static String text(Object o) {
        return o == null ? "" : o.toString();
    }

    private static String time(Instant t) {
        return t == null ? "" : t.toString();
    }
}
