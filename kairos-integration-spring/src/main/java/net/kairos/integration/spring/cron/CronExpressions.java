package net.kairos.integration.spring.cron;

import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * cron-utils parsing with an LRU of compiled expressions.
 * Five fields read as classic Unix cron (minute precision); six fields carry a leading seconds field.
 */
public final class CronExpressions {
    private static final CronParser UNIX =
            new CronParser(CronDefinitionBuilder.instanceDefinitionFor(CronType.UNIX));
    private static final CronParser WITH_SECONDS =
            new CronParser(CronDefinitionBuilder.instanceDefinitionFor(CronType.SPRING));

    private static final Map<String, ExecutionTime> CACHE = new LruMap<>(256);

    private CronExpressions() {}

    /** @throws IllegalArgumentException when the expression does not parse */
    public static ExecutionTime compile(String cronExpr) {
        Objects.requireNonNull(cronExpr, "cronExpr");
        String expr = cronExpr.trim();
        synchronized (CACHE) {
            ExecutionTime cached = CACHE.get(expr);
            if (cached != null) return cached;
        }
        ExecutionTime et = ExecutionTime.forCron(parserFor(expr).parse(expr).validate());
        synchronized (CACHE) {
            CACHE.put(expr, et);
        }
        return et;
    }

    public static Instant next(String cronExpr, ZoneId zone, Instant from) {
        Objects.requireNonNull(zone); Objects.requireNonNull(from);
        ZonedDateTime base = from.atZone(zone);
        return compile(cronExpr).nextExecution(base)
                .orElseThrow(() -> new IllegalStateException("No next execution for [" + cronExpr + "] at " + base))
                .toInstant();
    }

    public static void invalidateAll() { synchronized (CACHE) { CACHE.clear(); } }

    private static CronParser parserFor(String expr) {
        int fields = expr.isEmpty() ? 0 : expr.split("\\s+").length;
        return switch (fields) {
            case 5 -> UNIX;
            case 6 -> WITH_SECONDS;
            default -> throw new IllegalArgumentException("expected 5 or 6 cron fields, got " + fields);
        };
    }

    private static final class LruMap<K, V> extends LinkedHashMap<K, V> {
        private final int max;
        LruMap(int max) { super(16, 0.75f, true); this.max = max; }
        @Override protected boolean removeEldestEntry(Map.Entry<K, V> eldest) { return size() > max; }
    }
}
