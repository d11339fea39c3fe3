package io.syncbeat.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable job definition as stored in the schedule store.
 * This is a pure data object with no persistence logic.
 *
 * <p>Only the timing fields of {@link #timingKind()} are meaningful: crontab jobs read the five
 * pattern fields, interval jobs read {@link #intervalSeconds()}.
 */
public record JobSpec(

        // identity
        String name,
        String task,

        // scheduling
        TimingKind timingKind,
        String minute,
        String hour,
        String dayOfWeek,
        String dayOfMonth,
        String monthOfYear,
        long intervalSeconds,

        // payload
        List<Object> args,
        Map<String, Object> kwargs,
        Map<String, Object> options
) {
    public static final String ANY = "*";
    public static final long DEFAULT_INTERVAL_SECONDS = 300;

    public JobSpec {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        if (task == null || task.isBlank()) {
            throw new IllegalArgumentException("task must not be blank");
        }
        timingKind = timingKind == null ? TimingKind.INTERVAL : timingKind;
        minute = orAny(minute);
        hour = orAny(hour);
        dayOfWeek = orAny(dayOfWeek);
        dayOfMonth = orAny(dayOfMonth);
        monthOfYear = orAny(monthOfYear);
        if (intervalSeconds <= 0) {
            throw new IllegalArgumentException("intervalSeconds must be positive: " + intervalSeconds);
        }
        args = args == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(args));
        kwargs = kwargs == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(kwargs));
        options = options == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(options));
    }

    /**
     * Fixed-period job running every {@code seconds}.
     */
    public static JobSpec interval(String name, String task, long seconds) {
        return new JobSpec(name, task, TimingKind.INTERVAL, null, null, null, null, null, seconds, null, null, null);
    }

    /**
     * Crontab job; {@code null} fields mean "any".
     */
    public static JobSpec crontab(String name, String task,
                                  String minute, String hour, String dayOfWeek, String dayOfMonth, String monthOfYear) {
        return new JobSpec(name, task, TimingKind.CRONTAB, minute, hour, dayOfWeek, dayOfMonth, monthOfYear,
                DEFAULT_INTERVAL_SECONDS, null, null, null);
    }

    /**
     * Crontab job from a five-part line: {@code minute hour day_of_month month_of_year day_of_week}.
     *
     * @throws IllegalArgumentException when {@code cron} does not have exactly five parts
     */
    public static JobSpec crontab(String name, String task, String cron) {
        if (cron == null || cron.isBlank()) {
            throw new IllegalArgumentException("cron must not be blank");
        }
        String[] parts = cron.trim().split("\\s+");
        if (parts.length != 5) {
            throw new IllegalArgumentException(
                    "Invalid cron format. Expected 5 parts: minute hour day_of_month month_of_year day_of_week, got '"
                            + cron + "'");
        }
        return crontab(name, task, parts[0], parts[1], parts[4], parts[2], parts[3]);
    }

    /**
     * Returns a copy carrying the given payload.
     */
    public JobSpec withPayload(List<Object> args, Map<String, Object> kwargs, Map<String, Object> options) {
        return new JobSpec(name, task, timingKind, minute, hour, dayOfWeek, dayOfMonth, monthOfYear,
                intervalSeconds, args, kwargs, options);
    }

    private static String orAny(String field) {
        if (field == null || field.isBlank()) {
            return ANY;
        }
        return field.trim();
    }
}
