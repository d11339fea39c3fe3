package io.syncbeat.core;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The scheduler's materialized view of a {@link JobSpec}.
 */
public record ExecutionPlanEntry(
        String name,
        String task,
        Timing timing,
        List<Object> args,
        Map<String, Object> kwargs,
        Map<String, Object> options,
        Instant lastRunAt
) {
    public ExecutionPlanEntry {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(task, "task must not be null");
        Objects.requireNonNull(timing, "timing must not be null");
        args = args == null ? List.of() : args;
        kwargs = kwargs == null ? Map.of() : kwargs;
        options = options == null ? Map.of() : options;
    }

    public static ExecutionPlanEntry of(JobSpec spec, Timing timing, Instant lastRunAt) {
        return new ExecutionPlanEntry(
                spec.name(),
                spec.task(),
                timing,
                spec.args(),
                spec.kwargs(),
                spec.options(),
                lastRunAt
        );
    }

    public boolean isDue(Instant now) {
        return timing.isDue(lastRunAt, now);
    }

    public ExecutionPlanEntry withLastRunAt(Instant runAt) {
        return new ExecutionPlanEntry(name, task, timing, args, kwargs, options, runAt);
    }

    public JobInvocation toInvocation(Instant firedAt) {
        return new JobInvocation(name, task, args, kwargs, options, firedAt);
    }
}
