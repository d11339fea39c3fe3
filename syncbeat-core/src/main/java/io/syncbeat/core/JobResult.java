package io.syncbeat.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Structured outcome of one job execution.
 *
 * status  : SUCCESS or ERROR
 * message : human readable summary, never a stack trace
 * details : job specific counters (e.g. inserted / updated / deleted / total)
 */
public record JobResult(
        Status status,
        String message,
        Map<String, Object> details
) {
    public enum Status {
        SUCCESS,
        ERROR
    }

    public JobResult {
        details = details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public static JobResult success(String message) {
        return new JobResult(Status.SUCCESS, message, Map.of());
    }

    public static JobResult success(String message, Map<String, Object> details) {
        return new JobResult(Status.SUCCESS, message, details);
    }

    public static JobResult failure(String message) {
        return new JobResult(Status.ERROR, message, Map.of());
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }
}
