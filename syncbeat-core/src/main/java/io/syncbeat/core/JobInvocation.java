package io.syncbeat.core;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Task descriptor handed from the scheduler loop to the worker side.
 *
 * @param name    plan entry (job) name
 * @param task    handler identifier
 * @param firedAt scheduler time of the tick that dispatched it
 */
public record JobInvocation(
        String name,
        String task,
        List<Object> args,
        Map<String, Object> kwargs,
        Map<String, Object> options,
        Instant firedAt
) {
    public JobInvocation {
        args = args == null ? List.of() : args;
        kwargs = kwargs == null ? Map.of() : kwargs;
        options = options == null ? Map.of() : options;
    }
}
