package io.syncbeat.internal;

import io.syncbeat.core.ExecutionPlanEntry;
import io.syncbeat.core.JobDispatcher;
import io.syncbeat.core.ScheduleStore;
import io.syncbeat.core.ScheduleSynchronizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One scheduler step: resync the plan (throttled by the synchronizer) and dispatch every due entry.
 *
 * <p>Owns the execution plan. Not thread-safe: {@link #tick()} must be called serially by a single driver.
 */
public class SchedulerLoop {
    private static final Logger log = LoggerFactory.getLogger(SchedulerLoop.class);

    private final ScheduleStore store;
    private final ScheduleSynchronizer synchronizer;
    private final JobDispatcher dispatcher;
    private final Clock clock;

    private Map<String, ExecutionPlanEntry> plan = new LinkedHashMap<>();

    public SchedulerLoop(ScheduleStore store, ScheduleSynchronizer synchronizer, JobDispatcher dispatcher, Clock clock) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.synchronizer = Objects.requireNonNull(synchronizer, "synchronizer must not be null");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * @return number of entries dispatched during this tick
     */
    public int tick() {
        Instant now = clock.instant();
        Map<String, ExecutionPlanEntry> synced = synchronizer.synchronize(store, plan, now);
        if (synced != plan) {
            plan = new LinkedHashMap<>(synced);
        }

        int dispatched = 0;
        for (ExecutionPlanEntry entry : new ArrayList<>(plan.values())) {
            boolean due;
            try {
                due = entry.isDue(now);
            } catch (RuntimeException e) {
                log.error("Failed to evaluate timing, skipping name={} timing={} msg={}",
                        entry.name(), entry.timing(), e.getMessage(), e);
                continue;
            }
            if (!due) {
                continue;
            }
            if (dispatcher.submit(entry.toInvocation(now))) {
                plan.put(entry.name(), entry.withLastRunAt(now));
                dispatched++;
                log.debug("Dispatched job name={} task={} at={}", entry.name(), entry.task(), now);
            } else {
                log.warn("Dispatch rejected, will retry next tick name={} task={}", entry.name(), entry.task());
            }
        }
        return dispatched;
    }

    /**
     * Read-only view of the current plan.
     */
    public Map<String, ExecutionPlanEntry> plan() {
        return Collections.unmodifiableMap(plan);
    }
}
