package io.syncbeat.core;

import io.syncbeat.utils.JobSpecCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.ZoneId;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Reconciles the scheduler's execution plan against the schedule store.
 *
 * <p>Each sync reads the full store, drops plan entries whose name is gone, and rebuilds every
 * stored entry from its spec. Rebuilt entries replace the previous ones wholesale; only the
 * runtime {@code lastRunAt} of a surviving name is carried over.
 *
 * <p>Failure semantics:
 * <ul>
 *   <li>store unavailable: the plan is returned untouched and the window is not advanced,
 *       so the next call retries</li>
 *   <li>unparsable entry: logged and skipped; a previous version of that entry stays in the plan</li>
 * </ul>
 */
public class ScheduleSynchronizer {
    private static final Logger log = LoggerFactory.getLogger(ScheduleSynchronizer.class);

    private final JobSpecCodec codec;
    private final ZoneId zone;
    private final SyncWindow window;

    public ScheduleSynchronizer(JobSpecCodec codec, ZoneId zone, SyncWindow window) {
        this.codec = Objects.requireNonNull(codec, "codec must not be null");
        this.zone = Objects.requireNonNull(zone, "zone must not be null");
        this.window = Objects.requireNonNull(window, "window must not be null");
    }

    /**
     * @return the next plan; the same instance when the sync was throttled or the store was unavailable
     */
    public Map<String, ExecutionPlanEntry> synchronize(ScheduleStore store,
                                                       Map<String, ExecutionPlanEntry> plan,
                                                       Instant now) {
        Objects.requireNonNull(store, "store must not be null");
        Objects.requireNonNull(plan, "plan must not be null");
        Objects.requireNonNull(now, "now must not be null");

        if (!window.isOpen(now)) {
            return plan;
        }

        log.debug("Syncing schedule from store lastSyncAt={}", window.lastSyncAt());

        Map<String, String> stored;
        try {
            stored = store.listAll();
        } catch (ScheduleStoreUnavailableException e) {
            log.warn("Schedule store unavailable, keeping current plan msg={}", e.getMessage());
            return plan;
        }

        Map<String, ExecutionPlanEntry> next = new LinkedHashMap<>(plan);

        for (String name : plan.keySet()) {
            if (!stored.containsKey(name)) {
                log.info("Removing job from plan name={}", name);
                next.remove(name);
            }
        }

        int failed = 0;
        for (Map.Entry<String, String> e : stored.entrySet()) {
            String name = e.getKey();
            try {
                JobSpec spec = codec.parse(name, e.getValue());
                Timing timing = spec.timingKind().timingFor(spec, zone);
                ExecutionPlanEntry previous = plan.get(name);
                next.put(name, ExecutionPlanEntry.of(spec, timing, previous == null ? null : previous.lastRunAt()));
                log.debug("Added/updated job name={} task={} timing={}", name, spec.task(), timing);
            } catch (JobSpecParseException ex) {
                failed++;
                log.error("Failed to parse job spec name={} msg={}", name, ex.getMessage());
            }
        }

        window.markSynced(now);
        log.info("Schedule synced active={} failed={}", next.keySet(), failed);
        return next;
    }

    public SyncWindow window() {
        return window;
    }
}
