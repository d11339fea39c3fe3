package io.syncbeat;

import io.syncbeat.core.JobSpec;

import java.util.Map;

/**
 * Main scheduler API.
 *
 * <p>The schedule lives in a shared store, not in this process: {@link #addOrReplace(JobSpec)} and
 * {@link #remove(String)} write to the store and any running scheduler (this one or another
 * process) picks the change up on its next sync. Removing an entry is the only way to stop a job.
 */
public interface SyncScheduler {
    void start();

    void stop();

    /**
     * @return true between a successful {@link #start()} and the next {@link #stop()}
     */
    boolean isRunning();

    /**
     * Store {@code spec} under its name, replacing any previous entry.
     */
    void addOrReplace(JobSpec spec);

    /**
     * @return true if an entry was removed
     */
    boolean remove(String name);

    /**
     * All stored entries that parse; unparsable ones are skipped.
     */
    Map<String, JobSpec> listAll();
}
