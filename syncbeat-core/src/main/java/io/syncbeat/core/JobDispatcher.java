package io.syncbeat.core;

/**
 * Fire-and-forget handoff from the scheduler loop to job execution.
 */
public interface JobDispatcher {

    /**
     * Queue {@code invocation} for asynchronous execution. Never waits for the job to run.
     *
     * @return false if the invocation was not accepted (not started, queue full)
     */
    boolean submit(JobInvocation invocation);
}
