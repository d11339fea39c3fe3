package io.syncbeat;

import io.syncbeat.core.JobInvocation;
import io.syncbeat.core.JobResult;

public interface JobHandler {
    /**
     * Task identifier referenced by {@code JobSpec#task()}.
     */
    String name();

    JobResult execute(JobInvocation invocation) throws Exception;
}
