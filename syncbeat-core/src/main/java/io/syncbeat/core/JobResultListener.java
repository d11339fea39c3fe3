package io.syncbeat.core;

@FunctionalInterface
public interface JobResultListener {

    JobResultListener NOOP = (invocation, result) -> {
    };

    void onResult(JobInvocation invocation, JobResult result);
}
