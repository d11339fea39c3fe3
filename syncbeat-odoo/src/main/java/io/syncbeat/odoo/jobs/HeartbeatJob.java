package io.syncbeat.odoo.jobs;

import io.syncbeat.JobHandler;
import io.syncbeat.core.JobInvocation;
import io.syncbeat.core.JobResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * No-op job proving the schedule, dispatch and worker path end to end.
 */
public class HeartbeatJob implements JobHandler {

    private static final Logger log = LoggerFactory.getLogger(HeartbeatJob.class);

    public static final String NAME = "heartbeat";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public JobResult execute(JobInvocation invocation) {
        log.info("Heartbeat job={} firedAt={}", invocation.name(), invocation.firedAt());
        return JobResult.success("Heartbeat ok", Map.of("firedAt", invocation.firedAt().toString()));
    }
}
