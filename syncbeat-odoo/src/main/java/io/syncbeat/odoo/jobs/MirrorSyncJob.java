package io.syncbeat.odoo.jobs;

import io.syncbeat.JobHandler;
import io.syncbeat.core.JobInvocation;
import io.syncbeat.core.JobResult;
import io.syncbeat.mirror.FieldMapper;
import io.syncbeat.mirror.MirrorStore;
import io.syncbeat.mirror.MirroredRecord;
import io.syncbeat.mirror.ReconcileResult;
import io.syncbeat.mirror.ReconciliationEngine;
import io.syncbeat.mirror.ReconciliationException;
import io.syncbeat.mirror.RemoteFetchException;
import io.syncbeat.mirror.RemoteQuery;
import io.syncbeat.mirror.RemoteSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Fetches one remote resource in full and reconciles a local table against it.
 */
public abstract class MirrorSyncJob<E extends MirroredRecord> implements JobHandler {

    private static final Logger log = LoggerFactory.getLogger(MirrorSyncJob.class);

    private final RemoteSource source;
    private final ReconciliationEngine engine;
    private final MirrorStore<E> store;
    private final FieldMapper<E> mapper;

    protected MirrorSyncJob(RemoteSource source, ReconciliationEngine engine,
                            MirrorStore<E> store, FieldMapper<E> mapper) {
        this.source = Objects.requireNonNull(source, "source must not be null");
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    /**
     * Plural noun used in logs and result messages, e.g. {@code contacts}.
     */
    protected abstract String kind();

    protected abstract RemoteQuery query();

    @Override
    public JobResult execute(JobInvocation invocation) {
        log.info("Starting {} sync from Odoo job={}", kind(), invocation.name());
        ReconcileResult result;
        try {
            result = engine.reconcile(kind(), source.fetchAll(query()), store, mapper);
        } catch (RemoteFetchException e) {
            log.error("{} fetch failed job={} error={}", kind(), invocation.name(), e.getMessage(), e);
            return JobResult.failure("Error syncing " + kind() + ": remote fetch failed");
        } catch (ReconciliationException e) {
            log.error("{} reconciliation failed job={} error={}", kind(), invocation.name(), e.getMessage(), e);
            return JobResult.failure("Error syncing " + kind() + ": reconciliation failed");
        }

        if (result.emptySnapshot()) {
            return JobResult.success("No " + kind() + " found in Odoo");
        }
        return JobResult.success("Synced " + result.total() + " " + kind() + " from Odoo", result.toDetails());
    }
}
