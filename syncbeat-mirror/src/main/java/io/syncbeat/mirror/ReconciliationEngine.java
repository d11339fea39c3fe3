package io.syncbeat.mirror;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.transaction.support.TransactionOperations;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Makes a local table an exact mirror of a full remote snapshot.
 *
 * <p>Records present remotely but not locally are inserted, records present in both are overwritten,
 * and local records absent from the snapshot are deleted. All writes of one pass share one transaction.
 */
public class ReconciliationEngine {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationEngine.class);

    private final TransactionOperations transactions;
    private final boolean allowEmptySnapshot;
    private final Clock clock;

    public ReconciliationEngine(TransactionOperations transactions, boolean allowEmptySnapshot, Clock clock) {
        this.transactions = Objects.requireNonNull(transactions, "transactions must not be null");
        this.allowEmptySnapshot = allowEmptySnapshot;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Reconciles {@code store} against the complete remote snapshot {@code remoteRecords}.
     *
     * @throws ReconciliationException when any local write fails; nothing of this pass is kept
     */
    public <E extends MirroredRecord> ReconcileResult reconcile(String kind,
                                                                 Stream<Map<String, Object>> remoteRecords,
                                                                 MirrorStore<E> store,
                                                                 FieldMapper<E> mapper) {
        Objects.requireNonNull(remoteRecords, "remoteRecords must not be null");
        Objects.requireNonNull(store, "store must not be null");
        Objects.requireNonNull(mapper, "mapper must not be null");

        Map<Long, Map<String, Object>> snapshot = new LinkedHashMap<>();
        int[] skipped = {0};
        try (remoteRecords) {
            remoteRecords.forEach(record -> {
                Long remoteId = RemoteValues.remoteId(record);
                if (remoteId == null) {
                    skipped[0]++;
                    return;
                }
                snapshot.put(remoteId, record);
            });
        }
        if (skipped[0] > 0) {
            log.warn("Skipped remote records without id kind={} count={}", kind, skipped[0]);
        }

        if (snapshot.isEmpty() && !allowEmptySnapshot) {
            log.info("Empty remote snapshot, local table left untouched kind={}", kind);
            return ReconcileResult.emptySnapshot(skipped[0]);
        }

        ReconcileResult result;
        try {
            result = transactions.execute(status -> apply(snapshot, skipped[0], store, mapper));
        } catch (RuntimeException e) {
            log.error("Reconciliation rolled back kind={} error={}", kind, e.toString());
            throw new ReconciliationException(kind, e);
        }

        log.info("Reconciled kind={} inserted={} updated={} deleted={} total={}",
                kind, result.inserted(), result.updated(), result.deleted(), result.total());
        return result;
    }

    private <E extends MirroredRecord> ReconcileResult apply(Map<Long, Map<String, Object>> snapshot,
                                                             int skipped,
                                                             MirrorStore<E> store,
                                                             FieldMapper<E> mapper) {
        Map<Long, E> local = new HashMap<>();
        for (E existing : store.findAll()) {
            local.put(existing.getRemoteId(), existing);
        }

        Instant now = clock.instant();
        List<E> inserts = new ArrayList<>();
        List<E> updates = new ArrayList<>();

        for (Map.Entry<Long, Map<String, Object>> e : snapshot.entrySet()) {
            E target = local.remove(e.getKey());
            if (target == null) {
                target = mapper.create();
                target.setRemoteId(e.getKey());
                target.setCreatedAt(now);
                inserts.add(target);
            } else {
                updates.add(target);
            }
            mapper.apply(e.getValue(), target);
            target.setUpdatedAt(now);
        }

        if (!inserts.isEmpty()) {
            store.insertAll(inserts);
        }
        if (!updates.isEmpty()) {
            store.updateAll(updates);
        }
        // whatever is left locally was not in the snapshot
        int deleted = local.isEmpty() ? 0 : store.deleteByRemoteIds(local.keySet());

        return ReconcileResult.of(inserts.size(), updates.size(), deleted, snapshot.size(), skipped);
    }
}
