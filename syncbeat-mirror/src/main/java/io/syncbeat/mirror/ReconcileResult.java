package io.syncbeat.mirror;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Counts of one reconciliation pass.
 *
 * @param total         distinct remote records in the snapshot
 * @param skipped       remote records dropped for lack of a usable id
 * @param emptySnapshot the snapshot was empty and nothing was written
 */
public record ReconcileResult(int inserted, int updated, int deleted, int total, int skipped,
                              boolean emptySnapshot) {

    public static ReconcileResult of(int inserted, int updated, int deleted, int total, int skipped) {
        return new ReconcileResult(inserted, updated, deleted, total, skipped, false);
    }

    public static ReconcileResult emptySnapshot(int skipped) {
        return new ReconcileResult(0, 0, 0, 0, skipped, true);
    }

    public Map<String, Object> toDetails() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("inserted", inserted);
        details.put("updated", updated);
        details.put("deleted", deleted);
        details.put("total", total);
        return details;
    }
}
