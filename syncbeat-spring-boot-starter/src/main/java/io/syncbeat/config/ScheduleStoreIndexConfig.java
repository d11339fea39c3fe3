package io.syncbeat.config;

import io.syncbeat.internal.mongo.ScheduleEntryDocument;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;

/**
 * MongoDB index definitions for the schedule store.
 *
 * <p>Entries are keyed by job name in {@code _id}, so reads and upserts need no extra index.
 * Indexes are not created at startup unless {@code syncbeat.scheduler.ensure-indexes-on-startup=true};
 * in production they are usually managed by migration scripts.
 *
 * <h3>Indexes (collection: {@code schedule_entries})</h3>
 * <ul>
 *   <li><b>idx_updated_at</b>: { updatedAt: -1 }
 *       <br/>Used when auditing recent schedule changes.</li>
 * </ul>
 *
 * <h3>Example mongosh script</h3>
 * <pre>
 * db.schedule_entries.createIndex({ updatedAt: -1 }, { name: "idx_updated_at" });
 * </pre>
 */
public class ScheduleStoreIndexConfig {

    public static final String IDX_UPDATED_AT = "idx_updated_at";

    private final MongoTemplate mongoTemplate;

    public ScheduleStoreIndexConfig(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    public void ensureIndexes() {
        mongoTemplate.indexOps(ScheduleEntryDocument.class).ensureIndex(updatedAtIndex());
    }

    public static Index updatedAtIndex() {
        return new Index()
                .on("updatedAt", Sort.Direction.DESC)
                .named(IDX_UPDATED_AT);
    }
}
