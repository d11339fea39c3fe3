package io.syncbeat.internal.mongo;

import io.syncbeat.core.ScheduleStore;
import io.syncbeat.core.ScheduleStoreUnavailableException;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * MongoDB persistence layer for the schedule.
 *
 * <p>One document per job name in {@code schedule_entries}; writes are upserts by name, so concurrent
 * API writers simply overwrite each other (last write wins).
 */
public class MongoScheduleStore implements ScheduleStore {

    private final MongoTemplate mongoTemplate;
    private final Clock clock;

    public MongoScheduleStore(MongoTemplate mongoTemplate, Clock clock) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public void addOrReplace(String name, String serializedSpec) {
        requireName(name);
        Objects.requireNonNull(serializedSpec, "serializedSpec must not be null");

        Query q = new Query(Criteria.where("_id").is(name));
        Update u = new Update()
                .set("spec", serializedSpec)
                .set("updatedAt", clock.instant());
        try {
            mongoTemplate.upsert(q, u, ScheduleEntryDocument.class);
        } catch (DataAccessException e) {
            throw new ScheduleStoreUnavailableException("Failed to store schedule entry " + name, e);
        }
    }

    @Override
    public boolean remove(String name) {
        requireName(name);

        Query q = new Query(Criteria.where("_id").is(name));
        try {
            return mongoTemplate.remove(q, ScheduleEntryDocument.class).getDeletedCount() > 0;
        } catch (DataAccessException e) {
            throw new ScheduleStoreUnavailableException("Failed to remove schedule entry " + name, e);
        }
    }

    @Override
    public Map<String, String> listAll() {
        Query q = new Query().with(Sort.by(Sort.Order.asc("_id")));
        List<ScheduleEntryDocument> docs;
        try {
            docs = mongoTemplate.find(q, ScheduleEntryDocument.class);
        } catch (DataAccessException e) {
            throw new ScheduleStoreUnavailableException("Failed to read schedule entries", e);
        }

        Map<String, String> entries = new LinkedHashMap<>(docs.size());
        for (ScheduleEntryDocument d : docs) {
            if (d != null && d.getName() != null) {
                entries.put(d.getName(), d.getSpec());
            }
        }
        return entries;
    }

    private static void requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
    }
}
