package io.syncbeat.internal.mongo;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Mongo document model for one schedule store entry. The job name is the document id.
 */
@Document(collection = ScheduleEntryDocument.COLLECTION)
public class ScheduleEntryDocument {

    public static final String COLLECTION = "schedule_entries";

    @Id
    private String name;

    // serialized JobSpec, kept verbatim so a broken entry stays visible instead of failing the whole read
    private String spec;

    private Instant updatedAt;

    public ScheduleEntryDocument() {
    }

    public ScheduleEntryDocument(String name, String spec, Instant updatedAt) {
        this.name = name;
        this.spec = spec;
        this.updatedAt = updatedAt;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getSpec() {
        return spec;
    }

    public void setSpec(String spec) {
        this.spec = spec;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }
}
