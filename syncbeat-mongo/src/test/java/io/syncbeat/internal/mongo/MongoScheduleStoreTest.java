package io.syncbeat.internal.mongo;

import io.syncbeat.core.ScheduleStoreUnavailableException;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Clock;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class MongoScheduleStoreTest {

    private final MongoTemplate mongoTemplate = mock(MongoTemplate.class);
    private final MongoScheduleStore store = new MongoScheduleStore(mongoTemplate, Clock.systemUTC());

    @Test
    void readFailureShouldSurfaceAsStoreUnavailable() {
        when(mongoTemplate.find(any(Query.class), eq(ScheduleEntryDocument.class)))
                .thenThrow(new DataAccessResourceFailureException("timeout"));

        assertThatThrownBy(store::listAll)
                .isInstanceOf(ScheduleStoreUnavailableException.class)
                .hasCauseInstanceOf(DataAccessResourceFailureException.class);
    }

    @Test
    void writeFailureShouldSurfaceAsStoreUnavailable() {
        when(mongoTemplate.upsert(any(Query.class), any(Update.class), eq(ScheduleEntryDocument.class)))
                .thenThrow(new DataAccessResourceFailureException("not primary"));

        assertThatThrownBy(() -> store.addOrReplace("contacts", "{}"))
                .isInstanceOf(ScheduleStoreUnavailableException.class);
    }

    @Test
    void blankNameShouldBeRejected() {
        assertThatThrownBy(() -> store.addOrReplace(" ", "{}")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> store.remove(null)).isInstanceOf(IllegalArgumentException.class);
    }
}
