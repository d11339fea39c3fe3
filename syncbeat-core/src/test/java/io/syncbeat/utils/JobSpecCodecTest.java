package io.syncbeat.utils;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.syncbeat.core.JobSpec;
import io.syncbeat.core.JobSpecParseException;
import io.syncbeat.core.TimingKind;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JobSpecCodecTest {

    private final JobSpecCodec codec = new JobSpecCodec(new ObjectMapper());

    @Test
    void parseShouldApplyIntervalDefaults() {
        JobSpec spec = codec.parse("contacts", "{\"task\":\"sync_contacts\"}");

        assertThat(spec.name()).isEqualTo("contacts");
        assertThat(spec.task()).isEqualTo("sync_contacts");
        assertThat(spec.timingKind()).isEqualTo(TimingKind.INTERVAL);
        assertThat(spec.intervalSeconds()).isEqualTo(300);
        assertThat(spec.args()).isEmpty();
        assertThat(spec.kwargs()).isEmpty();
        assertThat(spec.options()).isEmpty();
    }

    @Test
    void parseShouldReadCrontabFieldsAndDefaultMissingOnesToAny() {
        JobSpec spec = codec.parse("nightly", """
                {"task":"sync_invoices","schedule_type":"crontab","minute":0,"hour":"2",
                 "args":[1,"x"],"kwargs":{"full":true},"options":{"queue":"sync"}}
                """);

        assertThat(spec.timingKind()).isEqualTo(TimingKind.CRONTAB);
        assertThat(spec.minute()).isEqualTo("0");
        assertThat(spec.hour()).isEqualTo("2");
        assertThat(spec.dayOfWeek()).isEqualTo("*");
        assertThat(spec.dayOfMonth()).isEqualTo("*");
        assertThat(spec.monthOfYear()).isEqualTo("*");
        assertThat(spec.args()).containsExactly(1, "x");
        assertThat(spec.kwargs()).containsEntry("full", true);
        assertThat(spec.options()).containsEntry("queue", "sync");
    }

    @Test
    void unknownScheduleTypeShouldFallBackToInterval() {
        JobSpec spec = codec.parse("j", "{\"task\":\"t\",\"schedule_type\":\"solar\",\"interval_seconds\":42}");

        assertThat(spec.timingKind()).isEqualTo(TimingKind.INTERVAL);
        assertThat(spec.intervalSeconds()).isEqualTo(42);
    }

    @Test
    void parseShouldRejectBrokenEntries() {
        assertThatThrownBy(() -> codec.parse("j", "{not json"))
                .isInstanceOf(JobSpecParseException.class)
                .hasMessageContaining("job 'j'");
        assertThatThrownBy(() -> codec.parse("j", "[]")).isInstanceOf(JobSpecParseException.class);
        assertThatThrownBy(() -> codec.parse("j", "{\"schedule_type\":\"interval\"}"))
                .isInstanceOf(JobSpecParseException.class)
                .hasMessageContaining("task");
        assertThatThrownBy(() -> codec.parse("j", "{\"task\":\"t\",\"interval_seconds\":0}"))
                .isInstanceOf(JobSpecParseException.class);
        assertThatThrownBy(() -> codec.parse("j", "{\"task\":\"t\",\"args\":{\"a\":1}}"))
                .isInstanceOf(JobSpecParseException.class);
    }

    @Test
    void writeShouldProduceWhatParseReads() {
        JobSpec spec = JobSpec.crontab("weekday", "sync_contacts", "*/15", "8-18", "1-5", null, null)
                .withPayload(List.of("a"), Map.of("limit", 10), Map.of());

        JobSpec parsed = codec.parse("weekday", codec.write(spec));

        assertThat(parsed).isEqualTo(spec);
    }
}
