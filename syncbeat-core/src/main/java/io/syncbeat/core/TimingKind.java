package io.syncbeat.core;

import java.time.Duration;
import java.time.ZoneId;
import java.util.Locale;

public enum TimingKind {
    CRONTAB("crontab") {
        @Override
        public Timing timingFor(JobSpec spec, ZoneId zone) {
            return CrontabTiming.of(
                    spec.minute(),
                    spec.hour(),
                    spec.dayOfWeek(),
                    spec.dayOfMonth(),
                    spec.monthOfYear(),
                    zone
            );
        }
    },
    INTERVAL("interval") {
        @Override
        public Timing timingFor(JobSpec spec, ZoneId zone) {
            return new IntervalTiming(Duration.ofSeconds(spec.intervalSeconds()));
        }
    };

    private final String wireName;

    TimingKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Builds the next-fire predicate for {@code spec}.
     *
     * @throws JobSpecParseException when the timing fields cannot be compiled
     */
    public abstract Timing timingFor(JobSpec spec, ZoneId zone);

    /**
     * Anything other than {@code crontab} (including null) is treated as an interval schedule.
     */
    public static TimingKind fromWireName(String value) {
        if (value != null && CRONTAB.wireName.equals(value.trim().toLowerCase(Locale.ROOT))) {
            return CRONTAB;
        }
        return INTERVAL;
    }
}
