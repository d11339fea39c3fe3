package io.syncbeat.core;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Fixed-period timer. An entry that never ran is due immediately.
 */
public record IntervalTiming(Duration period) implements Timing {

    public IntervalTiming {
        Objects.requireNonNull(period, "period must not be null");
        if (period.isZero() || period.isNegative()) {
            throw new IllegalArgumentException("period must be a positive duration");
        }
    }

    @Override
    public boolean isDue(Instant lastRunAt, Instant now) {
        if (lastRunAt == null) {
            return true;
        }
        return Duration.between(lastRunAt, now).compareTo(period) >= 0;
    }
}
