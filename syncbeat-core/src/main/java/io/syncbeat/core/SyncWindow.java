package io.syncbeat.core;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Throttle state of one {@link ScheduleSynchronizer}.
 */
public final class SyncWindow {

    public static final Duration DEFAULT_SYNC_INTERVAL = Duration.ofSeconds(10);

    private final Duration syncInterval;
    private Instant lastSyncAt;

    public SyncWindow(Duration syncInterval) {
        this.syncInterval = Objects.requireNonNull(syncInterval, "syncInterval must not be null");
        if (syncInterval.isNegative()) {
            throw new IllegalArgumentException("syncInterval must not be negative");
        }
    }

    /**
     * True when no sync happened yet or the last one is at least {@code syncInterval} old.
     */
    public boolean isOpen(Instant now) {
        return lastSyncAt == null || Duration.between(lastSyncAt, now).compareTo(syncInterval) >= 0;
    }

    public void markSynced(Instant now) {
        this.lastSyncAt = Objects.requireNonNull(now, "now must not be null");
    }

    public Instant lastSyncAt() {
        return lastSyncAt;
    }

    public Duration syncInterval() {
        return syncInterval;
    }
}
