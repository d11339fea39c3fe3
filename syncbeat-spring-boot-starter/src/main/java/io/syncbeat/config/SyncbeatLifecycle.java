package io.syncbeat.config;

import io.syncbeat.SyncScheduler;
import org.springframework.context.SmartLifecycle;

import java.util.Objects;

/**
 * Runs the scheduler with the Spring container: started after every other lifecycle bean,
 * stopped before them. Running state is read from the scheduler itself.
 */
public class SyncbeatLifecycle implements SmartLifecycle {
    private final SyncScheduler scheduler;

    public SyncbeatLifecycle(SyncScheduler scheduler) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
    }

    @Override
    public void start() {
        if (!scheduler.isRunning()) {
            scheduler.start();
        }
    }

    @Override
    public void stop() {
        if (scheduler.isRunning()) {
            scheduler.stop();
        }
    }

    @Override
    public boolean isRunning() {
        return scheduler.isRunning();
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }
}
