package io.syncbeat.internal;

import io.syncbeat.SyncScheduler;
import io.syncbeat.config.SchedulerProperties;
import io.syncbeat.core.JobSpec;
import io.syncbeat.core.JobSpecParseException;
import io.syncbeat.core.ScheduleStore;
import io.syncbeat.core.ScheduleSynchronizer;
import io.syncbeat.core.SyncWindow;
import io.syncbeat.utils.JobSpecCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Store-driven scheduler: a single driver thread ticks a {@link SchedulerLoop} at a fixed cadence.
 *
 * <p>The plan is re-read from the {@link ScheduleStore} at most once per sync interval, so schedule
 * changes made by any process take effect within {@code syncInterval + tickInterval} without a restart.
 *
 * <p>Typical usage:
 * <pre>{@code
 * scheduler.start();
 *
 * scheduler.addOrReplace(JobSpec.interval("contacts", "sync_contacts", 300));
 * scheduler.addOrReplace(JobSpec.crontab("nightly-invoices", "sync_invoices", "0", "2", null, null, null));
 *
 * scheduler.remove("contacts");
 * scheduler.stop();
 * }</pre>
 */
public class PollingSyncScheduler implements SyncScheduler {
    private static final Logger log = LoggerFactory.getLogger(PollingSyncScheduler.class);

    private final SchedulerProperties props;
    private final ScheduleStore store;
    private final QueueJobDispatcher dispatcher;
    private final JobSpecCodec codec;
    private final SchedulerLoop loop;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private Thread tickerThread;
    private int systemErrorCount = 0;

    public PollingSyncScheduler(SchedulerProperties props, ScheduleStore store, QueueJobDispatcher dispatcher,
                                JobSpecCodec codec, Clock clock) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher must not be null");
        this.codec = Objects.requireNonNull(codec, "codec must not be null");
        Objects.requireNonNull(clock, "clock must not be null");

        Duration syncInterval = Objects.requireNonNull(props.getSyncInterval(), "syncbeat.scheduler.syncInterval must not be null");
        ScheduleSynchronizer synchronizer = new ScheduleSynchronizer(codec, zone(props), new SyncWindow(syncInterval));
        this.loop = new SchedulerLoop(store, synchronizer, dispatcher, clock);
    }

    /**
     * Start ticking and executing due jobs. Idempotent.
     */
    @Override
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }

        Duration tick = Objects.requireNonNull(props.getTickInterval(), "syncbeat.scheduler.tickInterval must not be null");
        if (tick.isZero() || tick.isNegative()) {
            started.set(false);
            throw new IllegalArgumentException("syncbeat.scheduler.tickInterval must be a positive duration");
        }

        log.info("Scheduler starting with tickInterval={}, syncInterval={}, workerThreads={}, timezone={}",
                props.getTickInterval(),
                props.getSyncInterval(),
                props.getWorkerThreads(),
                props.getTimezone());

        dispatcher.start();

        tickerThread = new Thread(this::tickerLoop);
        tickerThread.setName("syncbeat.ticker");
        tickerThread.setDaemon(true);
        tickerThread.start();

        log.info("Scheduler started successfully.");
    }

    /**
     * Stop ticking, then drain running jobs. Idempotent.
     */
    @Override
    public void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }

        log.info("Scheduler stopping...");

        if (tickerThread != null) {
            tickerThread.interrupt();
            tickerThread = null;
        }

        dispatcher.stop();
        log.info("Scheduler stopped successfully.");
    }

    @Override
    public boolean isRunning() {
        return started.get();
    }

    @Override
    public void addOrReplace(JobSpec spec) {
        Objects.requireNonNull(spec, "spec must not be null");
        store.addOrReplace(spec.name(), codec.write(spec));
        log.info("Stored job name={} task={} timing={}", spec.name(), spec.task(), spec.timingKind());
    }

    @Override
    public boolean remove(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        boolean removed = store.remove(name);
        log.info("Removed job name={} existed={}", name, removed);
        return removed;
    }

    @Override
    public Map<String, JobSpec> listAll() {
        Map<String, JobSpec> specs = new LinkedHashMap<>();
        for (Map.Entry<String, String> e : store.listAll().entrySet()) {
            try {
                specs.put(e.getKey(), codec.parse(e.getKey(), e.getValue()));
            } catch (JobSpecParseException ex) {
                log.warn("Skipping unparsable job name={} msg={}", e.getKey(), ex.getMessage());
            }
        }
        return specs;
    }

    /**
     * The driven loop; {@link SchedulerLoop#plan()} exposes the live plan for diagnostics.
     */
    public SchedulerLoop loop() {
        return loop;
    }

    private void tickerLoop() {
        while (started.get()) {
            try {
                loop.tick();
                systemErrorCount = 0;
            } catch (Exception e) {
                systemErrorCount++;
                log.error("syncbeat tick failed msg={}", e.getMessage(), e);
                try {
                    Thread.sleep(backoff(systemErrorCount).toMillis());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    break;
                }
                continue;
            }

            try {
                Thread.sleep(props.getTickInterval().toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
    }

    // Exponential backoff for repeated tick failures.
    private Duration backoff(int failCount) {
        int exp = Math.max(0, Math.min(failCount, 15));
        long ms = Math.min(1000L * (1L << exp), 60_000L);
        return Duration.ofMillis(ms);
    }

    private static ZoneId zone(SchedulerProperties props) {
        try {
            return ZoneId.of(props.getTimezone() != null ? props.getTimezone() : "UTC");
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("syncbeat.scheduler.timezone is not a valid zone id: " + props.getTimezone(), e);
        }
    }
}
