package io.syncbeat.internal;

import io.syncbeat.JobHandler;
import io.syncbeat.core.JobDispatcher;
import io.syncbeat.core.JobHandlerRegistry;
import io.syncbeat.core.JobInvocation;
import io.syncbeat.core.JobResult;
import io.syncbeat.core.JobResultListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Queue-backed job executor.
 *
 * <p>The scheduler only offers {@link JobInvocation}s to a bounded queue. A dispatcher thread
 * drains the queue into a fixed worker pool, so job duration never delays the scheduler.
 *
 * <p>A job name that is still running is not started again; the overlapping invocation is dropped.
 * Every handler outcome, including exceptions, becomes a {@link JobResult} at this boundary.
 */
public class QueueJobDispatcher implements JobDispatcher {
    private static final Logger log = LoggerFactory.getLogger(QueueJobDispatcher.class);

    private final JobHandlerRegistry registry;
    private final int workerThreads;
    private final Duration shutdownTimeout;
    private final JobResultListener listener;

    private final BlockingQueue<JobInvocation> queue;
    private final Set<String> running = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean started = new AtomicBoolean(false);

    private ExecutorService workerPool;
    private Thread dispatcherThread;

    public QueueJobDispatcher(JobHandlerRegistry registry, int workerThreads, int queueCapacity,
                              Duration shutdownTimeout, JobResultListener listener) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        if (workerThreads <= 0) {
            throw new IllegalArgumentException("workerThreads must be positive");
        }
        if (queueCapacity <= 0) {
            throw new IllegalArgumentException("queueCapacity must be positive");
        }
        this.workerThreads = workerThreads;
        this.shutdownTimeout = Objects.requireNonNull(shutdownTimeout, "shutdownTimeout must not be null");
        this.listener = listener == null ? JobResultListener.NOOP : listener;
        this.queue = new ArrayBlockingQueue<>(queueCapacity);
    }

    /**
     * Start the dispatcher thread and worker pool. Idempotent.
     */
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }

        workerPool = Executors.newFixedThreadPool(workerThreads, r -> {
            Thread t = new Thread(r);
            t.setName("syncbeat.worker");
            t.setDaemon(true);
            return t;
        });

        dispatcherThread = new Thread(this::dispatchLoop);
        dispatcherThread.setName("syncbeat.dispatcher");
        dispatcherThread.setDaemon(true);
        dispatcherThread.start();

        log.info("Job dispatcher started workerThreads={} handlers={}", workerThreads, registry.taskNames());
    }

    /**
     * Stop taking invocations and wait up to the shutdown timeout for running jobs. Idempotent.
     */
    public void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }

        if (dispatcherThread != null) {
            dispatcherThread.interrupt();
            dispatcherThread = null;
        }

        if (workerPool != null) {
            workerPool.shutdown();
            try {
                if (!workerPool.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                    workerPool.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                workerPool.shutdownNow();
            } finally {
                workerPool = null;
            }
        }

        int dropped = queue.size();
        queue.clear();
        running.clear();
        log.info("Job dispatcher stopped droppedQueued={}", dropped);
    }

    @Override
    public boolean submit(JobInvocation invocation) {
        Objects.requireNonNull(invocation, "invocation must not be null");
        if (!started.get()) {
            log.warn("Dispatcher not started, rejecting job name={}", invocation.name());
            return false;
        }
        if (!queue.offer(invocation)) {
            log.warn("Dispatch queue full, rejecting job name={}", invocation.name());
            return false;
        }
        return true;
    }

    private void dispatchLoop() {
        while (started.get()) {
            try {
                JobInvocation invocation = queue.take();
                handOff(invocation);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (Exception e) {
                log.error("syncbeat dispatcher failed msg={}", e.getMessage(), e);
            }
        }
    }

    private void handOff(JobInvocation invocation) {
        String name = invocation.name();
        if (!running.add(name)) {
            log.warn("Job still running, skipping overlapping run name={} firedAt={}", name, invocation.firedAt());
            return;
        }
        try {
            workerPool.submit(() -> {
                try {
                    run(invocation);
                } finally {
                    running.remove(name);
                }
            });
        } catch (RejectedExecutionException e) {
            running.remove(name);
            log.warn("Worker pool rejected job name={} msg={}", name, e.getMessage());
        }
    }

    /**
     * Executes one invocation on the calling thread and reports its result.
     */
    JobResult run(JobInvocation invocation) {
        JobResult result;
        long startedAt = System.nanoTime();
        try {
            Optional<JobHandler> handler = registry.find(invocation.task());
            if (handler.isEmpty()) {
                result = JobResult.failure("Unknown task: " + invocation.task());
            } else {
                log.info("Job started name={} task={}", invocation.name(), invocation.task());
                result = handler.get().execute(invocation);
                if (result == null) {
                    result = JobResult.success(invocation.task() + " completed");
                }
            }
        } catch (Exception e) {
            log.error("Job failed name={} task={} msg={}", invocation.name(), invocation.task(), e.getMessage(), e);
            result = JobResult.failure("Error running " + invocation.task() + ": " + e.getMessage());
        }

        long tookMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAt);
        if (result.isSuccess()) {
            log.info("Job finished name={} status={} tookMs={} message={} details={}",
                    invocation.name(), result.status(), tookMs, result.message(), result.details());
        } else {
            log.warn("Job finished name={} status={} tookMs={} message={}",
                    invocation.name(), result.status(), tookMs, result.message());
        }

        try {
            listener.onResult(invocation, result);
        } catch (Exception e) {
            log.error("JobResultListener failed name={} msg={}", invocation.name(), e.getMessage(), e);
        }
        return result;
    }
}
