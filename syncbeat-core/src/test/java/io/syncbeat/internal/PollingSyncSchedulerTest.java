package io.syncbeat.internal;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.syncbeat.JobHandler;
import io.syncbeat.config.SchedulerProperties;
import io.syncbeat.core.InMemoryScheduleStore;
import io.syncbeat.core.JobHandlerRegistry;
import io.syncbeat.core.JobInvocation;
import io.syncbeat.core.JobResult;
import io.syncbeat.core.JobSpec;
import io.syncbeat.utils.JobSpecCodec;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PollingSyncSchedulerTest {

    private final CountDownLatch heartbeats = new CountDownLatch(2);
    private InMemoryScheduleStore store;
    private PollingSyncScheduler scheduler;

    @BeforeEach
    void setUp() {
        store = new InMemoryScheduleStore();
        SchedulerProperties props = defaultProps();
        JobHandler heartbeat = new JobHandler() {
            @Override
            public String name() {
                return "heartbeat";
            }

            @Override
            public JobResult execute(JobInvocation invocation) {
                heartbeats.countDown();
                return JobResult.success("alive");
            }
        };
        QueueJobDispatcher dispatcher = new QueueJobDispatcher(new JobHandlerRegistry(List.of(heartbeat)),
                props.getWorkerThreads(), props.getQueueCapacity(), props.getShutdownTimeout(), null);
        scheduler = new PollingSyncScheduler(props, store, dispatcher, new JobSpecCodec(new ObjectMapper()),
                Clock.systemUTC());
    }

    @AfterEach
    void tearDown() {
        scheduler.stop();
    }

    @Test
    void jobAddedAtRuntimeShouldBePickedUpWithoutRestart() throws Exception {
        scheduler.start();
        Thread.sleep(150);

        scheduler.addOrReplace(JobSpec.interval("ping", "heartbeat", 1));

        assertTrue(heartbeats.await(5, TimeUnit.SECONDS));
        assertThat(scheduler.loop().plan()).containsKey("ping");
    }

    @Test
    void listAllShouldSkipUnparsableEntries() {
        scheduler.addOrReplace(JobSpec.interval("ping", "heartbeat", 30));
        store.addOrReplace("broken", "{");

        assertThat(scheduler.listAll()).containsOnlyKeys("ping");
        assertThat(scheduler.remove("ping")).isTrue();
        assertThat(scheduler.remove("ping")).isFalse();
        assertThat(scheduler.listAll()).isEmpty();
    }

    @Test
    void startShouldRejectNonPositiveTickInterval() {
        SchedulerProperties props = defaultProps();
        props.setTickInterval(Duration.ZERO);
        QueueJobDispatcher dispatcher = new QueueJobDispatcher(new JobHandlerRegistry(List.of()), 1, 1,
                Duration.ofSeconds(1), null);
        PollingSyncScheduler invalid = new PollingSyncScheduler(props, store, dispatcher,
                new JobSpecCodec(new ObjectMapper()), Clock.systemUTC());

        assertThatThrownBy(invalid::start).isInstanceOf(IllegalArgumentException.class);
        assertThat(invalid.isRunning()).isFalse();
    }

    @Test
    void isRunningShouldFollowStartAndStop() {
        assertThat(scheduler.isRunning()).isFalse();

        scheduler.start();
        assertThat(scheduler.isRunning()).isTrue();

        scheduler.stop();
        assertThat(scheduler.isRunning()).isFalse();
    }

    private static SchedulerProperties defaultProps() {
        SchedulerProperties props = new SchedulerProperties();
        props.setTickInterval(Duration.ofMillis(50));
        props.setSyncInterval(Duration.ofMillis(100));
        props.setWorkerThreads(1);
        props.setQueueCapacity(10);
        props.setShutdownTimeout(Duration.ofSeconds(2));
        return props;
    }
}
