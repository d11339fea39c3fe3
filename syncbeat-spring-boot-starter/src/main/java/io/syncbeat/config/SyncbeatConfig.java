package io.syncbeat.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.syncbeat.JobHandler;
import io.syncbeat.SyncScheduler;
import io.syncbeat.core.JobHandlerRegistry;
import io.syncbeat.core.JobResultListener;
import io.syncbeat.core.ScheduleStore;
import io.syncbeat.internal.PollingSyncScheduler;
import io.syncbeat.internal.QueueJobDispatcher;
import io.syncbeat.internal.mongo.MongoScheduleStore;
import io.syncbeat.odoo.jobs.HeartbeatJob;
import io.syncbeat.utils.JobSpecCodec;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.time.Clock;
import java.util.List;

/**
 * Spring Boot auto-configuration entrypoint for the scheduler.
 */
@AutoConfiguration
@ConditionalOnClass({SyncScheduler.class, MongoTemplate.class})
@EnableConfigurationProperties(SchedulerProperties.class)
@ConditionalOnProperty(prefix = "syncbeat.scheduler", name = "enabled", havingValue = "true", matchIfMissing = true)
public class SyncbeatConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock syncbeatClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public JobSpecCodec jobSpecCodec(ObjectProvider<ObjectMapper> objectMapper) {
        return new JobSpecCodec(objectMapper.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    @ConditionalOnMissingBean
    public ScheduleStore scheduleStore(MongoTemplate mongoTemplate, Clock clock) {
        return new MongoScheduleStore(mongoTemplate, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    protected ScheduleStoreIndexConfig scheduleStoreIndexConfig(MongoTemplate mongoTemplate) {
        return new ScheduleStoreIndexConfig(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean(name = "heartbeatJob")
    public HeartbeatJob heartbeatJob() {
        return new HeartbeatJob();
    }

    @Bean
    @ConditionalOnMissingBean
    public JobHandlerRegistry jobHandlerRegistry(ObjectProvider<List<JobHandler>> handlersProvider) {
        List<JobHandler> handlers = handlersProvider.getIfAvailable(List::of);
        return new JobHandlerRegistry(handlers);
    }

    @Bean
    @ConditionalOnMissingBean
    public QueueJobDispatcher queueJobDispatcher(SchedulerProperties props, JobHandlerRegistry registry,
                                                 ObjectProvider<JobResultListener> listener) {
        return new QueueJobDispatcher(registry, props.getWorkerThreads(), props.getQueueCapacity(),
                props.getShutdownTimeout(), listener.getIfAvailable(() -> JobResultListener.NOOP));
    }

    @Bean
    @ConditionalOnMissingBean
    public SyncScheduler syncScheduler(SchedulerProperties props, ScheduleStore store, QueueJobDispatcher dispatcher,
                                       JobSpecCodec codec, Clock clock) {
        return new PollingSyncScheduler(props, store, dispatcher, codec, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public SyncbeatLifecycle syncbeatLifecycle(SyncScheduler scheduler) {
        return new SyncbeatLifecycle(scheduler);
    }

    @Bean
    @ConditionalOnProperty(prefix = "syncbeat.scheduler", name = "ensure-indexes-on-startup", havingValue = "true")
    public SmartInitializingSingleton scheduleStoreIndexesInitializer(ScheduleStoreIndexConfig indexConfig) {
        return indexConfig::ensureIndexes;
    }
}
