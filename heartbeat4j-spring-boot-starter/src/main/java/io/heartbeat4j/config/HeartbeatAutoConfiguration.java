package io.heartbeat4j.config;

import io.heartbeat4j.JobRegistry;
import io.heartbeat4j.TaskHandler;
import io.heartbeat4j.core.CronEngine;
import io.heartbeat4j.core.JobStore;
import io.heartbeat4j.core.TaskTypeRegistry;
import io.heartbeat4j.heartbeat.Brain;
import io.heartbeat4j.heartbeat.HeartbeatController;
import io.heartbeat4j.internal.CronJobRegistry;
import io.heartbeat4j.internal.InMemoryJobStore;
import io.heartbeat4j.internal.ScheduledCronEngine;
import io.heartbeat4j.internal.mongo.MongoJobStore;
import io.heartbeat4j.notify.MessageDeduper;
import io.heartbeat4j.notify.NotificationDispatcher;
import io.heartbeat4j.notify.Notifier;
import io.heartbeat4j.notify.QuietHours;
import io.heartbeat4j.notify.notifier.LoggingNotifier;
import io.heartbeat4j.worker.WorkerPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.data.mongo.MongoDataAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.time.Clock;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Spring Boot auto-configuration entrypoint for heartbeat4j components.
 *
 * <p>Jobs are persisted in MongoDB when a {@link MongoTemplate} bean exists, otherwise in memory.
 * The heartbeat controller and its system jobs are only wired when the application provides a
 * {@link Brain} bean.
 */
@AutoConfiguration(after = MongoDataAutoConfiguration.class)
@ConditionalOnClass(JobRegistry.class)
@EnableConfigurationProperties(HeartbeatProperties.class)
@ConditionalOnProperty(prefix = "heartbeat4j", name = "enabled", havingValue = "true", matchIfMissing = true)
public class HeartbeatAutoConfiguration {
    private static final Logger log = LoggerFactory.getLogger(HeartbeatAutoConfiguration.class);

    public static final String EXECUTOR_BEAN_NAME = "heartbeat4jExecutor";

    @Bean
    @ConditionalOnMissingBean
    public JobStore jobStore(ObjectProvider<MongoTemplate> mongoTemplateProvider) {
        MongoTemplate mongoTemplate = mongoTemplateProvider.getIfAvailable();
        if (mongoTemplate != null) {
            return new MongoJobStore(mongoTemplate);
        }
        log.warn("No MongoTemplate available, scheduled jobs are kept in memory and lost on restart");
        return new InMemoryJobStore();
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(MongoTemplate.class)
    public JobStoreIndexConfig jobStoreIndexConfig(MongoTemplate mongoTemplate) {
        return new JobStoreIndexConfig(mongoTemplate);
    }

    @Bean
    @ConditionalOnBean(MongoTemplate.class)
    @ConditionalOnProperty(prefix = "heartbeat4j", name = "ensure-indexes-on-startup", havingValue = "true")
    public SmartInitializingSingleton heartbeatIndexesInitializer(JobStoreIndexConfig indexConfig) {
        return indexConfig::ensureIndexes;
    }

    @Bean
    @ConditionalOnMissingBean
    public TaskTypeRegistry taskTypeRegistry(ObjectProvider<List<TaskHandler>> handlersProvider) {
        List<TaskHandler> handlers = handlersProvider.getIfAvailable(List::of);
        return new TaskTypeRegistry(handlers);
    }

    @Bean
    @ConditionalOnMissingBean
    public CronEngine cronEngine(HeartbeatProperties props) {
        return new ScheduledCronEngine(zoneOf(props), props.getCronThreads());
    }

    /**
     * Runs manual job triggers and notifier sends.
     */
    @Bean(name = EXECUTOR_BEAN_NAME, destroyMethod = "shutdown")
    @ConditionalOnMissingBean(name = EXECUTOR_BEAN_NAME)
    public ExecutorService heartbeat4jExecutor() {
        AtomicInteger seq = new AtomicInteger();
        return Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r);
            t.setName("heartbeat4j.exec-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Bean
    @ConditionalOnMissingBean
    public JobRegistry jobRegistry(JobStore jobStore,
                                   CronEngine cronEngine,
                                   TaskTypeRegistry taskTypeRegistry,
                                   @Qualifier(EXECUTOR_BEAN_NAME) ExecutorService executor) {
        return new CronJobRegistry(jobStore, cronEngine, taskTypeRegistry, executor);
    }

    @Bean
    @ConditionalOnMissingBean
    public WorkerPool workerPool(HeartbeatProperties props) {
        return new WorkerPool(props.getWorker().getQueueCapacity());
    }

    @Bean
    @ConditionalOnMissingBean
    public NotificationDispatcher notificationDispatcher(HeartbeatProperties props,
                                                         ObjectProvider<Notifier> notifiers,
                                                         @Qualifier(EXECUTOR_BEAN_NAME) ExecutorService executor) {
        HeartbeatProperties.Notify notify = props.getNotify();
        NotificationDispatcher dispatcher = new NotificationDispatcher(
                new MessageDeduper(notify.getCooldown(), Clock.systemUTC()),
                new QuietHours(LocalTime.parse(notify.getQuietStart()), LocalTime.parse(notify.getQuietEnd())),
                notify.getSendTimeout(),
                executor,
                Clock.systemUTC(),
                zoneOf(props)
        );

        List<Notifier> configured = notifiers.orderedStream().toList();
        if (configured.isEmpty()) {
            dispatcher.register(new LoggingNotifier());
        } else {
            configured.forEach(dispatcher::register);
        }
        return dispatcher;
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(Brain.class)
    public HeartbeatController heartbeatController(Brain brain, HeartbeatProperties props) {
        return new HeartbeatController(brain, props.getHeartbeat().getCycleTimeout());
    }

    @Bean
    @ConditionalOnMissingBean
    public HeartbeatLifecycle heartbeatLifecycle(JobRegistry jobRegistry,
                                                 WorkerPool workerPool,
                                                 ObjectProvider<HeartbeatController> controller,
                                                 HeartbeatProperties props) {
        return new HeartbeatLifecycle(jobRegistry, workerPool, controller.getIfAvailable(), props);
    }

    private static ZoneId zoneOf(HeartbeatProperties props) {
        String tz = props.getTimezone();
        return tz == null || tz.isBlank() ? ZoneId.systemDefault() : ZoneId.of(tz);
    }
}
