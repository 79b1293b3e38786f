package com.phillippitts.tapguard.config;

import com.phillippitts.tapguard.config.logging.ThreadContextTaskDecorator;
import com.phillippitts.tapguard.config.properties.ThreadPoolProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configuration for the executors used by the recovery engine.
 *
 * <p>Pool sizes are configured via {@link ThreadPoolProperties} and can be tuned
 * in application.properties.
 */
@Configuration
public class ThreadPoolConfig {

    /** Bean name of the bounded pool for ad-hoc cycles and bridge callbacks. */
    public static final String RECOVERY_TASK_EXECUTOR = "recoveryTaskExecutor";

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Bounded pool for work that must not run on the caller's thread: ad-hoc recovery
     * cycles and connectivity notifications pushed by the bridge.
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.CallerRunsPolicy}. When pool and queue
     * are full the submitting thread runs the task, providing backpressure instead of
     * dropping a recovery trigger.
     *
     * <p>MDC propagation: copies Log4j2 ThreadContext from the submitting thread so cycle
     * and request identifiers survive the hand-off.
     *
     * @return configured executor for recovery work
     */
    @Bean(name = RECOVERY_TASK_EXECUTOR)
    public ThreadPoolTaskExecutor recoveryTaskExecutor() {
        ThreadPoolProperties.RecoveryPoolProperties props = threadPoolProperties.getRecovery();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setTaskDecorator(ThreadContextTaskDecorator.INSTANCE);
        executor.initialize();
        return executor;
    }

    /**
     * Scheduler behind {@code @Scheduled} cycles, reboot grace timers and the network-blip
     * settle delay. Named {@code taskScheduler} so Spring's scheduling infrastructure picks it up.
     *
     * <p>The scheduler takes no task decorator. {@code @Scheduled} cycles set their own
     * ThreadContext and one-shot timers are wrapped with
     * {@link ThreadContextTaskDecorator#propagating(Runnable)} where they are scheduled.
     *
     * @return configured task scheduler
     */
    @Bean(name = "taskScheduler")
    public ThreadPoolTaskScheduler taskScheduler() {
        ThreadPoolProperties.SchedulerProperties props = threadPoolProperties.getScheduler();

        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(props.getPoolSize());
        scheduler.setThreadNamePrefix(props.getThreadNamePrefix());
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.initialize();
        return scheduler;
    }
}
