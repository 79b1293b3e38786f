package com.phillippitts.tapguard.config;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Gauges for the two pools the recovery engine runs on, tagged {@code pool=recovery} (ad-hoc
 * cycles, bridge callbacks) and {@code pool=timer} (polling cycles, grace timers, settle delays).
 *
 * <ul>
 *   <li>tapguard.pool.size - threads currently in the pool</li>
 *   <li>tapguard.pool.active - threads running a task</li>
 *   <li>tapguard.pool.queued - tasks waiting; for the timer pool this includes armed timers</li>
 *   <li>tapguard.pool.completed - tasks completed since start</li>
 * </ul>
 *
 * <p>A timer pool whose active count stays at its size means a cycle is stuck on a gateway call.
 */
@Configuration
public class ThreadPoolMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolMetricsConfig.class);

    static final String POOL_RECOVERY = "recovery";
    static final String POOL_TIMER = "timer";

    private final Map<String, Supplier<ThreadPoolExecutor>> pools = new LinkedHashMap<>();

    public ThreadPoolMetricsConfig(
            @Qualifier(ThreadPoolConfig.RECOVERY_TASK_EXECUTOR) ThreadPoolTaskExecutor recoveryTaskExecutor,
            @Qualifier("taskScheduler") ThreadPoolTaskScheduler taskScheduler) {
        pools.put(POOL_RECOVERY, recoveryTaskExecutor::getThreadPoolExecutor);
        pools.put(POOL_TIMER, taskScheduler::getScheduledThreadPoolExecutor);
    }

    @Bean
    public MeterBinder recoveryPoolMetrics() {
        return registry -> {
            pools.forEach((name, pool) -> register(registry, name, pool.get()));
            LOG.info("Pool gauges registered for {}: tapguard.pool.* via /actuator/metrics", pools.keySet());
        };
    }

    @Scheduled(fixedRate = 5, timeUnit = TimeUnit.MINUTES)
    public void logPoolHealth() {
        pools.forEach((name, pool) -> {
            ThreadPoolExecutor executor = pool.get();
            LOG.info("Pool {}: size={}/{}, active={}, queued={}, completed={}",
                    name,
                    executor.getPoolSize(),
                    executor.getMaximumPoolSize(),
                    executor.getActiveCount(),
                    executor.getQueue().size(),
                    executor.getCompletedTaskCount());
        });
    }

    private static void register(MeterRegistry registry, String name, ThreadPoolExecutor executor) {
        Gauge.builder("tapguard.pool.size", executor, ThreadPoolExecutor::getPoolSize)
                .tag("pool", name)
                .description("Current number of threads in the pool")
                .register(registry);
        Gauge.builder("tapguard.pool.active", executor, ThreadPoolExecutor::getActiveCount)
                .tag("pool", name)
                .description("Number of threads running a task")
                .register(registry);
        Gauge.builder("tapguard.pool.queued", executor, e -> e.getQueue().size())
                .tag("pool", name)
                .description("Number of tasks waiting in the queue")
                .register(registry);
        Gauge.builder("tapguard.pool.completed", executor, ThreadPoolExecutor::getCompletedTaskCount)
                .tag("pool", name)
                .description("Cumulative count of completed tasks")
                .register(registry);
    }
}
