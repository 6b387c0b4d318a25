package com.phillippitts.attendancekiosk.config;

import com.phillippitts.attendancekiosk.config.properties.AttendanceProperties;
import com.phillippitts.attendancekiosk.config.properties.SyncProperties;
import com.phillippitts.attendancekiosk.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.Map;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pools of the attendance pipeline.
 *
 * <p>Four pools keep network I/O and speech off the decisioning path:
 * <ul>
 *   <li>{@code frame-}: single-thread scheduler polling the vision provider</li>
 *   <li>{@code net-}: scheduler for connectivity probes, sync ticks and {@code @Scheduled} tasks</li>
 *   <li>{@code sync-}: single-thread executor running sync passes</li>
 *   <li>{@code speech-}: single-thread executor speaking greetings</li>
 * </ul>
 *
 * <p>Sizes and names are configured via {@link ThreadPoolProperties} ({@code threadpool.*}).
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;
    private final SyncProperties syncProperties;
    private final String deviceId;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties,
                            SyncProperties syncProperties,
                            AttendanceProperties attendanceProperties) {
        this.threadPoolProperties = threadPoolProperties;
        this.syncProperties = syncProperties;
        this.deviceId = attendanceProperties.getDeviceId();
    }

    /**
     * Single frame thread. One thread means frames are never processed concurrently.
     */
    @Bean(name = "frameScheduler")
    public ThreadPoolTaskScheduler frameScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix(threadPoolProperties.getFrame().getThreadNamePrefix());
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(2);
        scheduler.initialize();
        return scheduler;
    }

    /**
     * Scheduler for probes and sync triggers. Also registered as {@code taskScheduler} so
     * {@code @Scheduled} methods run here. Components scheduling work here apply
     * {@link #mdcDecorator()} to their own tasks.
     */
    @Bean(name = {"networkScheduler", "taskScheduler"})
    public ThreadPoolTaskScheduler networkScheduler() {
        ThreadPoolProperties.NetworkPoolProperties netProps = threadPoolProperties.getNetwork();

        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(netProps.getPoolSize());
        scheduler.setThreadNamePrefix(netProps.getThreadNamePrefix());
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.initialize();
        return scheduler;
    }

    /**
     * Executor for sync passes.
     *
     * <p>One worker and a bounded queue: a trigger arriving while a pass runs and another is
     * queued is rejected with {@link ThreadPoolExecutor.AbortPolicy}, and the sync manager drops it.
     *
     * <p>MDC propagation: copies Log4j2 ThreadContext from the triggering thread and adds the
     * device id.
     */
    @Bean(name = "syncExecutor")
    public ThreadPoolTaskExecutor syncExecutor() {
        ThreadPoolProperties.SyncPoolProperties syncProps = threadPoolProperties.getSync();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(syncProps.getQueueCapacity());
        executor.setThreadNamePrefix(syncProps.getThreadNamePrefix());
        executor.setKeepAliveSeconds(syncProps.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds((int) syncProperties.getShutdownGrace().toSeconds());
        executor.setTaskDecorator(mdcDecorator());
        executor.initialize();
        return executor;
    }

    /**
     * Executor for spoken greetings, so a slow speech provider never holds up the frame thread.
     * One worker; greetings beyond the queue capacity are rejected and skipped.
     */
    @Bean(name = "speechExecutor")
    public ThreadPoolTaskExecutor speechExecutor() {
        ThreadPoolProperties.SpeechPoolProperties speechProps = threadPoolProperties.getSpeech();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(speechProps.getQueueCapacity());
        executor.setThreadNamePrefix(speechProps.getThreadNamePrefix());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.setTaskDecorator(mdcDecorator());
        executor.initialize();
        return executor;
    }

    /**
     * Copies the caller's Log4j2 ThreadContext onto the worker thread and adds the device id.
     */
    @Bean(name = "mdcTaskDecorator")
    public TaskDecorator mdcDecorator() {
        return runnable -> {
            Map<String, String> contextMap = ThreadContext.getImmutableContext();
            return () -> {
                Map<String, String> previous = ThreadContext.getImmutableContext();
                try {
                    if (contextMap != null && !contextMap.isEmpty()) {
                        ThreadContext.putAll(contextMap);
                    }
                    ThreadContext.put("deviceId", deviceId);
                    runnable.run();
                } finally {
                    ThreadContext.clearAll();
                    if (previous != null && !previous.isEmpty()) {
                        ThreadContext.putAll(previous);
                    }
                }
            };
        };
    }
}
