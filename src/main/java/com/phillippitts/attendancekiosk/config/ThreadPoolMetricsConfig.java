package com.phillippitts.attendancekiosk.config;

import com.phillippitts.attendancekiosk.service.store.AttendanceEventStore;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Exposes sync executor and queue metrics via Micrometer.
 *
 * <ul>
 *   <li>kiosk.sync.pool.active - Number of sync passes running (0 or 1)</li>
 *   <li>kiosk.sync.pool.queued - Sync passes waiting to run</li>
 *   <li>kiosk.sync.pool.completed - Cumulative count of finished passes</li>
 *   <li>kiosk.events.pending - Events stored locally and not yet delivered</li>
 * </ul>
 *
 * <p>Additionally logs a queue summary every 5 minutes for operational visibility.
 */
@Configuration
public class ThreadPoolMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolMetricsConfig.class);

    private final ObjectProvider<ThreadPoolTaskExecutor> syncExecutorProvider;
    private final ObjectProvider<AttendanceEventStore> storeProvider;

    public ThreadPoolMetricsConfig(
            @Qualifier("syncExecutor") ObjectProvider<ThreadPoolTaskExecutor> syncExecutorProvider,
            ObjectProvider<AttendanceEventStore> storeProvider) {
        this.syncExecutorProvider = syncExecutorProvider;
        this.storeProvider = storeProvider;
    }

    @Bean
    public MeterBinder syncExecutorMetrics() {
        return registry -> {
            ThreadPoolExecutor executor = syncExecutorProvider.getObject().getThreadPoolExecutor();

            Gauge.builder("kiosk.sync.pool.active", executor, ThreadPoolExecutor::getActiveCount)
                    .description("Number of sync passes running")
                    .register(registry);

            Gauge.builder("kiosk.sync.pool.queued", executor, e -> e.getQueue().size())
                    .description("Number of sync passes waiting in the queue")
                    .register(registry);

            Gauge.builder("kiosk.sync.pool.completed", executor, ThreadPoolExecutor::getCompletedTaskCount)
                    .description("Cumulative count of completed sync passes")
                    .register(registry);

            Gauge.builder("kiosk.events.pending", storeProvider, ThreadPoolMetricsConfig::pendingOrNaN)
                    .description("Attendance events stored locally and not yet delivered")
                    .register(registry);

            LOG.info("Sync metrics registered: kiosk.sync.pool.* and kiosk.events.pending");
        };
    }

    /**
     * Logs a sync queue summary every 5 minutes.
     */
    @Scheduled(fixedRate = 300_000) // 5 minutes
    public void logSyncHealth() {
        ThreadPoolExecutor executor = syncExecutorProvider.getObject().getThreadPoolExecutor();
        double pending = pendingOrNaN(storeProvider);
        LOG.info("Sync health: pendingEvents={}, activePasses={}, queuedPasses={}, completedPasses={}",
                Double.isNaN(pending) ? "unknown" : String.valueOf((long) pending),
                executor.getActiveCount(),
                executor.getQueue().size(),
                executor.getCompletedTaskCount());
    }

    private static double pendingOrNaN(ObjectProvider<AttendanceEventStore> provider) {
        AttendanceEventStore store = provider.getIfAvailable();
        if (store == null) {
            return Double.NaN;
        }
        try {
            return store.countPending();
        } catch (RuntimeException e) {
            LOG.debug("Pending count unavailable: {}", e.getMessage());
            return Double.NaN;
        }
    }
}
