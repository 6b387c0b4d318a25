package com.phillippitts.attendancekiosk.config;

import com.phillippitts.attendancekiosk.config.properties.AttendanceProperties;
import com.phillippitts.attendancekiosk.config.properties.SyncProperties;
import com.phillippitts.attendancekiosk.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ThreadPoolConfigTest {

    private ThreadPoolConfig config;
    private ThreadPoolTaskExecutor syncExecutor;
    private ThreadPoolTaskExecutor speechExecutor;
    private ThreadPoolTaskScheduler networkScheduler;
    private ThreadPoolTaskScheduler frameScheduler;

    @BeforeEach
    void setUp() {
        AttendanceProperties attendance = new AttendanceProperties();
        attendance.setDeviceId("kiosk-lobby");
        config = new ThreadPoolConfig(new ThreadPoolProperties(), new SyncProperties(), attendance);
        ThreadContext.clearAll();
    }

    @AfterEach
    void tearDown() {
        if (syncExecutor != null) {
            syncExecutor.shutdown();
        }
        if (speechExecutor != null) {
            speechExecutor.shutdown();
        }
        if (networkScheduler != null) {
            networkScheduler.shutdown();
        }
        if (frameScheduler != null) {
            frameScheduler.shutdown();
        }
        ThreadContext.clearAll();
    }

    @Test
    void syncExecutorRunsOnOneThread() {
        syncExecutor = config.syncExecutor();

        assertThat(syncExecutor.getCorePoolSize()).isEqualTo(1);
        assertThat(syncExecutor.getMaxPoolSize()).isEqualTo(1);
        assertThat(syncExecutor.getThreadNamePrefix()).isEqualTo("sync-");
    }

    @Test
    void speechExecutorIsSingleThreadedWithSmallQueue() {
        speechExecutor = config.speechExecutor();

        assertThat(speechExecutor.getCorePoolSize()).isEqualTo(1);
        assertThat(speechExecutor.getMaxPoolSize()).isEqualTo(1);
        assertThat(speechExecutor.getThreadNamePrefix()).isEqualTo("speech-");
        assertThat(speechExecutor.getThreadPoolExecutor().getQueue().remainingCapacity()).isEqualTo(4);
    }

    @Test
    void schedulersUseConfiguredPrefixes() {
        frameScheduler = config.frameScheduler();
        networkScheduler = config.networkScheduler();

        assertThat(frameScheduler.getThreadNamePrefix()).isEqualTo("frame-");
        assertThat(networkScheduler.getThreadNamePrefix()).isEqualTo("net-");
    }

    @Test
    void syncExecutorRejectsWhenWorkerBusyAndQueueFull() throws InterruptedException {
        syncExecutor = config.syncExecutor();
        CountDownLatch running = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);

        syncExecutor.execute(() -> {
            running.countDown();
            awaitQuietly(release);
        });
        assertThat(running.await(2, TimeUnit.SECONDS)).isTrue();
        syncExecutor.execute(() -> { });

        try {
            assertThatThrownBy(() -> syncExecutor.execute(() -> { }))
                    .isInstanceOf(TaskRejectedException.class);
        } finally {
            release.countDown();
        }
    }

    @Test
    void syncTasksSeeCallerContextAndDeviceId() throws InterruptedException {
        syncExecutor = config.syncExecutor();
        AtomicReference<String> requestId = new AtomicReference<>();
        AtomicReference<String> deviceId = new AtomicReference<>();
        AtomicReference<String> threadName = new AtomicReference<>();
        CountDownLatch done = new CountDownLatch(1);

        ThreadContext.put("requestId", "req-42");
        syncExecutor.execute(() -> {
            requestId.set(ThreadContext.get("requestId"));
            deviceId.set(ThreadContext.get("deviceId"));
            threadName.set(Thread.currentThread().getName());
            done.countDown();
        });

        assertThat(done.await(2, TimeUnit.SECONDS)).isTrue();
        assertThat(requestId.get()).isEqualTo("req-42");
        assertThat(deviceId.get()).isEqualTo("kiosk-lobby");
        assertThat(threadName.get()).startsWith("sync-");
    }

    @Test
    void decoratorRestoresWorkerContextAfterTask() {
        ThreadContext.put("syncPass", "outer");
        Runnable decorated = config.mdcDecorator().decorate(() -> ThreadContext.put("syncPass", "inner"));

        decorated.run();

        assertThat(ThreadContext.get("syncPass")).isEqualTo("outer");
        assertThat(ThreadContext.get("deviceId")).isNull();
    }

    @Test
    void shutdownCompletesQueuedWork() throws InterruptedException {
        syncExecutor = config.syncExecutor();
        CountDownLatch done = new CountDownLatch(1);

        syncExecutor.execute(done::countDown);
        syncExecutor.shutdown();

        assertThat(done.await(2, TimeUnit.SECONDS)).isTrue();
        assertThat(syncExecutor.getThreadPoolExecutor().isShutdown()).isTrue();
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
