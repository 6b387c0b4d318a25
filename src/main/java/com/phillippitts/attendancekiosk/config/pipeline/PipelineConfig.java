package com.phillippitts.attendancekiosk.config.pipeline;

import com.phillippitts.attendancekiosk.config.properties.AttendanceProperties;
import com.phillippitts.attendancekiosk.config.properties.BackendProperties;
import com.phillippitts.attendancekiosk.config.properties.ConnectivityProperties;
import com.phillippitts.attendancekiosk.config.properties.PipelineProperties;
import com.phillippitts.attendancekiosk.config.properties.SyncProperties;
import com.phillippitts.attendancekiosk.config.properties.TrackingProperties;
import com.phillippitts.attendancekiosk.service.connectivity.ConnectivityMonitor;
import com.phillippitts.attendancekiosk.service.metrics.AttendanceMetrics;
import com.phillippitts.attendancekiosk.service.orchestration.PipelineCoordinator;
import com.phillippitts.attendancekiosk.service.orchestration.VisionProvider;
import com.phillippitts.attendancekiosk.service.store.AttendanceEventStore;
import com.phillippitts.attendancekiosk.service.store.JdbcAttendanceEventStore;
import com.phillippitts.attendancekiosk.service.sync.BackendClient;
import com.phillippitts.attendancekiosk.service.sync.RestBackendClient;
import com.phillippitts.attendancekiosk.service.sync.SyncManager;
import com.phillippitts.attendancekiosk.service.tracking.AttendanceWindowResolver;
import com.phillippitts.attendancekiosk.service.tracking.DecisionRecorder;
import com.phillippitts.attendancekiosk.service.tracking.FaceTrackStateMachine;
import com.phillippitts.attendancekiosk.service.tracking.PersonCooldownRegistry;
import com.phillippitts.attendancekiosk.service.tracking.TimeOfDayWindowResolver;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.web.client.RestClient;

import java.time.Clock;
import java.util.concurrent.Executor;

/**
 * Wires the attendance pipeline explicitly so every component receives its collaborators
 * through its constructor. Taking the validator as a dependency makes the cross-field checks
 * run before any pipeline bean is built.
 */
@Configuration
public class PipelineConfig {

    private final TrackingProperties trackingProperties;
    private final AttendanceProperties attendanceProperties;
    private final BackendProperties backendProperties;
    private final ConnectivityProperties connectivityProperties;
    private final SyncProperties syncProperties;
    private final PipelineProperties pipelineProperties;
    private final ApplicationEventPublisher publisher;

    PipelineConfig(PipelineConfigurationValidator validator,
                   TrackingProperties trackingProperties,
                   AttendanceProperties attendanceProperties,
                   BackendProperties backendProperties,
                   ConnectivityProperties connectivityProperties,
                   SyncProperties syncProperties,
                   PipelineProperties pipelineProperties,
                   ApplicationEventPublisher publisher) {
        this.trackingProperties = trackingProperties;
        this.attendanceProperties = attendanceProperties;
        this.backendProperties = backendProperties;
        this.connectivityProperties = connectivityProperties;
        this.syncProperties = syncProperties;
        this.pipelineProperties = pipelineProperties;
        this.publisher = publisher;
    }

    @Bean
    public Clock kioskClock() {
        return Clock.systemUTC();
    }

    @Bean
    public AttendanceWindowResolver attendanceWindowResolver() {
        return new TimeOfDayWindowResolver(attendanceProperties.getWindows(), attendanceProperties.zoneId());
    }

    @Bean
    public PersonCooldownRegistry personCooldownRegistry() {
        return new PersonCooldownRegistry(attendanceProperties.getCooldown());
    }

    @Bean
    public FaceTrackStateMachine faceTrackStateMachine(PersonCooldownRegistry cooldowns,
                                                       AttendanceWindowResolver windowResolver) {
        return new FaceTrackStateMachine(trackingProperties, cooldowns, windowResolver);
    }

    /**
     * Local event store on the application data source. Creates its schema on first use.
     */
    @Bean
    public JdbcAttendanceEventStore attendanceEventStore(JdbcTemplate jdbcTemplate, Clock kioskClock) {
        JdbcAttendanceEventStore store =
                new JdbcAttendanceEventStore(jdbcTemplate, syncProperties.getMaxAttempts(), kioskClock);
        store.initializeSchema();
        return store;
    }

    @Bean
    public DecisionRecorder decisionRecorder(AttendanceEventStore store,
                                             FaceTrackStateMachine stateMachine,
                                             AttendanceMetrics metrics) {
        return new DecisionRecorder(store, stateMachine, publisher, metrics,
                attendanceProperties.getDeviceId(), attendanceProperties.getAppendRetries());
    }

    @Bean
    public BackendClient backendClient(RestClient.Builder restClientBuilder) {
        return RestBackendClient.create(restClientBuilder, backendProperties,
                attendanceProperties.getDeviceId(), connectivityProperties.getProbeTimeout());
    }

    @Bean
    public ConnectivityMonitor connectivityMonitor(BackendClient backendClient,
                                                   @Qualifier("networkScheduler") TaskScheduler networkScheduler,
                                                   @Qualifier("mdcTaskDecorator") TaskDecorator mdcTaskDecorator,
                                                   Clock kioskClock) {
        ConnectivityMonitor monitor =
                new ConnectivityMonitor(backendClient, connectivityProperties, networkScheduler, publisher, kioskClock);
        monitor.setTaskDecorator(mdcTaskDecorator);
        return monitor;
    }

    @Bean
    public SyncManager syncManager(AttendanceEventStore store,
                                   BackendClient backendClient,
                                   ConnectivityMonitor connectivityMonitor,
                                   @Qualifier("syncExecutor") Executor syncExecutor,
                                   @Qualifier("networkScheduler") TaskScheduler networkScheduler,
                                   @Qualifier("mdcTaskDecorator") TaskDecorator mdcTaskDecorator,
                                   AttendanceMetrics metrics,
                                   Clock kioskClock) {
        SyncManager syncManager = new SyncManager(store, backendClient, connectivityMonitor, syncExecutor,
                networkScheduler, publisher, metrics, syncProperties, kioskClock);
        syncManager.setTaskDecorator(mdcTaskDecorator);
        return syncManager;
    }

    /**
     * Pipeline lifecycle. Polls a {@link VisionProvider} when one is defined.
     */
    @Bean
    public PipelineCoordinator pipelineCoordinator(FaceTrackStateMachine stateMachine,
                                                   DecisionRecorder recorder,
                                                   AttendanceEventStore store,
                                                   ConnectivityMonitor connectivityMonitor,
                                                   SyncManager syncManager,
                                                   ObjectProvider<VisionProvider> visionProvider,
                                                   @Qualifier("frameScheduler") TaskScheduler frameScheduler,
                                                   Clock kioskClock) {
        return new PipelineCoordinator(stateMachine, recorder, store, connectivityMonitor, syncManager,
                visionProvider.getIfAvailable(), frameScheduler, pipelineProperties, kioskClock);
    }
}
