package com.phillippitts.attendancekiosk.config.pipeline;

import com.phillippitts.attendancekiosk.config.properties.AttendanceProperties;
import com.phillippitts.attendancekiosk.config.properties.BackendProperties;
import com.phillippitts.attendancekiosk.config.properties.ConnectivityProperties;
import com.phillippitts.attendancekiosk.config.properties.SyncProperties;
import com.phillippitts.attendancekiosk.config.properties.TrackingProperties;
import com.phillippitts.attendancekiosk.domain.AttendanceKind;
import com.phillippitts.attendancekiosk.exception.InvalidConfigurationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PipelineConfigurationValidatorTest {

    private TrackingProperties tracking;
    private AttendanceProperties attendance;
    private SyncProperties sync;
    private ConnectivityProperties connectivity;
    private BackendProperties backend;
    private PipelineConfigurationValidator validator;

    @BeforeEach
    void setUp() {
        tracking = new TrackingProperties();
        attendance = new AttendanceProperties();
        sync = new SyncProperties();
        connectivity = new ConnectivityProperties();
        backend = new BackendProperties();
        validator = new PipelineConfigurationValidator(tracking, attendance, sync, connectivity, backend);
    }

    @Test
    void acceptsDefaults() {
        assertThatCode(validator::validate).doesNotThrowAnyException();
    }

    @Test
    void rejectsAgreementLargerThanWindow() {
        tracking.setRequiredAgreement(4);

        assertThatThrownBy(validator::validate)
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("kiosk.tracking.required-agreement")
                .hasMessageContaining("must not exceed");
    }

    @Test
    void rejectsAgreementThatIsNotAMajority() {
        tracking.setVerifyWindowSize(4);
        tracking.setRequiredAgreement(2);

        assertThatThrownBy(validator::validate)
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("strict majority");
    }

    @Test
    void acceptsUnanimousAgreement() {
        tracking.setVerifyWindowSize(1);
        tracking.setRequiredAgreement(1);

        assertThatCode(validator::validate).doesNotThrowAnyException();
    }

    @Test
    void rejectsZeroVerifyTimeout() {
        tracking.setVerifyTimeout(Duration.ZERO);

        assertThatThrownBy(validator::validate)
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("kiosk.tracking.verify-timeout");
    }

    @Test
    void rejectsDuplicateWindowNames() {
        attendance.setWindows(List.of(
                new AttendanceProperties.Window("shift", LocalTime.MIDNIGHT, AttendanceKind.CHECK_IN),
                new AttendanceProperties.Window("shift", LocalTime.NOON, AttendanceKind.CHECK_OUT)));

        assertThatThrownBy(validator::validate)
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("duplicate window name 'shift'");
    }

    @Test
    void rejectsWindowsSharingAStartTime() {
        attendance.setWindows(List.of(
                new AttendanceProperties.Window("in", LocalTime.MIDNIGHT, AttendanceKind.CHECK_IN),
                new AttendanceProperties.Window("out", LocalTime.MIDNIGHT, AttendanceKind.CHECK_OUT)));

        assertThatThrownBy(validator::validate)
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("two windows start at");
    }

    @Test
    void rejectsWindowsLeavingEarlyMorningUncovered() {
        attendance.setWindows(List.of(
                new AttendanceProperties.Window("in", LocalTime.of(6, 0), AttendanceKind.CHECK_IN)));

        assertThatThrownBy(validator::validate)
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("00:00");
    }

    @Test
    void rejectsUnknownZone() {
        attendance.setZone("Mars/Olympus_Mons");

        assertThatThrownBy(validator::validate)
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("kiosk.attendance.zone");
    }

    @Test
    void rejectsNegativeCooldown() {
        attendance.setCooldown(Duration.ofMinutes(-1));

        assertThatThrownBy(validator::validate)
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("kiosk.attendance.cooldown");
    }

    @Test
    void rejectsBackoffCapBelowBase() {
        sync.setBackoffBase(Duration.ofSeconds(10));
        sync.setBackoffCap(Duration.ofSeconds(5));

        assertThatThrownBy(validator::validate)
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("kiosk.sync.backoff-cap");
    }

    @Test
    void rejectsZeroProbeInterval() {
        connectivity.setOfflineProbeInterval(Duration.ZERO);

        assertThatThrownBy(validator::validate)
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("kiosk.connectivity.offline-probe-interval");
    }

    @Test
    void rejectsNonHttpBaseUrl() {
        backend.setBaseUrl("ftp://attendance.example.com");

        assertThatThrownBy(validator::validate)
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("kiosk.backend.base-url");
    }

    @Test
    void rejectsMalformedBaseUrl() {
        backend.setBaseUrl("http://bad host");

        assertThatThrownBy(validator::validate)
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("malformed URL");
    }
}
