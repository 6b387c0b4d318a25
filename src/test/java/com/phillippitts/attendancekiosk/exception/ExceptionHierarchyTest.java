package com.phillippitts.attendancekiosk.exception;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.sql.SQLException;

import static org.assertj.core.api.Assertions.assertThat;

class ExceptionHierarchyTest {

    @Test
    void allKioskExceptionsAreUnchecked() {
        assertThat(new EventStoreException("append", null)).isInstanceOf(AttendanceKioskException.class);
        assertThat(new NetworkTransientException(503, "Service unavailable"))
                .isInstanceOf(AttendanceKioskException.class);
        assertThat(new BackendRejectionException(422, "unknown person"))
                .isInstanceOf(AttendanceKioskException.class);
        assertThat(new VisionInputException("bad")).isInstanceOf(AttendanceKioskException.class);
        assertThat(new InvalidConfigurationException("kiosk.sync.interval", "bad"))
                .isInstanceOf(AttendanceKioskException.class);
        assertThat(new AttendanceKioskException("x")).isInstanceOf(RuntimeException.class);
    }

    @Test
    void eventStoreExceptionKeepsOperationAndCause() {
        SQLException cause = new SQLException("disk full");

        EventStoreException ex = new EventStoreException("append", cause);

        assertThat(ex.getOperation()).isEqualTo("append");
        assertThat(ex).hasMessage("Event store append failed").hasCause(cause);
    }

    @Test
    void transientExceptionWithoutResponseHasStatusZero() {
        IOException cause = new IOException("Connection refused");

        NetworkTransientException ex = new NetworkTransientException("Backend unreachable", cause);

        assertThat(ex.getStatusCode()).isZero();
        assertThat(ex).hasMessage("Backend unreachable").hasCause(cause);
    }

    @Test
    void transientExceptionWithStatus() {
        NetworkTransientException ex = new NetworkTransientException(429, "Too many requests");

        assertThat(ex.getStatusCode()).isEqualTo(429);
        assertThat(ex).hasMessage("Too many requests (status: 429)");
    }

    @Test
    void rejectionCarriesStatusAndReason() {
        BackendRejectionException ex = new BackendRejectionException(400, "malformed payload");

        assertThat(ex.getStatusCode()).isEqualTo(400);
        assertThat(ex.getReason()).isEqualTo("malformed payload");
        assertThat(ex).hasMessage("Backend rejected event (status: 400): malformed payload");
    }

    @Test
    void configurationExceptionNamesProperty() {
        InvalidConfigurationException ex =
                new InvalidConfigurationException("kiosk.tracking.max-tracks", "must be >= 1");

        assertThat(ex.getProperty()).isEqualTo("kiosk.tracking.max-tracks");
        assertThat(ex).hasMessage("Invalid configuration 'kiosk.tracking.max-tracks': must be >= 1");
    }

    @Test
    void visionInputExceptionPrefixesMessage() {
        assertThat(new VisionInputException("Detection without trackId"))
                .hasMessage("Invalid detection frame: Detection without trackId");
    }
}
