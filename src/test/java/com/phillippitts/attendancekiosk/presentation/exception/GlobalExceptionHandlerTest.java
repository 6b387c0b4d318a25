package com.phillippitts.attendancekiosk.presentation.exception;

import com.phillippitts.attendancekiosk.exception.EventStoreException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.sql.SQLException;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
    }

    @Test
    void storeFailureReturns503() {
        EventStoreException ex = new EventStoreException("countPending", new SQLException("database is locked"));

        ResponseEntity<GlobalExceptionHandler.ApiError> response = handler.handleStoreFailure(ex);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().errorCode()).isEqualTo("EventStoreException");
        assertThat(response.getBody().message()).isEqualTo("Local event store unavailable");
    }

    @Test
    void storeFailureDoesNotExposeCause() {
        EventStoreException ex = new EventStoreException("append",
                new SQLException("File corrupted: /var/lib/kiosk/attendance.mv.db"));

        ResponseEntity<GlobalExceptionHandler.ApiError> response = handler.handleStoreFailure(ex);

        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().toString()).doesNotContain("/var/lib/kiosk");
    }

    @Test
    void unexpectedErrorReturns500WithGenericMessage() {
        Instant before = Instant.now();

        ResponseEntity<GlobalExceptionHandler.ApiError> response =
                handler.handleUnexpected(new IllegalStateException("secret internal state"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().errorCode()).isEqualTo("InternalServerError");
        assertThat(response.getBody().toString()).doesNotContain("secret internal state");
        assertThat(response.getBody().timestamp()).isAfterOrEqualTo(before);
    }
}
