package com.phillippitts.attendancekiosk.service.sync;

import com.phillippitts.attendancekiosk.domain.AttendanceEvent;
import com.phillippitts.attendancekiosk.exception.BackendRejectionException;
import com.phillippitts.attendancekiosk.exception.NetworkTransientException;

/**
 * Remote attendance backend.
 *
 * <p>The backend deduplicates on {@link AttendanceEvent#eventId()}, so submitting the same event
 * twice records it once.
 */
public interface BackendClient {

    /**
     * Delivers one event.
     *
     * @throws NetworkTransientException on timeout, connection error, 5xx, 408 or 429
     * @throws BackendRejectionException on any other 4xx
     */
    void submit(AttendanceEvent event);

    /**
     * Probes the backend health endpoint. Never throws.
     *
     * @return true on a 2xx answer within the probe timeout
     */
    boolean checkHealth();
}
