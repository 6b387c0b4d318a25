package com.phillippitts.attendancekiosk.service.sync;

import com.phillippitts.attendancekiosk.config.properties.BackendProperties;
import com.phillippitts.attendancekiosk.domain.AttendanceEvent;
import com.phillippitts.attendancekiosk.exception.BackendRejectionException;
import com.phillippitts.attendancekiosk.exception.NetworkTransientException;
import com.phillippitts.attendancekiosk.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.time.Duration;
import java.util.Objects;

/**
 * {@link BackendClient} over HTTP using Spring {@link RestClient}.
 *
 * <p>Submissions use the request timeout; health probes use a separate client with the shorter
 * probe timeout. Both send the device credentials as {@code X-Device-Id} and
 * {@code X-Device-Token} headers.
 *
 * <p>Status mapping: 2xx success; 408, 429 and 5xx transient; other 4xx permanent rejection
 * with the reason read from the response's {@code detail} field.
 */
public class RestBackendClient implements BackendClient {

    private static final Logger LOG = LogManager.getLogger(RestBackendClient.class);

    static final String DEVICE_ID_HEADER = "X-Device-Id";
    static final String DEVICE_TOKEN_HEADER = "X-Device-Token";

    private static final int MAX_REASON_LENGTH = 300;

    private final RestClient requestClient;
    private final RestClient healthClient;
    private final BackendProperties props;
    private final String deviceId;

    public RestBackendClient(RestClient requestClient, RestClient healthClient,
                             BackendProperties props, String deviceId) {
        this.requestClient = Objects.requireNonNull(requestClient, "requestClient");
        this.healthClient = Objects.requireNonNull(healthClient, "healthClient");
        this.props = Objects.requireNonNull(props, "props");
        this.deviceId = Objects.requireNonNull(deviceId, "deviceId");
    }

    /**
     * Builds a client with the configured connect and request timeouts and the given probe timeout.
     */
    public static RestBackendClient create(RestClient.Builder builder, BackendProperties props,
                                           String deviceId, Duration probeTimeout) {
        RestClient requestClient = builder.clone()
                .baseUrl(props.getBaseUrl())
                .requestFactory(requestFactory(props.getConnectTimeout(), props.getRequestTimeout()))
                .build();
        RestClient healthClient = builder.clone()
                .baseUrl(props.getBaseUrl())
                .requestFactory(requestFactory(probeTimeout, probeTimeout))
                .build();
        return new RestBackendClient(requestClient, healthClient, props, deviceId);
    }

    @Override
    public void submit(AttendanceEvent event) {
        try {
            requestClient.post()
                    .uri(props.getAttendancePath())
                    .contentType(MediaType.APPLICATION_JSON)
                    .headers(h -> {
                        h.set(DEVICE_ID_HEADER, deviceId);
                        if (!props.getDeviceToken().isBlank()) {
                            h.set(DEVICE_TOKEN_HEADER, props.getDeviceToken());
                        }
                    })
                    .body(toJson(event).toString())
                    .retrieve()
                    .toBodilessEntity();
            LOG.debug("Delivered event {}", event.eventId());
        } catch (RestClientResponseException e) {
            throw mapStatus(e.getStatusCode().value(), e.getResponseBodyAsString());
        } catch (ResourceAccessException e) {
            throw new NetworkTransientException("Backend unreachable: " + LogSanitizer.describe(e), e);
        } catch (RestClientException e) {
            throw new NetworkTransientException("Backend request failed: " + LogSanitizer.describe(e), e);
        }
    }

    @Override
    public boolean checkHealth() {
        try {
            return healthClient.get()
                    .uri(props.getHealthPath())
                    .header(DEVICE_ID_HEADER, deviceId)
                    .retrieve()
                    .toBodilessEntity()
                    .getStatusCode()
                    .is2xxSuccessful();
        } catch (RestClientException e) {
            LOG.debug("Health probe failed: {}", LogSanitizer.describe(e));
            return false;
        }
    }

    static JSONObject toJson(AttendanceEvent event) {
        JSONObject json = new JSONObject();
        json.put("eventId", event.eventId());
        json.put("deviceId", event.deviceId());
        json.put("personId", event.personId() == null ? JSONObject.NULL : event.personId());
        json.put("occurredAt", event.occurredAt().toString());
        json.put("kind", event.kind().name());
        return json;
    }

    static RuntimeException mapStatus(int status, String body) {
        if (status >= 500 || status == 408 || status == 429 || status < 400) {
            return new NetworkTransientException(status, "Backend returned a retryable error");
        }
        return new BackendRejectionException(status, reasonFrom(status, body));
    }

    /**
     * Extracts the rejection reason from a JSON {@code detail} field, falling back to the raw body.
     */
    static String reasonFrom(int status, String body) {
        if (body == null || body.isBlank()) {
            return "HTTP " + status;
        }
        try {
            String detail = new JSONObject(body).optString("detail", "");
            if (!detail.isBlank()) {
                return LogSanitizer.truncate(detail, MAX_REASON_LENGTH);
            }
        } catch (JSONException ignored) {
            // plain-text body
        }
        return LogSanitizer.truncate(body, MAX_REASON_LENGTH);
    }

    private static SimpleClientHttpRequestFactory requestFactory(Duration connectTimeout, Duration readTimeout) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(connectTimeout);
        factory.setReadTimeout(readTimeout);
        return factory;
    }
}
