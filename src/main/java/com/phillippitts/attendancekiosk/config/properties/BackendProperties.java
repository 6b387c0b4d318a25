package com.phillippitts.attendancekiosk.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Backend API location, device credentials and request timeouts.
 */
@ConfigurationProperties(prefix = "kiosk.backend")
@Validated
public class BackendProperties {

    @NotBlank(message = "Backend base URL must not be blank")
    private String baseUrl = "http://localhost:8000";

    /** Sent as X-Device-Token; blank means no token header. */
    private String deviceToken = "";

    @NotBlank
    private String attendancePath = "/attendance";

    @NotBlank
    private String healthPath = "/health";

    @NotNull
    private Duration connectTimeout = Duration.ofSeconds(5);

    /** Read timeout for attendance submissions. */
    @NotNull
    private Duration requestTimeout = Duration.ofSeconds(15);

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getDeviceToken() {
        return deviceToken;
    }

    public void setDeviceToken(String deviceToken) {
        this.deviceToken = deviceToken;
    }

    public String getAttendancePath() {
        return attendancePath;
    }

    public void setAttendancePath(String attendancePath) {
        this.attendancePath = attendancePath;
    }

    public String getHealthPath() {
        return healthPath;
    }

    public void setHealthPath(String healthPath) {
        this.healthPath = healthPath;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public void setConnectTimeout(Duration connectTimeout) {
        this.connectTimeout = connectTimeout;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public void setRequestTimeout(Duration requestTimeout) {
        this.requestTimeout = requestTimeout;
    }
}
