package com.phillippitts.attendancekiosk.config.properties;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Frame loop settings for the pipeline coordinator.
 */
@ConfigurationProperties(prefix = "kiosk.pipeline")
@Validated
public class PipelineProperties {

    /** Start the frame loop, monitor and sync manager with the application context. */
    private boolean autoStart = true;

    /** Upper bound on frames pulled from the vision provider per second. */
    @Positive(message = "Max FPS must be positive")
    @Max(value = 120, message = "Max FPS must be <= 120")
    private int maxFps = 30;

    public boolean isAutoStart() {
        return autoStart;
    }

    public void setAutoStart(boolean autoStart) {
        this.autoStart = autoStart;
    }

    public int getMaxFps() {
        return maxFps;
    }

    public void setMaxFps(int maxFps) {
        this.maxFps = maxFps;
    }
}
