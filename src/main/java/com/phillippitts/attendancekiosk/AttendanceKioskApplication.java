package com.phillippitts.attendancekiosk;

import com.phillippitts.attendancekiosk.config.properties.AttendanceProperties;
import com.phillippitts.attendancekiosk.config.properties.BackendProperties;
import com.phillippitts.attendancekiosk.config.properties.ConnectivityProperties;
import com.phillippitts.attendancekiosk.config.properties.PipelineProperties;
import com.phillippitts.attendancekiosk.config.properties.SyncProperties;
import com.phillippitts.attendancekiosk.config.properties.ThreadPoolProperties;
import com.phillippitts.attendancekiosk.config.properties.TrackingProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        TrackingProperties.class,
        AttendanceProperties.class,
        BackendProperties.class,
        ConnectivityProperties.class,
        SyncProperties.class,
        PipelineProperties.class,
        ThreadPoolProperties.class
})
@EnableScheduling
public class AttendanceKioskApplication {

    public static void main(String[] args) {
        SpringApplication.run(AttendanceKioskApplication.class, args);
    }

}
