package com.dayplanner.timeline;

import com.dayplanner.config.CalendarCacheProperties;
import com.dayplanner.config.GoogleCalendarProperties;
import com.dayplanner.config.TimelineLayoutProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication(scanBasePackages = "com.dayplanner")
@EntityScan("com.dayplanner.domain")
@EnableJpaRepositories("com.dayplanner.repository")
@EnableScheduling
@EnableConfigurationProperties({GoogleCalendarProperties.class, CalendarCacheProperties.class, TimelineLayoutProperties.class})
public class TimelineBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(TimelineBackendApplication.class, args);
    }
}
