package io.github.notecal.ingestion.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

@Configuration
public class ClockConfig {

    @Bean
    public Clock calendarClock(@Value("${app.calendar.timezone:Europe/Dublin}") String timezone) {
        return Clock.system(ZoneId.of(timezone));
    }
}
