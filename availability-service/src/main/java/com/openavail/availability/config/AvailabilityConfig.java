package com.openavail.availability.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(AvailabilityProperties.class)
public class AvailabilityConfig {

    /**
     * Source of "today" for the stay date rules.
     */
    @Bean
    public Clock availabilityClock() {
        return Clock.systemDefaultZone();
    }
}
