package com.gocomet.ridepool.common.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ClockConfig {

    /**
     * System clock in the JVM's zone, the same zone Hibernate stamps createdAt with.
     * Peak and night pricing read the hour from it.
     */
    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
