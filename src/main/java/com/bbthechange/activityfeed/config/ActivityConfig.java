package com.bbthechange.activityfeed.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ActivityConfig {

    private static final Logger logger = LoggerFactory.getLogger(ActivityConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Activity type definitions are fixed for the life of the process.
     */
    @Bean
    public ActivityRegistry activityRegistry(ActivityProperties properties) {
        ActivityRegistry registry = ActivityRegistry.fromProperties(properties);
        logger.info("Registered activity types: {}", registry.verbs());
        return registry;
    }
}
