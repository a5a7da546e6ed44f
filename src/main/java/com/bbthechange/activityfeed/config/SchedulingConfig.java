package com.bbthechange.activityfeed.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Bucket sweeps run only in processes that have processing switched on.
 */
@Configuration
@EnableScheduling
@ConditionalOnProperty(name = "activity.processing.enabled", havingValue = "true", matchIfMissing = true)
public class SchedulingConfig {
}
