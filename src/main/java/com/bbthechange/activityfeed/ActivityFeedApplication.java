package com.bbthechange.activityfeed;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ActivityFeedApplication {

    public static void main(String[] args) {
        SpringApplication.run(ActivityFeedApplication.class, args);
    }
}
