package com.bbthechange.activityfeed.util;

import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Generates activity ids of the form {@code <epochMillis>:<random>}. The zero-padded millisecond
 * prefix makes ids sort by creation time.
 */
@Component
public class ActivityIdGenerator {

    private final Clock clock;

    public ActivityIdGenerator(Clock clock) {
        this.clock = clock;
    }

    public String nextId() {
        long suffix = ThreadLocalRandom.current().nextLong() & 0xffffffffL;
        return String.format("%013d:%08x", clock.millis(), suffix);
    }
}
