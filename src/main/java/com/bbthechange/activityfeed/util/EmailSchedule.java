package com.bbthechange.activityfeed.util;

import com.bbthechange.activityfeed.config.ActivityProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;

/**
 * Decides which scheduled email buckets are due in a mail collection pass.
 *
 * Daily and weekly buckets go out on the hour. A pass collects them when the UTC hour rolls over
 * before the next pass would start, and then takes the slot of the hour that is about to begin.
 */
@Component
public class EmailSchedule {

    private final ActivityProperties properties;

    public EmailSchedule(ActivityProperties properties) {
        this.properties = properties;
    }

    public boolean isDailyCycle(Instant now) {
        return hourRollsOver(now);
    }

    /**
     * Weekly mails can leave a day early or late because of tenant timezones.
     */
    public boolean isWeeklyCycle(Instant now) {
        int today = utc(now).getDayOfWeek().getValue();
        int configured = properties.getMail().getWeeklyDay();
        boolean inWindow = today == configured
                || today == BucketAssigner.previousDay(configured)
                || today == BucketAssigner.nextDay(configured);
        return inWindow && hourRollsOver(now);
    }

    public int dailySlotHour(Instant now) {
        return nextHour(now).getHour();
    }

    public int weeklySlotDay(Instant now) {
        return nextHour(now).getDayOfWeek().getValue();
    }

    public int weeklySlotHour(Instant now) {
        return nextHour(now).getHour();
    }

    private boolean hourRollsOver(Instant now) {
        Duration polling = properties.getMail().getPollingFrequency();
        return utc(now).getHour() != utc(now.plus(polling)).getHour();
    }

    private static ZonedDateTime nextHour(Instant now) {
        return utc(now.plus(Duration.ofHours(1)));
    }

    private static ZonedDateTime utc(Instant instant) {
        return instant.atZone(ZoneOffset.UTC);
    }
}
