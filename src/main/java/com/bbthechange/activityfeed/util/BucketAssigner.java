package com.bbthechange.activityfeed.util;

import com.bbthechange.activityfeed.config.ActivityProperties;
import com.bbthechange.activityfeed.model.EmailPreference;
import com.bbthechange.activityfeed.model.StreamType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.HexFormat;

/**
 * Maps recipients onto processing buckets.
 *
 * Activity and notification buckets are {@code <stream>:<n>}. Email buckets are further sliced
 * by delivery schedule: {@code email:<n>:immediate}, {@code email:<n>:daily:<utcHour>} and
 * {@code email:<n>:weekly:<isoDay>:<utcHour>}, where the UTC slot is chosen so that the mail
 * arrives at the configured local hour in the recipient's tenant timezone.
 */
@Component
public class BucketAssigner {

    private static final Logger logger = LoggerFactory.getLogger(BucketAssigner.class);

    private final ActivityProperties properties;
    private final Clock clock;

    public BucketAssigner(ActivityProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Stable bucket number for a string: the last four hex digits of its MD5, modulo the bucket count.
     */
    public static int bucketNumber(String value, int numberOfBuckets) {
        try {
            byte[] md5 = MessageDigest.getInstance("MD5").digest(value.getBytes(StandardCharsets.UTF_8));
            String hex = HexFormat.of().formatHex(md5);
            return Integer.parseInt(hex.substring(hex.length() - 4), 16) % numberOfBuckets;
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 not available", e);
        }
    }

    public int bucketNumber(String recipientId) {
        return bucketNumber(recipientId, properties.getNumberOfBuckets());
    }

    public String streamBucketId(StreamType streamType, String recipientId) {
        if (streamType == StreamType.EMAIL) {
            throw new IllegalArgumentException("Email buckets depend on the recipient's preference");
        }
        return bucketId(streamType, bucketNumber(recipientId));
    }

    /**
     * Email bucket for a recipient. Callers must filter out {@link EmailPreference#NEVER} first.
     */
    public String emailBucketId(String recipientId, EmailPreference preference, String timezone) {
        int bucketNumber = bucketNumber(recipientId);
        ActivityProperties.Mail mail = properties.getMail();
        return switch (preference) {
            case IMMEDIATE -> immediateEmailBucketId(bucketNumber);
            case DAILY -> dailyEmailBucketId(bucketNumber, Math.floorMod(toUtcHour(mail.getDailyHour(), timezone), 24));
            case WEEKLY -> {
                int utcHour = toUtcHour(mail.getWeeklyHour(), timezone);
                int day = mail.getWeeklyDay();
                if (utcHour < 0) {
                    day = previousDay(day);
                } else if (utcHour >= 24) {
                    day = nextDay(day);
                }
                yield weeklyEmailBucketId(bucketNumber, day, Math.floorMod(utcHour, 24));
            }
            case NEVER -> throw new IllegalArgumentException("Recipient " + recipientId + " does not receive email");
        };
    }

    /**
     * Local hour shifted into UTC. May fall outside 0-23, which means the previous or next UTC day.
     */
    private int toUtcHour(int localHour, String timezone) {
        int offsetSeconds = resolveZone(timezone).getRules().getOffset(clock.instant()).getTotalSeconds();
        return localHour - Math.floorDiv(offsetSeconds, 3600);
    }

    private ZoneId resolveZone(String timezone) {
        String fallback = properties.getMail().getDefaultTimezone();
        if (timezone == null || timezone.isBlank()) {
            return ZoneId.of(fallback);
        }
        try {
            return ZoneId.of(timezone);
        } catch (DateTimeException e) {
            logger.warn("Unknown timezone {}, scheduling email in {}", timezone, fallback);
            return ZoneId.of(fallback);
        }
    }

    public static String bucketId(StreamType streamType, int bucketNumber) {
        return streamType.bucketPrefix() + ":" + bucketNumber;
    }

    public static String immediateEmailBucketId(int bucketNumber) {
        return bucketId(StreamType.EMAIL, bucketNumber) + ":immediate";
    }

    public static String dailyEmailBucketId(int bucketNumber, int utcHour) {
        return bucketId(StreamType.EMAIL, bucketNumber) + ":daily:" + utcHour;
    }

    public static String weeklyEmailBucketId(int bucketNumber, int isoDayOfWeek, int utcHour) {
        return bucketId(StreamType.EMAIL, bucketNumber) + ":weekly:" + isoDayOfWeek + ":" + utcHour;
    }

    /**
     * Delivery preference an email bucket was created for.
     */
    public static EmailPreference emailPreferenceOf(String emailBucketId) {
        if (emailBucketId.contains(":daily:")) {
            return EmailPreference.DAILY;
        }
        if (emailBucketId.contains(":weekly:")) {
            return EmailPreference.WEEKLY;
        }
        if (emailBucketId.endsWith(":immediate")) {
            return EmailPreference.IMMEDIATE;
        }
        throw new IllegalArgumentException("Not an email bucket: " + emailBucketId);
    }

    static int previousDay(int isoDay) {
        return isoDay == 1 ? 7 : isoDay - 1;
    }

    static int nextDay(int isoDay) {
        return isoDay == 7 ? 1 : isoDay + 1;
    }
}
