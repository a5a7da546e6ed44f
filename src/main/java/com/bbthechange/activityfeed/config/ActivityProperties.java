package com.bbthechange.activityfeed.config;

import com.bbthechange.activityfeed.model.PivotField;
import com.bbthechange.activityfeed.model.StreamRoute;
import com.bbthechange.activityfeed.model.StreamType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Engine settings bound from the {@code activity.*} namespace, including the activity type
 * definitions that are turned into the {@link ActivityRegistry} at startup.
 */
@Component
@Validated
@ConfigurationProperties(prefix = "activity")
public class ActivityProperties {

    @Min(1)
    private int numberOfBuckets = 3;

    @Valid
    private Aggregation aggregation = new Aggregation();

    @Valid
    private CollectionSettings collection = new CollectionSettings();

    @Valid
    private Mail mail = new Mail();

    @Valid
    private Queues queues = new Queues();

    private Processing processing = new Processing();

    @Valid
    private List<TypeConfig> types = new ArrayList<>();

    public int getNumberOfBuckets() {
        return numberOfBuckets;
    }

    public void setNumberOfBuckets(int numberOfBuckets) {
        this.numberOfBuckets = numberOfBuckets;
    }

    public Aggregation getAggregation() {
        return aggregation;
    }

    public void setAggregation(Aggregation aggregation) {
        this.aggregation = aggregation;
    }

    public CollectionSettings getCollection() {
        return collection;
    }

    public void setCollection(CollectionSettings collection) {
        this.collection = collection;
    }

    public Mail getMail() {
        return mail;
    }

    public void setMail(Mail mail) {
        this.mail = mail;
    }

    public Queues getQueues() {
        return queues;
    }

    public void setQueues(Queues queues) {
        this.queues = queues;
    }

    public Processing getProcessing() {
        return processing;
    }

    public void setProcessing(Processing processing) {
        this.processing = processing;
    }

    public List<TypeConfig> getTypes() {
        return types;
    }

    public void setTypes(List<TypeConfig> types) {
        this.types = types;
    }

    @Data
    public static class Aggregation {
        /** Merge window for rules that do not set their own. */
        @DurationUnit(ChronoUnit.SECONDS)
        private Duration defaultMergeWindow = Duration.ofHours(3);

        @Min(1)
        private int maxCasAttempts = 5;
    }

    @Data
    public static class CollectionSettings {
        @DurationUnit(ChronoUnit.SECONDS)
        private Duration leaseDuration = Duration.ofSeconds(60);

        @Min(1)
        private int maxConcurrentCollections = 3;

        @Min(1)
        private int batchSize = 1000;

        /** Delay between activity-bucket sweeps. Read by the scheduler as an ISO-8601 duration. */
        private Duration activityInterval = Duration.ofSeconds(10);

        private Duration notificationInterval = Duration.ofSeconds(10);
    }

    @Data
    public static class Processing {
        /** Run the ingest listener and the bucket sweeps in this process. */
        private boolean enabled = true;
    }

    @Data
    public static class Mail {
        @DurationUnit(ChronoUnit.SECONDS)
        private Duration pollingFrequency = Duration.ofMinutes(15);

        @DurationUnit(ChronoUnit.SECONDS)
        private Duration gracePeriod = Duration.ofMinutes(3);

        @Min(0)
        @Max(23)
        private int dailyHour = 8;

        /** ISO day of week, 1 = Monday. */
        @Min(1)
        @Max(7)
        private int weeklyDay = 5;

        @Min(0)
        @Max(23)
        private int weeklyHour = 12;

        @NotBlank
        private String defaultTimezone = "UTC";
    }

    @Data
    public static class Queues {
        private String ingestQueueName = "activity-events";
        private String ingestQueueUrl = "";
        private String emailDigestQueueUrl = "";

        @Min(1)
        private int maxConcurrentMessages = 10;
    }

    @Data
    public static class TypeConfig {
        @NotBlank
        private String verb;

        @Valid
        private List<RuleConfig> grouping = new ArrayList<>();

        @Valid
        private List<RouteConfig> routes = new ArrayList<>();
    }

    @Data
    public static class RuleConfig {
        @NotBlank
        private String ruleId;

        private Set<PivotField> pivots = EnumSet.noneOf(PivotField.class);

        /** Falls back to the aggregation default when unset. */
        @DurationUnit(ChronoUnit.SECONDS)
        private Duration mergeWindow;
    }

    @Data
    public static class RouteConfig {
        @NotNull
        private StreamType stream;

        @NotNull
        private PivotField entity;

        private StreamRoute.Association association = StreamRoute.Association.SELF;

        private boolean excludeActors;
    }
}
