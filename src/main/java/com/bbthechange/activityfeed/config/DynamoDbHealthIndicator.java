package com.bbthechange.activityfeed.config;

import com.bbthechange.activityfeed.util.ActivityKeyFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.DescribeTableRequest;
import software.amazon.awssdk.services.dynamodb.model.DescribeTableResponse;
import software.amazon.awssdk.services.dynamodb.model.TableStatus;

/**
 * Health indicator for DynamoDB connectivity and the activity table status.
 */
@Component
public class DynamoDbHealthIndicator implements HealthIndicator {

    private final DynamoDbClient dynamoDbClient;
    private final String region;

    public DynamoDbHealthIndicator(DynamoDbClient dynamoDbClient, @Value("${aws.region:us-west-2}") String region) {
        this.dynamoDbClient = dynamoDbClient;
        this.region = region;
    }

    @Override
    public Health health() {
        try {
            DescribeTableResponse response = dynamoDbClient.describeTable(
                DescribeTableRequest.builder().tableName(ActivityKeyFactory.TABLE_NAME).build()
            );

            TableStatus status = response.table().tableStatus();
            if (status == TableStatus.ACTIVE) {
                return Health.up()
                    .withDetail("activityTable", "ACTIVE")
                    .withDetail("itemCount", response.table().itemCount())
                    .withDetail("region", region)
                    .build();
            }
            return Health.down()
                .withDetail("activityTable", String.valueOf(status))
                .withDetail("reason", "ActivityTable not active")
                .build();

        } catch (Exception e) {
            return Health.down()
                .withDetail("error", "DynamoDB connection failed")
                .withDetail("message", e.getMessage())
                .build();
        }
    }
}
