package com.bbthechange.activityfeed.config;

import com.bbthechange.activityfeed.model.BaseItem;
import com.bbthechange.activityfeed.util.ActivityKeyFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.enhanced.dynamodb.model.CreateTableEnhancedRequest;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.DynamoDbException;
import software.amazon.awssdk.services.dynamodb.model.ProvisionedThroughput;
import software.amazon.awssdk.services.dynamodb.model.ResourceNotFoundException;
import software.amazon.awssdk.services.dynamodb.model.TimeToLiveSpecification;
import software.amazon.awssdk.services.dynamodb.model.UpdateTimeToLiveRequest;

/**
 * Creates the single activity table on startup when it is missing, for local and test stacks.
 * Aggregate states, leases and delivered entries all carry an {@code expiresAt} TTL attribute.
 */
@Component
@ConditionalOnProperty(name = "dynamodb.table.init.enabled", havingValue = "true", matchIfMissing = true)
public class DynamoDBTableInitializer implements ApplicationRunner {

    private static final Logger logger = LoggerFactory.getLogger(DynamoDBTableInitializer.class);

    static final String TTL_ATTRIBUTE = "expiresAt";

    private final DynamoDbEnhancedClient dynamoDbEnhancedClient;
    private final DynamoDbClient dynamoDbClient;

    public DynamoDBTableInitializer(DynamoDbEnhancedClient dynamoDbEnhancedClient, DynamoDbClient dynamoDbClient) {
        this.dynamoDbEnhancedClient = dynamoDbEnhancedClient;
        this.dynamoDbClient = dynamoDbClient;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (createTableIfNotExists(ActivityKeyFactory.TABLE_NAME)) {
            configureTTL(ActivityKeyFactory.TABLE_NAME, TTL_ATTRIBUTE);
        }
    }

    /**
     * @return true if the table was created by this call
     */
    boolean createTableIfNotExists(String tableName) {
        DynamoDbTable<BaseItem> table = dynamoDbEnhancedClient.table(tableName, TableSchema.fromBean(BaseItem.class));
        try {
            table.describeTable();
            logger.info("Table {} already exists", tableName);
            return false;
        } catch (ResourceNotFoundException e) {
            logger.info("Creating table: {}", tableName);
            table.createTable(CreateTableEnhancedRequest.builder()
                    .provisionedThroughput(ProvisionedThroughput.builder()
                            .readCapacityUnits(5L)
                            .writeCapacityUnits(5L)
                            .build())
                    .build());
            dynamoDbClient.waiter().waitUntilTableExists(b -> b.tableName(tableName));
            logger.info("Table {} created successfully", tableName);
            return true;
        } catch (Exception e) {
            logger.error("Error creating table {}: {}", tableName, e.getMessage());
            throw e;
        }
    }

    private void configureTTL(String tableName, String ttlAttributeName) {
        try {
            logger.info("Configuring TTL for table {} on attribute {}", tableName, ttlAttributeName);
            dynamoDbClient.updateTimeToLive(UpdateTimeToLiveRequest.builder()
                    .tableName(tableName)
                    .timeToLiveSpecification(TimeToLiveSpecification.builder()
                            .attributeName(ttlAttributeName)
                            .enabled(true)
                            .build())
                    .build());
        } catch (DynamoDbException e) {
            logger.warn("Could not configure TTL for table {} on attribute {}: {}",
                tableName, ttlAttributeName, e.getMessage());
        }
    }
}
