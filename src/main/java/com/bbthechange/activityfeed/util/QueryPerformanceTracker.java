package com.bbthechange.activityfeed.util;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Utility for tracking DynamoDB operation latency.
 * Logs slow operations and records a timer per operation for dashboards.
 */
@Component
public class QueryPerformanceTracker {

    private static final Logger logger = LoggerFactory.getLogger(QueryPerformanceTracker.class);
    private static final long SLOW_QUERY_THRESHOLD_MS = 500L;

    private final MeterRegistry meterRegistry;

    @Autowired
    public QueryPerformanceTracker(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    /**
     * Run a store operation with latency tracking.
     *
     * @param operation The operation name for logging/metrics
     * @param table The table being accessed
     * @param storeOperation The operation to execute
     * @return The result of the operation
     */
    public <T> T trackQuery(String operation, String table, Supplier<T> storeOperation) {
        Timer.Sample sample = Timer.start(meterRegistry);
        long startTime = System.currentTimeMillis();
        String outcome = "success";

        try {
            T result = storeOperation.get();
            long duration = System.currentTimeMillis() - startTime;

            if (duration > SLOW_QUERY_THRESHOLD_MS) {
                logger.warn("Slow DynamoDB operation: operation={}, table={}, duration={}ms",
                    operation, table, duration);
            } else {
                logger.debug("DynamoDB operation completed: operation={}, table={}, duration={}ms",
                    operation, table, duration);
            }
            return result;

        } catch (RuntimeException e) {
            outcome = "error";
            long duration = System.currentTimeMillis() - startTime;
            logger.error("DynamoDB operation failed: operation={}, table={}, duration={}ms, error={}",
                operation, table, duration, e.getMessage());
            throw e;

        } finally {
            sample.stop(Timer.builder("dynamodb.query.duration")
                .tag("operation", operation)
                .tag("table", table)
                .tag("outcome", outcome)
                .register(meterRegistry));
        }
    }

    /**
     * Variant for operations without a result.
     */
    public void track(String operation, String table, Runnable storeOperation) {
        trackQuery(operation, table, () -> {
            storeOperation.run();
            return null;
        });
    }
}
