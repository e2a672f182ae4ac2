package com.campusevents.util;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Times every DynamoDB call made by the repositories.
 * Slow calls are logged at warn; all calls are recorded as dynamodb.query.duration.
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
     * Run a DynamoDB operation under a timer.
     *
     * @param operation name used in logs and as the metric's operation tag
     * @param table the table being read or written
     * @param queryOperation the call to execute
     * @return whatever the call returns
     */
    public <T> T trackQuery(String operation, String table, Supplier<T> queryOperation) {
        Timer.Sample sample = Timer.start(meterRegistry);
        long startTime = System.currentTimeMillis();

        try {
            T result = queryOperation.get();
            long duration = System.currentTimeMillis() - startTime;

            if (duration > SLOW_QUERY_THRESHOLD_MS) {
                logger.warn("Slow DynamoDB query detected: operation={}, table={}, duration={}ms",
                    operation, table, duration);
            } else {
                logger.debug("DynamoDB query completed: operation={}, table={}, duration={}ms",
                    operation, table, duration);
            }
            return result;

        } catch (RuntimeException e) {
            long duration = System.currentTimeMillis() - startTime;
            logger.debug("DynamoDB query failed: operation={}, table={}, duration={}ms, error={}",
                operation, table, duration, e.getMessage());
            throw e;

        } finally {
            sample.stop(Timer.builder("dynamodb.query.duration")
                .tag("operation", operation)
                .tag("table", table)
                .register(meterRegistry));
        }
    }
}
