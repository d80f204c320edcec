package com.bbthechange.gallery.util;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Times every DynamoDB call, records a Micrometer timer per operation and flags slow calls.
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
     * @param operation DynamoDB API name (GetItem, Query, TransactWriteItems...)
     * @param table table name for the metric tag
     * @param queryOperation the call to execute
     * @return whatever the call returns
     */
    public <T> T trackQuery(String operation, String table, Supplier<T> queryOperation) {
        Timer.Sample sample = Timer.start(meterRegistry);
        long startTime = System.currentTimeMillis();
        String outcome = "success";

        try {
            T result = queryOperation.get();
            long duration = System.currentTimeMillis() - startTime;
            if (duration > SLOW_QUERY_THRESHOLD_MS) {
                logger.warn("Slow DynamoDB call: operation={}, table={}, duration={}ms",
                    operation, table, duration);
            } else {
                logger.debug("DynamoDB call completed: operation={}, table={}, duration={}ms",
                    operation, table, duration);
            }
            return result;

        } catch (RuntimeException e) {
            outcome = "error";
            logger.debug("DynamoDB call ended with {}: operation={}, table={}, duration={}ms",
                e.getClass().getSimpleName(), operation, table, System.currentTimeMillis() - startTime);
            throw e;

        } finally {
            sample.stop(Timer.builder("dynamodb.query.duration")
                .tag("operation", operation)
                .tag("table", table)
                .tag("outcome", outcome)
                .register(meterRegistry));
        }
    }
}
