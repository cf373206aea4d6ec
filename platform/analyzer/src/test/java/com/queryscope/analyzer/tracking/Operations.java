package com.queryscope.analyzer.tracking;

import java.sql.Connection;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Completed operations for tests that start after tracking.
 */
public final class Operations {

    public static final Instant STARTED = Instant.parse("2025-06-01T12:00:00Z");

    private Operations() {}

    public static CompletedOperation completed(String id, String sql, long elapsedMillis) {
        return completed(id, sql, Map.of(), elapsedMillis, null, null);
    }

    public static CompletedOperation completed(String id, String sql, Map<String, ?> parameters, long elapsedMillis,
                                               Connection connection, Object dataContext) {
        Duration elapsed = Duration.ofMillis(elapsedMillis);
        @SuppressWarnings("unchecked")
        Map<String, Object> params = (Map<String, Object>) parameters;
        return new CompletedOperation(id, new CorrelationKey("conn-" + id, "cmd-" + id), sql, params,
            STARTED, STARTED.plus(elapsed), elapsed, List.of("com.acme.Orders.find(Orders.java:42)"),
            "OrdersContext", connection, dataContext);
    }
}
