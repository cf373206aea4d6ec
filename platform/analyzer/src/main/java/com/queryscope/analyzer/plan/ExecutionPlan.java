package com.queryscope.analyzer.plan;

import java.util.Objects;

/**
 * A captured execution plan.
 */
public record ExecutionPlan(DatabaseProvider provider, PlanFormat format, String content) {

    public ExecutionPlan {
        Objects.requireNonNull(provider, "provider");
        Objects.requireNonNull(format, "format");
        Objects.requireNonNull(content, "content");
    }
}
