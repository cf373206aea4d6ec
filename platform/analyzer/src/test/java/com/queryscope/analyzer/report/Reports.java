package com.queryscope.analyzer.report;

import com.queryscope.analyzer.plan.ExecutionPlan;
import com.queryscope.analyzer.tracking.Operations;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

final class Reports {

    private Reports() {}

    static SlowQueryReport sample(String id) {
        return sample(id, null);
    }

    static SlowQueryReport sample(String id, ExecutionPlan plan) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("@id", 42);
        params.put("@note", null);
        return SlowQueryReport.of(
            Operations.completed(id, "SELECT * FROM orders WHERE id = @id", params, 1500, null, null),
            new ReportEnvironment("production", Optional.of("shop"), Optional.empty()),
            plan);
    }
}
