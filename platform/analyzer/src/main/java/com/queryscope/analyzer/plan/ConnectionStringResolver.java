package com.queryscope.analyzer.plan;

import com.queryscope.analyzer.tracking.CompletedOperation;

import java.util.Optional;

/**
 * Last-resort lookup of a JDBC URL for an operation, used when neither config,
 * the live connection nor the data context provide one.
 */
@FunctionalInterface
public interface ConnectionStringResolver {

    Optional<String> resolve(CompletedOperation operation);

    static ConnectionStringResolver none() {
        return op -> Optional.empty();
    }
}
