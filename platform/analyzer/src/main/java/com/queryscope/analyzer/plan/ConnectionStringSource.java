package com.queryscope.analyzer.plan;

import java.util.Optional;

/**
 * Implemented by host data contexts that can tell plan capture how to open
 * a separate connection to the same database.
 */
public interface ConnectionStringSource {

    /** JDBC URL, or empty when unknown. */
    Optional<String> connectionString();
}
