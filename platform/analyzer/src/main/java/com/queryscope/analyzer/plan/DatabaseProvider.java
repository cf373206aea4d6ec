package com.queryscope.analyzer.plan;

import java.util.Locale;

/**
 * Database engines recognized by plan capture.
 */
public enum DatabaseProvider {
    AUTO("Auto"),
    SQL_SERVER("SqlServer"),
    POSTGRESQL("PostgreSQL"),
    MYSQL("MySQL"),
    ORACLE("Oracle"),
    SQLITE("SQLite"),
    OTHER("Other"),
    UNKNOWN("Unknown");

    private final String providerName;

    DatabaseProvider(String providerName) {
        this.providerName = providerName;
    }

    /** Stable name used on the wire. */
    public String providerName() {
        return providerName;
    }

    /**
     * Map a JDBC {@code DatabaseMetaData.getDatabaseProductName()} value.
     */
    public static DatabaseProvider fromProductName(String productName) {
        if (productName == null || productName.isBlank()) {
            return UNKNOWN;
        }
        String name = productName.toLowerCase(Locale.ROOT);
        if (name.contains("sql server")) {
            return SQL_SERVER;
        }
        if (name.contains("postgres")) {
            return POSTGRESQL;
        }
        // MariaDB speaks the MySQL EXPLAIN dialect
        if (name.contains("mysql") || name.contains("mariadb")) {
            return MYSQL;
        }
        if (name.contains("oracle")) {
            return ORACLE;
        }
        if (name.contains("sqlite")) {
            return SQLITE;
        }
        return OTHER;
    }
}
