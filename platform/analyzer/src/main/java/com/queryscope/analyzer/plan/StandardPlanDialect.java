package com.queryscope.analyzer.plan;

import java.util.Optional;

/**
 * Built-in dialects.
 */
public enum StandardPlanDialect implements PlanDialect {

    SQL_SERVER(DatabaseProvider.SQL_SERVER, PlanFormat.XML) {
        @Override
        public Optional<String> enableStatement() {
            return Optional.of("SET SHOWPLAN_XML ON");
        }

        @Override
        public Optional<String> disableStatement() {
            return Optional.of("SET SHOWPLAN_XML OFF");
        }

        @Override
        public String planStatement(String sql) {
            return sql;
        }
    },

    POSTGRESQL(DatabaseProvider.POSTGRESQL, PlanFormat.JSON) {
        @Override
        public String planStatement(String sql) {
            return "EXPLAIN (FORMAT JSON) " + sql;
        }
    },

    MYSQL(DatabaseProvider.MYSQL, PlanFormat.JSON) {
        @Override
        public String planStatement(String sql) {
            return "EXPLAIN FORMAT=JSON " + sql;
        }
    };

    private final DatabaseProvider provider;
    private final PlanFormat format;

    StandardPlanDialect(DatabaseProvider provider, PlanFormat format) {
        this.provider = provider;
        this.format = format;
    }

    @Override
    public DatabaseProvider provider() {
        return provider;
    }

    @Override
    public PlanFormat format() {
        return format;
    }

    @Override
    public Optional<String> enableStatement() {
        return Optional.empty();
    }

    @Override
    public Optional<String> disableStatement() {
        return Optional.empty();
    }

    /** Built-in dialect for a provider, if there is one. */
    public static Optional<PlanDialect> forProvider(DatabaseProvider provider) {
        for (StandardPlanDialect dialect : values()) {
            if (dialect.provider == provider) {
                return Optional.of(dialect);
            }
        }
        return Optional.empty();
    }
}
