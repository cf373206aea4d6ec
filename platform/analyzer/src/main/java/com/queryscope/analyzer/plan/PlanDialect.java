package com.queryscope.analyzer.plan;

import java.util.Optional;

/**
 * How one database engine is asked for an estimated plan.
 *
 * Engines with a session toggle (SQL Server's SHOWPLAN) return the enable and
 * disable statements and run the query text unchanged; engines with an EXPLAIN
 * prefix return no toggles and wrap the query.
 */
public interface PlanDialect {

    DatabaseProvider provider();

    PlanFormat format();

    /** Statement that switches the session into plan-only mode, if any. */
    Optional<String> enableStatement();

    /** Statement that restores normal execution, if any. */
    Optional<String> disableStatement();

    /** The statement whose first row, first column is the plan. */
    String planStatement(String sql);

    default boolean togglesSession() {
        return enableStatement().isPresent();
    }
}
