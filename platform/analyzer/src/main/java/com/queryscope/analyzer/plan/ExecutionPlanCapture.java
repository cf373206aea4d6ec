package com.queryscope.analyzer.plan;

import com.queryscope.analyzer.config.AnalyzerConfig.PlanCaptureConfig;
import com.queryscope.analyzer.plan.ConnectionStrategy.Source;
import com.queryscope.analyzer.tracking.CompletedOperation;
import com.queryscope.platform.base.Result;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Objects;
import java.util.Optional;

import static com.queryscope.platform.observe.Log.*;

/**
 * Captures the estimated execution plan of a completed operation.
 *
 * Runs on the analysis worker only. The session is switched into plan-only
 * mode, the command (with literals inlined) is executed, and the session is
 * switched back in a finally block. Every failure yields an empty result.
 */
public final class ExecutionPlanCapture {

    private final PlanCaptureConfig config;
    private final ConnectionFactory connectionFactory;
    private final ConnectionStringResolver resolver;
    private final PlanDialect configuredDialect;

    /**
     * @param dialect explicit dialect, or null to pick one from config or the connection metadata
     */
    public ExecutionPlanCapture(PlanCaptureConfig config, ConnectionFactory connectionFactory,
                                ConnectionStringResolver resolver, PlanDialect dialect) {
        this.config = Objects.requireNonNull(config, "config");
        this.connectionFactory = Objects.requireNonNull(connectionFactory, "connectionFactory");
        this.resolver = resolver == null ? ConnectionStringResolver.none() : resolver;
        this.configuredDialect = dialect;
    }

    public Optional<ExecutionPlan> capture(CompletedOperation operation) {
        Optional<ConnectionStrategy> strategy;
        try {
            strategy = selectStrategy(operation);
        } catch (RuntimeException e) {
            warn("Connection strategy selection failed for operation {}: {}", operation.operationId(), e.toString());
            return Optional.empty();
        }
        if (strategy.isEmpty()) {
            warn("No connection available to capture execution plan for operation {}", operation.operationId());
            return Optional.empty();
        }
        debug("Capturing execution plan for operation {} via {}", operation.operationId(), strategy.get());
        try {
            return traced("queryscope.plan_capture", () -> captureWith(strategy.get(), operation));
        } catch (RuntimeException e) {
            error("Unexpected failure capturing execution plan for operation {}", operation.operationId(), e);
            return Optional.empty();
        }
    }

    /**
     * Configured URL, then the live connection, then the data context, then the resolver.
     * A reused live connection is never closed here; the host may see its session
     * in plan-only mode while the capture runs.
     */
    public Optional<ConnectionStrategy> selectStrategy(CompletedOperation operation) {
        if (config.connectionString().isPresent()) {
            return Optional.of(ConnectionStrategy.open(Source.CONFIGURED, config.connectionString().get()));
        }
        Connection live = operation.connection();
        if (live != null && isOpen(live)) {
            return Optional.of(ConnectionStrategy.reuse(live));
        }
        if (operation.dataContext() instanceof ConnectionStringSource source) {
            Optional<String> url = source.connectionString().filter(s -> !s.isBlank());
            if (url.isPresent()) {
                return Optional.of(ConnectionStrategy.open(Source.DATA_CONTEXT, url.get()));
            }
        }
        return resolver.resolve(operation)
            .filter(s -> !s.isBlank())
            .map(url -> ConnectionStrategy.open(Source.FALLBACK_RESOLVER, url));
    }

    private Optional<ExecutionPlan> captureWith(ConnectionStrategy strategy, CompletedOperation operation) {
        if (!strategy.ownsConnection()) {
            return captureOn(strategy.connection(), operation);
        }
        try (Connection connection = connectionFactory.open(strategy.jdbcUrl())) {
            return captureOn(connection, operation);
        } catch (SQLException e) {
            warn("Could not open plan capture connection ({}) for operation {}: {}",
                strategy, operation.operationId(), e.getMessage());
            return Optional.empty();
        }
    }

    Optional<ExecutionPlan> captureOn(Connection connection, CompletedOperation operation) {
        Optional<PlanDialect> dialect = dialectFor(connection);
        if (dialect.isEmpty()) {
            return Optional.empty();
        }
        PlanDialect d = dialect.get();
        String sql = d.planStatement(SqlLiterals.substitute(operation.commandText(), operation.parameters()));

        try {
            if (d.enableStatement().isPresent()) {
                execute(connection, d.enableStatement().get());
            }
        } catch (SQLException e) {
            warn("Could not enable plan mode for operation {}: {}", operation.operationId(), e.getMessage());
            return Optional.empty();
        }

        try {
            return readPlan(connection, sql).map(content -> new ExecutionPlan(d.provider(), d.format(), content));
        } catch (SQLException e) {
            warn("Execution plan query failed for operation {}: {}", operation.operationId(), e.getMessage());
            return Optional.empty();
        } finally {
            disable(connection, d, operation);
        }
    }

    private Optional<String> readPlan(Connection connection, String sql) throws SQLException {
        try (Statement statement = connection.createStatement()) {
            statement.setQueryTimeout(config.timeoutSeconds());
            if (!statement.execute(sql)) {
                return Optional.empty();
            }
            try (ResultSet rs = statement.getResultSet()) {
                if (rs != null && rs.next()) {
                    return Optional.ofNullable(rs.getString(1)).filter(s -> !s.isEmpty());
                }
                return Optional.empty();
            }
        }
    }

    private void disable(Connection connection, PlanDialect dialect, CompletedOperation operation) {
        if (dialect.disableStatement().isEmpty() || !isOpen(connection)) {
            return;
        }
        Result.run(() -> execute(connection, dialect.disableStatement().get()))
            .onFailure(e -> warn("Could not disable plan mode after operation {}: {}",
                operation.operationId(), e.toString()));
    }

    private void execute(Connection connection, String sql) throws SQLException {
        try (Statement statement = connection.createStatement()) {
            statement.setQueryTimeout(config.timeoutSeconds());
            statement.execute(sql);
        }
    }

    Optional<PlanDialect> dialectFor(Connection connection) {
        if (configuredDialect != null) {
            return Optional.of(configuredDialect);
        }
        DatabaseProvider provider = config.databaseProvider();
        if (provider == DatabaseProvider.AUTO) {
            provider = detectProvider(connection);
        }
        Optional<PlanDialect> dialect = StandardPlanDialect.forProvider(provider);
        if (dialect.isEmpty()) {
            warn("Execution plan capture not supported for database provider {}", provider.providerName());
        }
        return dialect;
    }

    private static DatabaseProvider detectProvider(Connection connection) {
        return Result.of(() -> connection.getMetaData().getDatabaseProductName())
            .map(DatabaseProvider::fromProductName)
            .onFailure(e -> warn("Could not read database product name: {}", e.getMessage()))
            .getOrElse(DatabaseProvider.UNKNOWN);
    }

    private static boolean isOpen(Connection connection) {
        return Result.of(() -> !connection.isClosed()).getOrElse(false);
    }
}
