package com.queryscope.analyzer.plan;

import java.sql.Connection;
import java.util.Objects;

/**
 * Where plan capture gets its connection from.
 *
 * Only {@link Source#REUSED_CONNECTION} carries a live connection, which
 * belongs to the host and is never closed here. Every other source carries a
 * JDBC URL for a connection opened and closed by the capture itself.
 */
public record ConnectionStrategy(Source source, String jdbcUrl, Connection connection) {

    public enum Source {
        CONFIGURED,
        REUSED_CONNECTION,
        DATA_CONTEXT,
        FALLBACK_RESOLVER
    }

    public ConnectionStrategy {
        Objects.requireNonNull(source, "source");
        if (source == Source.REUSED_CONNECTION) {
            Objects.requireNonNull(connection, "connection");
        } else {
            Objects.requireNonNull(jdbcUrl, "jdbcUrl");
        }
    }

    static ConnectionStrategy open(Source source, String jdbcUrl) {
        return new ConnectionStrategy(source, jdbcUrl, null);
    }

    static ConnectionStrategy reuse(Connection connection) {
        return new ConnectionStrategy(Source.REUSED_CONNECTION, null, connection);
    }

    public boolean ownsConnection() {
        return source != Source.REUSED_CONNECTION;
    }

    @Override
    public String toString() {
        return ownsConnection() ? source + "(" + redact(jdbcUrl) + ")" : source.toString();
    }

    private static String redact(String url) {
        int query = url.indexOf('?');
        int semi = url.indexOf(';');
        int cut = query < 0 ? semi : semi < 0 ? query : Math.min(query, semi);
        return cut < 0 ? url : url.substring(0, cut);
    }
}
