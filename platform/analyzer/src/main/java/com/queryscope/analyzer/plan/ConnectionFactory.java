package com.queryscope.analyzer.plan;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Optional;
import java.util.Properties;

/**
 * Opens connections for plan capture. The caller closes them.
 */
@FunctionalInterface
public interface ConnectionFactory {

    Connection open(String jdbcUrl) throws SQLException;

    /** {@link DriverManager} with optional credentials. */
    static ConnectionFactory driverManager(Optional<String> username, Optional<String> password) {
        return url -> {
            Properties props = new Properties();
            username.ifPresent(u -> props.setProperty("user", u));
            password.ifPresent(p -> props.setProperty("password", p));
            return DriverManager.getConnection(url, props);
        };
    }
}
