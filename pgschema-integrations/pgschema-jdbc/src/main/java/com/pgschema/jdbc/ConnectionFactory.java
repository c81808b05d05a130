package com.pgschema.jdbc;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;

/** Opens a fresh connection for each executed statement. */
@FunctionalInterface
public interface ConnectionFactory {

    Connection open() throws SQLException;

    /** A factory backed by {@link DriverManager} and the given settings. */
    static ConnectionFactory driverManager(JdbcExecutorConfig config) {
        return () -> DriverManager.getConnection(config.getUrl(), config.getDriverProperties());
    }
}
