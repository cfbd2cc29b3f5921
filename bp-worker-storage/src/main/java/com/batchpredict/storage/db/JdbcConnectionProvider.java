package com.batchpredict.storage.db;

import com.batchpredict.config.PredictConfig;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Objects;
import java.util.TimeZone;

/**
 * Provides JDBC connections to the dataset database (PostgreSQL, UTC).
 */
public final class JdbcConnectionProvider {

    private final PredictConfig config;

    public JdbcConnectionProvider(PredictConfig config) {
        this.config = Objects.requireNonNull(config, "PredictConfig");
    }

    public Connection getConnection() throws SQLException {
        TimeZone prev = TimeZone.getDefault();
        try {
            TimeZone.setDefault(TimeZone.getTimeZone("UTC"));
            return DriverManager.getConnection(config.getJdbcUrl(), config.getDbUser(),
                    config.getDbPassword() != null ? config.getDbPassword() : "");
        } finally {
            TimeZone.setDefault(prev);
        }
    }
}
