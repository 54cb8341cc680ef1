package com.echopost.media.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.logging.Level;
import java.util.logging.LogRecord;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DatabaseLogHandlerTest {

    private static final String JDBC_URL = "jdbc:h2:mem:engine-logs;MODE=PostgreSQL;DATABASE_TO_UPPER=false;DB_CLOSE_DELAY=-1";
    private static final String JDBC_USER = "sa";
    private static final String JDBC_PASS = "";

    private static final DatabaseLogHandler.CentralLogSettings SETTINGS =
        new DatabaseLogHandler.CentralLogSettings(JDBC_URL, JDBC_USER, JDBC_PASS, 2);

    @BeforeAll
    static void setUpDatabase() throws SQLException {
        try (Connection connection = DriverManager.getConnection(JDBC_URL, JDBC_USER, JDBC_PASS);
             Statement statement = connection.createStatement()) {
            statement.execute("DROP TABLE IF EXISTS engine_logs");
            statement.execute("""
                CREATE TABLE engine_logs (
                    logged_at     TIMESTAMP NOT NULL,
                    level         VARCHAR(16) NOT NULL,
                    logger        VARCHAR(128),
                    message       TEXT,
                    source_method VARCHAR(256),
                    thread_id     BIGINT,
                    host          VARCHAR(128),
                    thrown_type   VARCHAR(256),
                    thrown_msg    TEXT
                )
                """);
        }
    }

    @AfterEach
    void clearTable() throws SQLException {
        try (Connection connection = DriverManager.getConnection(JDBC_URL, JDBC_USER, JDBC_PASS);
             Statement statement = connection.createStatement()) {
            statement.executeUpdate("DELETE FROM engine_logs");
        }
    }

    @Test
    void publishPersistsFormattedRecord() throws Exception {
        DatabaseLogHandler handler = new DatabaseLogHandler(SETTINGS);
        boolean closed = false;
        try {
            LogRecord record = new LogRecord(Level.INFO, "Resolved {0} of {1} assets");
            record.setLoggerName("com.echopost.media");
            record.setParameters(new Object[]{9, 10});
            record.setSourceClassName("com.echopost.media.core.resolve.BatchMetadataResolver");
            record.setSourceMethodName("resolve");

            handler.publish(record);

            handler.close();
            closed = true;

            try (Connection connection = DriverManager.getConnection(JDBC_URL, JDBC_USER, JDBC_PASS);
                 PreparedStatement statement = connection.prepareStatement(
                     "SELECT level, logger, message, source_method, thrown_type FROM engine_logs")) {
                ResultSet resultSet = statement.executeQuery();
                assertTrue(resultSet.next(), "No log record persisted");
                assertEquals("INFO", resultSet.getString("level"));
                assertEquals("com.echopost.media", resultSet.getString("logger"));
                assertEquals("Resolved 9 of 10 assets", resultSet.getString("message"));
                assertEquals("BatchMetadataResolver#resolve", resultSet.getString("source_method"));
                assertEquals(null, resultSet.getString("thrown_type"));
                assertFalse(resultSet.next());
            }
        } finally {
            if (!closed) {
                handler.close();
            }
        }
    }

    @Test
    void recordsThrownException() throws Exception {
        DatabaseLogHandler handler = new DatabaseLogHandler(SETTINGS);
        LogRecord record = new LogRecord(Level.WARNING, "Skipping album");
        record.setThrown(new IOException("disk went away"));
        handler.publish(record);
        handler.close();

        try (Connection connection = DriverManager.getConnection(JDBC_URL, JDBC_USER, JDBC_PASS);
             PreparedStatement statement = connection.prepareStatement(
                 "SELECT thrown_type, thrown_msg FROM engine_logs")) {
            ResultSet resultSet = statement.executeQuery();
            assertTrue(resultSet.next());
            assertEquals("java.io.IOException", resultSet.getString("thrown_type"));
            assertEquals("disk went away", resultSet.getString("thrown_msg"));
        }
    }

    @Test
    void missingUrlDisablesHandler() {
        assertThrows(IllegalStateException.class,
            () -> new DatabaseLogHandler(new DatabaseLogHandler.CentralLogSettings(null, null, null, 2)));
    }
}
