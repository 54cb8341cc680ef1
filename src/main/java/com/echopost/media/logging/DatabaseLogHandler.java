package com.echopost.media.logging;

import com.echopost.media.config.SettingSources;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.text.MessageFormat;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;

/**
 * Ships engine log records to the central log database in small JDBC batches.
 * Construction fails with {@link IllegalStateException} when no JDBC URL is configured.
 */
public final class DatabaseLogHandler extends Handler {

    static final String RESOURCE_NAME = "logging-db.properties";
    private static final int MAX_BATCH = 50;
    private static final long POLL_MILLIS = 250;

    private static final String INSERT_SQL = """
        INSERT INTO engine_logs (
            logged_at,
            level,
            logger,
            message,
            source_method,
            thread_id,
            host,
            thrown_type,
            thrown_msg
        ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
        """;

    private final BlockingQueue<LogRecord> queue = new LinkedBlockingQueue<>(1024);
    private final HikariDataSource dataSource;
    private final String hostName;
    private final Thread worker;

    private volatile boolean running = true;

    public DatabaseLogHandler() {
        this(CentralLogSettings.load(SettingSources.fromClasspath(RESOURCE_NAME)));
    }

    DatabaseLogHandler(CentralLogSettings settings) {
        if (settings.url() == null) {
            throw new IllegalStateException("no JDBC URL configured for engine logs");
        }
        this.dataSource = createDataSource(settings);
        this.hostName = resolveHostName();
        this.worker = new Thread(this::drainLoop, "engine-log-writer");
        this.worker.setDaemon(true);
        this.worker.start();
        setLevel(Level.ALL);
    }

    private void drainLoop() {
        List<LogRecord> batch = new ArrayList<>(MAX_BATCH);
        while (running && !Thread.currentThread().isInterrupted()) {
            try {
                LogRecord first = queue.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
                if (first == null) {
                    continue;
                }
                batch.add(first);
                queue.drainTo(batch, MAX_BATCH - 1);
                writeBatch(batch);
            } catch (InterruptedException interrupted) {
                Thread.currentThread().interrupt();
            } catch (SQLException | RuntimeException ex) {
                System.err.println("DatabaseLogHandler failure: " + ex.getMessage());
            } finally {
                batch.clear();
            }
        }

        queue.drainTo(batch);
        if (!batch.isEmpty()) {
            try {
                writeBatch(batch);
            } catch (SQLException | RuntimeException ex) {
                System.err.println("DatabaseLogHandler shutdown failure: " + ex.getMessage());
            }
        }
    }

    @Override
    public void publish(LogRecord record) {
        Objects.requireNonNull(record);
        if (!isLoggable(record) || !running) {
            return;
        }
        if (!queue.offer(record)) {
            queue.poll();
            queue.offer(record);
        }
    }

    @Override
    public void flush() {
        // records are written by the worker thread
    }

    @Override
    public void close() throws SecurityException {
        running = false;
        try {
            // the worker exits after its current poll and flushes what is queued
            worker.join(TimeUnit.SECONDS.toMillis(2));
            if (worker.isAlive()) {
                worker.interrupt();
                worker.join(TimeUnit.SECONDS.toMillis(1));
            }
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
        }
        dataSource.close();
    }

    private void writeBatch(List<LogRecord> records) throws SQLException {
        try (Connection connection = dataSource.getConnection();
             PreparedStatement statement = connection.prepareStatement(INSERT_SQL)) {
            for (LogRecord record : records) {
                statement.setTimestamp(1, Timestamp.from(Instant.ofEpochMilli(record.getMillis())));
                statement.setString(2, record.getLevel().getName());
                statement.setString(3, record.getLoggerName());
                statement.setString(4, renderMessage(record));
                statement.setString(5, sourceMethod(record));
                statement.setLong(6, record.getLongThreadID());
                statement.setString(7, hostName);
                Throwable thrown = record.getThrown();
                statement.setString(8, thrown == null ? null : thrown.getClass().getName());
                statement.setString(9, thrown == null ? null : thrown.getMessage());
                statement.addBatch();
            }
            statement.executeBatch();
        }
    }

    private static String renderMessage(LogRecord record) {
        String message = record.getMessage();
        Object[] params = record.getParameters();
        if (message == null) {
            return "";
        }
        if (params == null || params.length == 0) {
            return message;
        }
        try {
            return MessageFormat.format(message, params);
        } catch (IllegalArgumentException ex) {
            return message;
        }
    }

    private static String sourceMethod(LogRecord record) {
        if (record.getSourceClassName() == null) {
            return null;
        }
        String simple = record.getSourceClassName().substring(record.getSourceClassName().lastIndexOf('.') + 1);
        return record.getSourceMethodName() == null ? simple : simple + "#" + record.getSourceMethodName();
    }

    private static String resolveHostName() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            return "unknown-host";
        }
    }

    private static HikariDataSource createDataSource(CentralLogSettings settings) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(settings.url());
        hikariConfig.setUsername(settings.username());
        hikariConfig.setPassword(settings.password());
        hikariConfig.setMaximumPoolSize(settings.poolSize());
        hikariConfig.setPoolName("EngineLogPool");
        hikariConfig.setAutoCommit(true);
        hikariConfig.setInitializationFailTimeout(-1);
        return new HikariDataSource(hikariConfig);
    }

    record CentralLogSettings(String url, String username, String password, int poolSize) {

        static CentralLogSettings load(SettingSources sources) {
            return new CentralLogSettings(
                sources.lookup("logging.jdbc.url", "jdbc.url"),
                sources.lookup("logging.jdbc.user", "jdbc.username"),
                sources.lookup("logging.jdbc.pass", "jdbc.password"),
                sources.intValue("logging.jdbc.poolSize", "jdbc.poolSize", 2)
            );
        }
    }
}
