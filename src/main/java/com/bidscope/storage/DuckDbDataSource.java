package com.bidscope.storage;

import org.duckdb.DuckDBConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.io.PrintWriter;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.sql.Statement;
import java.util.Properties;

/**
 * DataSource over a single DuckDB database instance.
 *
 * <p>One root connection owns the database. Every {@link #getConnection()} hands out a
 * {@link DuckDBConnection#duplicate() duplicate} of it, so all callers share one catalog and one
 * buffer pool, which also makes in-memory databases usable from many threads. Closing a duplicate
 * leaves the database open; {@link #close()} shuts it down.
 */
public class DuckDbDataSource implements DataSource, AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(DuckDbDataSource.class);

    private final String url;
    private final DuckDBConnection root;
    private PrintWriter logWriter;
    private int loginTimeout = 0;

    public DuckDbDataSource(String url) throws SQLException {
        this(url, 0, null);
    }

    /**
     * @param threads     DuckDB worker threads, 0 for the engine default
     * @param memoryLimit DuckDB memory limit such as {@code 4GB}, null for the engine default
     */
    public DuckDbDataSource(String url, int threads, String memoryLimit) throws SQLException {
        this.url = url;
        Properties properties = new Properties();
        properties.setProperty("jdbc_stream_results", "true");
        this.root = (DuckDBConnection) DriverManager.getConnection(url, properties);

        try (Statement statement = root.createStatement()) {
            if (threads > 0) {
                statement.execute("SET threads = " + threads);
            }
            if (memoryLimit != null && !memoryLimit.isBlank()) {
                statement.execute("SET memory_limit = '" + memoryLimit.replace("'", "") + "'");
            }
        }
        logger.info("DuckDB database opened: {} (threads={}, memoryLimit={})",
            url, threads > 0 ? threads : "default", memoryLimit == null ? "default" : memoryLimit);
    }

    public String getUrl() {
        return url;
    }

    @Override
    public Connection getConnection() throws SQLException {
        synchronized (root) {
            if (root.isClosed()) {
                throw new SQLException("DuckDB database is closed: " + url);
            }
            return root.duplicate();
        }
    }

    @Override
    public Connection getConnection(String username, String password) throws SQLException {
        return getConnection();
    }

    @Override
    public void close() throws SQLException {
        synchronized (root) {
            if (!root.isClosed()) {
                root.close();
                logger.info("DuckDB database closed: {}", url);
            }
        }
    }

    @Override
    public PrintWriter getLogWriter() {
        return logWriter;
    }

    @Override
    public void setLogWriter(PrintWriter out) {
        this.logWriter = out;
    }

    @Override
    public void setLoginTimeout(int seconds) {
        this.loginTimeout = seconds;
    }

    @Override
    public int getLoginTimeout() {
        return loginTimeout;
    }

    @Override
    public java.util.logging.Logger getParentLogger() throws SQLFeatureNotSupportedException {
        return java.util.logging.Logger.getLogger(java.util.logging.Logger.GLOBAL_LOGGER_NAME);
    }

    @Override
    public <T> T unwrap(Class<T> iface) throws SQLException {
        if (iface.isInstance(this)) {
            return iface.cast(this);
        }
        throw new SQLException("Cannot unwrap to " + iface);
    }

    @Override
    public boolean isWrapperFor(Class<?> iface) {
        return iface.isInstance(this);
    }
}
