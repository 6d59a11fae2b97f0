package com.postqueue.db;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Array;
import java.sql.Blob;
import java.sql.CallableStatement;
import java.sql.Clob;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.DriverManager;
import java.sql.NClob;
import java.sql.PreparedStatement;
import java.sql.SQLClientInfoException;
import java.sql.SQLException;
import java.sql.SQLWarning;
import java.sql.SQLXML;
import java.sql.Savepoint;
import java.sql.Statement;
import java.sql.Struct;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

// Fixed-size JDBC connection pool for the H2 job database
public class Database {
    private static final Logger logger = Logger.getLogger(Database.class.getName());

    public static final String DEFAULT_URL = "jdbc:h2:./postqueue;AUTO_SERVER=TRUE";
    private static final String SCHEMA_RESOURCE = "/schema.sql";
    private static final int CONNECTION_TIMEOUT_SECONDS = 30;

    private final String url;
    private final String user;
    private final String password;
    private final int poolSize;
    private final BlockingQueue<Connection> connectionPool;
    private volatile boolean initialized = false;
    private volatile boolean closed = false;

    public Database() {
        this(DEFAULT_URL, "sa", "", 10);
    }

    public Database(String url, String user, String password, int poolSize) {
        if (poolSize < 1) {
            throw new IllegalArgumentException("poolSize must be at least 1");
        }
        this.url = url;
        this.user = user;
        this.password = password;
        this.poolSize = poolSize;
        this.connectionPool = new ArrayBlockingQueue<>(poolSize);
    }

    public synchronized void initialize() throws SQLException {
        if (initialized) {
            logger.fine("Database already initialized");
            return;
        }

        logger.info("Initializing database connection pool for " + url);
        for (int i = 0; i < poolSize; i++) {
            connectionPool.offer(createConnection());
        }
        logger.info("Connection pool created with " + poolSize + " connections");

        initializeSchema();
        initialized = true;
    }

    private Connection createConnection() throws SQLException {
        return DriverManager.getConnection(url, user, password);
    }

    public Connection getConnection() throws SQLException {
        if (!initialized) {
            throw new SQLException("Database not initialized. Call initialize() first.");
        }
        if (closed) {
            throw new SQLException("Database has been closed");
        }

        try {
            Connection conn = connectionPool.poll(CONNECTION_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            if (conn == null) {
                throw new SQLException("Timeout waiting for available connection");
            }
            if (conn.isClosed() || !conn.isValid(2)) {
                logger.warning("Pooled connection invalid, opening a new one");
                conn = createConnection();
            }
            return new PooledConnection(conn, this);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SQLException("Interrupted while waiting for connection", e);
        }
    }

    // Return connection to pool (called when a pooled connection is closed)
    synchronized void returnConnection(Connection connection) {
        if (connection == null) {
            return;
        }
        if (closed) {
            closeQuietly(connection);
            return;
        }

        try {
            if (!connection.getAutoCommit()) {
                connection.rollback();
                connection.setAutoCommit(true);
            }
            if (connection.isClosed() || !connection.isValid(2)) {
                closeQuietly(connection);
                connection = createConnection();
            }
            if (!connectionPool.offer(connection)) {
                logger.warning("Connection pool full, closing returned connection");
                closeQuietly(connection);
            }
        } catch (SQLException e) {
            logger.log(Level.WARNING, "Error returning connection to pool", e);
            closeQuietly(connection);
        }
    }

    private void closeQuietly(Connection conn) {
        try {
            conn.close();
        } catch (SQLException e) {
            logger.log(Level.FINE, "Failed to close connection", e);
        }
    }

    // Runs schema.sql from the classpath; statements are terminated by ';' at end of line
    private void initializeSchema() throws SQLException {
        String schema;
        try (InputStream in = Database.class.getResourceAsStream(SCHEMA_RESOURCE)) {
            if (in == null) {
                throw new SQLException("Schema resource not found: " + SCHEMA_RESOURCE);
            }
            schema = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new SQLException("Failed to read schema resource", e);
        }

        Connection conn = connectionPool.peek();
        if (conn == null) {
            throw new SQLException("No connection available for schema initialization");
        }

        int executedCount = 0;
        try (Statement stmt = conn.createStatement()) {
            StringBuilder currentStatement = new StringBuilder();
            for (String line : schema.split("\n")) {
                line = line.trim();
                if (line.startsWith("--") || line.isEmpty()) {
                    continue;
                }
                currentStatement.append(line).append(' ');
                if (line.endsWith(";")) {
                    String sql = currentStatement.toString().trim();
                    sql = sql.substring(0, sql.length() - 1).trim();
                    if (!sql.isEmpty()) {
                        stmt.execute(sql);
                        executedCount++;
                    }
                    currentStatement = new StringBuilder();
                }
            }
        }
        logger.info("Database schema initialized (" + executedCount + " statements)");
    }

    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;

        Connection conn;
        int closedCount = 0;
        while ((conn = connectionPool.poll()) != null) {
            closeQuietly(conn);
            closedCount++;
        }
        logger.info("Closed " + closedCount + " database connections");
    }

    int availableConnections() {
        return connectionPool.size();
    }

    public boolean isInitialized() {
        return initialized;
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Connection handed out by {@link #getConnection()}. Closing it returns the
     * physical connection to the pool instead of closing it; any other call
     * after that fails.
     */
    private static final class PooledConnection implements Connection {
        private final Connection delegate;
        private final Database database;
        private final AtomicBoolean released = new AtomicBoolean(false);

        PooledConnection(Connection delegate, Database database) {
            this.delegate = delegate;
            this.database = database;
        }

        private Connection live() throws SQLException {
            if (released.get()) {
                throw new SQLException("Connection already returned to pool");
            }
            return delegate;
        }

        @Override
        public void close() {
            if (released.compareAndSet(false, true)) {
                database.returnConnection(delegate);
            }
        }

        @Override
        public boolean isClosed() throws SQLException {
            return released.get() || delegate.isClosed();
        }

        @Override
        public Statement createStatement() throws SQLException {
            return live().createStatement();
        }

        @Override
        public Statement createStatement(int resultSetType, int resultSetConcurrency) throws SQLException {
            return live().createStatement(resultSetType, resultSetConcurrency);
        }

        @Override
        public Statement createStatement(int resultSetType, int resultSetConcurrency, int resultSetHoldability)
                throws SQLException {
            return live().createStatement(resultSetType, resultSetConcurrency, resultSetHoldability);
        }

        @Override
        public PreparedStatement prepareStatement(String sql) throws SQLException {
            return live().prepareStatement(sql);
        }

        @Override
        public PreparedStatement prepareStatement(String sql, int autoGeneratedKeys) throws SQLException {
            return live().prepareStatement(sql, autoGeneratedKeys);
        }

        @Override
        public PreparedStatement prepareStatement(String sql, int[] columnIndexes) throws SQLException {
            return live().prepareStatement(sql, columnIndexes);
        }

        @Override
        public PreparedStatement prepareStatement(String sql, String[] columnNames) throws SQLException {
            return live().prepareStatement(sql, columnNames);
        }

        @Override
        public PreparedStatement prepareStatement(String sql, int resultSetType, int resultSetConcurrency)
                throws SQLException {
            return live().prepareStatement(sql, resultSetType, resultSetConcurrency);
        }

        @Override
        public PreparedStatement prepareStatement(String sql, int resultSetType, int resultSetConcurrency,
                                                  int resultSetHoldability) throws SQLException {
            return live().prepareStatement(sql, resultSetType, resultSetConcurrency, resultSetHoldability);
        }

        @Override
        public CallableStatement prepareCall(String sql) throws SQLException {
            return live().prepareCall(sql);
        }

        @Override
        public CallableStatement prepareCall(String sql, int resultSetType, int resultSetConcurrency)
                throws SQLException {
            return live().prepareCall(sql, resultSetType, resultSetConcurrency);
        }

        @Override
        public CallableStatement prepareCall(String sql, int resultSetType, int resultSetConcurrency,
                                             int resultSetHoldability) throws SQLException {
            return live().prepareCall(sql, resultSetType, resultSetConcurrency, resultSetHoldability);
        }

        @Override
        public String nativeSQL(String sql) throws SQLException {
            return live().nativeSQL(sql);
        }

        @Override
        public void setAutoCommit(boolean autoCommit) throws SQLException {
            live().setAutoCommit(autoCommit);
        }

        @Override
        public boolean getAutoCommit() throws SQLException {
            return live().getAutoCommit();
        }

        @Override
        public void commit() throws SQLException {
            live().commit();
        }

        @Override
        public void rollback() throws SQLException {
            live().rollback();
        }

        @Override
        public void rollback(Savepoint savepoint) throws SQLException {
            live().rollback(savepoint);
        }

        @Override
        public Savepoint setSavepoint() throws SQLException {
            return live().setSavepoint();
        }

        @Override
        public Savepoint setSavepoint(String name) throws SQLException {
            return live().setSavepoint(name);
        }

        @Override
        public void releaseSavepoint(Savepoint savepoint) throws SQLException {
            live().releaseSavepoint(savepoint);
        }

        @Override
        public DatabaseMetaData getMetaData() throws SQLException {
            return live().getMetaData();
        }

        @Override
        public void setReadOnly(boolean readOnly) throws SQLException {
            live().setReadOnly(readOnly);
        }

        @Override
        public boolean isReadOnly() throws SQLException {
            return live().isReadOnly();
        }

        @Override
        public void setCatalog(String catalog) throws SQLException {
            live().setCatalog(catalog);
        }

        @Override
        public String getCatalog() throws SQLException {
            return live().getCatalog();
        }

        @Override
        public void setSchema(String schema) throws SQLException {
            live().setSchema(schema);
        }

        @Override
        public String getSchema() throws SQLException {
            return live().getSchema();
        }

        @Override
        public void setTransactionIsolation(int level) throws SQLException {
            live().setTransactionIsolation(level);
        }

        @Override
        public int getTransactionIsolation() throws SQLException {
            return live().getTransactionIsolation();
        }

        @Override
        public SQLWarning getWarnings() throws SQLException {
            return live().getWarnings();
        }

        @Override
        public void clearWarnings() throws SQLException {
            live().clearWarnings();
        }

        @Override
        public Map<String, Class<?>> getTypeMap() throws SQLException {
            return live().getTypeMap();
        }

        @Override
        public void setTypeMap(Map<String, Class<?>> map) throws SQLException {
            live().setTypeMap(map);
        }

        @Override
        public void setHoldability(int holdability) throws SQLException {
            live().setHoldability(holdability);
        }

        @Override
        public int getHoldability() throws SQLException {
            return live().getHoldability();
        }

        @Override
        public Clob createClob() throws SQLException {
            return live().createClob();
        }

        @Override
        public Blob createBlob() throws SQLException {
            return live().createBlob();
        }

        @Override
        public NClob createNClob() throws SQLException {
            return live().createNClob();
        }

        @Override
        public SQLXML createSQLXML() throws SQLException {
            return live().createSQLXML();
        }

        @Override
        public Array createArrayOf(String typeName, Object[] elements) throws SQLException {
            return live().createArrayOf(typeName, elements);
        }

        @Override
        public Struct createStruct(String typeName, Object[] attributes) throws SQLException {
            return live().createStruct(typeName, attributes);
        }

        @Override
        public boolean isValid(int timeout) throws SQLException {
            return !released.get() && delegate.isValid(timeout);
        }

        @Override
        public void setClientInfo(String name, String value) throws SQLClientInfoException {
            delegate.setClientInfo(name, value);
        }

        @Override
        public void setClientInfo(Properties properties) throws SQLClientInfoException {
            delegate.setClientInfo(properties);
        }

        @Override
        public String getClientInfo(String name) throws SQLException {
            return live().getClientInfo(name);
        }

        @Override
        public Properties getClientInfo() throws SQLException {
            return live().getClientInfo();
        }

        @Override
        public void abort(Executor executor) throws SQLException {
            live().abort(executor);
        }

        @Override
        public void setNetworkTimeout(Executor executor, int milliseconds) throws SQLException {
            live().setNetworkTimeout(executor, milliseconds);
        }

        @Override
        public int getNetworkTimeout() throws SQLException {
            return live().getNetworkTimeout();
        }

        @Override
        public <T> T unwrap(Class<T> iface) throws SQLException {
            if (iface.isInstance(this)) {
                return iface.cast(this);
            }
            return delegate.unwrap(iface);
        }

        @Override
        public boolean isWrapperFor(Class<?> iface) throws SQLException {
            return iface.isInstance(this) || delegate.isWrapperFor(iface);
        }
    }
}
