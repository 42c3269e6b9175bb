package com.gpuopt.infrastructure.db;

import com.gpuopt.domain.StorageUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Properties;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bounded pool of SQLite connections.
 *
 * Exhaustion never fails a caller: after the acquire timeout an extra connection with the
 * same settings is opened. On release a connection goes back to the pool while there is
 * room and is closed otherwise, so the pool never holds more than {@code poolSize}.
 *
 * Every connection runs in WAL mode with {@code synchronous=NORMAL}, a 10000 page cache,
 * in-memory temp storage, a busy timeout, and {@code BEGIN IMMEDIATE} transactions.
 */
public final class ResourcePool implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ResourcePool.class);

    public static final int DEFAULT_POOL_SIZE = 10;
    public static final Duration DEFAULT_ACQUIRE_TIMEOUT = Duration.ofSeconds(5);
    static final int CACHE_SIZE_PAGES = 10000;

    private final String url;
    private final Properties connectionProperties;
    private final int poolSize;
    private final Duration acquireTimeout;
    private final BlockingQueue<Connection> idle;

    private final AtomicLong acquired = new AtomicLong();
    private final AtomicLong ephemeralOpened = new AtomicLong();
    private final AtomicLong closedOnRelease = new AtomicLong();
    private volatile boolean closed;

    /**
     * Opens and pre-warms the pool.
     *
     * @throws StorageUnavailableException if the database cannot be opened
     */
    public ResourcePool(Path databaseFile, int poolSize, Duration acquireTimeout, Duration busyTimeout) {
        Objects.requireNonNull(databaseFile, "databaseFile");
        if (poolSize <= 0) throw new IllegalArgumentException("poolSize must be > 0");
        this.poolSize = poolSize;
        this.acquireTimeout = Objects.requireNonNull(acquireTimeout, "acquireTimeout");
        this.url = "jdbc:sqlite:" + databaseFile.toAbsolutePath();
        this.connectionProperties = connectionConfig(busyTimeout).toProperties();
        this.idle = new ArrayBlockingQueue<>(poolSize);

        ensureParentDir(databaseFile);
        for (int i = 0; i < poolSize; i++) {
            idle.add(open());
        }
        log.info("SQLite pool ready: url={} size={} acquireTimeout={}", url, poolSize, acquireTimeout);
    }

    static SQLiteConfig connectionConfig(Duration busyTimeout) {
        SQLiteConfig config = new SQLiteConfig();
        config.setJournalMode(SQLiteConfig.JournalMode.WAL);
        config.setSynchronous(SQLiteConfig.SynchronousMode.NORMAL);
        config.setCacheSize(CACHE_SIZE_PAGES);
        config.setTempStore(SQLiteConfig.TempStore.MEMORY);
        config.setBusyTimeout((int) busyTimeout.toMillis());
        config.setTransactionMode(SQLiteConfig.TransactionMode.IMMEDIATE);
        config.enforceForeignKeys(true);
        return config;
    }

    public Lease acquire() {
        return acquire(acquireTimeout);
    }

    /**
     * Borrows a pooled connection, or opens an ephemeral one once {@code timeout} has elapsed.
     */
    public Lease acquire(Duration timeout) {
        ensureOpen();
        Connection c = null;
        try {
            c = idle.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        if (c != null && isBroken(c)) {
            log.warn("Dropping broken pooled connection");
            closeQuietly(c);
            c = null;
        }
        if (c == null) {
            ephemeralOpened.incrementAndGet();
            log.debug("Pool exhausted after {}, opening ephemeral connection", timeout);
            c = open();
        }
        acquired.incrementAndGet();
        return new Lease(this, c);
    }

    /**
     * Returns a connection. Never blocks: if the pool is full or closed the connection is closed.
     */
    public void release(Connection c) {
        if (c == null) return;
        if (closed || !reset(c) || !idle.offer(c)) {
            closedOnRelease.incrementAndGet();
            closeQuietly(c);
        }
    }

    /**
     * Runs {@code work} in one transaction; commits on success, rolls back on any failure.
     * Domain exceptions thrown by {@code work} propagate unchanged.
     */
    public <T> T inTransaction(SqlWork<T> work) {
        try (Lease lease = acquire()) {
            Connection c = lease.connection();
            try {
                c.setAutoCommit(false);
                T result = work.apply(c);
                c.commit();
                return result;
            } catch (SQLException e) {
                rollbackQuietly(c);
                throw new StorageUnavailableException("Transaction failed: " + e.getMessage(), e);
            } catch (RuntimeException e) {
                rollbackQuietly(c);
                throw e;
            }
        }
    }

    /** Runs {@code work} in auto-commit mode. */
    public <T> T withConnection(SqlWork<T> work) {
        try (Lease lease = acquire()) {
            return work.apply(lease.connection());
        } catch (SQLException e) {
            throw new StorageUnavailableException("Query failed: " + e.getMessage(), e);
        }
    }

    public PoolStats stats() {
        return new PoolStats(poolSize, idle.size(), acquired.get(), ephemeralOpened.get(), closedOnRelease.get());
    }

    @Override
    public void close() {
        closed = true;
        List<Connection> drained = new ArrayList<>();
        idle.drainTo(drained);
        drained.forEach(ResourcePool::closeQuietly);
        log.info("SQLite pool closed: {} connections", drained.size());
    }

    private Connection open() {
        try {
            return DriverManager.getConnection(url, connectionProperties);
        } catch (SQLException e) {
            throw new StorageUnavailableException("Failed to open SQLite connection: " + url, e);
        }
    }

    private void ensureOpen() {
        if (closed) throw new IllegalStateException("pool is closed");
    }

    private static boolean reset(Connection c) {
        try {
            if (c.isClosed()) return false;
            if (!c.getAutoCommit()) {
                c.rollback();
                c.setAutoCommit(true);
            }
            return true;
        } catch (SQLException e) {
            log.warn("Connection reset failed, discarding: {}", e.getMessage());
            return false;
        }
    }

    private static boolean isBroken(Connection c) {
        try {
            return c.isClosed();
        } catch (SQLException e) {
            return true;
        }
    }

    private static void rollbackQuietly(Connection c) {
        try {
            c.rollback();
        } catch (SQLException e) {
            log.warn("Rollback failed: {}", e.getMessage());
        }
    }

    private static void closeQuietly(Connection c) {
        try {
            c.close();
        } catch (SQLException e) {
            log.debug("Close failed: {}", e.getMessage());
        }
    }

    private static void ensureParentDir(Path file) {
        Path parent = file.toAbsolutePath().getParent();
        if (parent == null) return;
        try {
            Files.createDirectories(parent);
        } catch (IOException e) {
            throw new StorageUnavailableException("Failed to create database directory: " + parent, e);
        }
    }

    /**
     * A borrowed connection; closing the lease releases it to the pool.
     */
    public static final class Lease implements AutoCloseable {

        private final ResourcePool pool;
        private final Connection connection;
        private boolean released;

        private Lease(ResourcePool pool, Connection connection) {
            this.pool = pool;
            this.connection = connection;
        }

        public Connection connection() {
            return connection;
        }

        @Override
        public void close() {
            if (released) return;
            released = true;
            pool.release(connection);
        }
    }
}
