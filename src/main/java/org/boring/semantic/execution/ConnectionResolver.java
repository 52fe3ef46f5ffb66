package org.boring.semantic.execution;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Opens DuckDB connections.
 *
 * Supports:
 * - InMemory DuckDB, cached by name so that tables persist across queries
 * - LocalFile DuckDB
 */
public final class ConnectionResolver {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConnectionResolver.class);

    // Cache for named in-memory connections
    private static final Map<String, Connection> connectionCache = new ConcurrentHashMap<>();

    private ConnectionResolver() {
    }

    /**
     * Gets a cached named in-memory DuckDB connection or creates a new one.
     */
    public static Connection inMemory(String name) throws SQLException {
        Connection cached = connectionCache.get(name);
        if (cached != null && !cached.isClosed()) {
            return cached;
        }
        Connection newConn = createInMemoryDuckDB();
        connectionCache.put(name, newConn);
        return newConn;
    }

    /**
     * Opens a DuckDB database file.
     */
    public static Connection localFile(String path) throws SQLException {
        return DriverManager.getConnection("jdbc:duckdb:" + path);
    }

    /**
     * Creates an in-memory DuckDB connection without caching it.
     * Convenience method for testing.
     */
    public static Connection createInMemoryDuckDB() throws SQLException {
        return DriverManager.getConnection("jdbc:duckdb:");
    }

    /**
     * Closes and forgets all cached connections.
     */
    public static void clearCache() {
        connectionCache.forEach((name, conn) -> {
            try {
                conn.close();
            } catch (SQLException e) {
                LOGGER.warn("Failed to close cached connection '{}'", name, e);
            }
        });
        connectionCache.clear();
    }
}
