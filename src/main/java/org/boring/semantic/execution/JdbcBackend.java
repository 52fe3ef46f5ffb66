package org.boring.semantic.execution;

import org.boring.semantic.transpiler.DuckDBDialect;
import org.boring.semantic.transpiler.SQLDialect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Objects;

/**
 * Runs queries through a JDBC connection owned by the caller.
 */
public final class JdbcBackend implements Backend {

    private static final Logger LOGGER = LoggerFactory.getLogger(JdbcBackend.class);

    private final Connection connection;
    private final SQLDialect dialect;

    public JdbcBackend(Connection connection, SQLDialect dialect) {
        this.connection = Objects.requireNonNull(connection, "Connection cannot be null");
        this.dialect = Objects.requireNonNull(dialect, "Dialect cannot be null");
    }

    /**
     * A backend over a DuckDB connection.
     */
    public static JdbcBackend duckDb(Connection connection) {
        return new JdbcBackend(connection, DuckDBDialect.INSTANCE);
    }

    public Connection connection() {
        return connection;
    }

    @Override
    public SQLDialect dialect() {
        return dialect;
    }

    @Override
    public BufferedResult execute(String sql) {
        LOGGER.debug("Executing on {}: {}", dialect.name(), sql);
        try (Statement stmt = connection.createStatement();
                ResultSet rs = stmt.executeQuery(sql)) {
            BufferedResult result = BufferedResult.fromResultSet(rs);
            LOGGER.debug("Query returned {} rows", result.rowCount());
            return result;
        } catch (SQLException e) {
            throw new QueryExecutionException(sql, e);
        }
    }
}
