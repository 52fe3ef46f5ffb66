package org.boring.semantic.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads table schemas from a live JDBC connection through {@link DatabaseMetaData}.
 */
public final class JdbcCatalog {

    private static final Logger LOGGER = LoggerFactory.getLogger(JdbcCatalog.class);

    private JdbcCatalog() {
        // Static utility class
    }

    /**
     * Loads the named tables from the connection's default schema.
     *
     * @param connection The connection to read metadata from
     * @param tableNames The tables to load
     * @return A catalog containing exactly the requested tables
     * @throws IllegalArgumentException if a table does not exist
     * @throws SQLException if the metadata query fails
     */
    public static Catalog load(Connection connection, String... tableNames) throws SQLException {
        DatabaseMetaData metaData = connection.getMetaData();
        List<Table> tables = new ArrayList<>();
        for (String tableName : tableNames) {
            List<Column> columns = new ArrayList<>();
            try (ResultSet rs = metaData.getColumns(null, null, tableName, null)) {
                while (rs.next()) {
                    columns.add(Column.fromMetadata(rs));
                }
            }
            if (columns.isEmpty()) {
                throw new IllegalArgumentException("Table '" + tableName + "' not found in database");
            }
            LOGGER.debug("Loaded table {} with columns {}", tableName, columns);
            tables.add(new Table(tableName, columns));
        }
        return Catalog.of(tables);
    }
}
