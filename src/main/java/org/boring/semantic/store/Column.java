package org.boring.semantic.store;

import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Objects;

/**
 * A physical column of a backend table, as dimensions and measures see it through
 * {@code row.column(name)}. The data type decides how filter literals compared against
 * the column are typed.
 *
 * @param name     The column name in the backend
 * @param dataType The column's type
 * @param nullable Whether the column may hold NULL
 */
public record Column(String name, SqlDataType dataType, boolean nullable) {

    public Column {
        Objects.requireNonNull(name, "Column name cannot be null");
        Objects.requireNonNull(dataType, "Column data type cannot be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Column name cannot be blank");
        }
    }

    public static Column required(String name, SqlDataType dataType) {
        return new Column(name, dataType, false);
    }

    public static Column nullable(String name, SqlDataType dataType) {
        return new Column(name, dataType, true);
    }

    /**
     * Reads the current row of a {@link DatabaseMetaData#getColumns} result. Columns whose
     * nullability is unknown are treated as nullable.
     */
    public static Column fromMetadata(ResultSet columns) throws SQLException {
        return new Column(
                columns.getString("COLUMN_NAME"),
                SqlDataType.fromJdbcType(columns.getInt("DATA_TYPE")),
                columns.getInt("NULLABLE") != DatabaseMetaData.columnNoNulls);
    }

    @Override
    public String toString() {
        return name + " " + dataType + (nullable ? "" : " NOT NULL");
    }
}
