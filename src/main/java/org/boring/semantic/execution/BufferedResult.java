package org.boring.semantic.execution;

import org.boring.semantic.json.Json;

import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A fully materialized, immutable query result.
 *
 * All rows are loaded into memory, allowing random access and re-iteration.
 */
public record BufferedResult(
        List<Column> columns,
        List<Row> rows) {

    public BufferedResult {
        columns = List.copyOf(columns);
        rows = List.copyOf(rows);
    }

    public int rowCount() {
        return rows.size();
    }

    public int columnCount() {
        return columns.size();
    }

    public List<String> columnNames() {
        return columns.stream().map(Column::name).toList();
    }

    public Object getValue(int rowIndex, int columnIndex) {
        return rows.get(rowIndex).values().get(columnIndex);
    }

    public Object getValue(int rowIndex, String columnName) {
        return rows.get(rowIndex).values().get(columnIndex(columnName));
    }

    /**
     * @return Every value of one column, in row order
     */
    public List<Object> columnValues(String columnName) {
        int index = columnIndex(columnName);
        List<Object> values = new ArrayList<>(rows.size());
        for (Row row : rows) {
            values.add(row.get(index));
        }
        return values;
    }

    /**
     * @return The rows as column-name keyed maps
     */
    public List<Map<String, Object>> toMaps() {
        List<Map<String, Object>> records = new ArrayList<>(rows.size());
        for (Row row : rows) {
            Map<String, Object> record = new LinkedHashMap<>();
            for (int i = 0; i < columns.size(); i++) {
                Object value = row.get(i);
                record.put(columns.get(i).name(), value);
            }
            records.add(record);
        }
        return records;
    }

    /**
     * Serializes this result as a JSON array of objects.
     * Each row becomes a JSON object with column names as keys; temporal and other
     * non-JSON values are written as strings.
     */
    public String toJsonArray() {
        return Json.toJson(toMaps());
    }

    private int columnIndex(String columnName) {
        for (int i = 0; i < columns.size(); i++) {
            if (columns.get(i).name().equals(columnName)) {
                return i;
            }
        }
        throw new IllegalArgumentException("Column not found: " + columnName + ". Available: " + columnNames());
    }

    /**
     * Creates a BufferedResult from a JDBC ResultSet.
     * The ResultSet is fully consumed and can be closed after this call.
     */
    public static BufferedResult fromResultSet(ResultSet rs) throws SQLException {
        ResultSetMetaData meta = rs.getMetaData();
        int columnCount = meta.getColumnCount();

        // Build column metadata
        List<Column> columns = new ArrayList<>(columnCount);
        for (int i = 1; i <= columnCount; i++) {
            columns.add(new Column(
                    meta.getColumnLabel(i),
                    meta.getColumnTypeName(i),
                    Column.mapJdbcTypeToJava(meta.getColumnType(i))));
        }

        // Build rows
        List<Row> rows = new ArrayList<>();
        while (rs.next()) {
            rows.add(Row.fromResultSet(rs, columnCount));
        }

        return new BufferedResult(columns, rows);
    }
}
