package org.boring.semantic.execution;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A row of values, in result column order.
 */
public record Row(List<Object> values) {

    public Row {
        // nulls allowed
        values = Collections.unmodifiableList(new ArrayList<>(values));
    }

    public Object get(int index) {
        return values.get(index);
    }

    /**
     * Reads the current row of a ResultSet.
     */
    static Row fromResultSet(ResultSet rs, int columnCount) throws SQLException {
        List<Object> values = new ArrayList<>(columnCount);
        for (int i = 1; i <= columnCount; i++) {
            values.add(rs.getObject(i));
        }
        return new Row(values);
    }
}
