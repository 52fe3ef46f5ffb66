package org.boring.semantic.execution;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BufferedResultTest {

    private Connection connection;
    private JdbcBackend backend;

    @BeforeEach
    void setUp() throws SQLException {
        connection = ConnectionResolver.createInMemoryDuckDB();
        backend = JdbcBackend.duckDb(connection);
    }

    @AfterEach
    void tearDown() throws SQLException {
        if (connection != null) {
            connection.close();
        }
    }

    @Test
    @DisplayName("Buffers rows with column labels")
    void testBuffering() {
        // WHEN
        BufferedResult result = backend.execute(
                "SELECT * FROM (VALUES (1, 'a'), (2, NULL)) AS t(\"id\", \"label\") ORDER BY \"id\"");

        // THEN
        assertEquals(2, result.rowCount());
        assertEquals(List.of("id", "label"), result.columnNames());
        assertEquals(1, result.getValue(0, 0));
        assertNull(result.getValue(1, "label"));
        assertEquals("a", result.toMaps().get(0).get("label"));
        assertThrows(IllegalArgumentException.class, () -> result.columnValues("missing"));
    }

    @Test
    @DisplayName("Serializes rows as a JSON array")
    void testToJsonArray() {
        // WHEN
        BufferedResult result = backend.execute(
                "SELECT 'US' AS \"customers.country\", 1.5::DOUBLE AS \"share\", NULL AS \"note\"");

        // THEN
        assertEquals("[{\"customers.country\":\"US\",\"share\":1.5,\"note\":null}]", result.toJsonArray());
    }

    @Test
    @DisplayName("Failures carry the SQL text")
    void testFailure() {
        var error = assertThrows(QueryExecutionException.class, () -> backend.execute("SELECT * FROM nowhere"));
        assertEquals("SELECT * FROM nowhere", error.sql());
    }
}
