package org.boring.semantic.store;

import java.sql.Types;

/**
 * Represents SQL data types for relational columns.
 */
public enum SqlDataType {
    VARCHAR,
    INTEGER,
    BIGINT,
    BOOLEAN,
    DATE,
    TIMESTAMP,
    DOUBLE,
    DECIMAL,
    UNKNOWN;

    /**
     * @return true for DATE and TIMESTAMP
     */
    public boolean isTemporal() {
        return this == DATE || this == TIMESTAMP;
    }

    /**
     * @return true for the integral and floating point types
     */
    public boolean isNumeric() {
        return this == INTEGER || this == BIGINT || this == DOUBLE || this == DECIMAL;
    }

    /**
     * Maps a JDBC type code (java.sql.Types) to a SQL data type.
     *
     * @param jdbcType The JDBC type code
     * @return The corresponding SQL data type, UNKNOWN when there is no mapping
     */
    public static SqlDataType fromJdbcType(int jdbcType) {
        return switch (jdbcType) {
            case Types.VARCHAR, Types.CHAR, Types.LONGVARCHAR, Types.NVARCHAR -> VARCHAR;
            case Types.INTEGER, Types.SMALLINT, Types.TINYINT -> INTEGER;
            case Types.BIGINT -> BIGINT;
            case Types.BOOLEAN, Types.BIT -> BOOLEAN;
            case Types.DATE -> DATE;
            case Types.TIMESTAMP, Types.TIMESTAMP_WITH_TIMEZONE -> TIMESTAMP;
            case Types.DOUBLE, Types.FLOAT, Types.REAL -> DOUBLE;
            case Types.DECIMAL, Types.NUMERIC -> DECIMAL;
            default -> UNKNOWN;
        };
    }
}
