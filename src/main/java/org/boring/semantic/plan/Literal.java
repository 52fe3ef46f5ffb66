package org.boring.semantic.plan;

import org.boring.semantic.store.SqlDataType;

import java.util.Objects;

/**
 * Represents a literal value in the relational plan.
 * Supports String, numeric, Boolean, date/timestamp and null values.
 * 
 * @param value       The literal value (can be null)
 * @param literalType The type of the literal
 */
public record Literal(
        Object value,
        LiteralType literalType) implements Expression {

    public enum LiteralType {
        STRING,
        INTEGER,
        BOOLEAN,
        DECIMAL,
        NULL,
        DATE,
        TIMESTAMP
    }

    public Literal {
        Objects.requireNonNull(literalType, "Literal type cannot be null");

        if (literalType == LiteralType.NULL && value != null) {
            throw new IllegalArgumentException("NULL literal cannot have a value");
        }
        if (value != null) {
            switch (literalType) {
                case STRING, DATE, TIMESTAMP -> {
                    if (!(value instanceof String)) {
                        throw new IllegalArgumentException(literalType + " literal must have String value");
                    }
                }
                case INTEGER, DECIMAL -> {
                    if (!(value instanceof Number)) {
                        throw new IllegalArgumentException(literalType + " literal must have Number value");
                    }
                }
                case BOOLEAN -> {
                    if (!(value instanceof Boolean)) {
                        throw new IllegalArgumentException("BOOLEAN literal must have Boolean value");
                    }
                }
                default -> {
                }
            }
        }
    }

    public static Literal string(String value) {
        return new Literal(value, LiteralType.STRING);
    }

    public static Literal integer(long value) {
        return new Literal(value, LiteralType.INTEGER);
    }

    public static Literal decimal(Number value) {
        return new Literal(value, LiteralType.DECIMAL);
    }

    public static Literal bool(boolean value) {
        return new Literal(value, LiteralType.BOOLEAN);
    }

    public static Literal nullValue() {
        return new Literal(null, LiteralType.NULL);
    }

    /**
     * Factory for DATE literals. Value should be in 'YYYY-MM-DD' format.
     */
    public static Literal date(String value) {
        return new Literal(value, LiteralType.DATE);
    }

    /**
     * Factory for TIMESTAMP literals. Value should be in 'YYYY-MM-DD HH:MM:SS' format.
     */
    public static Literal timestamp(String value) {
        return new Literal(value, LiteralType.TIMESTAMP);
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitLiteral(this);
    }

    @Override
    public SqlDataType type() {
        return switch (literalType) {
            case STRING -> SqlDataType.VARCHAR;
            case INTEGER -> SqlDataType.BIGINT;
            case BOOLEAN -> SqlDataType.BOOLEAN;
            case DECIMAL -> SqlDataType.DOUBLE;
            case NULL -> SqlDataType.UNKNOWN;
            case DATE -> SqlDataType.DATE;
            case TIMESTAMP -> SqlDataType.TIMESTAMP;
        };
    }

    @Override
    public String toString() {
        return switch (literalType) {
            case NULL -> "NULL";
            case STRING -> "'" + value + "'";
            case DATE -> "DATE '" + value + "'";
            case TIMESTAMP -> "TIMESTAMP '" + value + "'";
            default -> String.valueOf(value);
        };
    }
}
