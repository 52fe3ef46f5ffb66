package org.boring.semantic.plan;

import org.boring.semantic.store.SqlDataType;

import java.util.List;
import java.util.Objects;

/**
 * Represents a scalar SQL function call such as UPPER(x), COALESCE(x, 0) or NULLIF(x, 0).
 * 
 * @param functionName The SQL function name
 * @param arguments    The arguments, in call order
 * @param returnType   The SQL type returned by this function
 */
public record SqlFunctionCall(
        String functionName,
        List<Expression> arguments,
        SqlDataType returnType) implements Expression {

    public SqlFunctionCall {
        Objects.requireNonNull(functionName, "Function name cannot be null");
        Objects.requireNonNull(arguments, "Arguments cannot be null");
        arguments = List.copyOf(arguments);
        if (returnType == null) {
            returnType = SqlDataType.UNKNOWN;
        }
    }

    /**
     * Creates a function call whose type is taken from its first argument.
     */
    public static SqlFunctionCall of(String functionName, Expression... args) {
        SqlDataType type = args.length > 0 ? args[0].type() : SqlDataType.UNKNOWN;
        return new SqlFunctionCall(functionName, List.of(args), type);
    }

    /**
     * Creates a function call with an explicit return type.
     */
    public static SqlFunctionCall typed(String functionName, SqlDataType returnType, Expression... args) {
        return new SqlFunctionCall(functionName, List.of(args), returnType);
    }

    public static SqlFunctionCall coalesce(Expression value, Expression fallback) {
        return of("COALESCE", value, fallback);
    }

    public static SqlFunctionCall nullIf(Expression value, Expression sentinel) {
        return of("NULLIF", value, sentinel);
    }

    /**
     * @return The upper-cased SQL function name
     */
    public String sqlFunctionName() {
        return functionName.toUpperCase();
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitFunctionCall(this);
    }

    @Override
    public SqlDataType type() {
        return returnType;
    }
}
