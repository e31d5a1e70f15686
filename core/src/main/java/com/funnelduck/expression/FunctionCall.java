package com.funnelduck.expression;

import com.funnelduck.types.DataType;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Expression representing a scalar or aggregate function call.
 *
 * <p>Examples:
 * <pre>
 *   json_extract_string(properties, '$."$browser"')
 *   date_diff('second', latest_0, latest_1)
 *   count_if(steps = 2)
 *   count(DISTINCT aggregation_target)
 * </pre>
 *
 * <p>Function names are emitted as given; they are always chosen by the compiler,
 * never taken from a request.
 */
public final class FunctionCall implements Expression {

    private final String functionName;
    private final List<Expression> arguments;
    private final DataType dataType;
    private final boolean nullable;
    private final boolean distinct;

    /**
     * Creates a function call expression.
     *
     * @param functionName the function name
     * @param arguments the function arguments
     * @param dataType the return type
     * @param nullable whether the result can be null
     * @param distinct whether DISTINCT applies to the arguments (aggregates only)
     */
    public FunctionCall(String functionName, List<Expression> arguments,
                        DataType dataType, boolean nullable, boolean distinct) {
        this.functionName = Objects.requireNonNull(functionName, "functionName must not be null");
        this.arguments = Collections.unmodifiableList(
            new ArrayList<>(Objects.requireNonNull(arguments, "arguments must not be null")));
        this.dataType = Objects.requireNonNull(dataType, "dataType must not be null");
        this.nullable = nullable;
        this.distinct = distinct;
    }

    public FunctionCall(String functionName, List<Expression> arguments, DataType dataType) {
        this(functionName, arguments, dataType, true, false);
    }

    public String functionName() {
        return functionName;
    }

    public List<Expression> arguments() {
        return arguments;
    }

    public boolean distinct() {
        return distinct;
    }

    @Override
    public DataType dataType() {
        return dataType;
    }

    @Override
    public boolean nullable() {
        return nullable;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(functionName).append('(');
        if (distinct) {
            sb.append("DISTINCT ");
        }
        for (int i = 0; i < arguments.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(arguments.get(i));
        }
        return sb.append(')').toString();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof FunctionCall)) return false;
        FunctionCall that = (FunctionCall) obj;
        return nullable == that.nullable &&
               distinct == that.distinct &&
               functionName.equals(that.functionName) &&
               arguments.equals(that.arguments) &&
               dataType.equals(that.dataType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(functionName, arguments, dataType, nullable, distinct);
    }

    // ==================== Factory Methods ====================

    /**
     * Creates a function call with any number of arguments.
     *
     * @param functionName the function name
     * @param dataType the return type
     * @param args the arguments
     * @return the function call
     */
    public static FunctionCall of(String functionName, DataType dataType, Expression... args) {
        return new FunctionCall(functionName, Arrays.asList(args), dataType);
    }

    /**
     * Creates a DISTINCT aggregate call, e.g. {@code count(DISTINCT x)}.
     */
    public static FunctionCall distinct(String functionName, DataType dataType, Expression... args) {
        return new FunctionCall(functionName, Arrays.asList(args), dataType, true, true);
    }
}
