package com.funnelduck.expression;

import com.funnelduck.expression.window.WindowFrame;
import com.funnelduck.logical.Sort;
import com.funnelduck.types.DataType;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Expression representing a window function.
 *
 * <p>Window functions operate on a set of rows and return a value for each row.
 * Unlike aggregate functions, window functions do not group rows into a single
 * output row.
 *
 * <p>The funnel engines rely on two shapes:
 * <pre>
 *   min(latest_1) OVER (PARTITION BY aggregation_target ORDER BY "timestamp" DESC
 *                       ROWS BETWEEN UNBOUNDED PRECEDING AND 0 PRECEDING)
 *   max(steps) OVER (PARTITION BY aggregation_target)
 * </pre>
 *
 * @see WindowFrame
 */
public final class WindowFunction implements Expression {

    private final String function;
    private final List<Expression> arguments;
    private final List<Expression> partitionBy;
    private final List<Sort.SortOrder> orderBy;
    private final WindowFrame frame;
    private final DataType dataType;

    /**
     * Creates a window function with an optional frame specification.
     *
     * @param function the function name (min, arg_min, max, ...)
     * @param arguments the function arguments
     * @param partitionBy the partition by expressions (empty for no partitioning)
     * @param orderBy the order by specifications (empty for no ordering)
     * @param frame the window frame specification (null for default frame)
     * @param dataType the result type
     */
    public WindowFunction(String function,
                          List<Expression> arguments,
                          List<Expression> partitionBy,
                          List<Sort.SortOrder> orderBy,
                          WindowFrame frame,
                          DataType dataType) {
        this.function = Objects.requireNonNull(function, "function must not be null");
        this.arguments = Collections.unmodifiableList(new ArrayList<>(
            Objects.requireNonNull(arguments, "arguments must not be null")));
        this.partitionBy = Collections.unmodifiableList(new ArrayList<>(
            Objects.requireNonNull(partitionBy, "partitionBy must not be null")));
        this.orderBy = Collections.unmodifiableList(new ArrayList<>(
            Objects.requireNonNull(orderBy, "orderBy must not be null")));
        this.frame = frame;  // Can be null
        this.dataType = Objects.requireNonNull(dataType, "dataType must not be null");
        if (frame != null && this.orderBy.isEmpty()) {
            throw new IllegalArgumentException("a ROWS frame requires an ORDER BY");
        }
    }

    public String function() {
        return function;
    }

    public List<Expression> arguments() {
        return arguments;
    }

    public List<Expression> partitionBy() {
        return partitionBy;
    }

    public List<Sort.SortOrder> orderBy() {
        return orderBy;
    }

    public Optional<WindowFrame> frame() {
        return Optional.ofNullable(frame);
    }

    @Override
    public DataType dataType() {
        return dataType;
    }

    @Override
    public boolean nullable() {
        return true;
    }

    @Override
    public String toString() {
        return String.format("%s(%s) OVER (partition=%s, order=%s, frame=%s)",
            function, arguments, partitionBy, orderBy, frame);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof WindowFunction)) return false;
        WindowFunction that = (WindowFunction) obj;
        return function.equals(that.function) &&
               arguments.equals(that.arguments) &&
               partitionBy.equals(that.partitionBy) &&
               orderBy.equals(that.orderBy) &&
               Objects.equals(frame, that.frame) &&
               dataType.equals(that.dataType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(function, arguments, partitionBy, orderBy, frame, dataType);
    }
}
