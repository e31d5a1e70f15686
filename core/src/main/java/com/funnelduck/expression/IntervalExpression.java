package com.funnelduck.expression;

import com.funnelduck.types.DataType;
import com.funnelduck.types.IntervalType;
import java.util.Locale;
import java.util.Objects;

/**
 * Expression representing an interval constant, e.g. {@code INTERVAL 14 DAY}.
 *
 * <p>Used for conversion windows: {@code latest_0 + INTERVAL 14 DAY}.
 */
public final class IntervalExpression implements Expression {

    /**
     * Interval units supported by conversion windows.
     */
    public enum Unit {
        SECOND,
        MINUTE,
        HOUR,
        DAY,
        WEEK,
        MONTH;

        /**
         * Parses a unit name case-insensitively, accepting singular and plural forms.
         *
         * @param name the unit name ("day", "DAYS", "week", ...)
         * @return the unit
         * @throws IllegalArgumentException if the name is not a known unit
         */
        public static Unit parse(String name) {
            Objects.requireNonNull(name, "name must not be null");
            String normalized = name.trim().toUpperCase(Locale.ROOT);
            if (normalized.endsWith("S")) {
                normalized = normalized.substring(0, normalized.length() - 1);
            }
            return Unit.valueOf(normalized);
        }
    }

    private final long amount;
    private final Unit unit;

    public IntervalExpression(long amount, Unit unit) {
        if (amount < 0) {
            throw new IllegalArgumentException("interval amount must not be negative: " + amount);
        }
        this.amount = amount;
        this.unit = Objects.requireNonNull(unit, "unit must not be null");
    }

    public long amount() {
        return amount;
    }

    public Unit unit() {
        return unit;
    }

    @Override
    public DataType dataType() {
        return IntervalType.get();
    }

    @Override
    public boolean nullable() {
        return false;
    }

    @Override
    public String toString() {
        return "INTERVAL " + amount + " " + unit;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof IntervalExpression)) return false;
        IntervalExpression that = (IntervalExpression) obj;
        return amount == that.amount && unit == that.unit;
    }

    @Override
    public int hashCode() {
        return Objects.hash(amount, unit);
    }
}
