package com.funnelduck.funnel.step;

import com.funnelduck.exception.FunnelConfigurationException;
import com.funnelduck.expression.BinaryExpression;
import com.funnelduck.expression.CastExpression;
import com.funnelduck.expression.Expression;
import com.funnelduck.expression.FunctionCall;
import com.funnelduck.expression.InExpression;
import com.funnelduck.expression.LikeExpression;
import com.funnelduck.expression.Parameter;
import com.funnelduck.expression.UnaryExpression;
import com.funnelduck.funnel.spec.PropertyFilter;
import com.funnelduck.types.BooleanType;
import com.funnelduck.types.DoubleType;
import com.funnelduck.types.StringType;

import java.util.ArrayList;
import java.util.List;

/**
 * Compiles {@link PropertyFilter}s into predicates over the event row.
 *
 * <p>Properties are compared as text. Negative operators ({@code is_not},
 * {@code not_icontains}, {@code not_regex}) also match rows where the property
 * is missing. Numeric operators compare {@code TRY_CAST(value AS DOUBLE)}, so
 * non-numeric values never match.
 */
public class PropertyFilterCompiler {

    /**
     * Compiles a list of filters into one ANDed predicate.
     *
     * @param filters the filters, possibly empty
     * @param paramPrefix prefix for the parameter names of this filter list
     * @return the predicate, or null if there are no filters
     */
    public Expression compileAll(List<PropertyFilter> filters, String paramPrefix) {
        if (filters.isEmpty()) {
            return null;
        }
        List<Expression> predicates = new ArrayList<>(filters.size());
        for (int i = 0; i < filters.size(); i++) {
            predicates.add(compile(filters.get(i), paramPrefix + "prop_" + i));
        }
        return BinaryExpression.and(predicates);
    }

    public Expression compile(PropertyFilter filter, String paramName) {
        Expression value = EventTable.property(filter.type(), filter.groupTypeIndex(), filter.key());

        switch (filter.operator()) {
            case EXACT:
                return equalsAny(value, filter, paramName, false);
            case IS_NOT:
                return BinaryExpression.or(UnaryExpression.isNull(value), equalsAny(value, filter, paramName, true));
            case ICONTAINS:
                return new LikeExpression(value, containsPattern(filter, paramName), true, false);
            case NOT_ICONTAINS:
                return BinaryExpression.or(UnaryExpression.isNull(value),
                    new LikeExpression(value, containsPattern(filter, paramName), true, true));
            case REGEX:
                return regexMatch(value, filter, paramName);
            case NOT_REGEX:
                return BinaryExpression.or(UnaryExpression.isNull(value),
                    UnaryExpression.not(regexMatch(value, filter, paramName)));
            case GT:
                return BinaryExpression.greaterThan(numeric(value), number(filter, paramName));
            case GTE:
                return BinaryExpression.greaterThanOrEqual(numeric(value), number(filter, paramName));
            case LT:
                return BinaryExpression.lessThan(numeric(value), number(filter, paramName));
            case LTE:
                return BinaryExpression.lessThanOrEqual(numeric(value), number(filter, paramName));
            case IS_SET:
                return UnaryExpression.isNotNull(value);
            case IS_NOT_SET:
                return UnaryExpression.isNull(value);
            default:
                throw new FunnelConfigurationException("propertyFilters",
                    "unsupported operator " + filter.operator().wireName() + " on " + filter.key());
        }
    }

    private static Expression equalsAny(Expression value, PropertyFilter filter, String paramName, boolean negated) {
        if (filter.value() instanceof List<?> values) {
            if (values.isEmpty()) {
                throw new FunnelConfigurationException("propertyFilters",
                    "operator " + filter.operator().wireName() + " on " + filter.key() + " needs at least one value");
            }
            List<Expression> params = new ArrayList<>(values.size());
            for (int i = 0; i < values.size(); i++) {
                params.add(new Parameter(paramName + "_" + i, asText(values.get(i), filter), StringType.get()));
            }
            return new InExpression(value, params, negated);
        }
        Parameter param = new Parameter(paramName, asText(filter.value(), filter), StringType.get());
        return negated ? BinaryExpression.notEqual(value, param) : BinaryExpression.equal(value, param);
    }

    private static Parameter containsPattern(PropertyFilter filter, String paramName) {
        return new Parameter(paramName, "%" + asText(filter.value(), filter) + "%", StringType.get());
    }

    private static Expression regexMatch(Expression value, PropertyFilter filter, String paramName) {
        return FunctionCall.of("regexp_matches", BooleanType.get(), value,
            new Parameter(paramName, asText(filter.value(), filter), StringType.get()));
    }

    private static Expression numeric(Expression value) {
        return CastExpression.tryCast(value, DoubleType.get());
    }

    private static Parameter number(PropertyFilter filter, String paramName) {
        Object raw = filter.value();
        double parsed;
        if (raw instanceof Number n) {
            parsed = n.doubleValue();
        } else {
            try {
                parsed = Double.parseDouble(raw.toString().trim());
            } catch (NumberFormatException e) {
                throw new FunnelConfigurationException("propertyFilters",
                    "operator " + filter.operator().wireName() + " on " + filter.key() + " needs a number, got " + raw, e);
            }
        }
        return new Parameter(paramName, parsed, DoubleType.get());
    }

    static String asText(Object value, PropertyFilter filter) {
        if (value instanceof List<?>) {
            throw new FunnelConfigurationException("propertyFilters",
                "operator " + filter.operator().wireName() + " on " + filter.key() + " takes a single value");
        }
        return String.valueOf(value);
    }
}
