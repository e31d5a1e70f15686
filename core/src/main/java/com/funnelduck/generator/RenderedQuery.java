package com.funnelduck.generator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A rendered SQL statement with its bound values.
 *
 * <p>{@code parameters} holds one value per {@code ?} placeholder, in textual
 * order. {@code namedParameters} maps each parameter's descriptive name to its
 * value for logging and inspection; a name bound more than once with different
 * values gets a {@code #n} suffix.
 *
 * @param sql the SQL text with positional placeholders
 * @param parameters the positional values
 * @param namedParameters the values by descriptive name
 */
public record RenderedQuery(String sql, List<Object> parameters, Map<String, Object> namedParameters) {

    public RenderedQuery {
        Objects.requireNonNull(sql, "sql must not be null");
        parameters = Collections.unmodifiableList(new ArrayList<>(
            Objects.requireNonNull(parameters, "parameters must not be null")));
        namedParameters = Collections.unmodifiableMap(new LinkedHashMap<>(
            Objects.requireNonNull(namedParameters, "namedParameters must not be null")));
    }

    /**
     * Creates a query without parameters.
     */
    public static RenderedQuery of(String sql) {
        return new RenderedQuery(sql, List.of(), Map.of());
    }

    public int parameterCount() {
        return parameters.size();
    }
}
