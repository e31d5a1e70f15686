package com.funnelduck.funnel;

import com.funnelduck.funnel.breakdown.ResolvedBreakdown;
import com.funnelduck.funnel.result.RowLayout;
import com.funnelduck.funnel.spec.FunnelSpec;
import com.funnelduck.generator.RenderedQuery;

import java.util.Objects;

/**
 * A funnel compiled to one parameterized DuckDB query.
 *
 * @param spec the normalized spec the query was compiled from
 * @param query the SQL and its parameters
 * @param breakdown the resolved breakdown, or null
 * @param layout the row layout of step-count queries, null for other queries
 */
public record CompiledFunnelQuery(FunnelSpec spec, RenderedQuery query, ResolvedBreakdown breakdown, RowLayout layout) {

    public CompiledFunnelQuery {
        Objects.requireNonNull(spec, "spec must not be null");
        Objects.requireNonNull(query, "query must not be null");
    }

    public String sql() {
        return query.sql();
    }
}
