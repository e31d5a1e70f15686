package com.funnelduck.funnel.breakdown;

import com.funnelduck.generator.RenderedQuery;
import com.funnelduck.runtime.QueryExecutor;
import com.funnelduck.runtime.QueryResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Ranks breakdown values against the DuckDB event store.
 */
public class QueryExecutorBreakdownSource implements BreakdownValueSource {

    private final QueryExecutor executor;

    public QueryExecutorBreakdownSource(QueryExecutor executor) {
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
    }

    @Override
    public List<Object> fetchValues(RenderedQuery rankingQuery) {
        QueryResult result = executor.execute(rankingQuery);
        List<Object> values = new ArrayList<>(result.rowCount());
        for (List<Object> row : result.rows()) {
            values.add(row.get(0));
        }
        return values;
    }
}
