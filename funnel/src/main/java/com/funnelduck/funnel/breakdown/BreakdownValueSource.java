package com.funnelduck.funnel.breakdown;

import com.funnelduck.generator.RenderedQuery;

import java.util.List;

/**
 * Runs the breakdown ranking query: the round trip that must finish before the
 * funnel query can be compiled.
 */
@FunctionalInterface
public interface BreakdownValueSource {

    /**
     * Executes the ranking query.
     *
     * @param rankingQuery a query whose first column holds breakdown values, most popular first
     * @return the values of the first column, in row order
     */
    List<Object> fetchValues(RenderedQuery rankingQuery);
}
