package com.funnelduck.generator;

import com.funnelduck.logical.LogicalPlan;

/**
 * Renders a logical plan into SQL text for one dialect.
 *
 * <p>Implementations must be safe to call from several threads: any state used
 * while rendering belongs to a single {@link #render} call.
 */
public interface SQLRenderer {

    /**
     * Renders the plan into SQL with positional parameters.
     *
     * @param plan the plan to render
     * @return the rendered query
     * @throws com.funnelduck.exception.SQLGenerationException if the plan holds an unsupported node
     */
    RenderedQuery render(LogicalPlan plan);
}
