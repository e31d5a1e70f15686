package com.funnelduck.logical;

import java.util.Objects;

/**
 * Gives a fixed name to a derived relation so that outer expressions can
 * qualify its columns, e.g. {@code cohort_join.value}.
 *
 * <p>SQL generation: {@code (child) AS alias}
 */
public final class AliasedRelation extends LogicalPlan {

    private final String alias;

    public AliasedRelation(LogicalPlan child, String alias) {
        super(child);
        this.alias = Objects.requireNonNull(alias, "alias must not be null");
    }

    public LogicalPlan child() {
        return children.get(0);
    }

    public String alias() {
        return alias;
    }

    @Override
    public String toString() {
        return String.format("AliasedRelation(%s)", alias);
    }
}
