package com.funnelduck.logical;

/**
 * Logical plan node representing LIMIT / OFFSET.
 *
 * <p>SQL generation: {@code SELECT * FROM (child) AS subquery_N LIMIT n OFFSET m}, or
 * appended directly when the child is a {@link Sort}.
 */
public final class Limit extends LogicalPlan {

    private final long limit;
    private final long offset;

    public Limit(LogicalPlan child, long limit, long offset) {
        super(child);
        if (limit < 0) {
            throw new IllegalArgumentException("limit must not be negative: " + limit);
        }
        if (offset < 0) {
            throw new IllegalArgumentException("offset must not be negative: " + offset);
        }
        this.limit = limit;
        this.offset = offset;
    }

    public Limit(LogicalPlan child, long limit) {
        this(child, limit, 0);
    }

    public LogicalPlan child() {
        return children.get(0);
    }

    public long limit() {
        return limit;
    }

    public long offset() {
        return offset;
    }

    @Override
    public String toString() {
        return String.format("Limit(%d, offset=%d)", limit, offset);
    }
}
