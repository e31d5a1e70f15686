package com.funnelduck.logical;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Base class for all logical plan nodes built by the funnel compiler.
 *
 * <p>This represents a node in the logical query plan tree. Each node can have
 * zero or more children. Plans are immutable and carry no SQL text; they are
 * rendered once by a {@link com.funnelduck.generator.SQLRenderer}.
 *
 * @see com.funnelduck.generator.DuckDBSQLRenderer
 */
public abstract class LogicalPlan {

    /** Child nodes in the plan tree */
    protected final List<LogicalPlan> children;

    /**
     * Creates a logical plan node with no children.
     */
    protected LogicalPlan() {
        this.children = Collections.emptyList();
    }

    /**
     * Creates a logical plan node with a single child.
     *
     * @param child the child node
     */
    protected LogicalPlan(LogicalPlan child) {
        if (child == null) {
            throw new NullPointerException("child must not be null");
        }
        this.children = Collections.singletonList(child);
    }

    /**
     * Creates a logical plan node with multiple children.
     *
     * @param children the child nodes
     */
    protected LogicalPlan(List<LogicalPlan> children) {
        this.children = Collections.unmodifiableList(new ArrayList<>(children));
    }

    /**
     * Returns the child nodes of this plan.
     *
     * @return an unmodifiable list of children
     */
    public List<LogicalPlan> children() {
        return children;
    }

    /**
     * Returns a multi-line, indented description of the plan tree.
     *
     * @return the tree description
     */
    public String treeString() {
        StringBuilder sb = new StringBuilder();
        appendTree(sb, 0);
        return sb.toString();
    }

    private void appendTree(StringBuilder sb, int depth) {
        sb.append("  ".repeat(depth)).append(this).append('\n');
        for (LogicalPlan child : children) {
            child.appendTree(sb, depth + 1);
        }
    }
}
