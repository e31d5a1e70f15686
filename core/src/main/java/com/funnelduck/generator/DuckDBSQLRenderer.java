package com.funnelduck.generator;

import com.funnelduck.exception.SQLGenerationException;
import com.funnelduck.expression.AliasExpression;
import com.funnelduck.expression.ArrayLiteralExpression;
import com.funnelduck.expression.BinaryExpression;
import com.funnelduck.expression.CaseWhenExpression;
import com.funnelduck.expression.CastExpression;
import com.funnelduck.expression.ColumnReference;
import com.funnelduck.expression.Expression;
import com.funnelduck.expression.FunctionCall;
import com.funnelduck.expression.InExpression;
import com.funnelduck.expression.IntervalExpression;
import com.funnelduck.expression.LikeExpression;
import com.funnelduck.expression.Literal;
import com.funnelduck.expression.Parameter;
import com.funnelduck.expression.StarExpression;
import com.funnelduck.expression.UnaryExpression;
import com.funnelduck.expression.WindowFunction;
import com.funnelduck.expression.window.WindowFrame;
import com.funnelduck.logical.Aggregate;
import com.funnelduck.logical.AliasedRelation;
import com.funnelduck.logical.Filter;
import com.funnelduck.logical.Join;
import com.funnelduck.logical.Limit;
import com.funnelduck.logical.LogicalPlan;
import com.funnelduck.logical.Project;
import com.funnelduck.logical.Sort;
import com.funnelduck.logical.TableScan;
import com.funnelduck.logical.Union;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import static com.funnelduck.generator.SQLQuoting.quoteIdentifierIfNeeded;
import static com.funnelduck.generator.SQLQuoting.quoteLiteral;

/**
 * Renders funnel plans into DuckDB SQL.
 *
 * <p>Each plan node becomes a SELECT over its child, with derived children
 * wrapped as {@code (...) AS subquery_N}. A Filter directly under a Project or
 * Aggregate is folded into that SELECT's WHERE clause, so a funnel level reads
 * as {@code SELECT ... FROM (...) AS subquery_N WHERE ...}.
 *
 * <p>Every {@link Parameter} becomes a {@code ?} placeholder. Clauses are
 * rendered strictly left to right, so the collected values line up with the
 * placeholders in the final text.
 *
 * <p>Example usage:
 * <pre>
 *   RenderedQuery query = new DuckDBSQLRenderer().render(plan);
 *   PreparedStatement stmt = connection.prepareStatement(query.sql());
 * </pre>
 */
public class DuckDBSQLRenderer implements SQLRenderer {

    @Override
    public RenderedQuery render(LogicalPlan plan) {
        Objects.requireNonNull(plan, "plan must not be null");
        Rendering rendering = new Rendering();
        try {
            String sql = rendering.select(plan);
            return new RenderedQuery(sql, rendering.parameters, rendering.namedParameters);
        } catch (SQLGenerationException | IllegalArgumentException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new SQLGenerationException("Unexpected error during SQL generation", e, plan);
        }
    }

    /**
     * Renders a single expression, collecting its parameters into a standalone query.
     * Mostly useful for tests and debugging.
     *
     * @param expression the expression
     * @return the rendered expression text with its parameters
     */
    public RenderedQuery renderExpression(Expression expression) {
        Objects.requireNonNull(expression, "expression must not be null");
        Rendering rendering = new Rendering();
        String sql = rendering.expr(expression);
        return new RenderedQuery(sql, rendering.parameters, rendering.namedParameters);
    }

    /**
     * State of one render call.
     */
    private static final class Rendering {

        private final List<Object> parameters = new ArrayList<>();
        private final Map<String, Object> namedParameters = new LinkedHashMap<>();
        private int aliasCounter;

        private String nextSubqueryAlias() {
            return "subquery_" + (++aliasCounter);
        }

        // ==================== Plans ====================

        /**
         * Renders a plan as a complete SELECT statement.
         */
        String select(LogicalPlan plan) {
            if (plan instanceof Project project) {
                return selectProject(project);
            } else if (plan instanceof Aggregate aggregate) {
                return selectAggregate(aggregate);
            } else if (plan instanceof Filter filter) {
                StringBuilder sql = new StringBuilder("SELECT *");
                appendFromWhere(sql, filter);
                return sql.toString();
            } else if (plan instanceof Sort sort) {
                return selectSort(sort);
            } else if (plan instanceof Limit limit) {
                return selectLimit(limit);
            } else if (plan instanceof Union union) {
                return selectUnion(union);
            } else if (plan instanceof TableScan || plan instanceof Join || plan instanceof AliasedRelation) {
                return "SELECT * FROM " + relation(plan);
            }
            throw new SQLGenerationException("SQL generation not implemented", plan);
        }

        /**
         * Renders a plan as an item of a FROM clause.
         */
        private String relation(LogicalPlan plan) {
            if (plan instanceof TableScan scan) {
                String table = quoteIdentifierIfNeeded(scan.tableName());
                return scan.alias() == null ? table : table + " AS " + quoteIdentifierIfNeeded(scan.alias());
            } else if (plan instanceof AliasedRelation aliased) {
                return "(" + select(aliased.child()) + ") AS " + quoteIdentifierIfNeeded(aliased.alias());
            } else if (plan instanceof Join join) {
                StringBuilder sql = new StringBuilder();
                sql.append(relation(join.left()));
                sql.append(' ').append(join.joinType().keyword()).append(' ');
                sql.append(relation(join.right()));
                sql.append(" ON ").append(expr(join.condition()));
                return sql.toString();
            }
            String inner = select(plan);
            return "(" + inner + ") AS " + nextSubqueryAlias();
        }

        private void appendFromWhere(StringBuilder sql, LogicalPlan source) {
            if (source instanceof Filter filter) {
                sql.append(" FROM ").append(relation(filter.child()));
                sql.append(" WHERE ").append(expr(filter.condition()));
            } else {
                sql.append(" FROM ").append(relation(source));
            }
        }

        private String selectProject(Project project) {
            StringBuilder sql = new StringBuilder("SELECT ");
            sql.append(exprList(project.projections()));
            appendFromWhere(sql, project.child());
            return sql.toString();
        }

        private String selectAggregate(Aggregate aggregate) {
            StringBuilder sql = new StringBuilder("SELECT ");
            List<Expression> selected = new ArrayList<>();
            if (aggregate.selectGrouping()) {
                selected.addAll(aggregate.groupingExpressions());
            }
            selected.addAll(aggregate.aggregateExpressions());
            sql.append(exprList(selected));
            appendFromWhere(sql, aggregate.child());

            if (!aggregate.groupingExpressions().isEmpty()) {
                sql.append(" GROUP BY ");
                List<String> keys = new ArrayList<>();
                for (Expression key : aggregate.groupingExpressions()) {
                    // group by the output name, the expression was already rendered in the SELECT list
                    keys.add(key instanceof AliasExpression alias
                        ? quoteIdentifierIfNeeded(alias.alias())
                        : expr(key));
                }
                sql.append(String.join(", ", keys));
            }
            if (aggregate.havingCondition() != null) {
                sql.append(" HAVING ").append(expr(aggregate.havingCondition()));
            }
            return sql.toString();
        }

        private String selectSort(Sort sort) {
            StringBuilder sql = new StringBuilder("SELECT * FROM ");
            sql.append(relation(sort.child()));
            sql.append(" ORDER BY ").append(sortOrders(sort.sortOrders()));
            return sql.toString();
        }

        private String selectLimit(Limit limit) {
            StringBuilder sql = new StringBuilder();
            if (limit.child() instanceof Sort) {
                sql.append(select(limit.child()));
            } else {
                sql.append("SELECT * FROM ").append(relation(limit.child()));
            }
            sql.append(" LIMIT ").append(limit.limit());
            if (limit.offset() > 0) {
                sql.append(" OFFSET ").append(limit.offset());
            }
            return sql.toString();
        }

        private String selectUnion(Union union) {
            String separator = union.all() ? " UNION ALL " : " UNION ";
            List<String> parts = new ArrayList<>();
            for (LogicalPlan input : union.inputs()) {
                if (input instanceof Sort || input instanceof Limit || input instanceof Union) {
                    parts.add("SELECT * FROM " + relation(input));
                } else {
                    parts.add(select(input));
                }
            }
            return String.join(separator, parts);
        }

        // ==================== Expressions ====================

        private String exprList(List<? extends Expression> expressions) {
            List<String> parts = new ArrayList<>(expressions.size());
            for (Expression e : expressions) {
                parts.add(expr(e));
            }
            return String.join(", ", parts);
        }

        String expr(Expression expression) {
            if (expression instanceof ColumnReference col) {
                String name = quoteIdentifierIfNeeded(col.columnName());
                return col.isQualified() ? quoteIdentifierIfNeeded(col.qualifier()) + "." + name : name;
            } else if (expression instanceof Literal literal) {
                return literal(literal);
            } else if (expression instanceof Parameter param) {
                bind(param);
                return "?";
            } else if (expression instanceof AliasExpression alias) {
                return expr(alias.expression()) + " AS " + quoteIdentifierIfNeeded(alias.alias());
            } else if (expression instanceof BinaryExpression binary) {
                String left = expr(binary.left());
                String right = expr(binary.right());
                return "(" + left + " " + binary.operator().symbol() + " " + right + ")";
            } else if (expression instanceof UnaryExpression unary) {
                String operand = expr(unary.operand());
                return unary.operator().isPrefix()
                    ? "(" + unary.operator().symbol() + " " + operand + ")"
                    : "(" + operand + " " + unary.operator().symbol() + ")";
            } else if (expression instanceof CaseWhenExpression caseWhen) {
                return caseWhen(caseWhen);
            } else if (expression instanceof FunctionCall call) {
                return call.functionName() + "(" + (call.distinct() ? "DISTINCT " : "") +
                    exprList(call.arguments()) + ")";
            } else if (expression instanceof WindowFunction window) {
                return window(window);
            } else if (expression instanceof InExpression in) {
                String test = expr(in.testExpr());
                return "(" + test + (in.isNegated() ? " NOT IN (" : " IN (") + exprList(in.values()) + "))";
            } else if (expression instanceof LikeExpression like) {
                String input = expr(like.input());
                return "(" + input + " " + like.keyword() + " " + expr(like.pattern()) + ")";
            } else if (expression instanceof IntervalExpression interval) {
                return "INTERVAL " + interval.amount() + " " + interval.unit().name();
            } else if (expression instanceof ArrayLiteralExpression array) {
                return "[" + exprList(array.elements()) + "]";
            } else if (expression instanceof CastExpression cast) {
                return (cast.isTryCast() ? "TRY_CAST(" : "CAST(") + expr(cast.expression()) +
                    " AS " + cast.targetType().duckdbName() + ")";
            } else if (expression instanceof StarExpression) {
                return "*";
            }
            throw new SQLGenerationException("SQL generation not implemented", expression);
        }

        private String literal(Literal literal) {
            Object value = literal.value();
            if (value == null) {
                return "NULL";
            }
            if (value instanceof String s) {
                return quoteLiteral(s);
            }
            if (value instanceof Boolean b) {
                return b ? "TRUE" : "FALSE";
            }
            if (value instanceof Number) {
                return value.toString();
            }
            throw new SQLGenerationException(
                "Unsupported literal value of type " + value.getClass().getSimpleName(), literal);
        }

        private void bind(Parameter param) {
            parameters.add(param.value());
            String name = param.name();
            Object existing = namedParameters.get(name);
            if (existing == null || existing.equals(param.value())) {
                namedParameters.put(name, param.value());
                return;
            }
            int suffix = 2;
            while (namedParameters.containsKey(name + "#" + suffix)
                    && !namedParameters.get(name + "#" + suffix).equals(param.value())) {
                suffix++;
            }
            namedParameters.put(name + "#" + suffix, param.value());
        }

        private String caseWhen(CaseWhenExpression caseWhen) {
            StringBuilder sql = new StringBuilder("CASE");
            for (int i = 0; i < caseWhen.conditions().size(); i++) {
                sql.append(" WHEN ").append(expr(caseWhen.conditions().get(i)));
                sql.append(" THEN ").append(expr(caseWhen.thenBranches().get(i)));
            }
            if (caseWhen.elseBranch() != null) {
                sql.append(" ELSE ").append(expr(caseWhen.elseBranch()));
            }
            return sql.append(" END").toString();
        }

        private String window(WindowFunction window) {
            StringBuilder sql = new StringBuilder();
            sql.append(window.function()).append('(').append(exprList(window.arguments())).append(")");
            sql.append(" OVER (");
            boolean needsSpace = false;
            if (!window.partitionBy().isEmpty()) {
                sql.append("PARTITION BY ").append(exprList(window.partitionBy()));
                needsSpace = true;
            }
            if (!window.orderBy().isEmpty()) {
                if (needsSpace) {
                    sql.append(' ');
                }
                sql.append("ORDER BY ").append(sortOrders(window.orderBy()));
                needsSpace = true;
            }
            if (window.frame().isPresent()) {
                WindowFrame frame = window.frame().get();
                if (needsSpace) {
                    sql.append(' ');
                }
                sql.append("ROWS BETWEEN ").append(frame.start()).append(" AND ").append(frame.end());
            }
            return sql.append(')').toString();
        }

        private String sortOrders(List<Sort.SortOrder> orders) {
            List<String> parts = new ArrayList<>(orders.size());
            for (Sort.SortOrder order : orders) {
                String clause = expr(order.expression());
                clause += order.direction() == Sort.SortDirection.DESCENDING ? " DESC" : " ASC";
                clause += order.nullOrdering() == Sort.NullOrdering.NULLS_FIRST ? " NULLS FIRST" : " NULLS LAST";
                parts.add(clause);
            }
            return String.join(", ", parts);
        }
    }
}
