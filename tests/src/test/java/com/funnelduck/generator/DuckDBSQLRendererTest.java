package com.funnelduck.generator;

import com.funnelduck.expression.AliasExpression;
import com.funnelduck.expression.BinaryExpression;
import com.funnelduck.expression.CaseWhenExpression;
import com.funnelduck.expression.ColumnReference;
import com.funnelduck.expression.Expression;
import com.funnelduck.expression.FunctionCall;
import com.funnelduck.expression.InExpression;
import com.funnelduck.expression.IntervalExpression;
import com.funnelduck.expression.Literal;
import com.funnelduck.expression.Parameter;
import com.funnelduck.expression.StarExpression;
import com.funnelduck.expression.WindowFunction;
import com.funnelduck.expression.window.WindowFrame;
import com.funnelduck.logical.Aggregate;
import com.funnelduck.logical.Filter;
import com.funnelduck.logical.Join;
import com.funnelduck.logical.Limit;
import com.funnelduck.logical.Project;
import com.funnelduck.logical.Sort;
import com.funnelduck.logical.TableScan;
import com.funnelduck.logical.Union;
import com.funnelduck.test.TestBase;
import com.funnelduck.test.TestCategories;
import com.funnelduck.types.LongType;
import com.funnelduck.types.StringType;
import com.funnelduck.types.TimestampType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@TestCategories.Tier1
@TestCategories.SQL
@DisplayName("DuckDB SQL rendering")
public class DuckDBSQLRendererTest extends TestBase {

    private final DuckDBSQLRenderer renderer = new DuckDBSQLRenderer();

    private static ColumnReference col(String name) {
        return ColumnReference.of(name, LongType.get());
    }

    @Nested
    @DisplayName("Plans")
    class Plans {

        @Test
        @DisplayName("project over a filtered scan")
        void testProjectFilter() {
            TableScan events = new TableScan("events", "e");
            Filter filter = new Filter(events,
                BinaryExpression.equal(ColumnReference.qualified("e", "event", StringType.get()), Literal.of("buy")));
            Project project = new Project(filter, List.of(
                new AliasExpression(ColumnReference.qualified("e", "person_id", StringType.get()), "aggregation_target")));

            String sql = renderer.render(project).sql();
            logData("SQL", sql);

            assertThat(sql).isEqualTo(
                "SELECT e.person_id AS aggregation_target FROM events AS e WHERE (e.event = 'buy')");
        }

        @Test
        @DisplayName("nested plans get numbered subquery aliases")
        void testSubqueryAliases() {
            Project inner = new Project(new TableScan("events"), List.of(col("a")));
            Project middle = new Project(inner, List.of(col("a")));
            Project outer = new Project(middle, List.of(col("a")));

            String sql = renderer.render(outer).sql();

            assertThat(sql).isEqualTo(
                "SELECT a FROM (SELECT a FROM (SELECT a FROM events) AS subquery_1) AS subquery_2");
        }

        @Test
        @DisplayName("aggregates group by output names and render HAVING")
        void testAggregate() {
            Aggregate aggregate = new Aggregate(new TableScan("t"),
                List.of(new AliasExpression(col("x"), "value")),
                List.of(new AliasExpression(FunctionCall.of("count", LongType.get(), StarExpression.get()), "count")),
                BinaryExpression.greaterThan(col("count"), Literal.of(1)),
                true);

            String sql = renderer.render(aggregate).sql();

            assertThat(sql).isEqualTo(
                "SELECT x AS value, count(*) AS count FROM t GROUP BY value HAVING (count > 1)");
        }

        @Test
        @DisplayName("limit over sort keeps the ORDER BY in the same statement")
        void testSortLimit() {
            Sort sort = new Sort(new TableScan("t"), List.of(
                Sort.SortOrder.desc(col("count")),
                Sort.SortOrder.asc(col("value"))));
            String sql = renderer.render(new Limit(sort, 11, 5)).sql();

            assertThat(sql).isEqualTo(
                "SELECT * FROM t ORDER BY count DESC NULLS LAST, value ASC NULLS LAST LIMIT 11 OFFSET 5");
        }

        @Test
        void testUnionAll() {
            Project a = new Project(new TableScan("a"), List.of(col("x")));
            Project b = new Project(new TableScan("b"), List.of(col("x")));

            assertThat(renderer.render(new Union(List.of(a, b), true)).sql())
                .isEqualTo("SELECT x FROM a UNION ALL SELECT x FROM b");
        }

        @Test
        void testJoin() {
            Join join = new Join(new TableScan("events", "e"), new TableScan("cohort_people", "c"),
                Join.JoinType.INNER,
                BinaryExpression.equal(ColumnReference.qualified("e", "distinct_id", StringType.get()),
                    ColumnReference.qualified("c", "distinct_id", StringType.get())));

            assertThat(renderer.render(join).sql()).isEqualTo(
                "SELECT * FROM events AS e INNER JOIN cohort_people AS c ON (e.distinct_id = c.distinct_id)");
        }
    }

    @Nested
    @DisplayName("Expressions")
    class Expressions {

        @Test
        @DisplayName("parameters render as placeholders in order")
        void testParameters() {
            Expression condition = BinaryExpression.and(
                BinaryExpression.equal(col("event"), new Parameter("step_0_event", "sign up", StringType.get())),
                BinaryExpression.equal(col("event"), new Parameter("step_0_event", "sign up", StringType.get())));

            RenderedQuery rendered = renderer.renderExpression(condition);

            assertThat(rendered.sql()).isEqualTo("((event = ?) AND (event = ?))");
            assertThat(rendered.parameters()).containsExactly("sign up", "sign up");
            assertThat(rendered.namedParameters()).containsEntry("step_0_event", "sign up").hasSize(1);
        }

        @Test
        @DisplayName("same-named parameters with different values are both recorded")
        void testConflictingParameterNames() {
            Expression condition = BinaryExpression.or(
                BinaryExpression.equal(col("event"), new Parameter("event", "a", StringType.get())),
                BinaryExpression.equal(col("event"), new Parameter("event", "b", StringType.get())));

            RenderedQuery rendered = renderer.renderExpression(condition);

            assertThat(rendered.parameterCount()).isEqualTo(2);
            assertThat(rendered.namedParameters()).containsEntry("event", "a").containsEntry("event#2", "b");
        }

        @Test
        @DisplayName("window functions with a ROWS frame")
        void testWindowFrame() {
            WindowFunction window = new WindowFunction("min", List.of(col("latest_1")),
                List.of(col("aggregation_target")),
                List.of(Sort.SortOrder.desc(col("timestamp"))),
                WindowFrame.unboundedPrecedingTo(0),
                TimestampType.get());

            assertThat(renderer.renderExpression(window).sql()).isEqualTo(
                "min(latest_1) OVER (PARTITION BY aggregation_target ORDER BY \"timestamp\" DESC NULLS LAST "
                    + "ROWS BETWEEN UNBOUNDED PRECEDING AND CURRENT ROW)");
        }

        @Test
        void testExactlyPrecedingFrame() {
            assertThat(WindowFrame.exactlyPreceding(2).toString())
                .isEqualTo("ROWS BETWEEN 2 PRECEDING AND 2 PRECEDING");
            assertThat(WindowFrame.unboundedPrecedingTo(1).toString())
                .isEqualTo("ROWS BETWEEN UNBOUNDED PRECEDING AND 1 PRECEDING");
        }

        @Test
        void testCaseAndInterval() {
            Expression caseWhen = CaseWhenExpression.when(
                new InExpression(col("prop"), List.of(Literal.of("Chrome"))),
                col("prop"),
                Literal.of("Other"));
            Expression window = BinaryExpression.add(col("latest_0"), new IntervalExpression(14, IntervalExpression.Unit.DAY));

            assertThat(renderer.renderExpression(caseWhen).sql())
                .isEqualTo("CASE WHEN (prop IN ('Chrome')) THEN prop ELSE 'Other' END");
            assertThat(renderer.renderExpression(window).sql()).isEqualTo("(latest_0 + INTERVAL 14 DAY)");
        }
    }
}
