package com.funnelduck.funnel.step;

import com.funnelduck.exception.FunnelConfigurationException;
import com.funnelduck.funnel.catalog.ActionDefinition;
import com.funnelduck.funnel.catalog.InMemoryCatalog;
import com.funnelduck.funnel.spec.ActionStep;
import com.funnelduck.funnel.spec.EventStep;
import com.funnelduck.funnel.spec.ExclusionRange;
import com.funnelduck.funnel.spec.PropertyFilter;
import com.funnelduck.funnel.spec.PropertyOperator;
import com.funnelduck.generator.DuckDBSQLRenderer;
import com.funnelduck.generator.RenderedQuery;
import com.funnelduck.test.TestBase;
import com.funnelduck.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("Step conditions")
public class StepConditionBuilderTest extends TestBase {

    private final InMemoryCatalog catalog = new InMemoryCatalog()
        .addAction(new ActionDefinition(1, "Checkout", List.of(
            ActionDefinition.Matcher.event("buy"),
            ActionDefinition.Matcher.event("subscribe", PropertyFilter.event("plan", PropertyOperator.EXACT, "pro")))))
        .addAction(new ActionDefinition(2, "Empty", List.of()));
    private final StepConditionBuilder builder = new StepConditionBuilder(catalog);
    private final DuckDBSQLRenderer renderer = new DuckDBSQLRenderer();

    @Test
    void testEventStep() {
        RenderedQuery rendered = renderer.renderExpression(builder.predicate(EventStep.of("sign up"), "step_0_"));

        assertThat(rendered.sql()).isEqualTo("(e.event = ?)");
        assertThat(rendered.namedParameters()).containsEntry("step_0_event", "sign up");
    }

    @Test
    @DisplayName("a step without an event name matches every event")
    void testAnyEvent() {
        assertThat(renderer.renderExpression(builder.predicate(EventStep.anyEvent(), "step_0_")).sql())
            .isEqualTo("TRUE");
    }

    @Test
    @DisplayName("step filters are ANDed onto the event match")
    void testStepFilters() {
        EventStep step = EventStep.of("buy", PropertyFilter.event("amount", PropertyOperator.GTE, 10));

        String sql = renderer.renderExpression(builder.predicate(step, "step_1_")).sql();

        assertThat(sql).startsWith("((e.event = ?) AND (TRY_CAST(");
    }

    @Test
    @DisplayName("action steps OR their matchers")
    void testActionStep() {
        RenderedQuery rendered = renderer.renderExpression(builder.predicate(ActionStep.of(1), "step_2_"));
        logData("Action predicate", rendered.sql());

        assertThat(rendered.sql()).startsWith("((e.event = ?) OR ((e.event = ?) AND ");
        assertThat(rendered.namedParameters())
            .containsEntry("step_2_action_0_event", "buy")
            .containsEntry("step_2_action_1_event", "subscribe")
            .containsEntry("step_2_action_1_prop_0", "pro");
    }

    @Test
    void testUnknownAction() {
        assertThatThrownBy(() -> builder.predicate(ActionStep.of(99), "step_0_"))
            .isInstanceOf(FunnelConfigurationException.class)
            .hasMessageContaining("action 99");
        assertThatThrownBy(() -> builder.predicate(ActionStep.of(2), "step_0_"))
            .isInstanceOf(FunnelConfigurationException.class)
            .hasMessageContaining("no matchers");
    }

    @Test
    @DisplayName("step columns flag, timestamp and recordings")
    void testStepColumns() {
        StepColumns columns = builder.stepColumns(EventStep.of("buy"), 2, List.of(RecordingField.SESSION_ID));

        assertThat(columns.flagName()).isEqualTo("step_2");
        assertThat(columns.latestName()).isEqualTo("latest_2");
        assertThat(columns.projections()).hasSize(3);
        assertThat(renderer.renderExpression(columns.latestColumn()).sql())
            .isEqualTo("CASE WHEN (e.event = ?) THEN e.\"timestamp\" ELSE NULL END AS latest_2");
        assertThat(renderer.renderExpression(columns.recordingColumns().get(0)).sql())
            .endsWith("AS session_id_2");
    }

    @Test
    @DisplayName("exclusion columns are prefixed and indexed by the range start")
    void testExclusionColumns() {
        StepColumns columns = builder.exclusionColumns(new ExclusionRange(EventStep.of("refund"), 1, 2), 0);

        assertThat(columns.flagName()).isEqualTo("exclusion_0_step_1");
        assertThat(columns.latestName()).isEqualTo("exclusion_0_latest_1");
        assertThat(renderer.renderExpression(columns.predicate()).namedParameters())
            .containsEntry("exclusion_0_step_1_event", "refund");
    }
}
