package com.funnelduck.funnel.engine;

import com.funnelduck.funnel.spec.EventStep;
import com.funnelduck.funnel.spec.FunnelMode;
import com.funnelduck.funnel.spec.StepDefinition;
import com.funnelduck.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("Unordered engine")
class UnorderedEngineTest {

    private static final StepDefinition A = EventStep.of("a");
    private static final StepDefinition B = EventStep.of("b");
    private static final StepDefinition C = EventStep.of("c");

    @Test
    @DisplayName("rotation r starts at step r and wraps around")
    void testRotate() {
        List<StepDefinition> steps = List.of(A, B, C);

        assertThat(UnorderedEngine.rotate(steps, 0)).containsExactly(A, B, C);
        assertThat(UnorderedEngine.rotate(steps, 1)).containsExactly(B, C, A);
        assertThat(UnorderedEngine.rotate(steps, 2)).containsExactly(C, A, B);
    }

    @Test
    void testModes() {
        ExclusionEngine exclusions = new ExclusionEngine();

        assertThat(new OrderedEngine(exclusions).mode()).isEqualTo(FunnelMode.ORDERED);
        assertThat(new StrictEngine(exclusions).mode()).isEqualTo(FunnelMode.STRICT);
        assertThat(new UnorderedEngine(exclusions).mode()).isEqualTo(FunnelMode.UNORDERED);
    }
}
