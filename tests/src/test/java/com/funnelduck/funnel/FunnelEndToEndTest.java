package com.funnelduck.funnel;

import com.funnelduck.funnel.actors.FunnelActor;
import com.funnelduck.funnel.catalog.ActionDefinition;
import com.funnelduck.funnel.catalog.CohortDefinition;
import com.funnelduck.funnel.catalog.InMemoryCatalog;
import com.funnelduck.funnel.histogram.ConversionTimeHistogram;
import com.funnelduck.funnel.histogram.HistogramBin;
import com.funnelduck.funnel.result.DrillDownSelector;
import com.funnelduck.funnel.result.FunnelResult;
import com.funnelduck.funnel.result.FunnelWarning;
import com.funnelduck.funnel.result.StepResult;
import com.funnelduck.funnel.spec.ActionStep;
import com.funnelduck.funnel.spec.AggregationTarget;
import com.funnelduck.funnel.spec.Breakdown;
import com.funnelduck.funnel.spec.BreakdownAttribution;
import com.funnelduck.funnel.spec.ConversionWindow;
import com.funnelduck.funnel.spec.DateRange;
import com.funnelduck.funnel.spec.EventStep;
import com.funnelduck.funnel.spec.ExclusionRange;
import com.funnelduck.funnel.spec.FunnelMode;
import com.funnelduck.funnel.spec.FunnelSpec;
import com.funnelduck.funnel.spec.PropertyFilter;
import com.funnelduck.funnel.spec.PropertyOperator;
import com.funnelduck.funnel.spec.TimeToConvertOptions;
import com.funnelduck.funnel.spec.VizType;
import com.funnelduck.funnel.step.RecordingField;
import com.funnelduck.test.TestBase;
import com.funnelduck.test.TestCategories;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.List;
import java.util.stream.Collectors;

import static com.funnelduck.funnel.EventFixtures.T0;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Funnels compiled, executed against an in-memory DuckDB, and formatted.
 */
@TestCategories.Tier2
@TestCategories.Integration
@DisplayName("Funnel end-to-end")
public class FunnelEndToEndTest extends TestBase {

    private EventFixtures fixtures;
    private InMemoryCatalog catalog;
    private FunnelQueryRunner runner;

    @BeforeEach
    void setUp() {
        fixtures = EventFixtures.create();
        catalog = new InMemoryCatalog();
        runner = new FunnelQueryRunner(FunnelSettings.defaults(), catalog, catalog, fixtures.executor());
    }

    @AfterEach
    void tearDown() {
        fixtures.close();
    }

    private static FunnelSpec.Builder signUpPlayBuy() {
        return FunnelSpec.builder()
            .step(EventStep.of("sign up"))
            .step(EventStep.of("play movie"))
            .step(EventStep.of("buy"))
            .window(ConversionWindow.days(7));
    }

    /** Person A converts through all three steps an hour apart; person B only signs up. */
    private void seedMovieFunnel() {
        fixtures.event("person_a", "sign up").at(T0).property("$session_id", "s1").insert();
        fixtures.event("person_a", "play movie").at(T0.plusHours(1)).property("$session_id", "s1").insert();
        fixtures.event("person_a", "buy").at(T0.plusHours(2)).property("$session_id", "s2").insert();
        fixtures.event("person_b", "sign up").at(T0).insert();
    }

    private static List<Long> counts(List<StepResult> steps) {
        return steps.stream().map(StepResult::matchedCount).collect(Collectors.toList());
    }

    @Nested
    @DisplayName("Ordered funnels")
    class Ordered {

        @Test
        @DisplayName("counts people per step and averages conversion times")
        void testBasicFunnel() {
            // Given
            seedMovieFunnel();

            // When
            FunnelResult result = runner.run(signUpPlayBuy().build());

            // Then
            List<StepResult> steps = result.steps();
            assertThat(counts(steps)).containsExactly(2L, 1L, 1L);
            assertThat(steps.get(0).averageConversionTimeSeconds()).isNull();
            assertThat(steps.get(0).medianConversionTimeSeconds()).isNull();
            assertThat(steps.get(1).averageConversionTimeSeconds()).isEqualTo(3600.0);
            assertThat(steps.get(2).averageConversionTimeSeconds()).isEqualTo(3600.0);
            assertThat(steps.get(2).medianConversionTimeSeconds()).isEqualTo(3600.0);
            assertThat(result.warnings()).isEmpty();
        }

        @Test
        @DisplayName("labels steps and builds drill-down selectors")
        void testLabelsAndSelectors() {
            seedMovieFunnel();

            List<StepResult> steps = runner.run(signUpPlayBuy().build()).steps();

            assertThat(steps).extracting(StepResult::label).containsExactly("sign up", "play movie", "buy");
            assertThat(steps.get(0).droppedSelector()).isNull();
            assertThat(steps.get(1).convertedSelector().funnelStep()).isEqualTo(2);
            assertThat(steps.get(1).droppedSelector().funnelStep()).isEqualTo(-2);
        }

        @Test
        @DisplayName("steps outside the conversion window do not count")
        void testConversionWindow() {
            fixtures.event("late", "sign up").at(T0).insert();
            fixtures.event("late", "play movie").at(T0.plusDays(8)).insert();

            FunnelResult result = runner.run(signUpPlayBuy().build());

            assertThat(counts(result.steps())).containsExactly(1L, 0L, 0L);
        }

        @Test
        @DisplayName("events out of order do not convert")
        void testOrderMatters() {
            fixtures.event("backwards", "buy").at(T0).insert();
            fixtures.event("backwards", "play movie").at(T0.plusMinutes(10)).insert();
            fixtures.event("backwards", "sign up").at(T0.plusMinutes(20)).insert();

            FunnelResult result = runner.run(signUpPlayBuy().build());

            assertThat(counts(result.steps())).containsExactly(1L, 0L, 0L);
        }

        @Test
        @DisplayName("a repeated step needs a second event")
        void testRepeatedStep() {
            fixtures.event("once", "pageview").at(T0).insert();
            fixtures.event("twice", "pageview").at(T0).insert();
            fixtures.event("twice", "pageview").at(T0.plusMinutes(5)).insert();

            FunnelSpec spec = FunnelSpec.builder()
                .step(EventStep.of("pageview"))
                .step(EventStep.of("pageview"))
                .build();
            FunnelResult result = runner.run(spec);

            assertThat(counts(result.steps())).containsExactly(2L, 1L);
            assertThat(result.steps().get(1).averageConversionTimeSeconds()).isEqualTo(300.0);
        }

        @Test
        @DisplayName("an excluded event between two steps disqualifies the person")
        void testExclusion() {
            // Given
            seedMovieFunnel();
            fixtures.event("person_a", "refund").at(T0.plusMinutes(90)).insert();

            // When
            FunnelSpec spec = signUpPlayBuy()
                .exclusion(new ExclusionRange(EventStep.of("refund"), 1, 2))
                .build();
            FunnelResult result = runner.run(spec);

            // Then
            assertThat(counts(result.steps())).containsExactly(1L, 0L, 0L);
        }

        @Test
        @DisplayName("an excluded event outside the range has no effect")
        void testExclusionOutsideRange() {
            seedMovieFunnel();
            fixtures.event("person_a", "refund").at(T0.plusHours(3)).insert();

            FunnelSpec spec = signUpPlayBuy()
                .exclusion(new ExclusionRange(EventStep.of("refund"), 1, 2))
                .build();

            assertThat(counts(runner.run(spec).steps())).containsExactly(2L, 1L, 1L);
        }

        @Test
        @DisplayName("a filtered exclusion only disqualifies matching events")
        void testFilteredExclusion() {
            // Given: both play a movie between the steps, only pro_user on the pro plan
            fixtures.event("free_user", "sign up").at(T0).insert();
            fixtures.event("free_user", "play movie").at(T0.plusHours(1)).property("plan", "free").insert();
            fixtures.event("free_user", "buy").at(T0.plusHours(2)).insert();
            fixtures.event("pro_user", "sign up").at(T0).insert();
            fixtures.event("pro_user", "play movie").at(T0.plusHours(1)).property("plan", "basic").insert();
            fixtures.event("pro_user", "play movie").at(T0.plusMinutes(90)).property("plan", "pro").insert();
            fixtures.event("pro_user", "buy").at(T0.plusHours(2)).insert();

            // When
            FunnelSpec spec = signUpPlayBuy()
                .exclusion(new ExclusionRange(
                    EventStep.of("play movie", PropertyFilter.event("plan", PropertyOperator.EXACT, "pro")), 1, 2))
                .build();
            FunnelResult result = runner.run(spec);

            // Then
            assertThat(counts(result.steps())).containsExactly(1L, 1L, 1L);
            assertThat(counts(runner.run(signUpPlayBuy().build()).steps())).containsExactly(2L, 2L, 2L);
        }

        @Test
        @DisplayName("group property filters read the group's properties")
        void testGroupPropertyFilter() {
            fixtures.event("alice", "sign up").at(T0).group(0, "acme").groupProperty(0, "industry", "media").insert();
            fixtures.event("alice", "buy").at(T0.plusHours(1)).group(0, "acme").groupProperty(0, "industry", "media").insert();
            fixtures.event("bob", "sign up").at(T0).group(0, "globex").groupProperty(0, "industry", "retail").insert();
            fixtures.event("carol", "sign up").at(T0).insert();

            FunnelSpec spec = FunnelSpec.builder()
                .step(EventStep.of("sign up", PropertyFilter.group(0, "industry", PropertyOperator.EXACT, "media")))
                .step(EventStep.of("buy"))
                .build();

            assertThat(counts(runner.run(spec).steps())).containsExactly(1L, 1L);
        }

        @Test
        @DisplayName("property filters restrict which events match a step")
        void testStepPropertyFilter() {
            fixtures.event("chrome", "sign up").at(T0).property("$browser", "Chrome").insert();
            fixtures.event("chrome", "buy").at(T0.plusHours(1)).property("amount", 30).insert();
            fixtures.event("safari", "sign up").at(T0).property("$browser", "Safari").insert();
            fixtures.event("safari", "buy").at(T0.plusHours(1)).property("amount", 5).insert();

            FunnelSpec spec = FunnelSpec.builder()
                .step(EventStep.of("sign up"))
                .step(EventStep.of("buy", PropertyFilter.event("amount", PropertyOperator.GT, 10)))
                .build();

            assertThat(counts(runner.run(spec).steps())).containsExactly(2L, 1L);
        }

        @Test
        @DisplayName("action steps match any of their events")
        void testActionStep() {
            catalog.addAction(new ActionDefinition(7, "Checkout", List.of(
                ActionDefinition.Matcher.event("buy"),
                ActionDefinition.Matcher.event("subscribe"))));
            fixtures.event("buyer", "sign up").at(T0).insert();
            fixtures.event("buyer", "buy").at(T0.plusHours(1)).insert();
            fixtures.event("subscriber", "sign up").at(T0).insert();
            fixtures.event("subscriber", "subscribe").at(T0.plusHours(1)).insert();

            FunnelSpec spec = FunnelSpec.builder()
                .step(EventStep.of("sign up"))
                .step(ActionStep.of(7))
                .build();
            List<StepResult> steps = runner.run(spec).steps();

            assertThat(counts(steps)).containsExactly(2L, 2L);
            assertThat(steps.get(1).label()).isEqualTo("Checkout");
            assertThat(steps.get(1).actionId()).isEqualTo(7L);
        }

        @Test
        @DisplayName("the date range limits the events considered")
        void testDateRange() {
            seedMovieFunnel();

            FunnelSpec spec = signUpPlayBuy()
                .dateRange(DateRange.between(T0.plusMinutes(30), T0.plusDays(1)))
                .build();

            assertThat(counts(runner.run(spec).steps())).containsExactly(0L, 0L, 0L);
        }

        @Test
        @DisplayName("an empty event store reports zero steps reached")
        void testNoEvents() {
            FunnelResult result = runner.run(signUpPlayBuy().build());

            assertThat(counts(result.steps())).containsExactly(0L, 0L, 0L);
            assertThat(result.warnings()).containsExactly(FunnelWarning.ZERO_STEPS_REACHED);
        }

        @Test
        @DisplayName("groups can be the aggregation target")
        void testGroupAggregation() {
            fixtures.event("alice", "sign up").at(T0).group(0, "acme").insert();
            fixtures.event("bob", "buy").at(T0.plusHours(1)).group(0, "acme").insert();
            fixtures.event("carol", "sign up").at(T0).group(0, "globex").insert();

            FunnelSpec spec = FunnelSpec.builder()
                .step(EventStep.of("sign up"))
                .step(EventStep.of("buy"))
                .aggregationTarget(AggregationTarget.group(0))
                .build();

            assertThat(counts(runner.run(spec).steps())).containsExactly(2L, 1L);
        }
    }

    @Nested
    @DisplayName("Breakdowns")
    class Breakdowns {

        @Test
        @DisplayName("values past the limit fold into Other")
        void testBreakdownLimit() {
            // Given: browser_i is used by i + 1 people
            int people = 0;
            for (int i = 0; i < 10; i++) {
                for (int p = 0; p <= i; p++) {
                    String person = "person_" + i + "_" + p;
                    fixtures.event(person, "sign up").at(T0).property("$browser", "browser_" + i).insert();
                    people++;
                }
            }

            // When
            FunnelSpec spec = FunnelSpec.builder()
                .step(EventStep.of("sign up"))
                .step(EventStep.of("buy"))
                .breakdown(Breakdown.event("$browser").withLimit(1))
                .build();
            FunnelResult result = runner.run(spec);

            // Then
            assertThat(result.partitions()).hasSize(2);
            assertThat(result.partitions())
                .extracting(steps -> steps.get(0).breakdownValue())
                .containsExactly("Other", "browser_9");
            long total = result.partitions().stream().mapToLong(steps -> steps.get(0).matchedCount()).sum();
            assertThat(total).isEqualTo(people);
        }

        @Test
        @DisplayName("each partition is monotonic")
        void testPartitionMonotonicity() {
            fixtures.event("a", "sign up").at(T0).property("$browser", "Chrome").insert();
            fixtures.event("a", "play movie").at(T0.plusMinutes(1)).property("$browser", "Chrome").insert();
            fixtures.event("b", "sign up").at(T0).property("$browser", "Chrome").insert();
            fixtures.event("c", "sign up").at(T0).property("$browser", "Firefox").insert();
            fixtures.event("c", "play movie").at(T0.plusMinutes(1)).property("$browser", "Firefox").insert();
            fixtures.event("c", "buy").at(T0.plusMinutes(2)).property("$browser", "Firefox").insert();

            FunnelSpec spec = signUpPlayBuy().breakdown(Breakdown.event("$browser")).build();
            FunnelResult result = runner.run(spec);

            assertThat(result.partitions()).hasSize(2);
            for (List<StepResult> steps : result.partitions()) {
                for (int i = 1; i < steps.size(); i++) {
                    assertThat(steps.get(i).matchedCount()).isLessThanOrEqualTo(steps.get(i - 1).matchedCount());
                }
            }
            List<StepResult> chrome = result.partitions().get(0);
            assertThat(chrome.get(0).breakdownLabel()).isEqualTo("Chrome");
            assertThat(counts(chrome)).containsExactly(2L, 1L, 0L);
        }

        @Test
        @DisplayName("missing values form their own partition")
        void testMissingBreakdownValue() {
            fixtures.event("a", "sign up").at(T0).property("$browser", "Chrome").insert();
            fixtures.event("b", "sign up").at(T0).insert();

            FunnelSpec spec = FunnelSpec.builder()
                .step(EventStep.of("sign up"))
                .breakdown(Breakdown.event("$browser"))
                .build();
            FunnelResult result = runner.run(spec);

            assertThat(result.partitions())
                .extracting(steps -> steps.get(0).breakdownValue())
                .containsExactly("", "Chrome");
        }

        @Test
        @DisplayName("cohort breakdowns include the all users cohort")
        void testCohortBreakdown() {
            catalog.addCohort(new CohortDefinition(1, "Paying"));
            fixtures.cohortMember(1, "alice");
            fixtures.event("alice", "sign up").at(T0).insert();
            fixtures.event("alice", "buy").at(T0.plusHours(1)).insert();
            fixtures.event("bob", "sign up").at(T0).insert();

            FunnelSpec spec = FunnelSpec.builder()
                .step(EventStep.of("sign up"))
                .step(EventStep.of("buy"))
                .breakdown(Breakdown.cohorts(1L))
                .build();
            FunnelResult result = runner.run(spec);

            assertThat(result.partitions()).hasSize(2);
            List<StepResult> allUsers = result.partitions().get(0);
            List<StepResult> paying = result.partitions().get(1);
            assertThat(allUsers.get(0).breakdownLabel()).isEqualTo("All Users");
            assertThat(counts(allUsers)).containsExactly(2L, 1L);
            assertThat(paying.get(0).breakdownLabel()).isEqualTo("Paying");
            assertThat(counts(paying)).containsExactly(1L, 1L);
        }

        @Test
        @DisplayName("the request limit and offset page through breakdown rows")
        void testBreakdownPaging() {
            fixtures.event("a", "sign up").at(T0).property("$browser", "Chrome").insert();
            fixtures.event("b", "sign up").at(T0).property("$browser", "Chrome").insert();
            fixtures.event("c", "sign up").at(T0).property("$browser", "Safari").insert();

            FunnelSpec.Builder spec = FunnelSpec.builder()
                .step(EventStep.of("sign up"))
                .step(EventStep.of("buy"))
                .breakdown(Breakdown.event("$browser"));

            assertThat(runner.run(spec.build()).partitions())
                .extracting(steps -> steps.get(0).breakdownValue())
                .containsExactly("Chrome", "Safari");
            FunnelResult page = runner.run(spec.limit(1).offset(1).build());
            assertThat(page.partitions()).hasSize(1);
            assertThat(page.partitions().get(0).get(0).breakdownValue()).isEqualTo("Safari");
            assertThat(counts(page.partitions().get(0))).containsExactly(1L, 0L);
        }

        @Test
        @DisplayName("group breakdowns split by the group's property")
        void testGroupBreakdown() {
            fixtures.event("alice", "sign up").at(T0).group(0, "acme").groupProperty(0, "industry", "media").insert();
            fixtures.event("alice", "buy").at(T0.plusHours(1)).group(0, "acme").groupProperty(0, "industry", "media").insert();
            fixtures.event("bob", "sign up").at(T0).group(0, "globex").groupProperty(0, "industry", "retail").insert();

            FunnelSpec spec = FunnelSpec.builder()
                .step(EventStep.of("sign up"))
                .step(EventStep.of("buy"))
                .breakdown(Breakdown.group(0, "industry"))
                .build();
            FunnelResult result = runner.run(spec);

            assertThat(result.partitions())
                .extracting(steps -> steps.get(0).breakdownValue())
                .containsExactly("retail", "media");
            assertThat(counts(result.partitions().get(0))).containsExactly(1L, 0L);
            assertThat(counts(result.partitions().get(1))).containsExactly(1L, 1L);
        }

        @Test
        @DisplayName("no matching values yields an empty breakdown warning")
        void testEmptyBreakdown() {
            FunnelSpec spec = FunnelSpec.builder()
                .step(EventStep.of("sign up"))
                .breakdown(Breakdown.person("plan"))
                .build();

            FunnelResult result = runner.run(spec);

            assertThat(result.isEmpty()).isTrue();
            assertThat(result.warnings()).contains(FunnelWarning.EMPTY_BREAKDOWN);
        }
    }

    @Nested
    @DisplayName("Breakdown attribution")
    class Attribution {

        /** steady signs up and buys on Chrome; switcher signs up on Chrome and buys on Safari. */
        private void seedBrowserSwitch() {
            fixtures.event("steady", "sign up").at(T0).property("$browser", "Chrome").insert();
            fixtures.event("steady", "buy").at(T0.plusHours(1)).property("$browser", "Chrome").insert();
            fixtures.event("switcher", "sign up").at(T0).property("$browser", "Chrome").insert();
            fixtures.event("switcher", "buy").at(T0.plusHours(1)).property("$browser", "Safari").insert();
        }

        private FunnelResult run(Breakdown breakdown) {
            return runner.run(FunnelSpec.builder()
                .step(EventStep.of("sign up"))
                .step(EventStep.of("buy"))
                .breakdown(breakdown)
                .build());
        }

        private List<Object> values(FunnelResult result) {
            return result.partitions().stream()
                .map(steps -> steps.get(0).breakdownValue())
                .collect(Collectors.toList());
        }

        @Test
        @DisplayName("all events: a value change breaks the conversion")
        void testAllEvents() {
            seedBrowserSwitch();

            FunnelResult result = run(Breakdown.event("$browser"));

            assertThat(values(result)).containsExactly("Chrome");
            assertThat(counts(result.partitions().get(0))).containsExactly(2L, 1L);
        }

        @Test
        @DisplayName("first touch counts the target under its first value")
        void testFirstTouch() {
            seedBrowserSwitch();

            FunnelResult result = run(Breakdown.event("$browser").withAttribution(BreakdownAttribution.FIRST_TOUCH));

            assertThat(values(result)).containsExactly("Chrome");
            assertThat(counts(result.partitions().get(0))).containsExactly(2L, 2L);
        }

        @Test
        @DisplayName("last touch counts the target under its last value")
        void testLastTouch() {
            seedBrowserSwitch();

            FunnelResult result = run(Breakdown.event("$browser").withAttribution(BreakdownAttribution.LAST_TOUCH));

            assertThat(values(result)).containsExactly("Chrome", "Safari");
            assertThat(counts(result.partitions().get(0))).containsExactly(1L, 1L);
            assertThat(counts(result.partitions().get(1))).containsExactly(1L, 1L);
        }

        @Test
        @DisplayName("step attribution uses the value seen on that step")
        void testStep() {
            seedBrowserSwitch();

            FunnelResult result = run(Breakdown.event("$browser").attributedToStep(1));

            assertThat(values(result)).containsExactly("Chrome", "Safari");
            assertThat(counts(result.partitions().get(1))).containsExactly(1L, 1L);
        }

        @Test
        @DisplayName("step attribution counts the target under every value of the step")
        void testStepWithSeveralValues() {
            fixtures.event("multi", "sign up").at(T0).property("$browser", "Chrome").insert();
            fixtures.event("multi", "sign up").at(T0.plusMinutes(10)).property("$browser", "Firefox").insert();
            fixtures.event("multi", "buy").at(T0.plusHours(1)).insert();

            FunnelResult result = run(Breakdown.event("$browser").attributedToStep(0));

            assertThat(values(result)).containsExactly("Chrome", "Firefox");
            for (List<StepResult> steps : result.partitions()) {
                assertThat(counts(steps)).containsExactly(1L, 1L);
            }
        }
    }

    @Nested
    @DisplayName("Funnel modes")
    class Modes {

        @Test
        @DisplayName("strict funnels need adjacent events")
        void testStrict() {
            fixtures.event("interrupted", "sign up").at(T0).insert();
            fixtures.event("interrupted", "pageview").at(T0.plusMinutes(30)).insert();
            fixtures.event("interrupted", "buy").at(T0.plusHours(1)).insert();
            fixtures.event("direct", "sign up").at(T0).insert();
            fixtures.event("direct", "buy").at(T0.plusHours(1)).insert();

            FunnelSpec spec = FunnelSpec.builder()
                .step(EventStep.of("sign up"))
                .step(EventStep.of("buy"))
                .mode(FunnelMode.STRICT)
                .build();
            FunnelResult result = runner.run(spec);

            assertThat(counts(result.steps())).containsExactly(2L, 1L);
            assertThat(result.steps().get(1).averageConversionTimeSeconds()).isEqualTo(3600.0);
        }

        @Test
        @DisplayName("unordered funnels accept any order within the window")
        void testUnordered() {
            fixtures.event("reversed", "buy").at(T0).insert();
            fixtures.event("reversed", "sign up").at(T0.plusHours(1)).insert();

            FunnelSpec.Builder spec = FunnelSpec.builder()
                .step(EventStep.of("sign up"))
                .step(EventStep.of("buy"));

            List<StepResult> ordered = runner.run(spec.mode(FunnelMode.ORDERED).build()).steps();
            List<StepResult> unordered = runner.run(spec.mode(FunnelMode.UNORDERED).build()).steps();

            assertThat(counts(ordered)).containsExactly(1L, 0L);
            assertThat(counts(unordered)).containsExactly(1L, 1L);
            assertThat(unordered.get(1).averageConversionTimeSeconds()).isEqualTo(3600.0);
        }

        @Test
        @DisplayName("unordered exclusions only drop the attempt they interrupt")
        void testUnorderedExclusion() {
            fixtures.event("refunded", "buy").at(T0).insert();
            fixtures.event("refunded", "refund").at(T0.plusMinutes(30)).insert();
            fixtures.event("refunded", "sign up").at(T0.plusHours(1)).insert();
            fixtures.event("clean", "buy").at(T0).insert();
            fixtures.event("clean", "sign up").at(T0.plusHours(1)).insert();

            FunnelSpec.Builder spec = FunnelSpec.builder()
                .step(EventStep.of("sign up"))
                .step(EventStep.of("buy"))
                .mode(FunnelMode.UNORDERED);

            List<StepResult> plain = runner.run(spec.build()).steps();
            List<StepResult> excluded = runner.run(spec
                .exclusion(new ExclusionRange(EventStep.of("refund"), 0, 1))
                .build()).steps();

            assertThat(counts(plain)).containsExactly(2L, 2L);
            assertThat(counts(excluded)).containsExactly(2L, 1L);
        }

        @ParameterizedTest(name = "{0}")
        @EnumSource(FunnelMode.class)
        @DisplayName("step counts never increase")
        void testMonotonicity(FunnelMode mode) {
            seedMovieFunnel();
            fixtures.event("person_c", "play movie").at(T0).insert();
            fixtures.event("person_c", "sign up").at(T0.plusMinutes(5)).insert();

            List<StepResult> steps = runner.run(signUpPlayBuy().mode(mode).build()).steps();

            for (int i = 1; i < steps.size(); i++) {
                assertThat(steps.get(i).matchedCount()).isLessThanOrEqualTo(steps.get(i - 1).matchedCount());
            }
        }

        @Test
        @DisplayName("unordered first-step count is at least the ordered one")
        void testUnorderedCoversOrdered() {
            seedMovieFunnel();
            fixtures.event("person_c", "buy").at(T0).insert();

            long ordered = runner.run(signUpPlayBuy().build()).steps().get(0).matchedCount();
            long unordered = runner.run(signUpPlayBuy().mode(FunnelMode.UNORDERED).build()).steps().get(0).matchedCount();

            assertThat(unordered).isGreaterThanOrEqualTo(ordered);
            assertThat(unordered).isEqualTo(3L);
        }
    }

    @Nested
    @DisplayName("Time to convert")
    class TimeToConvert {

        @Test
        @DisplayName("bins every converted person exactly once")
        void testHistogram() {
            fixtures.event("fast", "sign up").at(T0).insert();
            fixtures.event("fast", "buy").at(T0.plusHours(1)).insert();
            fixtures.event("slow", "sign up").at(T0).insert();
            fixtures.event("slow", "buy").at(T0.plusHours(3)).insert();
            fixtures.event("never", "sign up").at(T0).insert();

            FunnelSpec spec = FunnelSpec.builder()
                .step(EventStep.of("sign up"))
                .step(EventStep.of("buy"))
                .vizType(VizType.TIME_TO_CONVERT)
                .build();
            ConversionTimeHistogram histogram = runner.runTimeToConvert(spec);

            assertThat(histogram.totalCount()).isEqualTo(2);
            assertThat(histogram.bins()).hasSize(4);
            assertThat(histogram.bins().get(0)).isEqualTo(new HistogramBin(3600, 6000, 1));
            assertThat(histogram.bins().get(3)).isEqualTo(new HistogramBin(10800, 13200, 1));
            assertThat(histogram.averageConversionTimeSeconds()).isEqualTo(7200.0);
        }

        @Test
        @DisplayName("sums step times across the selected range")
        void testStepRange() {
            seedMovieFunnel();

            FunnelSpec spec = signUpPlayBuy()
                .vizType(VizType.TIME_TO_CONVERT)
                .timeToConvert(new TimeToConvertOptions(0, 2, 1))
                .build();
            ConversionTimeHistogram histogram = runner.runTimeToConvert(spec);

            assertThat(histogram.bins()).hasSize(2);
            assertThat(histogram.bins().get(0).fromSeconds()).isEqualTo(7200);
            assertThat(histogram.totalCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("no conversions yields an empty histogram")
        void testNoConversions() {
            fixtures.event("never", "sign up").at(T0).insert();

            FunnelSpec spec = FunnelSpec.builder()
                .step(EventStep.of("sign up"))
                .step(EventStep.of("buy"))
                .vizType(VizType.TIME_TO_CONVERT)
                .build();
            ConversionTimeHistogram histogram = runner.runTimeToConvert(spec);

            assertThat(histogram.bins()).isEmpty();
            assertThat(histogram.warnings()).containsExactly(FunnelWarning.ZERO_SAMPLE_HISTOGRAM);
        }
    }

    @Nested
    @DisplayName("Actors")
    class Actors {

        @Test
        @DisplayName("converted selector lists people who reached the step")
        void testConvertedActors() {
            seedMovieFunnel();

            List<FunnelActor> actors = runner.actors(signUpPlayBuy().build(), DrillDownSelector.converted(2, null));

            assertThat(actors).extracting(FunnelActor::actorId).containsExactly("person_a");
            assertThat(actors.get(0).stepsReached()).isEqualTo(3);
        }

        @Test
        @DisplayName("dropped selector lists people who stopped before the step")
        void testDroppedActors() {
            seedMovieFunnel();

            List<FunnelActor> actors = runner.actors(signUpPlayBuy().build(), DrillDownSelector.dropped(1, null));

            assertThat(actors).extracting(FunnelActor::actorId).containsExactly("person_b");
        }

        @Test
        @DisplayName("first step lists everyone, ordered and paged")
        void testPaging() {
            seedMovieFunnel();

            FunnelSpec spec = signUpPlayBuy().limit(1).offset(1).build();
            List<FunnelActor> actors = runner.actors(spec, DrillDownSelector.converted(0, null));

            assertThat(actors).extracting(FunnelActor::actorId).containsExactly("person_b");
        }

        @Test
        @DisplayName("recordings carry the matched session ids per step")
        void testMatchedSessions() {
            seedMovieFunnel();

            FunnelSpec spec = signUpPlayBuy().includeRecordings(true).build();
            List<FunnelActor> actors = runner.actors(spec, DrillDownSelector.converted(2, null));

            FunnelActor actor = actors.get(0);
            assertThat(actor.matchedSessions(0)).containsExactly("s1");
            assertThat(actor.matchedSessions(2)).containsExactly("s2");
            assertThat(actor.matchedRecordings().get(RecordingField.UUID).get(0)).hasSize(1);
        }
    }
}
