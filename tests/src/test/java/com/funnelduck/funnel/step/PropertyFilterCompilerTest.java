package com.funnelduck.funnel.step;

import com.funnelduck.exception.FunnelConfigurationException;
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
@DisplayName("Property filter compilation")
public class PropertyFilterCompilerTest extends TestBase {

    private static final String BROWSER = "json_extract_string(e.properties, '$.\"$browser\"')";

    private final PropertyFilterCompiler compiler = new PropertyFilterCompiler();
    private final DuckDBSQLRenderer renderer = new DuckDBSQLRenderer();

    private RenderedQuery render(PropertyFilter filter) {
        RenderedQuery rendered = renderer.renderExpression(compiler.compile(filter, "p"));
        logData("Predicate", rendered.sql());
        return rendered;
    }

    @Test
    void testExact() {
        RenderedQuery rendered = render(PropertyFilter.event("$browser", PropertyOperator.EXACT, "Chrome"));

        assertThat(rendered.sql()).isEqualTo("(" + BROWSER + " = ?)");
        assertThat(rendered.parameters()).containsExactly("Chrome");
    }

    @Test
    @DisplayName("exact with a list matches any of the values")
    void testExactList() {
        RenderedQuery rendered = render(PropertyFilter.event("$browser", PropertyOperator.EXACT, List.of("Chrome", "Safari")));

        assertThat(rendered.sql()).isEqualTo("(" + BROWSER + " IN (?, ?))");
        assertThat(rendered.namedParameters()).containsEntry("p_0", "Chrome").containsEntry("p_1", "Safari");
    }

    @Test
    @DisplayName("negative operators also match missing properties")
    void testIsNot() {
        RenderedQuery rendered = render(PropertyFilter.event("$browser", PropertyOperator.IS_NOT, "Chrome"));

        assertThat(rendered.sql()).isEqualTo("((" + BROWSER + " IS NULL) OR (" + BROWSER + " != ?))");
    }

    @Test
    void testIcontains() {
        RenderedQuery rendered = render(PropertyFilter.event("$browser", PropertyOperator.ICONTAINS, "chr"));

        assertThat(rendered.sql()).isEqualTo("(" + BROWSER + " ILIKE ?)");
        assertThat(rendered.parameters()).containsExactly("%chr%");
    }

    @Test
    void testNotRegex() {
        RenderedQuery rendered = render(PropertyFilter.event("$browser", PropertyOperator.NOT_REGEX, "^Chr"));

        assertThat(rendered.sql()).contains("IS NULL").contains("(NOT regexp_matches(" + BROWSER + ", ?))");
    }

    @Test
    @DisplayName("numeric operators cast the property and bind a double")
    void testNumeric() {
        RenderedQuery rendered = render(PropertyFilter.event("amount", PropertyOperator.GT, "10"));

        assertThat(rendered.sql()).startsWith("(TRY_CAST(").contains(" > ?");
        assertThat(rendered.parameters()).containsExactly(10.0);
    }

    @Test
    void testPersonAndGroupProperties() {
        assertThat(render(PropertyFilter.person("plan", PropertyOperator.IS_SET, null)).sql())
            .isEqualTo("(json_extract_string(e.person_properties, '$.\"plan\"') IS NOT NULL)");
        assertThat(render(PropertyFilter.group(3, "name", PropertyOperator.IS_NOT_SET, null)).sql())
            .isEqualTo("(json_extract_string(e.group3_properties, '$.\"name\"') IS NULL)");
    }

    @Test
    void testCompileAllAndsFilters() {
        RenderedQuery rendered = renderer.renderExpression(compiler.compileAll(List.of(
            PropertyFilter.event("$browser", PropertyOperator.EXACT, "Chrome"),
            PropertyFilter.event("amount", PropertyOperator.LTE, 5)), "step_0_"));

        assertThat(rendered.sql()).contains(" AND ");
        assertThat(rendered.namedParameters()).containsKeys("step_0_prop_0", "step_0_prop_1");
        assertThat(compiler.compileAll(List.of(), "step_0_")).isNull();
    }

    @Test
    void testNonNumericValueRejected() {
        assertThatThrownBy(() -> compiler.compile(PropertyFilter.event("amount", PropertyOperator.GT, "lots"), "p"))
            .isInstanceOf(FunnelConfigurationException.class)
            .hasMessageContaining("needs a number");
    }

    @Test
    void testListRejectedForSingleValueOperators() {
        assertThatThrownBy(() -> compiler.compile(
            PropertyFilter.event("$browser", PropertyOperator.ICONTAINS, List.of("a", "b")), "p"))
            .isInstanceOf(FunnelConfigurationException.class);
    }
}
