package com.livemux.query;

import com.livemux.schema.Table;
import com.livemux.store.QueryScope;
import com.livemux.store.Row;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for filter evaluation against rows.
 */
@DisplayName("Filter Tests")
class FilterTest {

    private static final Table ITEMS = Table.builder("items")
            .prefix("item_")
            .string("name")
            .number("state", "latency")
            .stringList("groups")
            .numberList("comments")
            .map("custom_variables")
            .key("name")
            .build();

    private final FilterParser parser = new FilterParser();
    private final QueryScope scope = new QueryScope("p1", "Site 1", name -> null);

    private final Row web = new Row(new Object[]{
        "web1", 0L, 0.5, List.of("web", "prod"), List.of(7L, 9L), Map.of("TAGS", "linux web")});
    private final Row db = new Row(new Object[]{
        "DB1", 2L, 1.5, Collections.emptyList(), Collections.emptyList(), Collections.emptyMap()});

    private Filter filter(String value) {
        return parser.parseFilter(ITEMS, value, "Filter: " + value);
    }

    // ========== Strings ==========

    @Test
    @DisplayName("Should compare strings exactly and case-insensitively")
    void shouldCompareStrings() {
        assertThat(filter("name = web1").matches(web, scope)).isTrue();
        assertThat(filter("name = WEB1").matches(web, scope)).isFalse();
        assertThat(filter("name =~ WEB1").matches(web, scope)).isTrue();
        assertThat(filter("name != web1").matches(db, scope)).isTrue();
        assertThat(filter("name !=~ db1").matches(db, scope)).isFalse();
    }

    @Test
    @DisplayName("Should match regular expressions anywhere in the value")
    void shouldMatchRegex() {
        assertThat(filter("name ~ eb").matches(web, scope)).isTrue();
        assertThat(filter("name ~ ^db").matches(db, scope)).isFalse();
        assertThat(filter("name ~~ ^db").matches(db, scope)).isTrue();
        assertThat(filter("name !~ eb").matches(web, scope)).isFalse();
    }

    @Test
    @DisplayName("Should order strings lexically")
    void shouldOrderStrings() {
        assertThat(filter("name > abc").matches(web, scope)).isTrue();
        assertThat(filter("name <= web1").matches(web, scope)).isTrue();
        assertThat(filter("name < web1").matches(web, scope)).isFalse();
    }

    @Test
    @DisplayName("Should resolve prefixed column names")
    void shouldResolvePrefixedNames() {
        assertThat(filter("item_name = web1").matches(web, scope)).isTrue();
    }

    @Test
    @DisplayName("Should treat unknown columns as empty strings")
    void shouldTreatUnknownColumnsAsEmpty() {
        assertThat(filter("no_such_column =").matches(web, scope)).isTrue();
        assertThat(filter("no_such_column = x").matches(web, scope)).isFalse();
    }

    // ========== Numbers ==========

    @Test
    @DisplayName("Should compare numbers numerically")
    void shouldCompareNumbers() {
        assertThat(filter("state = 0").matches(web, scope)).isTrue();
        assertThat(filter("state != 0").matches(db, scope)).isTrue();
        assertThat(filter("latency > 1").matches(db, scope)).isTrue();
        assertThat(filter("latency >= 0.5").matches(web, scope)).isTrue();
        assertThat(filter("latency < 0.5").matches(web, scope)).isFalse();
        assertThat(filter("state <= 2").matches(db, scope)).isTrue();
    }

    // ========== Lists ==========

    @Test
    @DisplayName("Should use membership semantics for list columns")
    void shouldMatchListMembership() {
        assertThat(filter("groups >= prod").matches(web, scope)).isTrue();
        assertThat(filter("groups >= prod").matches(db, scope)).isFalse();
        assertThat(filter("groups < prod").matches(db, scope)).isTrue();
        assertThat(filter("groups <= PROD").matches(web, scope)).isTrue();
        assertThat(filter("groups ~ ^we").matches(web, scope)).isTrue();
        assertThat(filter("comments >= 9").matches(web, scope)).isTrue();
        assertThat(filter("comments >= 8").matches(web, scope)).isFalse();
    }

    @Test
    @DisplayName("Should test list emptiness with an empty literal")
    void shouldMatchEmptyLists() {
        assertThat(filter("groups =").matches(db, scope)).isTrue();
        assertThat(filter("groups =").matches(web, scope)).isFalse();
        assertThat(filter("groups !=").matches(web, scope)).isTrue();
    }

    // ========== Custom Variables ==========

    @Test
    @DisplayName("Should compare one custom variable by name")
    void shouldMatchCustomVariables() {
        assertThat(filter("custom_variables = TAGS linux web").matches(web, scope)).isTrue();
        assertThat(filter("custom_variables ~~ tags WEB").matches(web, scope)).isTrue();
        assertThat(filter("custom_variables ~ TAGS database").matches(web, scope)).isFalse();
    }

    @Test
    @DisplayName("Should only match negated operators on missing custom variables")
    void shouldHandleMissingCustomVariables() {
        assertThat(filter("custom_variables = TAGS linux").matches(db, scope)).isFalse();
        assertThat(filter("custom_variables != TAGS linux").matches(db, scope)).isTrue();
    }

    // ========== Groups ==========

    @Test
    @DisplayName("Should combine children with And and Or")
    void shouldEvaluateGroups() {
        Filter and = Filter.group(GroupOperator.AND, List.of(filter("state = 0"), filter("groups >= web")));
        Filter or = Filter.group(GroupOperator.OR, List.of(filter("state = 0"), filter("name = DB1")));

        assertThat(and.matches(web, scope)).isTrue();
        assertThat(and.matches(db, scope)).isFalse();
        assertThat(or.matches(web, scope)).isTrue();
        assertThat(or.matches(db, scope)).isTrue();
    }

    @Test
    @DisplayName("Should treat an empty And as true and an empty Or as false")
    void shouldEvaluateEmptyGroups() {
        assertThat(Filter.group(GroupOperator.AND, List.of()).matches(web, scope)).isTrue();
        assertThat(Filter.group(GroupOperator.OR, List.of()).matches(web, scope)).isFalse();
    }

    @Test
    @DisplayName("Should only push down filters on stored columns")
    void shouldDetectPushableFilters() {
        Filter stored = filter("state = 0");
        Filter unknown = filter("no_such_column = x");

        assertThat(stored.isPushable()).isTrue();
        assertThat(unknown.isPushable()).isFalse();
        assertThat(Filter.group(GroupOperator.OR, List.of(stored, unknown)).isPushable()).isFalse();
    }

    @Test
    @DisplayName("Should write groups after their children")
    void shouldSerializeGroups() {
        Filter or = Filter.group(GroupOperator.OR, List.of(filter("state = 0"), filter("name = DB1")));
        StringBuilder sb = new StringBuilder();

        or.appendTo(sb, "WaitCondition");

        assertThat(sb.toString())
                .isEqualTo("WaitCondition: state = 0\nWaitCondition: name = DB1\nWaitConditionOr: 2\n");
    }
}
