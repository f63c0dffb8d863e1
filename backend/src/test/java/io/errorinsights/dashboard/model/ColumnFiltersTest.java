package io.errorinsights.dashboard.model;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ColumnFiltersTest {

    @Test
    void dropsEmptyConditions() {
        ColumnFilters filters = ColumnFilters.of(Map.of(
                LogField.HOST_NAME, FilterCondition.in("alpha"),
                LogField.USER_ID, new FilterCondition(FilterOperator.NOT_IN, List.of())));

        assertThat(filters.asMap()).containsOnlyKeys(LogField.HOST_NAME);
    }

    @Test
    void conditionValuesAreDeduplicatedInOrder() {
        FilterCondition condition = new FilterCondition(FilterOperator.IN, Arrays.asList("b", null, "a", "b"));

        assertThat(condition.values()).containsExactly("b", "a");
    }

    @Test
    void withReplacesAndWithoutRemoves() {
        ColumnFilters filters = ColumnFilters.empty()
                .with(LogField.HOST_NAME, FilterCondition.in("alpha"))
                .with(LogField.HOST_NAME, FilterCondition.notIn("beta"));

        assertThat(filters.asMap()).containsExactly(Map.entry(LogField.HOST_NAME, FilterCondition.notIn("beta")));
        assertThat(filters.without(LogField.HOST_NAME).isEmpty()).isTrue();
    }

    @Test
    void parsesWireNames() {
        assertThat(FilterOperator.fromWireName("notIn")).contains(FilterOperator.NOT_IN);
        assertThat(FilterOperator.fromWireName("and")).contains(FilterOperator.CONTAINS_ALL);
        assertThat(FilterOperator.fromWireName("contains-all")).contains(FilterOperator.CONTAINS_ALL);
        assertThat(FilterOperator.fromWireName("like")).isEmpty();
        assertThat(SortDirection.fromWireName("DESC")).contains(SortDirection.DESCENDING);
        assertThat(LogField.fromId(" Host_Name ")).contains(LogField.HOST_NAME);
    }
}
