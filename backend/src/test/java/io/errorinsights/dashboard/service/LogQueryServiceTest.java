package io.errorinsights.dashboard.service;

import static io.errorinsights.dashboard.support.TestRecords.record;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.errorinsights.dashboard.config.QueryEngineProperties;
import io.errorinsights.dashboard.engine.BucketPolicy;
import io.errorinsights.dashboard.engine.ExportProjector;
import io.errorinsights.dashboard.engine.FilterStage;
import io.errorinsights.dashboard.engine.GroupingStage;
import io.errorinsights.dashboard.engine.PaginationStage;
import io.errorinsights.dashboard.engine.PredicateEvaluator;
import io.errorinsights.dashboard.engine.QueryException;
import io.errorinsights.dashboard.engine.SortStage;
import io.errorinsights.dashboard.engine.TimeBucketingStage;
import io.errorinsights.dashboard.model.ColumnFilters;
import io.errorinsights.dashboard.model.FilterCondition;
import io.errorinsights.dashboard.model.GroupNode;
import io.errorinsights.dashboard.model.LogField;
import io.errorinsights.dashboard.model.LogRecord;
import io.errorinsights.dashboard.model.SortDirection;
import io.errorinsights.dashboard.model.SortSpec;
import io.errorinsights.dashboard.model.TimeWindow;
import io.errorinsights.dashboard.model.TrendPoint;
import io.errorinsights.dashboard.service.dto.ExportRows;
import io.errorinsights.dashboard.service.dto.QueryParameters;
import io.errorinsights.dashboard.service.dto.QueryResult;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class LogQueryServiceTest {

    private static final TimeWindow DAY = new TimeWindow(
            Instant.parse("2024-05-10T00:00:00Z"), Instant.parse("2024-05-10T23:59:59Z"));

    private LogQueryService service;
    private List<LogRecord> records;

    @BeforeEach
    void setUp() {
        records = List.of(
                record("1", "2024-05-10T09:00:00Z", "server-alpha-01").toBuilder().errorNumber(500).build(),
                record("2", "2024-05-10T10:00:00Z", "server-beta-02").toBuilder().errorNumber(404).build(),
                record("3", "2024-05-10T11:00:00Z", "server-alpha-01").toBuilder().errorNumber(404).build(),
                record("4", "2024-05-10T12:00:00Z", "server-alpha-02").toBuilder().errorNumber(500).build(),
                record("5", "2024-05-10T13:00:00Z", "server-beta-02").toBuilder().errorNumber(500).build(),
                record("6", "2024-05-11T09:00:00Z", "server-alpha-01").toBuilder().errorNumber(500).build()
        );
        QueryEngineProperties properties = new QueryEngineProperties();
        BucketPolicy bucketPolicy = new BucketPolicy(properties);
        service = new LogQueryService(
                () -> records,
                new FilterStage(new PredicateEvaluator(properties)),
                new SortStage(),
                new GroupingStage(properties),
                new TimeBucketingStage(bucketPolicy, properties),
                bucketPolicy,
                new PaginationStage(),
                new ExportProjector());
    }

    @Test
    void searchReturnsSortedPageAndFullCount() {
        QueryResult result = service.search(parameters(ColumnFilters.empty(), SortSpec.none(), 1, 2, List.of()));

        assertThat(result.totalCount()).isEqualTo(5);
        assertThat(result.logs()).extracting(LogRecord::id).containsExactly("5", "4");
        assertThat(result.groupData()).isEmpty();
        assertThat(result.chartData()).isEmpty();
    }

    @Test
    void queryWithoutGroupingReturnsPageAndTrend() {
        ColumnFilters alpha = ColumnFilters.empty().with(LogField.HOST_NAME, FilterCondition.in("alpha"));

        QueryResult result = service.query(parameters(alpha,
                new SortSpec(LogField.LOG_DATE_TIME, SortDirection.ASCENDING), 1, 10, List.of()));

        assertThat(result.totalCount()).isEqualTo(3);
        assertThat(result.logs()).extracting(LogRecord::id).containsExactly("1", "3", "4");
        assertThat(result.chartData()).hasSize(24);
        assertThat(result.chartData().stream().mapToLong(TrendPoint::count).sum()).isEqualTo(3);
    }

    @Test
    void queryWithGroupingReturnsGroupsInsteadOfLogs() {
        QueryResult result = service.query(parameters(ColumnFilters.empty(), SortSpec.none(), 1, 10,
                List.of(LogField.HOST_NAME)));

        assertThat(result.logs()).isEmpty();
        assertThat(result.totalCount()).isEqualTo(5);
        assertThat(result.groupData()).extracting(GroupNode::key)
                .containsExactly("server-alpha-01", "server-beta-02", "server-alpha-02");
        assertThat(result.chartData()).isNotEmpty();
    }

    @Test
    void trendBreaksDownByField() {
        QueryParameters parameters = new QueryParameters("t", Optional.of(DAY), 1, 10, SortSpec.none(),
                ColumnFilters.empty(), List.of(), Optional.of(LogField.ERROR_NUMBER));

        QueryResult result = service.trend(parameters);

        assertThat(result.logs()).isEmpty();
        TrendPoint nine = result.chartData().stream()
                .filter(point -> point.bucketStart().equals(Instant.parse("2024-05-10T09:00:00Z")))
                .findFirst()
                .orElseThrow();
        assertThat(nine.count()).isEqualTo(1);
        assertThat(nine.breakdown()).containsExactly(Map.entry("500", 1L));
    }

    @Test
    void drillDownNarrowsToClickedGroup() {
        ColumnFilters base = ColumnFilters.empty().with(LogField.HOST_NAME, FilterCondition.in("beta"));
        QueryParameters parameters = parameters(base, SortSpec.none(), 1, 10, List.of(LogField.HOST_NAME));

        QueryResult result = service.drillDown(parameters,
                Map.of(LogField.HOST_NAME, "server-alpha-01", LogField.ERROR_NUMBER, "404"));

        assertThat(result.logs()).extracting(LogRecord::id).containsExactly("3");
        assertThat(result.totalCount()).isEqualTo(1);
        assertThat(result.groupData()).isEmpty();
    }

    @Test
    void drillDownIntoMissingValueGroupMatchesGroupCount() {
        records = List.of(
                record("a1", "2024-05-10T09:00:00Z", "a"),
                record("a2", "2024-05-10T10:00:00Z", "a"),
                record("n1", "2024-05-10T11:00:00Z", null),
                record("b1", "2024-05-10T12:00:00Z", "b"));
        QueryParameters parameters = parameters(ColumnFilters.empty(), SortSpec.none(), 1, 10,
                List.of(LogField.HOST_NAME));

        List<GroupNode> groups = service.searchGroups(parameters).groupData();
        QueryResult result = service.drillDown(parameters, Map.of(LogField.HOST_NAME, "N/A"));

        assertThat(groups).extracting(GroupNode::key).containsExactly("a", "N/A", "b");
        assertThat(result.totalCount()).isEqualTo(groups.get(1).count());
        assertThat(result.logs()).extracting(LogRecord::id).containsExactly("n1");
    }

    @Test
    void drillDownKeyDoesNotMatchLongerValues() {
        records = List.of(
                record("1", "2024-05-10T09:00:00Z", "a").toBuilder().errorNumber(500).build(),
                record("2", "2024-05-10T10:00:00Z", "a").toBuilder().errorNumber(1500).build(),
                record("3", "2024-05-10T11:00:00Z", "b").toBuilder().errorNumber(500).build());

        QueryResult result = service.drillDown(parameters(ColumnFilters.empty(), SortSpec.none(), 1, 10, List.of()),
                Map.of(LogField.ERROR_NUMBER, "500"));

        assertThat(result.totalCount()).isEqualTo(2);
        assertThat(result.logs()).extracting(LogRecord::id).containsExactly("3", "1");
    }

    @Test
    void exportIsNotPaginated() {
        ExportRows rows = service.export(parameters(ColumnFilters.empty(),
                new SortSpec(LogField.LOG_DATE_TIME, SortDirection.ASCENDING), 1, 1, List.of()),
                List.of(LogField.HOST_NAME, LogField.ERROR_NUMBER));

        assertThat(rows.rows()).hasSize(5);
        assertThat(rows.rows().get(0)).containsExactly("server-alpha-01", "500");
    }

    @Test
    void missingWindowScansNothing() {
        QueryParameters parameters = new QueryParameters("none", Optional.empty(), 1, 10, SortSpec.none(),
                ColumnFilters.empty(), List.of(LogField.HOST_NAME), Optional.empty());

        assertThat(service.query(parameters)).isEqualTo(QueryResult.empty("none"));
        assertThat(service.search(parameters).logs()).isEmpty();
        assertThat(service.export(parameters, List.of(LogField.HOST_NAME)).rows()).isEmpty();
    }

    @Test
    void rejectsWindowsWithTooManyBuckets() {
        TimeWindow decades = new TimeWindow(Instant.parse("1990-01-01T00:00:00Z"), Instant.parse("2024-01-01T00:00:00Z"));
        QueryParameters parameters = new QueryParameters("wide", Optional.of(decades), 1, 10, SortSpec.none(),
                ColumnFilters.empty(), List.of(), Optional.empty());

        assertThatThrownBy(() -> service.query(parameters)).isInstanceOf(QueryException.class);
    }

    private static QueryParameters parameters(ColumnFilters filters, SortSpec sort, int page, int pageSize,
                                              List<LogField> groupBy) {
        return new QueryParameters("test", Optional.of(DAY), page, pageSize, sort, filters, groupBy, Optional.empty());
    }
}
