package io.errorinsights.dashboard.engine;

import static io.errorinsights.dashboard.support.TestRecords.record;
import static org.assertj.core.api.Assertions.assertThat;

import io.errorinsights.dashboard.config.QueryEngineProperties;
import io.errorinsights.dashboard.model.GroupNode;
import io.errorinsights.dashboard.model.LogField;
import io.errorinsights.dashboard.model.LogRecord;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class GroupingStageTest {

    private GroupingStage stage;
    private List<LogRecord> records;

    @BeforeEach
    void setUp() {
        stage = new GroupingStage(new QueryEngineProperties());
        records = List.of(
                record("1", "2024-05-10T12:00:00Z", "host-b").toBuilder().errorNumber(500).build(),
                record("2", "2024-05-10T12:01:00Z", "host-a").toBuilder().errorNumber(404).build(),
                record("3", "2024-05-10T12:02:00Z", "host-a").toBuilder().errorNumber(500).build(),
                record("4", "2024-05-10T12:03:00Z", "host-a").toBuilder().errorNumber(404).build(),
                record("5", "2024-05-10T12:04:00Z", "host-b").toBuilder().errorNumber(null).build()
        );
    }

    @Test
    void groupsTwoLevelsLargestFirst() {
        List<GroupNode> groups = stage.group(records, List.of(LogField.HOST_NAME, LogField.ERROR_NUMBER));

        assertThat(groups).extracting(GroupNode::key).containsExactly("host-a", "host-b");
        assertThat(groups).extracting(GroupNode::count).containsExactly(3L, 2L);

        GroupNode hostA = groups.get(0);
        assertThat(hostA.subgroups()).extracting(GroupNode::key).containsExactly("404", "500");
        assertThat(hostA.subgroups()).extracting(GroupNode::count).containsExactly(2L, 1L);
        assertThat(hostA.subgroups()).allSatisfy(node -> assertThat(node.subgroups()).isEmpty());
    }

    @Test
    void groupsTwoHostsByErrorCode() {
        List<LogRecord> hosts = List.of(
                record("1", "2024-05-10T12:00:00Z", "A").toBuilder().errorNumber(500).build(),
                record("2", "2024-05-10T12:01:00Z", "A").toBuilder().errorNumber(500).build(),
                record("3", "2024-05-10T12:02:00Z", "A").toBuilder().errorNumber(404).build(),
                record("4", "2024-05-10T12:03:00Z", "B").toBuilder().errorNumber(500).build(),
                record("5", "2024-05-10T12:04:00Z", "B").toBuilder().errorNumber(500).build());

        List<GroupNode> groups = stage.group(hosts, List.of(LogField.HOST_NAME, LogField.ERROR_NUMBER));

        assertThat(groups).containsExactly(
                new GroupNode("A", 3, List.of(GroupNode.leaf("500", 2), GroupNode.leaf("404", 1))),
                new GroupNode("B", 2, List.of(GroupNode.leaf("500", 2))));
    }

    @Test
    void missingValuesGroupUnderNotAvailable() {
        List<GroupNode> groups = stage.group(records, List.of(LogField.ERROR_NUMBER));

        assertThat(groups).extracting(GroupNode::key).contains("N/A");
    }

    @Test
    void emptyStringIsItsOwnGroup() {
        List<LogRecord> withEmpty = List.of(
                records.get(0).toBuilder().reportIdName("").build(),
                records.get(1).toBuilder().reportIdName(null).build());

        assertThat(stage.group(withEmpty, List.of(LogField.REPORT_ID_NAME)))
                .extracting(GroupNode::key)
                .containsExactly("", "N/A");
    }

    @Test
    void equalCountsKeepFirstSeenOrder() {
        List<GroupNode> groups = stage.group(records.subList(0, 2), List.of(LogField.HOST_NAME));

        assertThat(groups).extracting(GroupNode::key).containsExactly("host-b", "host-a");
    }

    @Test
    void countsAreConservedAtEveryLevel() {
        List<GroupNode> groups = stage.group(records,
                List.of(LogField.HOST_NAME, LogField.ERROR_NUMBER, LogField.USER_ID));

        assertThat(groups.stream().mapToLong(GroupNode::count).sum()).isEqualTo(records.size());
        assertConserved(groups);
    }

    @Test
    void emptyPathOrInputGivesNoGroups() {
        assertThat(stage.group(records, List.of())).isEmpty();
        assertThat(stage.group(List.of(), List.of(LogField.HOST_NAME))).isEmpty();
    }

    private void assertConserved(List<GroupNode> nodes) {
        for (GroupNode node : nodes) {
            if (!node.subgroups().isEmpty()) {
                assertThat(node.subgroups().stream().mapToLong(GroupNode::count).sum()).isEqualTo(node.count());
                assertConserved(node.subgroups());
            }
        }
    }
}
