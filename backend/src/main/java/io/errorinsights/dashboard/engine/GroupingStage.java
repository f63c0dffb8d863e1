package io.errorinsights.dashboard.engine;

import io.errorinsights.dashboard.config.QueryEngineProperties;
import io.errorinsights.dashboard.model.GroupNode;
import io.errorinsights.dashboard.model.LogField;
import io.errorinsights.dashboard.model.LogRecord;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Partitions records into a group forest, one level per field of the group path.
 * Siblings are ordered by count, largest first; equal counts keep first-seen order.
 */
@Component
public class GroupingStage {

    private final String missingLabel;

    public GroupingStage(QueryEngineProperties properties) {
        this.missingLabel = properties.getMissingLabel();
    }

    public List<GroupNode> group(List<LogRecord> records, List<LogField> groupPath) {
        if (groupPath == null || groupPath.isEmpty()) {
            return List.of();
        }
        return groupLevel(records, groupPath, 0);
    }

    private List<GroupNode> groupLevel(List<LogRecord> records, List<LogField> groupPath, int depth) {
        if (depth >= groupPath.size()) {
            return List.of();
        }
        LogField field = groupPath.get(depth);
        Map<String, List<LogRecord>> buckets = new LinkedHashMap<>();
        for (LogRecord record : records) {
            buckets.computeIfAbsent(field.textOr(record, missingLabel), key -> new ArrayList<>()).add(record);
        }

        List<GroupNode> nodes = new ArrayList<>(buckets.size());
        buckets.forEach((key, members) -> nodes.add(new GroupNode(
                key,
                members.size(),
                groupLevel(members, groupPath, depth + 1)
        )));
        nodes.sort(Comparator.comparingLong(GroupNode::count).reversed());
        return List.copyOf(nodes);
    }
}
