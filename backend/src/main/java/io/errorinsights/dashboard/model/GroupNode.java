package io.errorinsights.dashboard.model;

import java.util.List;

/**
 * One group of a hierarchical group summary. {@code count} always equals the sum of subgroup counts
 * when subgroups are present.
 */
public record GroupNode(String key, long count, List<GroupNode> subgroups) {

    public GroupNode {
        subgroups = subgroups == null ? List.of() : List.copyOf(subgroups);
    }

    public static GroupNode leaf(String key, long count) {
        return new GroupNode(key, count, List.of());
    }
}
