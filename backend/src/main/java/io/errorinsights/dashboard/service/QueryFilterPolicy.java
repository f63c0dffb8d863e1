package io.errorinsights.dashboard.service;

import io.errorinsights.dashboard.config.QueryFilterProperties;
import io.errorinsights.dashboard.model.ColumnFilters;
import io.errorinsights.dashboard.model.FilterCondition;
import io.errorinsights.dashboard.model.LogField;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Operator-configured filter rules: blocked fields lose their client filters, forced fields always
 * carry the configured value.
 */
@Slf4j
@Component
public class QueryFilterPolicy {

    private final boolean enabled;
    private final Set<LogField> blocked;
    private final Map<LogField, FilterCondition> forced;

    public QueryFilterPolicy(QueryFilterProperties properties) {
        this.enabled = properties.isEnabled();
        Set<LogField> blockedFields = EnumSet.noneOf(LogField.class);
        Map<LogField, FilterCondition> forcedFilters = new LinkedHashMap<>();
        if (enabled) {
            blockedFields.addAll(properties.getBlockedFields());
            properties.getForcedFilters().forEach((field, value) -> {
                if (StringUtils.hasText(value)) {
                    forcedFilters.put(field, FilterCondition.in(value));
                }
            });
        }
        this.blocked = Collections.unmodifiableSet(blockedFields);
        this.forced = Collections.unmodifiableMap(forcedFilters);
    }

    public ColumnFilters apply(ColumnFilters requested) {
        if (!enabled) {
            return requested;
        }
        ColumnFilters result = requested;
        for (LogField field : blocked) {
            if (result.asMap().containsKey(field)) {
                result = result.without(field);
                log.debug("Dropped client filter on blocked field {}", field.id());
            }
        }
        for (Map.Entry<LogField, FilterCondition> entry : forced.entrySet()) {
            result = result.with(entry.getKey(), entry.getValue());
        }
        if (!Objects.equals(result, requested)) {
            log.info("Filter policy rewrote {} into {}", requested, result);
        }
        return result;
    }

    /**
     * Whether a drill-down may add a condition on {@code field}; forced and blocked fields are left alone.
     */
    public boolean allowsDrillDown(LogField field) {
        return !enabled || (!blocked.contains(field) && !forced.containsKey(field));
    }
}
