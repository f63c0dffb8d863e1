package io.errorinsights.dashboard.config;

import io.errorinsights.dashboard.model.LogField;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Operator rules for every query. Field ids bind leniently ({@code host_name}, {@code host-name}),
 * so an unknown id fails at startup.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "app.query-filter")
public class QueryFilterProperties {

    private boolean enabled = false;

    /** Every request gets an {@code in [value]} condition on these fields. */
    private Map<LogField, String> forcedFilters = new LinkedHashMap<>();

    /** Client supplied filters on these fields are dropped. */
    private Set<LogField> blockedFields = new LinkedHashSet<>();
}
