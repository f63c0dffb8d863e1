package io.errorinsights.dashboard.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Getter
@Setter
@ConfigurationProperties(prefix = "app.mock-data")
public class MockDataProperties {

    private boolean enabled = true;

    private int count = 5000;

    /** Records are spread over this many days up to application start. */
    private int days = 30;

    /** Fixed seed for reproducible data; random when unset. */
    private Long seed;
}
