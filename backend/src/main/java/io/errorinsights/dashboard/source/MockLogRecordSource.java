package io.errorinsights.dashboard.source;

import io.errorinsights.dashboard.config.MockDataProperties;
import io.errorinsights.dashboard.model.LogRecord;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Generates a fixed in-memory population of error logs at startup, standing in for the real log store.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "app.mock-data", name = "enabled", havingValue = "true", matchIfMissing = true)
public class MockLogRecordSource implements LogRecordSource {

    private static final List<String> HOSTS = List.of(
            "server-alpha-01", "server-beta-02", "server-gamma-03", "web-prod-1", "db-cluster-5");
    private static final List<String> REPOSITORIES = List.of(
            "/apps/main-service", "/apps/auth-service", "/apps/payment-gateway", "/apps/user-profiles");
    private static final List<String> VERSIONS = List.of("1.2.3", "1.2.4", "2.0.0-beta", "2.0.1");
    private static final List<Integer> PORTS = List.of(8080, 9000, 5432, 3000);
    private static final List<String> SERVER_MODES = List.of("production", "staging");
    private static final List<String> CONFIGS = List.of("config_A.json", "config_B.json", "config_C.json");
    private static final List<String> USERS = List.of(
            "user-101", "user-203", "system-internal", "api-key-xyz", "guest");
    private static final List<String> REPORT_NAMES = List.of(
            "daily_summary_report_for_all_active_users",
            "user_activity_detailed_breakdown_report_q3_final",
            "monthly_payment_failure_analysis_and_trends_report",
            "system_health_and_performance_overview_report",
            "daily_summary",
            "user_activity_report",
            "payment_failures",
            "system_health_check",
            "");
    private static final List<Integer> ERROR_NUMBERS = List.of(500, 404, 401, 503, 1201, 1337, 429);
    private static final List<String> MESSAGES = List.of(
            "Failed to connect to database: timeout expired while waiting for connection pool.",
            "Null pointer exception at user processing module during the final stage of the user data aggregation pipeline.",
            "API rate limit exceeded for user. The user has made too many requests in a short period of time.",
            "Authentication token is invalid or has expired. User needs to re-authenticate to get a new session token.",
            "Disk space is critically low on the primary data partition. Automated cleanup failed to run.",
            "Could not resolve external service DNS. The DNS server may be down or misconfigured.",
            "Request failed with status code 503: Service Unavailable. The upstream service is not responding.",
            "Unable to acquire lock for resource: payment-processing. The lock timeout was exceeded.",
            "");
    private static final Duration SERVER_UPTIME_BEFORE_ERROR = Duration.ofHours(6);

    private final List<LogRecord> records;

    public MockLogRecordSource(MockDataProperties properties, Clock clock) {
        Random random = properties.getSeed() != null ? new Random(properties.getSeed()) : new Random();
        Instant end = clock.instant();
        Instant start = end.minus(Duration.ofDays(properties.getDays()));
        this.records = List.copyOf(generate(properties.getCount(), start, end, random));
        log.info("Generated {} mock log records between {} and {}", records.size(), start, end);
    }

    @Override
    public List<LogRecord> snapshot() {
        return records;
    }

    static List<LogRecord> generate(int count, Instant start, Instant end, Random random) {
        long spanMillis = Math.max(1, Duration.between(start, end).toMillis());
        List<LogRecord> generated = new ArrayList<>(count);
        for (int i = 1; i <= count; i++) {
            Instant logged = start.plusMillis((long) (random.nextDouble() * spanMillis));
            generated.add(LogRecord.builder()
                    .id("log-" + i + "-" + logged.toEpochMilli())
                    .logDateTime(logged)
                    .hostName(pick(HOSTS, random))
                    .repositoryPath(pick(REPOSITORIES, random))
                    .portNumber(pick(PORTS, random))
                    .versionNumber(pick(VERSIONS, random))
                    .asServerMode(pick(SERVER_MODES, random))
                    .asStartDateTime(logged.minus(SERVER_UPTIME_BEFORE_ERROR))
                    .asServerConfig(pick(CONFIGS, random))
                    .userId(pick(USERS, random))
                    .reportIdName(pick(REPORT_NAMES, random))
                    .errorNumber(pick(ERROR_NUMBERS, random))
                    .xqlQueryId("q-" + Long.toString(random.nextLong() & Long.MAX_VALUE, 36))
                    .logMessage(pick(MESSAGES, random))
                    .build());
        }
        return generated;
    }

    private static <T> T pick(List<T> items, Random random) {
        return items.get(random.nextInt(items.size()));
    }
}
