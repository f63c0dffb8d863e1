package io.errorinsights.dashboard.http;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.errorinsights.dashboard.engine.QueryException;
import io.errorinsights.dashboard.model.GroupNode;
import io.errorinsights.dashboard.model.LogField;
import io.errorinsights.dashboard.model.LogRecord;
import io.errorinsights.dashboard.model.TrendPoint;
import io.errorinsights.dashboard.report.ReportFormat;
import io.errorinsights.dashboard.report.ReportRenderer;
import io.errorinsights.dashboard.service.LogQueryService;
import io.errorinsights.dashboard.service.QueryRequestMapper;
import io.errorinsights.dashboard.service.dto.ExportRows;
import io.errorinsights.dashboard.service.dto.LogsQueryRequest;
import io.errorinsights.dashboard.service.dto.QueryParameters;
import io.errorinsights.dashboard.service.dto.QueryResult;
import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/logs")
@RequiredArgsConstructor
public class LogQueryController {

    private final LogQueryService queryService;
    private final QueryRequestMapper requestMapper;
    private final ReportRenderer reportRenderer;

    @PostMapping
    public LogsQueryResponse query(@RequestBody LogsQueryRequest request) {
        return LogsQueryResponse.fromResult(queryService.query(requestMapper.toParameters(request)));
    }

    @PostMapping("/search")
    public LogsQueryResponse search(@RequestBody LogsQueryRequest request) {
        return LogsQueryResponse.fromResult(queryService.search(requestMapper.toParameters(request)));
    }

    @PostMapping("/groups")
    public LogsQueryResponse groups(@RequestBody LogsQueryRequest request) {
        return LogsQueryResponse.fromResult(queryService.searchGroups(requestMapper.toParameters(request)));
    }

    @PostMapping("/trend")
    public LogsQueryResponse trend(@RequestBody LogsQueryRequest request) {
        return LogsQueryResponse.fromResult(queryService.trend(requestMapper.toParameters(request)));
    }

    @PostMapping("/drilldown")
    public LogsQueryResponse drillDown(@RequestBody DrillDownRequest request) {
        QueryParameters parameters = requestMapper.toParameters(request.query());
        Map<LogField, String> keys = requestMapper.toDrillDownKeys(request.keys());
        return LogsQueryResponse.fromResult(queryService.drillDown(parameters, keys));
    }

    @PostMapping("/export")
    public ResponseEntity<byte[]> export(@RequestBody ExportRequest request) throws IOException {
        ReportFormat format = ReportFormat.fromName(request.format()).orElseThrow(() ->
                QueryException.invalidArgument("Unknown report format '" + request.format() + "'"));
        QueryParameters parameters = requestMapper.toParameters(request.query());
        List<LogField> columns = requestMapper.toColumns(request.columns());

        ExportRows rows = queryService.export(parameters, columns);
        byte[] body = reportRenderer.render(rows, format);
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, ContentDisposition.attachment()
                        .filename(reportRenderer.fileName(format))
                        .build()
                        .toString())
                .contentType(MediaType.parseMediaType(format.mediaType()))
                .body(body);
    }

    public record DrillDownRequest(LogsQueryRequest query, Map<String, String> keys) {
    }

    public record ExportRequest(LogsQueryRequest query, String format, List<String> columns) {
    }

    public record LogsQueryResponse(
            String requestId,
            List<LogRecordResponse> logs,
            long totalCount,
            List<GroupNode> groupData,
            List<TrendPoint> chartData
    ) {
        static LogsQueryResponse fromResult(QueryResult result) {
            return new LogsQueryResponse(
                    result.requestId(),
                    result.logs().stream().map(LogRecordResponse::fromRecord).toList(),
                    result.totalCount(),
                    result.groupData(),
                    result.chartData()
            );
        }
    }

    public record LogRecordResponse(
            String id,
            @JsonProperty("log_date_time") Instant logDateTime,
            @JsonProperty("host_name") String hostName,
            @JsonProperty("repository_path") String repositoryPath,
            @JsonProperty("port_number") Integer portNumber,
            @JsonProperty("version_number") String versionNumber,
            @JsonProperty("as_server_mode") String asServerMode,
            @JsonProperty("as_start_date_time") Instant asStartDateTime,
            @JsonProperty("as_server_config") String asServerConfig,
            @JsonProperty("user_id") String userId,
            @JsonProperty("report_id_name") String reportIdName,
            @JsonProperty("error_number") Integer errorNumber,
            @JsonProperty("xql_query_id") String xqlQueryId,
            @JsonProperty("log_message") String logMessage
    ) {
        static LogRecordResponse fromRecord(LogRecord record) {
            return new LogRecordResponse(
                    record.id(),
                    record.logDateTime(),
                    record.hostName(),
                    record.repositoryPath(),
                    record.portNumber(),
                    record.versionNumber(),
                    record.asServerMode(),
                    record.asStartDateTime(),
                    record.asServerConfig(),
                    record.userId(),
                    record.reportIdName(),
                    record.errorNumber(),
                    record.xqlQueryId(),
                    record.logMessage()
            );
        }
    }
}
