package io.errorinsights.dashboard.grpc;

import com.google.protobuf.ByteString;
import io.errorinsights.dashboard.engine.QueryException;
import io.errorinsights.dashboard.model.LogField;
import io.errorinsights.dashboard.report.ReportRenderer;
import io.errorinsights.dashboard.service.LogQueryService;
import io.errorinsights.dashboard.service.QueryRequestMapper;
import io.errorinsights.dashboard.service.dto.ExportRows;
import io.errorinsights.dashboard.service.dto.QueryParameters;
import io.grpc.Status;
import io.grpc.stub.StreamObserver;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.devh.boot.grpc.server.service.GrpcService;

/**
 * Streams an export as a file name chunk, payload chunks and a final eof chunk.
 */
@Slf4j
@GrpcService
@RequiredArgsConstructor
public class ReportGrpcService extends ReportServiceGrpc.ReportServiceImplBase {

    static final int CHUNK_SIZE = 64 * 1024;

    private final LogQueryService queryService;
    private final QueryRequestMapper requestMapper;
    private final GrpcMapper mapper;
    private final ReportRenderer renderer;

    @Override
    public void export(ReportExportRequest request, StreamObserver<ReportChunk> responseObserver) {
        QueryRequest base = request.hasQuery() ? request.getQuery() : QueryRequest.getDefaultInstance();
        io.errorinsights.dashboard.report.ReportFormat format;
        QueryParameters parameters;
        List<LogField> columns;
        try {
            format = mapper.toReportFormat(request.getFormat()).orElseThrow(() ->
                    QueryException.invalidArgument("Unknown report format " + request.getFormatValue()));
            parameters = requestMapper.toParameters(mapper.toQueryRequest(base));
            columns = requestMapper.toColumns(request.getColumnsList());
        } catch (QueryException e) {
            LogQueryGrpcService.reject(e, responseObserver);
            return;
        }

        try {
            ExportRows rows = queryService.export(parameters, columns);
            byte[] payload = renderer.render(rows, format);

            responseObserver.onNext(ReportChunk.newBuilder().setFileName(renderer.fileName(format)).build());
            for (int offset = 0; offset < payload.length; offset += CHUNK_SIZE) {
                int length = Math.min(CHUNK_SIZE, payload.length - offset);
                responseObserver.onNext(ReportChunk.newBuilder()
                        .setPayload(ByteString.copyFrom(payload, offset, length))
                        .build());
            }
            responseObserver.onNext(ReportChunk.newBuilder().setEof(true).build());
            responseObserver.onCompleted();
        } catch (Exception e) {
            log.error("Failed to export report", e);
            responseObserver.onError(Status.INTERNAL
                    .withDescription("Failed to export report")
                    .withCause(e)
                    .asRuntimeException());
        }
    }
}
