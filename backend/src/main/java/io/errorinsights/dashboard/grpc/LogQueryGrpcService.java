package io.errorinsights.dashboard.grpc;

import io.errorinsights.dashboard.engine.QueryException;
import io.errorinsights.dashboard.model.LogField;
import io.errorinsights.dashboard.service.LogQueryService;
import io.errorinsights.dashboard.service.QueryRequestMapper;
import io.errorinsights.dashboard.service.dto.QueryParameters;
import io.errorinsights.dashboard.service.dto.QueryResult;
import io.grpc.Status;
import io.grpc.stub.StreamObserver;
import java.util.Map;
import java.util.function.Function;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.devh.boot.grpc.server.service.GrpcService;

@Slf4j
@GrpcService
@RequiredArgsConstructor
public class LogQueryGrpcService extends LogQueryGrpc.LogQueryImplBase {

    private final LogQueryService queryService;
    private final QueryRequestMapper requestMapper;
    private final GrpcMapper mapper;

    @Override
    public void query(QueryRequest request, StreamObserver<QueryResponse> responseObserver) {
        respond(request, queryService::query, responseObserver);
    }

    @Override
    public void search(QueryRequest request, StreamObserver<QueryResponse> responseObserver) {
        respond(request, queryService::search, responseObserver);
    }

    @Override
    public void searchGroups(QueryRequest request, StreamObserver<QueryResponse> responseObserver) {
        respond(request, queryService::searchGroups, responseObserver);
    }

    @Override
    public void trend(QueryRequest request, StreamObserver<QueryResponse> responseObserver) {
        respond(request, queryService::trend, responseObserver);
    }

    @Override
    public void drillDown(DrillDownRequest request, StreamObserver<QueryResponse> responseObserver) {
        QueryRequest base = request.hasQuery() ? request.getQuery() : QueryRequest.getDefaultInstance();
        try {
            QueryParameters parameters = requestMapper.toParameters(mapper.toQueryRequest(base));
            Map<LogField, String> keys = requestMapper.toDrillDownKeys(request.getKeysMap());
            responseObserver.onNext(mapper.toQueryResponse(queryService.drillDown(parameters, keys)));
            responseObserver.onCompleted();
        } catch (QueryException e) {
            reject(e, responseObserver);
        }
    }

    private void respond(QueryRequest request,
                         Function<QueryParameters, QueryResult> operation,
                         StreamObserver<QueryResponse> responseObserver) {
        try {
            QueryParameters parameters = requestMapper.toParameters(mapper.toQueryRequest(request));
            responseObserver.onNext(mapper.toQueryResponse(operation.apply(parameters)));
            responseObserver.onCompleted();
        } catch (QueryException e) {
            reject(e, responseObserver);
        }
    }

    static void reject(QueryException e, StreamObserver<?> responseObserver) {
        log.warn("Rejected query: {}", e.getMessage());
        responseObserver.onError(Status.INVALID_ARGUMENT
                .withDescription(e.getMessage())
                .asRuntimeException());
    }
}
