package io.github.koszti.flinksqlgateway.gateway;

import io.github.koszti.flinksqlgateway.gateway.dto.ExecuteStatementRequest;
import io.github.koszti.flinksqlgateway.gateway.dto.FetchResultsResponse;
import io.github.koszti.flinksqlgateway.gateway.dto.GatewayInfoResponse;
import io.github.koszti.flinksqlgateway.gateway.dto.OpenSessionRequest;
import io.github.koszti.flinksqlgateway.gateway.dto.OperationStatusResponse;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Low-level client for one Flink SQL Gateway instance.
 * <p>
 * Each method maps to one REST endpoint. Futures complete exceptionally with a
 * {@link io.github.koszti.flinksqlgateway.gateway.exception.GatewayException} subtype;
 * cancelling a returned future aborts the underlying request.
 * Polling and result aggregation live in {@link io.github.koszti.flinksqlgateway.query.QueryRunner}.
 */
public interface GatewayClient {

    String getBaseUrl();

    CompletableFuture<String> openSession(OpenSessionRequest request);

    CompletableFuture<Void> closeSession(String sessionHandle);

    CompletableFuture<Void> heartbeat(String sessionHandle);

    /**
     * Submits one statement and returns its operation handle.
     */
    CompletableFuture<String> submitStatement(String sessionHandle, ExecuteStatementRequest request);

    CompletableFuture<FetchResultsResponse> fetchResults(String sessionHandle, String operationHandle, long token);

    CompletableFuture<OperationStatusResponse> getOperationStatus(String sessionHandle, String operationHandle);

    CompletableFuture<OperationStatusResponse> cancelOperation(String sessionHandle, String operationHandle);

    CompletableFuture<OperationStatusResponse> closeOperation(String sessionHandle, String operationHandle);

    CompletableFuture<GatewayInfoResponse> getInfo();

    CompletableFuture<List<String>> getApiVersions();
}
