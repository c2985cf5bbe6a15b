package io.github.koszti.flinksqlgateway.gateway;

import io.github.koszti.flinksqlgateway.config.GatewayClientProperties;
import io.github.koszti.flinksqlgateway.gateway.dto.ExecuteStatementRequest;
import io.github.koszti.flinksqlgateway.gateway.dto.ExecuteStatementResponse;
import io.github.koszti.flinksqlgateway.gateway.dto.FetchResultsResponse;
import io.github.koszti.flinksqlgateway.gateway.dto.GatewayInfoResponse;
import io.github.koszti.flinksqlgateway.gateway.dto.OpenSessionRequest;
import io.github.koszti.flinksqlgateway.gateway.dto.OpenSessionResponse;
import io.github.koszti.flinksqlgateway.gateway.dto.OperationStatusResponse;
import io.github.koszti.flinksqlgateway.gateway.exception.GatewayException;
import io.github.koszti.flinksqlgateway.gateway.exception.GatewayRequestFailedException;
import io.github.koszti.flinksqlgateway.gateway.exception.GatewayTimeoutException;
import io.github.koszti.flinksqlgateway.gateway.exception.GatewayUnavailableException;
import io.github.koszti.flinksqlgateway.gateway.exception.RequestCancelledException;
import io.github.koszti.flinksqlgateway.gateway.exception.SessionExpiredException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * {@link GatewayClient} over the Flink SQL Gateway REST API, using the JDK {@link HttpClient}.
 * <p>
 * Requests are sent with {@code sendAsync}; cancelling a returned future cancels the exchange.
 */
public class HttpGatewayClient implements GatewayClient {

    private static final Logger log = LoggerFactory.getLogger(HttpGatewayClient.class);

    private static final String ROW_FORMAT = "JSON";

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final String versionedUrl;
    private final Duration requestTimeout;

    public HttpGatewayClient(String gatewayUrl,
            HttpClient httpClient,
            ObjectMapper objectMapper,
            GatewayClientProperties props) {
        Objects.requireNonNull(gatewayUrl, "gatewayUrl must not be null");
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.baseUrl = gatewayUrl.replaceAll("/+$", "");
        this.versionedUrl = baseUrl + "/" + props.getApiVersion();
        this.requestTimeout = props.getRequestTimeout();
    }

    @Override
    public String getBaseUrl() {
        return baseUrl;
    }

    @Override
    public CompletableFuture<String> openSession(OpenSessionRequest request) {
        return send("POST", versioned("/sessions"), request, OpenSessionResponse.class,
                r -> required(r == null ? null : r.getSessionHandle(), "sessionHandle"));
    }

    @Override
    public CompletableFuture<Void> closeSession(String sessionHandle) {
        return send("DELETE", versioned("/sessions/" + sessionHandle), null, Void.class);
    }

    @Override
    public CompletableFuture<Void> heartbeat(String sessionHandle) {
        return send("POST", versioned("/sessions/" + sessionHandle + "/heartbeat"), null, Void.class);
    }

    @Override
    public CompletableFuture<String> submitStatement(String sessionHandle, ExecuteStatementRequest request) {
        log.debug("Submitting statement to {}: {}", baseUrl, request.statement());
        return send("POST", versioned("/sessions/" + sessionHandle + "/statements"), request, ExecuteStatementResponse.class,
                r -> required(r == null ? null : r.getOperationHandle(), "operationHandle"));
    }

    @Override
    public CompletableFuture<FetchResultsResponse> fetchResults(String sessionHandle, String operationHandle, long token) {
        String path = operationPath(sessionHandle, operationHandle) + "/result/" + token + "?rowFormat=" + ROW_FORMAT;
        return send("GET", versioned(path), null, FetchResultsResponse.class);
    }

    @Override
    public CompletableFuture<OperationStatusResponse> getOperationStatus(String sessionHandle, String operationHandle) {
        return send("GET", versioned(operationPath(sessionHandle, operationHandle) + "/status"), null,
                OperationStatusResponse.class);
    }

    @Override
    public CompletableFuture<OperationStatusResponse> cancelOperation(String sessionHandle, String operationHandle) {
        return send("POST", versioned(operationPath(sessionHandle, operationHandle) + "/cancel"), null,
                OperationStatusResponse.class);
    }

    @Override
    public CompletableFuture<OperationStatusResponse> closeOperation(String sessionHandle, String operationHandle) {
        return send("DELETE", versioned(operationPath(sessionHandle, operationHandle) + "/close"), null,
                OperationStatusResponse.class);
    }

    @Override
    public CompletableFuture<GatewayInfoResponse> getInfo() {
        return send("GET", URI.create(baseUrl + "/info"), null, GatewayInfoResponse.class);
    }

    @Override
    public CompletableFuture<List<String>> getApiVersions() {
        return send("GET", URI.create(baseUrl + "/api_versions"), null, GatewayInfoResponse.class,
                r -> r == null || r.getVersions() == null ? List.<String>of() : List.copyOf(r.getVersions()));
    }

    private static String operationPath(String sessionHandle, String operationHandle) {
        return "/sessions/" + sessionHandle + "/operations/" + operationHandle;
    }

    private URI versioned(String path) {
        return URI.create(versionedUrl + path);
    }

    private <T> CompletableFuture<T> send(String method, URI uri, Object body, Class<T> type) {
        return send(method, uri, body, type, Function.identity());
    }

    /**
     * Sends one request. The mapper runs before the returned future completes, so cancelling
     * that future is what aborts the exchange.
     */
    private <T, R> CompletableFuture<R> send(String method, URI uri, Object body, Class<T> type, Function<T, R> mapper) {
        HttpRequest.BodyPublisher publisher;
        try {
            publisher = body == null
                    ? HttpRequest.BodyPublishers.noBody()
                    : HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body));
        } catch (JsonProcessingException e) {
            return CompletableFuture.failedFuture(new IllegalArgumentException("Unable to serialize request body for " + uri, e));
        }

        HttpRequest request = HttpRequest.newBuilder(uri)
                .timeout(requestTimeout)
                .header("Content-Type", "application/json")
                .header("Accept", "application/json")
                .method(method, publisher)
                .build();

        CompletableFuture<HttpResponse<String>> exchange =
                httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString());
        CompletableFuture<R> result = new CompletableFuture<>();

        exchange.whenComplete((response, error) -> {
            if (error != null) {
                result.completeExceptionally(classify(error));
                return;
            }
            try {
                result.complete(mapper.apply(decode(response, type)));
            } catch (RuntimeException e) {
                result.completeExceptionally(e);
            }
        });
        result.whenComplete((value, error) -> {
            if (result.isCancelled()) {
                exchange.cancel(true);
            }
        });
        return result;
    }

    private <T> T decode(HttpResponse<String> response, Class<T> type) {
        int status = response.statusCode();
        String text = response.body();

        if (status < 200 || status >= 300) {
            String detail = text == null || text.isBlank()
                    ? "HTTP " + status
                    : errorText(text);
            log.debug("Gateway request {} {} failed with HTTP {}: {}",
                    response.request().method(), response.uri(), status, detail);
            throw failure(status, detail);
        }

        if (text == null || text.isBlank() || type == Void.class) {
            return null;
        }

        JsonNode node;
        try {
            node = objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new GatewayRequestFailedException(status, "Malformed response from " + response.uri() + ": " + e.getOriginalMessage());
        }

        // 200 with an errors array means an operation-level failure; errors[1], when present, holds the stack trace.
        JsonNode errors = node.get("errors");
        if (errors != null && errors.isArray() && !errors.isEmpty()) {
            throw failure(-1, joinErrors(errors));
        }

        try {
            return objectMapper.treeToValue(node, type);
        } catch (JsonProcessingException e) {
            throw new GatewayRequestFailedException(status, "Unexpected response from " + response.uri() + ": " + e.getOriginalMessage());
        }
    }

    private String errorText(String body) {
        try {
            JsonNode node = objectMapper.readTree(body);
            JsonNode errors = node == null ? null : node.get("errors");
            if (errors != null && errors.isArray() && !errors.isEmpty()) {
                return joinErrors(errors);
            }
        } catch (JsonProcessingException e) {
            // plain-text error body
        }
        return body;
    }

    private static String joinErrors(JsonNode errors) {
        List<String> lines = new ArrayList<>();
        errors.forEach(e -> lines.add(e.asText()));
        return String.join("\n", lines);
    }

    private static GatewayException failure(int status, String fullText) {
        String message = GatewayErrors.extractErrorMessage(fullText);
        if (GatewayErrors.mentionsMissingSession(fullText)) {
            return new SessionExpiredException(message);
        }
        return new GatewayRequestFailedException(status, message);
    }

    private GatewayException classify(Throwable error) {
        Throwable cause = GatewayErrors.unwrap(error);
        if (cause instanceof GatewayException ge) {
            return ge;
        }
        if (cause instanceof CancellationException) {
            return new RequestCancelledException();
        }
        if (cause instanceof HttpTimeoutException) {
            return new GatewayTimeoutException(cause);
        }
        if (cause instanceof IOException) {
            return new GatewayUnavailableException(baseUrl, cause);
        }
        return new GatewayRequestFailedException(-1, GatewayErrors.messageOf(cause));
    }

    private static String required(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new GatewayRequestFailedException(-1, "Gateway response is missing " + field);
        }
        return value;
    }
}
