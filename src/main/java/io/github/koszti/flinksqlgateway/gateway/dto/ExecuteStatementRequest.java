package io.github.koszti.flinksqlgateway.gateway.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;
import java.util.Objects;

@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ExecuteStatementRequest(String statement, Long executionTimeout, Map<String, String> executionConfig) {

    public ExecuteStatementRequest {
        Objects.requireNonNull(statement, "statement must not be null");
        executionConfig = executionConfig == null ? Map.of() : Map.copyOf(executionConfig);
    }

    public static ExecuteStatementRequest of(String statement) {
        return new ExecuteStatementRequest(statement, null, Map.of());
    }
}
