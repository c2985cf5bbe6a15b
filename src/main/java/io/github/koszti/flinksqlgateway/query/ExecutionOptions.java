package io.github.koszti.flinksqlgateway.query;

import io.github.koszti.flinksqlgateway.gateway.dto.ExecuteStatementRequest;

import java.util.Map;

/**
 * Per-run settings forwarded with every submitted statement.
 */
public record ExecutionOptions(Map<String, String> executionConfig, Long executionTimeout) {

    private static final ExecutionOptions DEFAULTS = new ExecutionOptions(Map.of(), null);

    public ExecutionOptions {
        executionConfig = executionConfig == null ? Map.of() : Map.copyOf(executionConfig);
    }

    public static ExecutionOptions defaults() {
        return DEFAULTS;
    }

    public static ExecutionOptions withConfig(Map<String, String> executionConfig) {
        return new ExecutionOptions(executionConfig, null);
    }

    ExecuteStatementRequest toRequest(String statement) {
        return new ExecuteStatementRequest(statement, executionTimeout, executionConfig);
    }
}
