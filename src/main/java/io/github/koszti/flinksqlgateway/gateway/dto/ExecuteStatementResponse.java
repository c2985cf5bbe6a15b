package io.github.koszti.flinksqlgateway.gateway.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class ExecuteStatementResponse {
    private String operationHandle;

    public String getOperationHandle() {
        return operationHandle;
    }

    public void setOperationHandle(String operationHandle) {
        this.operationHandle = operationHandle;
    }
}
