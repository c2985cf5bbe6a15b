package io.github.koszti.flinksqlgateway.gateway.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record OpenSessionRequest(String sessionName, Map<String, String> properties) {

    public OpenSessionRequest {
        properties = properties == null ? Map.of() : Map.copyOf(properties);
    }
}
