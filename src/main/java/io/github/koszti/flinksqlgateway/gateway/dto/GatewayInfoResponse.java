package io.github.koszti.flinksqlgateway.gateway.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Bodies of the unversioned {@code /info} and {@code /api_versions} endpoints.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class GatewayInfoResponse {
    private String productName;
    private String version;
    private List<String> versions;

    public String getProductName() {
        return productName;
    }

    public void setProductName(String productName) {
        this.productName = productName;
    }

    public String getVersion() {
        return version;
    }

    public void setVersion(String version) {
        this.version = version;
    }

    public List<String> getVersions() {
        return versions;
    }

    public void setVersions(List<String> versions) {
        this.versions = versions;
    }
}
