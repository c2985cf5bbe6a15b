package io.github.koszti.flinksqlgateway.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "gateway.client")
public class GatewayClientProperties {

    /**
     * REST API version prefix appended to every endpoint base URL, e.g. v4.
     */
    private String apiVersion = "v4";

    /**
     * Per-request timeout. There is no timeout on a whole run, only on each call.
     */
    private Duration requestTimeout = Duration.ofSeconds(30);

    private Duration connectTimeout = Duration.ofSeconds(10);

    /**
     * Interval between session heartbeats for an endpoint with at least one live session.
     */
    private Duration heartbeatInterval = Duration.ofSeconds(30);

    /**
     * Hard cap on the rows buffered for one statement.
     */
    private int maxRows = 10_000;

    /**
     * Linear backoff step added after every "not ready" result page.
     */
    private Duration pollBackoffStep = Duration.ofMillis(100);

    /**
     * Upper bound of the poll backoff.
     */
    private Duration pollBackoffMax = Duration.ofSeconds(2);

    /**
     * How many times an execution may recreate its session after an expiry before failing.
     */
    private int maxSessionRetries = 1;

    /**
     * JSON file holding endpoint definitions. When unset, endpoints are kept in memory only.
     */
    private String endpointsFile;

    public String getApiVersion() {
        return apiVersion;
    }

    public void setApiVersion(String apiVersion) {
        this.apiVersion = apiVersion;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public void setRequestTimeout(Duration requestTimeout) {
        this.requestTimeout = requestTimeout;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public void setConnectTimeout(Duration connectTimeout) {
        this.connectTimeout = connectTimeout;
    }

    public Duration getHeartbeatInterval() {
        return heartbeatInterval;
    }

    public void setHeartbeatInterval(Duration heartbeatInterval) {
        this.heartbeatInterval = heartbeatInterval;
    }

    public int getMaxRows() {
        return Math.max(1, maxRows);
    }

    public void setMaxRows(int maxRows) {
        this.maxRows = maxRows;
    }

    public Duration getPollBackoffStep() {
        return pollBackoffStep;
    }

    public void setPollBackoffStep(Duration pollBackoffStep) {
        this.pollBackoffStep = pollBackoffStep;
    }

    public Duration getPollBackoffMax() {
        return pollBackoffMax;
    }

    public void setPollBackoffMax(Duration pollBackoffMax) {
        this.pollBackoffMax = pollBackoffMax;
    }

    public int getMaxSessionRetries() {
        return Math.max(0, maxSessionRetries);
    }

    public void setMaxSessionRetries(int maxSessionRetries) {
        this.maxSessionRetries = maxSessionRetries;
    }

    public String getEndpointsFile() {
        return endpointsFile;
    }

    public void setEndpointsFile(String endpointsFile) {
        this.endpointsFile = endpointsFile;
    }
}
