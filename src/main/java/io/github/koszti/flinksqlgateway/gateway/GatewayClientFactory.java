package io.github.koszti.flinksqlgateway.gateway;

/**
 * Creates the client used for one endpoint URL.
 */
@FunctionalInterface
public interface GatewayClientFactory {

    GatewayClient create(String gatewayUrl);
}
