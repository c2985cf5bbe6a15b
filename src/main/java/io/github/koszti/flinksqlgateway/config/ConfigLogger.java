package io.github.koszti.flinksqlgateway.config;

import io.github.koszti.flinksqlgateway.session.ConnectionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

@Component
public class ConfigLogger
        implements CommandLineRunner
{
    private static final Logger log = LoggerFactory.getLogger(ConfigLogger.class);

    private final GatewayClientProperties props;
    private final ConnectionRegistry registry;

    public ConfigLogger(GatewayClientProperties props, ConnectionRegistry registry) {
        this.props = props;
        this.registry = registry;
    }

    @Override
    public void run(String... args)
    {
        log.info("Gateway API version : {}", props.getApiVersion());
        log.info("Request timeout     : {}", props.getRequestTimeout());
        log.info("Heartbeat interval  : {}", props.getHeartbeatInterval());
        log.info("Max rows            : {}", props.getMaxRows());
        log.info("Poll backoff        : +{} up to {}", props.getPollBackoffStep(), props.getPollBackoffMax());
        log.info("Session retries     : {}", props.getMaxSessionRetries());
        log.info("Endpoints file      : {}", props.getEndpointsFile() == null ? "(in memory)" : props.getEndpointsFile());
        log.info("Endpoints           : {}", registry.getConnections().size());
    }
}
