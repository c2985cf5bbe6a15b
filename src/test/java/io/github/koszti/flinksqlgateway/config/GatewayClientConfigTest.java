package io.github.koszti.flinksqlgateway.config;

import io.github.koszti.flinksqlgateway.query.QueryExecutionService;
import io.github.koszti.flinksqlgateway.session.ConnectionRegistry;
import io.github.koszti.flinksqlgateway.session.EndpointRepository;
import io.github.koszti.flinksqlgateway.session.InMemoryEndpointRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;

@SpringBootTest(properties = {
        "gateway.client.max-rows=500",
        "gateway.client.poll-backoff-step=50ms"
})
class GatewayClientConfigTest {

    @Autowired
    private GatewayClientProperties props;

    @Autowired
    private EndpointRepository endpointRepository;

    @Autowired
    private ConnectionRegistry registry;

    @Autowired
    private QueryExecutionService executionService;

    @Test
    void bindsPropertiesAndWiresServices() {
        assertEquals(500, props.getMaxRows());
        assertEquals(Duration.ofMillis(50), props.getPollBackoffStep());
        assertEquals("v4", props.getApiVersion());
        assertEquals(1, props.getMaxSessionRetries());
        assertInstanceOf(InMemoryEndpointRepository.class, endpointRepository);
        assertNotNull(executionService);
        assertEquals(0, registry.getConnections().size());
    }
}
