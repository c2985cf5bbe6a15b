package io.github.koszti.flinksqlgateway.config;

import io.github.koszti.flinksqlgateway.gateway.GatewayClientFactory;
import io.github.koszti.flinksqlgateway.gateway.HttpGatewayClient;
import io.github.koszti.flinksqlgateway.session.ConnectionRegistry;
import io.github.koszti.flinksqlgateway.session.EndpointRepository;
import io.github.koszti.flinksqlgateway.session.InMemoryEndpointRepository;
import io.github.koszti.flinksqlgateway.session.JsonFileEndpointRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.nio.file.Path;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class GatewayClientConfig
{
    @Bean
    public HttpClient gatewayHttpClient(GatewayClientProperties props) {
        return HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(props.getConnectTimeout())
                .build();
    }

    /**
     * Client per endpoint URL; all of them share one HttpClient and the Boot-configured ObjectMapper.
     */
    @Bean
    public GatewayClientFactory gatewayClientFactory(HttpClient gatewayHttpClient,
            ObjectMapper objectMapper,
            GatewayClientProperties props) {
        return url -> new HttpGatewayClient(url, gatewayHttpClient, objectMapper, props);
    }

    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService heartbeatScheduler() {
        AtomicInteger threadCount = new AtomicInteger();
        return Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "gateway-heartbeat-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Bean
    public EndpointRepository endpointRepository(GatewayClientProperties props, ObjectMapper objectMapper) {
        String file = props.getEndpointsFile();
        if (file == null || file.isBlank()) {
            return new InMemoryEndpointRepository();
        }
        return new JsonFileEndpointRepository(Path.of(file), objectMapper);
    }

    @Bean(destroyMethod = "close")
    public ConnectionRegistry connectionRegistry(EndpointRepository endpointRepository,
            GatewayClientFactory gatewayClientFactory,
            ScheduledExecutorService heartbeatScheduler,
            GatewayClientProperties props) {
        return new ConnectionRegistry(endpointRepository, gatewayClientFactory, heartbeatScheduler, props);
    }
}
