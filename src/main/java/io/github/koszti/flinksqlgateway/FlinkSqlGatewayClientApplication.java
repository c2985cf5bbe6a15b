package io.github.koszti.flinksqlgateway;

import io.github.koszti.flinksqlgateway.config.GatewayClientProperties;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
		GatewayClientProperties.class
})
public class FlinkSqlGatewayClientApplication {

	public static void main(String[] args) {
		SpringApplication.run(FlinkSqlGatewayClientApplication.class, args);
	}

}
