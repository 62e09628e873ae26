package dev.odoorpc.client.config;

import dev.odoorpc.client.Connector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Exposes a {@link Connector} bean bound to the {@code odoo.rpc.*} properties. The connector is
 * closed with the application context.
 */
@Configuration(proxyBeanMethods = false)
@EnableConfigurationProperties(ConnectorProperties.class)
public class ConnectorConfiguration {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConnectorConfiguration.class);

    @Bean(destroyMethod = "close")
    Connector odooConnector(ConnectorProperties properties) {
        Connector connector = properties.toConnector();
        LOGGER.info("Configured {}", connector);
        return connector;
    }
}
