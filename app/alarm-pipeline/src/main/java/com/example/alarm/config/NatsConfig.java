/*
 * Where: Alarm pipeline infrastructure configuration
 * What: Puts the NATS Connection under Spring management
 * Why: The uplink subscriber shares one connection for its lifetime
 */
package com.example.alarm.config;

import io.nats.client.Connection;
import io.nats.client.Nats;
import io.nats.client.Options;
import java.io.IOException;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
public class NatsConfig {

  @Bean(destroyMethod = "close")
  public Connection natsConnection(NatsProperties properties)
      throws IOException, InterruptedException {
    Options options =
        new Options.Builder()
            .server(properties.url())
            .connectionName(properties.connectionName())
            .connectionTimeout(properties.connectionTimeout())
            .maxReconnects(-1)
            .build();
    return Nats.connect(options);
  }
}
