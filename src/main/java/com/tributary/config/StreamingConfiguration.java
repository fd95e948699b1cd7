package com.tributary.config;

import com.tributary.service.ResilientStreamClient;
import com.tributary.transport.TransportFactory;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the streaming client with its production transport and logger.
 */
@Configuration
public class StreamingConfiguration {

    @Bean
    public ResilientStreamClient resilientStreamClient(TransportFactory geminiTransportFactory,
                                                       TributaryProperties properties) {
        return new ResilientStreamClient(
                geminiTransportFactory,
                properties::toStreamConfig,
                LoggerFactory.getLogger(ResilientStreamClient.class));
    }
}
