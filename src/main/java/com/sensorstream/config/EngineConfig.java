package com.sensorstream.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sensorstream.service.classification.HttpModelPredictor;
import com.sensorstream.service.classification.ModelPredictor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;

/**
 * Wiring for the engine's external capabilities.
 */
@Slf4j
@Configuration
@EnableScheduling  // closes aggregate buckets on an interval
public class EngineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * RestTemplate for the inference endpoint; the per-attempt timeout also bounds reads.
     */
    @Bean
    public RestTemplate modelRestTemplate(RestTemplateBuilder builder, EngineProperties properties) {
        return builder
            .setConnectTimeout(properties.getModel().getAttemptTimeout())
            .setReadTimeout(properties.getModel().getAttemptTimeout())
            .build();
    }

    /**
     * Only registered when an inference endpoint is configured; otherwise the engine is rule-only.
     */
    @Bean
    @ConditionalOnProperty(prefix = "sensor-engine.model", name = "endpoint")
    public ModelPredictor modelPredictor(RestTemplate modelRestTemplate,
                                         ObjectMapper objectMapper,
                                         EngineProperties properties) {
        log.info("Using inference endpoint {}", properties.getModel().getEndpoint());
        return new HttpModelPredictor(modelRestTemplate, objectMapper, properties.getModel().getEndpoint());
    }
}
