package com.itrassist.backend.config;

import java.time.Duration;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

/**
 * HTTP client used by the vision fallback. Read timeout follows itr.vision.timeout-seconds,
 * connect timeout is capped at 10 seconds.
 */
@Configuration
public class RestTemplateConfig {

    @Bean
    public RestTemplate visionRestTemplate(RestTemplateBuilder builder, VisionProperties visionProperties) {
        int readSeconds = Math.max(1, visionProperties.getTimeoutSeconds());

        return builder
                .setConnectTimeout(Duration.ofSeconds(Math.min(readSeconds, 10)))
                .setReadTimeout(Duration.ofSeconds(readSeconds))
                .defaultHeader("X-Title", "ITR Assist")
                .build();
    }
}
