package com.itrassist.backend.services.documents.vision;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.itrassist.backend.config.VisionProperties;
import com.itrassist.backend.services.documents.extraction.HeuristicFieldExtractor;

import lombok.extern.slf4j.Slf4j;

/**
 * Picks the vision backend from itr.vision.provider. Without one, image uploads go straight to
 * heuristic extraction.
 */
@Configuration
@Slf4j
public class VisionConfiguration {

    @Bean
    @ConditionalOnProperty(prefix = "itr.vision", name = "provider", havingValue = "openrouter")
    public VisionExtractionAdapter openRouterVisionExtractionAdapter(VisionProperties visionProperties,
                                                                     @Qualifier("visionRestTemplate") RestTemplate restTemplate,
                                                                     ObjectMapper objectMapper,
                                                                     VisionResultNormalizer normalizer) {
        log.info("[Vision] Provider: openrouter (timeout={}s)", visionProperties.getTimeoutSeconds());
        return new OpenRouterVisionExtractionAdapter(visionProperties, restTemplate, objectMapper, normalizer);
    }

    @Bean
    @ConditionalOnProperty(prefix = "itr.vision", name = "provider", havingValue = "google")
    public VisionExtractionAdapter googleVisionExtractionAdapter(VisionProperties visionProperties,
                                                                 HeuristicFieldExtractor heuristicFieldExtractor) {
        log.info("[Vision] Provider: google (timeout={}s)", visionProperties.getTimeoutSeconds());
        return new GoogleVisionExtractionAdapter(visionProperties, heuristicFieldExtractor);
    }

    @Bean
    @ConditionalOnMissingBean(VisionExtractionAdapter.class)
    public VisionExtractionAdapter disabledVisionExtractionAdapter() {
        log.info("[Vision] Disabled (itr.vision.provider=none)");
        return new DisabledVisionExtractionAdapter();
    }
}
