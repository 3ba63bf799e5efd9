package com.itrassist.backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import lombok.Data;

/**
 * Vision fallback settings, prefix "itr.vision". The fallback is only consulted for image uploads.
 */
@Data
@ConfigurationProperties(prefix = "itr.vision")
public class VisionProperties {

    /**
     * none | openrouter | google
     */
    private String provider = "none";

    /**
     * Upper bound for one vision call; after this the upload degrades to heuristic extraction.
     */
    private int timeoutSeconds = 20;

    private OpenRouter openrouter = new OpenRouter();

    private Google google = new Google();

    @Data
    public static class OpenRouter {

        private String apiKey = "";

        private String baseUrl = "https://openrouter.ai/api/v1";

        private String model = "openai/gpt-4o-mini";
    }

    @Data
    public static class Google {

        /**
         * Optional service-account JSON. Empty means application default credentials.
         */
        private String credentialsPath = "";

        private String projectId = "";
    }
}
