package com.itrassist.backend.services.documents.vision;

import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.itrassist.backend.config.VisionProperties;
import com.itrassist.backend.entities.ExtractionResult;
import com.itrassist.backend.enums.DocumentType;

import lombok.extern.slf4j.Slf4j;

/**
 * Sends the image to an OpenRouter chat-completions model and reads back a JSON extraction.
 *
 * The model is asked for JSON only; the answer is read between the first '{' and the last '}'.
 */
@Slf4j
public class OpenRouterVisionExtractionAdapter implements VisionExtractionAdapter {

    static final String SYSTEM_PROMPT =
            "You are an OCR+NLP extractor for Indian tax documents. Return ONLY compact JSON with fields: "
                    + "fields:[{name,value,confidence,source}], summary:{income,deductions,taxableIncome}, "
                    + "quality: 'good'|'low'|'unreadable', messages: string[]. "
                    + "Focus on PAN, Salary/Income, TDS, Deductions, Employer.";

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final VisionResultNormalizer normalizer;
    private final String apiKey;
    private final String baseUrl;
    private final String model;

    public OpenRouterVisionExtractionAdapter(VisionProperties properties,
                                             RestTemplate restTemplate,
                                             ObjectMapper objectMapper,
                                             VisionResultNormalizer normalizer) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.normalizer = normalizer;

        VisionProperties.OpenRouter cfg = properties.getOpenrouter();
        this.apiKey = cfg.getApiKey() == null ? "" : cfg.getApiKey().trim();
        String url = cfg.getBaseUrl() == null || cfg.getBaseUrl().isBlank()
                ? "https://openrouter.ai/api/v1"
                : cfg.getBaseUrl().trim();
        if (url.endsWith("/")) url = url.substring(0, url.length() - 1);
        this.baseUrl = url;
        this.model = cfg.getModel();

        log.info("[VisionAdapter] OpenRouter configured baseUrl={} model={} apiKeyPresent={}",
                this.baseUrl, this.model, !this.apiKey.isEmpty());
    }

    @Override
    public String name() {
        return "openrouter";
    }

    @Override
    public Optional<ExtractionResult> extract(byte[] imageBytes, String mimeType, DocumentType declaredType, String declaredLabel) {
        if (apiKey.isEmpty()) {
            log.debug("[VisionAdapter] OpenRouter api key missing, skipping");
            return Optional.empty();
        }
        if (!VisionExtractionAdapter.isImage(mimeType) || imageBytes == null || imageBytes.length == 0) {
            return Optional.empty();
        }

        String label = declaredLabel == null || declaredLabel.isBlank()
                ? (declaredType != null ? declaredType.getLabel() : "document")
                : declaredLabel;

        try {
            ResponseEntity<String> response = restTemplate.postForEntity(
                    baseUrl + "/chat/completions", request(imageBytes, mimeType, label), String.class);

            if (!response.getStatusCode().is2xxSuccessful() || response.getBody() == null) {
                log.warn("[VisionAdapter] OpenRouter answered status={} without usable body", response.getStatusCode());
                return Optional.empty();
            }

            String content = objectMapper.readTree(response.getBody())
                    .path("choices").path(0).path("message").path("content").asText("");

            Optional<String> json = jsonObject(content);
            if (json.isEmpty()) {
                log.warn("[VisionAdapter] OpenRouter answer had no JSON object ({} chars)", content.length());
                return Optional.empty();
            }

            ExtractionResult result = normalizer.normalize(objectMapper.readTree(json.get()), declaredType, declaredLabel);
            log.info("[VisionAdapter] OpenRouter extracted fields={} quality={}", result.getFields().size(), result.getQuality());
            return Optional.of(result);
        } catch (RestClientException e) {
            log.warn("[VisionAdapter] OpenRouter call failed: {}", e.toString());
            return Optional.empty();
        } catch (JsonProcessingException e) {
            log.warn("[VisionAdapter] OpenRouter answer is not valid JSON: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }

    private HttpEntity<Map<String, Object>> request(byte[] imageBytes, String mimeType, String label) {
        String dataUrl = "data:" + mimeType.trim() + ";base64," + Base64.getEncoder().encodeToString(imageBytes);

        Map<String, Object> body = Map.of(
                "model", model,
                "messages", List.of(
                        Map.of("role", "system", "content", SYSTEM_PROMPT),
                        Map.of("role", "user", "content", List.of(
                                Map.of("type", "image_url", "image_url", Map.of("url", dataUrl)),
                                Map.of("type", "text", "text", "Extract key fields from this " + label + ". Return JSON only.")
                        ))
                )
        );

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setBearerAuth(apiKey);
        return new HttpEntity<>(body, headers);
    }

    static Optional<String> jsonObject(String text) {
        if (text == null) return Optional.empty();
        int start = text.indexOf('{');
        int end = text.lastIndexOf('}');
        if (start < 0 || end <= start) return Optional.empty();
        return Optional.of(text.substring(start, end + 1));
    }
}
