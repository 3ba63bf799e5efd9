package com.itrassist.backend.services.documents.vision;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import com.google.api.gax.core.FixedCredentialsProvider;
import com.google.auth.oauth2.GoogleCredentials;
import com.google.cloud.vision.v1.AnnotateImageRequest;
import com.google.cloud.vision.v1.AnnotateImageResponse;
import com.google.cloud.vision.v1.BatchAnnotateImagesResponse;
import com.google.cloud.vision.v1.Feature;
import com.google.cloud.vision.v1.Feature.Type;
import com.google.cloud.vision.v1.Image;
import com.google.cloud.vision.v1.ImageAnnotatorClient;
import com.google.cloud.vision.v1.ImageAnnotatorSettings;
import com.google.protobuf.ByteString;
import com.itrassist.backend.config.VisionProperties;
import com.itrassist.backend.entities.ExtractedField;
import com.itrassist.backend.entities.ExtractionResult;
import com.itrassist.backend.enums.DocumentType;
import com.itrassist.backend.enums.FieldSource;
import com.itrassist.backend.services.documents.extraction.HeuristicFieldExtractor;

import lombok.extern.slf4j.Slf4j;

/**
 * Google Cloud Vision document-text OCR followed by the regular heuristic rules.
 * Fields found this way are tagged ocr:vision.
 */
@Slf4j
public class GoogleVisionExtractionAdapter implements VisionExtractionAdapter {

    private final VisionProperties.Google settings;
    private final HeuristicFieldExtractor heuristicExtractor;

    public GoogleVisionExtractionAdapter(VisionProperties properties, HeuristicFieldExtractor heuristicExtractor) {
        this.settings = properties.getGoogle();
        this.heuristicExtractor = heuristicExtractor;
    }

    @Override
    public String name() {
        return "google";
    }

    @Override
    public Optional<ExtractionResult> extract(byte[] imageBytes, String mimeType, DocumentType declaredType, String declaredLabel) {
        if (!VisionExtractionAdapter.isImage(mimeType) || imageBytes == null || imageBytes.length == 0) {
            return Optional.empty();
        }

        String text;
        try {
            text = detectText(imageBytes);
        } catch (IOException | RuntimeException e) {
            log.warn("[VisionAdapter] Google Vision OCR failed: {}", e.toString());
            return Optional.empty();
        }

        if (text == null || text.isBlank()) {
            log.info("[VisionAdapter] Google Vision returned no text");
            return Optional.empty();
        }

        ExtractionResult heuristic = heuristicExtractor.extract(text, declaredType, declaredLabel);
        List<ExtractedField> retagged = heuristic.getFields().stream()
                .map(f -> new ExtractedField(f.name(), f.value(), f.confidence(), FieldSource.OCR_VISION))
                .collect(Collectors.toList());

        return Optional.of(heuristic.toBuilder().fields(retagged).build());
    }

    /**
     * Raw DOCUMENT_TEXT_DETECTION output for one image.
     */
    protected String detectText(byte[] imageBytes) throws IOException {
        long startMs = System.currentTimeMillis();
        log.info("[VisionAdapter] Google Vision request bytes={} projectId='{}'", imageBytes.length, safe(settings.getProjectId()));

        try (ImageAnnotatorClient client = createClient()) {
            Image image = Image.newBuilder().setContent(ByteString.copyFrom(imageBytes)).build();
            Feature feature = Feature.newBuilder().setType(Type.DOCUMENT_TEXT_DETECTION).build();
            AnnotateImageRequest request = AnnotateImageRequest.newBuilder()
                    .addFeatures(feature)
                    .setImage(image)
                    .build();

            BatchAnnotateImagesResponse response = client.batchAnnotateImages(List.of(request));
            if (response == null || response.getResponsesCount() == 0) {
                return "";
            }

            AnnotateImageResponse r = response.getResponses(0);
            if (r.hasError()) {
                throw new IOException("Google Vision error: " + r.getError().getMessage());
            }

            String text = "";
            if (r.hasFullTextAnnotation()) {
                text = r.getFullTextAnnotation().getText();
            } else if (r.getTextAnnotationsCount() > 0) {
                text = r.getTextAnnotations(0).getDescription();
            }

            log.info("[VisionAdapter] Google Vision text={} chars in {}ms",
                    text == null ? 0 : text.length(), System.currentTimeMillis() - startMs);
            return text == null ? "" : text;
        }
    }

    private ImageAnnotatorClient createClient() throws IOException {
        // Application default credentials unless an existing key file is configured.
        String path = safe(settings.getCredentialsPath()).trim();
        if (!path.isEmpty()) {
            Path p = Path.of(path);
            if (Files.exists(p)) {
                GoogleCredentials credentials;
                try (InputStream in = Files.newInputStream(p)) {
                    credentials = GoogleCredentials.fromStream(in)
                            .createScoped(List.of("https://www.googleapis.com/auth/cloud-platform"));
                }
                ImageAnnotatorSettings annotatorSettings = ImageAnnotatorSettings.newBuilder()
                        .setCredentialsProvider(FixedCredentialsProvider.create(credentials))
                        .build();
                return ImageAnnotatorClient.create(annotatorSettings);
            }
            log.warn("[VisionAdapter] credentials-path not found: '{}' (falling back to ADC)", path);
        }
        return ImageAnnotatorClient.create();
    }

    private static String safe(String value) {
        return value == null ? "" : value;
    }
}
