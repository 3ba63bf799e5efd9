package com.itrassist.backend.services.documents;

import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import com.itrassist.backend.config.AsyncExecutorConfig;
import com.itrassist.backend.config.ExtractionProperties;
import com.itrassist.backend.config.VisionProperties;
import com.itrassist.backend.entities.ExtractionResult;
import com.itrassist.backend.enums.DocumentType;
import com.itrassist.backend.services.documents.extraction.HeuristicFieldExtractor;
import com.itrassist.backend.services.documents.text.TextNormalizer;
import com.itrassist.backend.services.documents.vision.VisionExtractionAdapter;
import com.itrassist.backend.services.ocr.PdfTextExtractor;

import lombok.extern.slf4j.Slf4j;

/**
 * Routes uploaded bytes to the right text source and extractor:
 * PDF text layer, vision backend for images, decoded text for text/html uploads.
 * Every degraded path still ends in a heuristic result (possibly "unreadable").
 */
@Slf4j
@Service
public class DocumentExtractionPipeline {

    private final PdfTextExtractor pdfTextExtractor;
    private final HeuristicFieldExtractor heuristicExtractor;
    private final VisionExtractionAdapter visionAdapter;
    private final Executor visionExecutor;
    private final long visionTimeoutMillis;

    public DocumentExtractionPipeline(PdfTextExtractor pdfTextExtractor,
                                      HeuristicFieldExtractor heuristicExtractor,
                                      VisionExtractionAdapter visionAdapter,
                                      @Qualifier(AsyncExecutorConfig.VISION_EXECUTOR) Executor visionExecutor,
                                      VisionProperties visionProperties) {
        this.pdfTextExtractor = pdfTextExtractor;
        this.heuristicExtractor = heuristicExtractor;
        this.visionAdapter = visionAdapter;
        this.visionExecutor = visionExecutor;
        int seconds = visionProperties.getTimeoutSeconds() > 0 ? visionProperties.getTimeoutSeconds() : 20;
        this.visionTimeoutMillis = TimeUnit.SECONDS.toMillis(seconds);
    }

    public ExtractionResult extract(byte[] bytes, String mimeType, DocumentType declaredType, String declaredLabel) {
        String base = ExtractionProperties.baseMimeType(mimeType);

        if ("application/pdf".equals(base)) {
            String text = TextNormalizer.normalizeText(pdfTextExtractor.extractText(bytes));
            log.info("[ExtractionPipeline] PDF text layer: {} chars", text.length());
            return heuristicExtractor.extract(text, declaredType, declaredLabel);
        }

        if (VisionExtractionAdapter.isImage(base)) {
            Optional<ExtractionResult> vision = callVision(bytes, base, declaredType, declaredLabel);
            if (vision.isPresent()) {
                return vision.get();
            }
            log.info("[ExtractionPipeline] vision unavailable ({}), heuristics on empty text", visionAdapter.name());
            return heuristicExtractor.extract("", declaredType, declaredLabel);
        }

        if ("text/html".equals(base)) {
            String text = TextNormalizer.stripHtml(decode(bytes));
            return heuristicExtractor.extract(text, declaredType, declaredLabel);
        }

        if (base.startsWith("text/")) {
            String text = TextNormalizer.normalizeText(decode(bytes));
            return heuristicExtractor.extract(text, declaredType, declaredLabel);
        }

        log.info("[ExtractionPipeline] no text source for mime '{}'", base);
        return heuristicExtractor.extract("", declaredType, declaredLabel);
    }

    private Optional<ExtractionResult> callVision(byte[] bytes, String mimeType, DocumentType declaredType, String declaredLabel) {
        CompletableFuture<Optional<ExtractionResult>> future = CompletableFuture.supplyAsync(
                () -> visionAdapter.extract(bytes, mimeType, declaredType, declaredLabel), visionExecutor);
        try {
            Optional<ExtractionResult> result = future.get(visionTimeoutMillis, TimeUnit.MILLISECONDS);
            return result == null ? Optional.empty() : result;
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("[ExtractionPipeline] vision backend '{}' timed out after {}ms", visionAdapter.name(), visionTimeoutMillis);
            return Optional.empty();
        } catch (ExecutionException e) {
            log.warn("[ExtractionPipeline] vision backend '{}' failed: {}", visionAdapter.name(), String.valueOf(e.getCause()));
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[ExtractionPipeline] interrupted while waiting for vision backend");
            return Optional.empty();
        }
    }

    private static String decode(byte[] bytes) {
        return bytes == null ? "" : new String(bytes, StandardCharsets.UTF_8);
    }
}
