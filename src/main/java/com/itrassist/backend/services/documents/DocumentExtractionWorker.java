package com.itrassist.backend.services.documents;

import java.util.Optional;
import java.util.UUID;

import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import com.itrassist.backend.config.AsyncExecutorConfig;
import com.itrassist.backend.entities.ExtractionResult;
import com.itrassist.backend.entities.TaxDocument;
import com.itrassist.backend.enums.DocumentStatus;
import com.itrassist.backend.exceptions.DocumentExtractionException;
import com.itrassist.backend.repositories.DocumentContentStore;
import com.itrassist.backend.repositories.DocumentContentStore.DocumentContent;
import com.itrassist.backend.repositories.TaxDocumentRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs extraction for one uploaded document off the request thread and records the outcome.
 * A document's transition is owned by its task; every write goes through an atomic repository update.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DocumentExtractionWorker {

    public static final String PROCESSING_FAILED = "Processing failed";

    private final TaxDocumentRepository documentRepository;
    private final DocumentContentStore contentStore;
    private final DocumentExtractionPipeline pipeline;

    @Async(AsyncExecutorConfig.DOCUMENT_EXTRACTION_EXECUTOR)
    public void startProcessing(UUID documentId) {
        if (documentId == null) return;
        processDocument(documentId);
    }

    public void processDocument(UUID documentId) {
        if (documentId == null) return;
        TaxDocument document = documentRepository.findById(documentId).orElse(null);
        if (document == null) {
            log.warn("[DocumentWorker] document not found (deleted?): {}", documentId);
            return;
        }

        // Already finished: nothing to redo.
        if (document.getStatus().isTerminal()) {
            return;
        }

        if (document.getStatus() == DocumentStatus.PENDING) {
            documentRepository.update(documentId, d -> {
                if (!d.getStatus().isTerminal()) d.markProcessing();
                return d;
            });
        }

        long startMs = System.currentTimeMillis();
        try {
            DocumentContent content = contentStore.fetch(documentId)
                    .orElseThrow(() -> new DocumentExtractionException("No stored content for document " + documentId));

            ExtractionResult result = pipeline.extract(
                    content.bytes(), content.mimeType(), document.getDeclaredType(), document.getDeclaredTypeLabel());

            Optional<TaxDocument> saved = documentRepository.update(documentId, d -> {
                if (!d.getStatus().isTerminal()) d.markExtracted(result);
                return d;
            });

            if (saved.isEmpty()) {
                log.info("[DocumentWorker] document {} was deleted during extraction", documentId);
                return;
            }
            log.info("[DocumentWorker] document={} extracted quality={} fields={} in {}ms",
                    documentId, result.getQuality(), result.getFields().size(), System.currentTimeMillis() - startMs);
        } catch (Exception e) {
            log.error("[DocumentWorker] extraction failed documentId={}", documentId, e);
            documentRepository.update(documentId, d -> {
                if (!d.getStatus().isTerminal()) d.markFailed(PROCESSING_FAILED);
                return d;
            });
        }
    }
}
