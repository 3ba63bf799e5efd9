package com.itrassist.backend.services.documents;

import java.time.LocalDateTime;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import org.springframework.http.MediaType;
import org.springframework.http.MediaTypeFactory;
import org.springframework.stereotype.Service;

import com.itrassist.backend.config.ExtractionProperties;
import com.itrassist.backend.entities.ExtractedField;
import com.itrassist.backend.entities.FieldNames;
import com.itrassist.backend.entities.TaxDocument;
import com.itrassist.backend.enums.DocumentType;
import com.itrassist.backend.exceptions.ConflictException;
import com.itrassist.backend.exceptions.IngestException;
import com.itrassist.backend.exceptions.ResourceNotFoundException;
import com.itrassist.backend.repositories.DocumentContentStore;
import com.itrassist.backend.repositories.TaxDocumentRepository;
import com.itrassist.backend.services.aggregate.FilerAggregate;
import com.itrassist.backend.services.aggregate.TaxAggregateCalculator;
import com.itrassist.backend.services.documents.corrections.CorrectionMerger;
import com.itrassist.backend.services.documents.corrections.CorrectionValidator;
import com.itrassist.backend.services.documents.corrections.FieldCorrection;
import com.itrassist.backend.services.documents.corrections.ManualFieldCatalog;
import com.itrassist.backend.services.documents.reconciliation.CrossDocumentReconciler;
import com.itrassist.backend.services.documents.reconciliation.ReconciliationFinding;
import com.itrassist.backend.services.documents.summary.CanonicalExportMapper;
import com.itrassist.backend.services.documents.summary.KeySummaryProjector;
import com.itrassist.backend.services.insights.DeductionAdvisor;
import com.itrassist.backend.services.insights.ItrFormRecommender;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Entry point for a filer's documents: upload, status, extracted data, corrections and the derived
 * filer-level views (aggregate, reconciliation, insights). Derived views are recomputed on every call.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TaxDocumentService {

    private final TaxDocumentRepository documentRepository;
    private final DocumentContentStore contentStore;
    private final DocumentExtractionWorker extractionWorker;
    private final ExtractionProperties extractionProperties;
    private final KeySummaryProjector keySummaryProjector;
    private final CanonicalExportMapper canonicalExportMapper;
    private final ManualFieldCatalog manualFieldCatalog;
    private final CorrectionValidator correctionValidator;
    private final CorrectionMerger correctionMerger;
    private final CrossDocumentReconciler reconciler;
    private final TaxAggregateCalculator aggregateCalculator;
    private final DeductionAdvisor deductionAdvisor;
    private final ItrFormRecommender itrFormRecommender;

    /**
     * Validates and stores an upload, then hands it to the extraction worker.
     * The returned document is already PROCESSING.
     *
     * @param declaredLabel document type as chosen by the filer; when blank the file name is used
     */
    public TaxDocument ingest(String ownerId, byte[] bytes, String mimeType, String declaredLabel, String originalFileName) {
        if (bytes == null) {
            throw new IngestException("file is required");
        }
        if (bytes.length == 0) {
            throw new IngestException("Uploaded file is empty");
        }
        if (bytes.length > extractionProperties.getMaxUploadBytes()) {
            throw new IngestException("File exceeds the maximum size of "
                    + (extractionProperties.getMaxUploadBytes() / (1024 * 1024)) + " MB");
        }

        String resolvedMime = resolveMimeType(mimeType, originalFileName);
        if (!extractionProperties.isAllowedMimeType(resolvedMime)) {
            throw new IngestException("Unsupported file type: " + (resolvedMime.isEmpty() ? "unknown" : resolvedMime));
        }

        boolean labelGiven = declaredLabel != null && !declaredLabel.isBlank();
        DocumentType type = DocumentType.fromLabel(labelGiven ? declaredLabel : originalFileName);
        String label = labelGiven ? declaredLabel.trim() : (type != null ? type.getLabel() : "");

        TaxDocument document = new TaxDocument();
        document.setId(UUID.randomUUID());
        document.setOwnerId(ownerId);
        document.setDeclaredType(type);
        document.setDeclaredTypeLabel(label);
        document.setMimeType(resolvedMime);
        document.setByteSize(bytes.length);
        document.setOriginalFileName(originalFileName);
        document.setUploadedAt(LocalDateTime.now());

        contentStore.put(document.getId(), bytes, resolvedMime);
        document.markProcessing();
        TaxDocument saved = documentRepository.save(document);

        log.info("[TaxDocumentService] ingested document={} owner={} type={} mime={} bytes={}",
                saved.getId(), ownerId, saved.getDeclaredType(), resolvedMime, bytes.length);

        extractionWorker.startProcessing(saved.getId());
        return saved;
    }

    public TaxDocument getStatus(UUID documentId, String ownerId) {
        return find(documentId, ownerId);
    }

    public DocumentData getData(UUID documentId, String ownerId) {
        TaxDocument document = find(documentId, ownerId);
        List<TaxDocument> ownerDocuments = documentRepository.findAllByOwnerId(ownerId);
        List<ReconciliationFinding> findings = reconciler.reconcile(ownerDocuments);

        Set<String> known = knownOwnerFields(ownerDocuments);
        List<ManualFieldCatalog.ManualFieldDefinition> manualFields =
                manualFieldCatalog.definitionsFor(document.getDeclaredType(), known);

        if (!document.isExtracted()) {
            return new DocumentData(document, Map.of(), Map.of(), findings, manualFields, List.of());
        }

        return new DocumentData(
                document,
                keySummaryProjector.project(document.getExtracted()),
                canonicalExportMapper.export(document.getExtracted()),
                findings,
                manualFields,
                manualFieldCatalog.missingRequiredFields(document.getExtracted(), known));
    }

    /**
     * Validates the whole batch first; on any violation nothing is merged.
     */
    public TaxDocument applyCorrections(UUID documentId, String ownerId, List<FieldCorrection> corrections) {
        TaxDocument document = find(documentId, ownerId);
        if (!document.isExtracted()) {
            throw new ConflictException("Document " + documentId + " has no extracted data yet (status " + document.getStatus() + ")");
        }

        List<FieldCorrection> batch = corrections == null ? List.of() : List.copyOf(corrections);
        Set<String> known = knownOwnerFields(documentRepository.findAllByOwnerId(ownerId));

        Optional<TaxDocument> updated = documentRepository.update(documentId, d -> {
            if (!d.isExtracted()) {
                throw new ConflictException("Document " + documentId + " has no extracted data");
            }
            correctionValidator.validate(d.getExtracted(), batch, known);
            d.replaceExtraction(correctionMerger.merge(d.getExtracted(), batch));
            return d;
        });

        TaxDocument result = updated.orElseThrow(() -> new ResourceNotFoundException("Document not found"));
        log.info("[TaxDocumentService] document={} corrected {} field(s)", documentId, batch.size());
        return result;
    }

    public List<TaxDocument> list(String ownerId) {
        return documentRepository.findAllByOwnerId(ownerId);
    }

    public void delete(UUID documentId, String ownerId) {
        find(documentId, ownerId);
        documentRepository.deleteById(documentId);
        contentStore.delete(documentId);
        log.info("[TaxDocumentService] deleted document={} owner={}", documentId, ownerId);
    }

    public FilerAggregate getAggregate(String ownerId) {
        return aggregateCalculator.aggregate(documentRepository.findAllByOwnerId(ownerId));
    }

    public List<ReconciliationFinding> getFindings(String ownerId) {
        return reconciler.reconcile(documentRepository.findAllByOwnerId(ownerId));
    }

    public DocumentInsights getInsights(String ownerId) {
        List<TaxDocument> documents = documentRepository.findAllByOwnerId(ownerId);
        return new DocumentInsights(
                deductionAdvisor.advise(documents),
                itrFormRecommender.recommend(documents),
                reconciler.reconcile(documents));
    }

    private TaxDocument find(UUID documentId, String ownerId) {
        return documentRepository.findByIdAndOwnerId(documentId, ownerId)
                .orElseThrow(() -> new ResourceNotFoundException("Document not found"));
    }

    /**
     * Identity fields already known for the filer: from the first extracted Form 16, else the first
     * extracted document.
     */
    Set<String> knownOwnerFields(List<TaxDocument> ownerDocuments) {
        Optional<TaxDocument> source = ownerDocuments.stream()
                .filter(d -> d.isExtracted() && d.getDeclaredType() == DocumentType.FORM_16)
                .findFirst()
                .or(() -> ownerDocuments.stream().filter(TaxDocument::isExtracted).findFirst());

        Set<String> known = new LinkedHashSet<>();
        source.ifPresent(d -> {
            for (ExtractedField f : d.getExtracted().getFields()) {
                if (!f.value().isBlank()) known.add(FieldNames.canonical(f.name()));
            }
        });
        return known;
    }

    private static String resolveMimeType(String mimeType, String originalFileName) {
        String base = ExtractionProperties.baseMimeType(mimeType);
        if (!base.isEmpty() && !MediaType.APPLICATION_OCTET_STREAM_VALUE.equals(base)) {
            return base;
        }
        return MediaTypeFactory.getMediaType(originalFileName == null ? "" : originalFileName)
                .map(m -> ExtractionProperties.baseMimeType(m.toString()))
                .orElse(base);
    }
}
