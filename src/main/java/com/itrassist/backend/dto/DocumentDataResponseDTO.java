package com.itrassist.backend.dto;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.itrassist.backend.entities.ExtractionResult;
import com.itrassist.backend.entities.ExtractionSummary;
import com.itrassist.backend.enums.DocumentStatus;
import com.itrassist.backend.enums.DocumentType;
import com.itrassist.backend.services.documents.corrections.ManualFieldCatalog.ManualFieldDefinition;
import com.itrassist.backend.services.documents.reconciliation.ReconciliationFinding;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class DocumentDataResponseDTO {
    private UUID id;
    private DocumentType docType;
    private String docTypeLabel;
    private DocumentStatus status;
    private String error;

    private ExtractionSummary summary;
    private ExtractionResult extracted;
    private Map<String, BigDecimal> keySummary;
    private Map<String, Object> canonicalExport;

    private List<ReconciliationFinding> findings;
    private List<ManualFieldDefinition> manualFields;
    private List<String> missingRequiredFields;
    private boolean needsReview;
}
