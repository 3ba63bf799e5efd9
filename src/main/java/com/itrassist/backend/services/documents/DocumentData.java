package com.itrassist.backend.services.documents;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import com.itrassist.backend.entities.TaxDocument;
import com.itrassist.backend.enums.ExtractionQuality;
import com.itrassist.backend.services.documents.corrections.ManualFieldCatalog.ManualFieldDefinition;
import com.itrassist.backend.services.documents.reconciliation.ReconciliationFinding;

/**
 * Everything the review screen shows for one document. Key summary and export are empty until extraction finishes.
 */
public record DocumentData(
        TaxDocument document,
        Map<String, BigDecimal> keySummary,
        Map<String, Object> canonicalExport,
        List<ReconciliationFinding> findings,
        List<ManualFieldDefinition> manualFields,
        List<String> missingRequiredFields
) {

    public boolean needsReview() {
        if (!document.isExtracted()) return false;
        return document.getExtracted().getQuality() != ExtractionQuality.GOOD || !missingRequiredFields.isEmpty();
    }
}
