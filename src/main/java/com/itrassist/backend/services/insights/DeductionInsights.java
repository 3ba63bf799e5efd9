package com.itrassist.backend.services.insights;

import java.math.BigDecimal;
import java.util.List;

import com.itrassist.backend.enums.DocumentType;

public record DeductionInsights(
        BigDecimal totalDeductions,
        BigDecimal remaining80C,
        String suggestion,
        List<DocumentType> missingDocumentTypes,
        boolean hasInvestmentProof,
        List<ChecklistItem> checklist
) {

    public record ChecklistItem(DocumentType type, String label, boolean uploaded) {
    }
}
