package com.itrassist.backend.services.documents.reconciliation;

import java.math.BigDecimal;
import java.util.UUID;

import com.itrassist.backend.enums.FindingType;

/**
 * Advisory discrepancy between two documents of the same filer. Never blocks anything.
 */
public record ReconciliationFinding(
        FindingType type,
        String message,
        UUID firstDocumentId,
        UUID secondDocumentId,
        BigDecimal firstValue,
        BigDecimal secondValue,
        BigDecimal relativeDifference
) {
}
