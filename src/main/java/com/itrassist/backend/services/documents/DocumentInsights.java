package com.itrassist.backend.services.documents;

import java.util.List;

import com.itrassist.backend.services.documents.reconciliation.ReconciliationFinding;
import com.itrassist.backend.services.insights.DeductionInsights;
import com.itrassist.backend.services.insights.ItrRecommendation;

public record DocumentInsights(
        DeductionInsights deductions,
        ItrRecommendation recommendation,
        List<ReconciliationFinding> findings
) {
}
