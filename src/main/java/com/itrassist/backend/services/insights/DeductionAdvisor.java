package com.itrassist.backend.services.insights;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

import org.springframework.stereotype.Component;

import com.itrassist.backend.config.TaxRulesProperties;
import com.itrassist.backend.entities.TaxDocument;
import com.itrassist.backend.enums.DocumentType;
import com.itrassist.backend.services.AmountFormats;
import com.itrassist.backend.services.documents.summary.KeySummaryProjector;

/**
 * 80C headroom and missing deduction proofs for one filer.
 *
 * Totals use extracted documents only; the checklist and the missing-proof list count every upload,
 * whatever its status.
 */
@Component
public class DeductionAdvisor {

    static final List<DocumentType> DEDUCTION_PROOF_TYPES = List.of(
            DocumentType.INVESTMENT_PROOF,
            DocumentType.MEDICAL_BILL,
            DocumentType.RENT_RECEIPT,
            DocumentType.LOAN_STATEMENT
    );

    private final KeySummaryProjector keySummaryProjector;
    private final TaxRulesProperties taxRules;

    public DeductionAdvisor(KeySummaryProjector keySummaryProjector, TaxRulesProperties taxRules) {
        this.keySummaryProjector = keySummaryProjector;
        this.taxRules = taxRules;
    }

    public DeductionInsights advise(List<TaxDocument> documents) {
        BigDecimal total = documents.stream()
                .filter(TaxDocument::isExtracted)
                .map(d -> keySummaryProjector.project(d.getExtracted()))
                .map(keys -> keys.getOrDefault(KeySummaryProjector.DEDUCTIONS, BigDecimal.ZERO)
                        .add(keys.getOrDefault(KeySummaryProjector.ELIGIBLE_80C_EST, BigDecimal.ZERO)))
                .reduce(BigDecimal.ZERO, BigDecimal::add);

        BigDecimal limit = taxRules.section80cLimit();
        BigDecimal remaining = limit.subtract(total).max(BigDecimal.ZERO);
        String suggestion = total.compareTo(limit) < 0
                ? "You can claim up to ₹" + AmountFormats.grouped(remaining) + " more under 80C."
                : "80C limit appears fully utilized.";

        Set<DocumentType> uploaded = documents.stream()
                .map(TaxDocument::getDeclaredType)
                .filter(Objects::nonNull)
                .collect(Collectors.toCollection(() -> EnumSet.noneOf(DocumentType.class)));

        List<DocumentType> missing = DEDUCTION_PROOF_TYPES.stream()
                .filter(t -> !uploaded.contains(t))
                .collect(Collectors.toList());

        List<DeductionInsights.ChecklistItem> checklist = Arrays.stream(DocumentType.values())
                .map(t -> new DeductionInsights.ChecklistItem(t, t.getLabel(), uploaded.contains(t)))
                .collect(Collectors.toList());

        return new DeductionInsights(total, remaining, suggestion, missing,
                uploaded.contains(DocumentType.INVESTMENT_PROOF), checklist);
    }
}
