package com.itrassist.backend.services.documents.reconciliation;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.springframework.stereotype.Component;

import com.itrassist.backend.config.TaxRulesProperties;
import com.itrassist.backend.entities.ExtractionResult;
import com.itrassist.backend.entities.FieldNames;
import com.itrassist.backend.entities.TaxDocument;
import com.itrassist.backend.enums.DocumentType;
import com.itrassist.backend.enums.FindingType;
import com.itrassist.backend.services.AmountFormats;

import lombok.extern.slf4j.Slf4j;

/**
 * Compares equivalent figures across a filer's documents.
 *
 * Only extracted documents take part; when several share a type, the first in upload order is used.
 */
@Slf4j
@Component
public class CrossDocumentReconciler {

    private final TaxRulesProperties taxRules;

    public CrossDocumentReconciler(TaxRulesProperties taxRules) {
        this.taxRules = taxRules;
    }

    /**
     * @param documents the filer's documents in upload order
     */
    public List<ReconciliationFinding> reconcile(List<TaxDocument> documents) {
        List<ReconciliationFinding> findings = new ArrayList<>();
        if (documents == null || documents.isEmpty()) return findings;

        Optional<TaxDocument> form16 = firstExtracted(documents, DocumentType.FORM_16);
        Optional<TaxDocument> slip = firstExtracted(documents, DocumentType.SALARY_SLIP);
        Optional<TaxDocument> annual = firstExtracted(documents, DocumentType.ANNUAL_TAX_STATEMENT);

        if (form16.isPresent() && slip.isPresent()) {
            BigDecimal s1 = salaryFigure(form16.get().getExtracted());
            BigDecimal s2 = salaryFigure(slip.get().getExtracted());
            relativeDifference(s1, s2)
                    .filter(diff -> diff.compareTo(taxRules.salaryTolerance()) > 0)
                    .ifPresent(diff -> findings.add(new ReconciliationFinding(
                            FindingType.SALARY_MISMATCH,
                            "Salary mismatch between Form 16 (₹" + AmountFormats.grouped(s1) + ") and Salary Slip (₹" + AmountFormats.grouped(s2)
                                    + "). Review and correct.",
                            form16.get().getId(), slip.get().getId(), s1, s2, diff)));
        }

        if (form16.isPresent() && annual.isPresent()) {
            BigDecimal t1 = taxableFigure(form16.get().getExtracted());
            BigDecimal t2 = taxableFigure(annual.get().getExtracted());
            relativeDifference(t1, t2)
                    .filter(diff -> diff.compareTo(taxRules.taxableIncomeTolerance()) > 0)
                    .ifPresent(diff -> findings.add(new ReconciliationFinding(
                            FindingType.TAXABLE_INCOME_MISMATCH,
                            "Reported taxable income differs between Form 16 and 26AS/AIS. Please reconcile figures.",
                            form16.get().getId(), annual.get().getId(), t1, t2, diff)));
        }

        if (!findings.isEmpty()) {
            log.info("[Reconciler] {} finding(s) across {} document(s)", findings.size(), documents.size());
        }
        return findings;
    }

    private static Optional<TaxDocument> firstExtracted(List<TaxDocument> documents, DocumentType type) {
        return documents.stream()
                .filter(d -> d.isExtracted() && d.getExtracted() != null && d.getDeclaredType() == type)
                .findFirst();
    }

    private static BigDecimal salaryFigure(ExtractionResult ex) {
        return ex.number(FieldNames.SALARY)
                .filter(v -> v.signum() != 0)
                .orElse(ex.getSummary().income());
    }

    private static BigDecimal taxableFigure(ExtractionResult ex) {
        BigDecimal fromSummary = ex.getSummary().taxableIncome();
        if (fromSummary.signum() != 0) return fromSummary;
        return ex.number(FieldNames.TAXABLE_INCOME).orElse(BigDecimal.ZERO);
    }

    /**
     * |a - b| / max(a, b); empty when either figure is zero.
     */
    static Optional<BigDecimal> relativeDifference(BigDecimal a, BigDecimal b) {
        if (a == null || b == null || a.signum() == 0 || b.signum() == 0) return Optional.empty();
        BigDecimal max = a.max(b);
        if (max.signum() <= 0) return Optional.empty();
        return Optional.of(a.subtract(b).abs().divide(max, MathContext.DECIMAL64));
    }
}
