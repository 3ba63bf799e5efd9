package com.itrassist.backend.services.documents.reconciliation;

import static com.itrassist.backend.support.TaxDocumentFixtures.amount;
import static com.itrassist.backend.support.TaxDocumentFixtures.extracted;
import static com.itrassist.backend.support.TaxDocumentFixtures.pending;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.itrassist.backend.config.TaxRulesProperties;
import com.itrassist.backend.entities.FieldNames;
import com.itrassist.backend.entities.TaxDocument;
import com.itrassist.backend.enums.DocumentType;
import com.itrassist.backend.enums.FindingType;

class CrossDocumentReconcilerTest {

    private final CrossDocumentReconciler reconciler = new CrossDocumentReconciler(TaxRulesProperties.defaults());

    @Test
    void reconcile_flagsSalaryMismatchAboveTolerance() {
        TaxDocument form16 = extracted(DocumentType.FORM_16, amount(FieldNames.SALARY, 1_000_000));
        TaxDocument slip = extracted(DocumentType.SALARY_SLIP, amount(FieldNames.SALARY, 1_030_000));

        List<ReconciliationFinding> findings = reconciler.reconcile(List.of(form16, slip));

        assertEquals(1, findings.size());
        ReconciliationFinding finding = findings.get(0);
        assertEquals(FindingType.SALARY_MISMATCH, finding.type());
        assertEquals("Salary mismatch between Form 16 (₹1,000,000) and Salary Slip (₹1,030,000). Review and correct.",
                finding.message());
        assertEquals(form16.getId(), finding.firstDocumentId());
        assertEquals(slip.getId(), finding.secondDocumentId());
    }

    @Test
    void reconcile_salaryWithinToleranceIsClean() {
        List<ReconciliationFinding> findings = reconciler.reconcile(List.of(
                extracted(DocumentType.FORM_16, amount(FieldNames.SALARY, 1_000_000)),
                extracted(DocumentType.SALARY_SLIP, amount(FieldNames.SALARY, 1_010_000))));

        assertTrue(findings.isEmpty());
    }

    @Test
    void reconcile_flagsTaxableIncomeMismatch() {
        List<ReconciliationFinding> findings = reconciler.reconcile(List.of(
                extracted(DocumentType.FORM_16, amount(FieldNames.TAXABLE_INCOME, 1_000_000)),
                extracted(DocumentType.ANNUAL_TAX_STATEMENT, amount(FieldNames.TAXABLE_INCOME, 1_100_000))));

        assertEquals(1, findings.size());
        assertEquals(FindingType.TAXABLE_INCOME_MISMATCH, findings.get(0).type());
        assertEquals("Reported taxable income differs between Form 16 and 26AS/AIS. Please reconcile figures.",
                findings.get(0).message());
    }

    @Test
    void reconcile_ignoresDocumentsNotExtracted() {
        List<ReconciliationFinding> findings = reconciler.reconcile(List.of(
                extracted(DocumentType.FORM_16, amount(FieldNames.SALARY, 1_000_000)),
                pending(DocumentType.SALARY_SLIP)));

        assertTrue(findings.isEmpty());
    }

    @Test
    void reconcile_usesFirstDocumentOfEachType() {
        List<ReconciliationFinding> findings = reconciler.reconcile(List.of(
                extracted(DocumentType.FORM_16, amount(FieldNames.SALARY, 1_000_000)),
                extracted(DocumentType.SALARY_SLIP, amount(FieldNames.SALARY, 1_000_000)),
                extracted(DocumentType.SALARY_SLIP, amount(FieldNames.SALARY, 2_000_000))));

        assertTrue(findings.isEmpty());
    }

    @Test
    void relativeDifference_emptyWhenEitherFigureIsZero() {
        assertTrue(CrossDocumentReconciler.relativeDifference(BigDecimal.ZERO, BigDecimal.TEN).isEmpty());
        assertEquals(0, new BigDecimal("0.5").compareTo(
                CrossDocumentReconciler.relativeDifference(BigDecimal.valueOf(50), BigDecimal.valueOf(100)).orElseThrow()));
    }
}
