package com.itrassist.backend.services.documents.summary;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.stereotype.Component;

import com.itrassist.backend.config.TaxRulesProperties;
import com.itrassist.backend.entities.ExtractionResult;
import com.itrassist.backend.entities.ExtractionSummary;
import com.itrassist.backend.enums.DocumentType;

/**
 * Projects an extraction summary onto the handful of figures that matter for its document type,
 * e.g. {Salary, Taxable Income, Deductions} for a Form 16. Keys keep insertion order.
 */
@Component
public class KeySummaryProjector {

    public static final String SALARY = "Salary";
    public static final String TAXABLE_INCOME = "Taxable Income";
    public static final String DEDUCTIONS = "Deductions";
    public static final String REPORTED_INCOME = "Reported Income";
    public static final String INCOME = "Income";
    public static final String INTEREST_INCOME_EST = "Interest Income (est.)";
    public static final String ELIGIBLE_80C_EST = "Eligible 80C (est.)";
    public static final String HRA_BASIS_EST = "HRA Basis (est.)";
    public static final String INTEREST_PAID_EST = "Interest Paid (est.)";
    public static final String MEDICAL_EXPENSE_EST = "Medical Expense (est.)";
    public static final String CAPITAL_GAINS_EST = "Capital Gains (est.)";
    public static final String BUSINESS_INCOME = "Business Income";

    private final BigDecimal section80cLimit;

    public KeySummaryProjector(TaxRulesProperties taxRules) {
        this.section80cLimit = taxRules.section80cLimit();
    }

    public Map<String, BigDecimal> project(ExtractionResult extraction) {
        if (extraction == null) return Map.of();
        return project(extraction.getDeclaredType(), extraction.getSummary());
    }

    public Map<String, BigDecimal> project(DocumentType type, ExtractionSummary summary) {
        ExtractionSummary s = summary == null ? ExtractionSummary.EMPTY : summary;
        BigDecimal income = s.income();
        BigDecimal deductions = s.deductions();
        BigDecimal taxable = s.taxableIncome();

        Map<String, BigDecimal> out = new LinkedHashMap<>();
        if (type == null) {
            out.put(INCOME, income);
            out.put(DEDUCTIONS, deductions);
            out.put(TAXABLE_INCOME, taxable);
            return Collections.unmodifiableMap(out);
        }

        switch (type) {
            case FORM_16, SALARY_SLIP -> {
                out.put(SALARY, income);
                out.put(TAXABLE_INCOME, taxable);
                out.put(DEDUCTIONS, deductions);
            }
            case ANNUAL_TAX_STATEMENT -> {
                out.put(REPORTED_INCOME, income);
                out.put(DEDUCTIONS, deductions);
                out.put(TAXABLE_INCOME, taxable);
            }
            case BANK_STATEMENT -> out.put(INTEREST_INCOME_EST, nonNegative(taxable.subtract(income.subtract(deductions))));
            case INVESTMENT_PROOF -> out.put(ELIGIBLE_80C_EST, deductions.min(section80cLimit));
            case RENT_RECEIPT -> out.put(HRA_BASIS_EST, nonNegative(deductions));
            case LOAN_STATEMENT -> out.put(INTEREST_PAID_EST, nonNegative(deductions));
            case MEDICAL_BILL -> out.put(MEDICAL_EXPENSE_EST, nonNegative(deductions));
            case CAPITAL_GAINS_REPORT -> out.put(CAPITAL_GAINS_EST, nonNegative(income.subtract(taxable)));
            case BUSINESS_INCOME_DOCUMENT -> {
                out.put(BUSINESS_INCOME, income);
                out.put(TAXABLE_INCOME, taxable);
            }
        }
        return Collections.unmodifiableMap(out);
    }

    private static BigDecimal nonNegative(BigDecimal value) {
        return value.max(BigDecimal.ZERO);
    }
}
