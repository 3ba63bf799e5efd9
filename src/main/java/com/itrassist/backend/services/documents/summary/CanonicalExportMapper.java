package com.itrassist.backend.services.documents.summary;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import org.springframework.stereotype.Component;

import com.itrassist.backend.config.TaxRulesProperties;
import com.itrassist.backend.entities.ExtractedField;
import com.itrassist.backend.entities.ExtractionResult;
import com.itrassist.backend.entities.ExtractionSummary;
import com.itrassist.backend.entities.FieldNames;
import com.itrassist.backend.entities.FieldValue;
import com.itrassist.backend.services.documents.extraction.AmountParser;

/**
 * Canonical snake_case export of one document, the shape downstream filing tools consume.
 *
 * Form 16 example:
 * {"document_type":"Form 16","PAN":"ABCDE1234F","gross_salary":1200000,
 *  "deductions":{"section_80C":150000},"tds_deducted":90000,"tax_payable":105000}
 */
@Component
public class CanonicalExportMapper {

    private final BigDecimal flatRate;

    public CanonicalExportMapper(TaxRulesProperties taxRules) {
        this.flatRate = taxRules.flatRate();
    }

    public Map<String, Object> export(ExtractionResult ex) {
        Map<String, Object> out = new LinkedHashMap<>();
        if (ex == null) return out;

        out.put("document_type", ex.getDeclaredTypeLabel());
        if (ex.getDeclaredType() == null) return Collections.unmodifiableMap(out);

        ExtractionSummary summary = ex.getSummary();

        switch (ex.getDeclaredType()) {
            case FORM_16 -> {
                value(ex, FieldNames.PAN).filter(v -> !v.isBlank()).ifPresent(v -> out.put("PAN", v.toJson()));
                value(ex, FieldNames.EMPLOYER).filter(v -> !v.isBlank()).ifPresent(v -> out.put("employer_name", v.toJson()));
                value(ex, FieldNames.SALARY).ifPresent(v -> out.put("gross_salary", v.toJson()));
                value(ex, FieldNames.DEDUCTIONS).ifPresent(v -> {
                    Map<String, Object> deductions = new LinkedHashMap<>();
                    v.asNumber().ifPresent(n -> deductions.put("section_80C", n));
                    out.put("deductions", deductions);
                });
                value(ex, FieldNames.TDS).ifPresent(v -> out.put("tds_deducted", v.toJson()));
                BigDecimal taxPayable = AmountParser.roundWhole(summary.taxableIncome().multiply(flatRate)).max(BigDecimal.ZERO);
                if (taxPayable.signum() > 0) out.put("tax_payable", taxPayable);
            }
            case ANNUAL_TAX_STATEMENT -> {
                value(ex, FieldNames.PAN).filter(v -> !v.isBlank()).ifPresent(v -> out.put("pan", v.toJson()));
                value(ex, FieldNames.TDS).ifPresent(v -> {
                    out.put("tax_deducted_at_source", v.toJson());
                    out.put("total_tax_paid", v.toJson());
                });
            }
            case SALARY_SLIP -> {
                Optional<BigDecimal> gross = ex.number(FieldNames.SALARY);
                Optional<BigDecimal> deductions = ex.number(FieldNames.DEDUCTIONS);
                if (gross.isPresent() && deductions.isPresent()) {
                    out.put("net_salary", gross.get().subtract(deductions.get()).max(BigDecimal.ZERO));
                }
            }
            case BANK_STATEMENT -> value(ex, FieldNames.INTEREST_INCOME).ifPresent(v -> out.put("interest_income", v.toJson()));
            case INVESTMENT_PROOF -> value(ex, FieldNames.ELIGIBLE_80C).ifPresent(v -> {
                out.put("investment_type", "ELSS");
                out.put("amount_invested", v.toJson());
                out.put("section", "80C");
            });
            case RENT_RECEIPT -> value(ex, FieldNames.DEDUCTIONS).ifPresent(v -> out.put("total_rent_paid", v.toJson()));
            case LOAN_STATEMENT -> value(ex, FieldNames.INTEREST_PAID)
                    .or(() -> value(ex, FieldNames.DEDUCTIONS))
                    .ifPresent(v -> out.put("interest_paid", v.toJson()));
            case MEDICAL_BILL -> value(ex, FieldNames.MEDICAL_EXPENSE)
                    .or(() -> value(ex, FieldNames.DEDUCTIONS))
                    .ifPresent(v -> out.put("amount_paid", v.toJson()));
            case CAPITAL_GAINS_REPORT -> {
                if (summary.income().signum() != 0) {
                    out.put("capital_gains", summary.income().subtract(summary.taxableIncome()).max(BigDecimal.ZERO));
                }
            }
            case BUSINESS_INCOME_DOCUMENT -> {
                BigDecimal income = summary.income();
                BigDecimal expenses = summary.deductions();
                if (income.signum() != 0) out.put("total_income", income);
                if (expenses.signum() != 0) out.put("total_expenses", expenses);
                if (income.signum() != 0) out.put("net_profit", income.subtract(expenses).max(BigDecimal.ZERO));
            }
        }
        return Collections.unmodifiableMap(out);
    }

    private static Optional<FieldValue> value(ExtractionResult ex, String name) {
        return ex.field(name).map(ExtractedField::value);
    }
}
