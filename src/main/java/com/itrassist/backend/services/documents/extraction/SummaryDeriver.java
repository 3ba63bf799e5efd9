package com.itrassist.backend.services.documents.extraction;

import java.math.BigDecimal;

import com.itrassist.backend.entities.ExtractedField;
import com.itrassist.backend.entities.ExtractionResult;
import com.itrassist.backend.entities.ExtractionSummary;
import com.itrassist.backend.entities.FieldNames;

/**
 * Income / deductions / taxable income precedence shared by heuristic extraction and manual
 * corrections:
 * income = Salary, else Reported Income;
 * deductions = Deductions, else Eligible 80C;
 * taxable = Taxable Income, else max(0, income - deductions).
 */
public final class SummaryDeriver {

    private SummaryDeriver() {}

    /**
     * @param fallback used for income and deductions when neither source field holds a number
     */
    public static ExtractionSummary derive(ExtractionResult fields, ExtractionSummary fallback) {
        ExtractionSummary base = fallback == null ? ExtractionSummary.EMPTY : fallback;

        BigDecimal income = fields.number(FieldNames.SALARY)
                .or(() -> fields.number(FieldNames.REPORTED_INCOME))
                .orElse(base.income());

        BigDecimal deductions = fields.number(FieldNames.DEDUCTIONS)
                .or(() -> fields.number(FieldNames.ELIGIBLE_80C))
                .orElse(base.deductions());

        BigDecimal taxable = fields.number(FieldNames.TAXABLE_INCOME)
                .orElseGet(() -> income.subtract(deductions).max(BigDecimal.ZERO));

        return new ExtractionSummary(income, deductions, taxable);
    }

    /**
     * True when the named field exists and holds an amount.
     */
    static boolean hasAmount(ExtractionResult fields, String name) {
        return fields.field(name).map(ExtractedField::value).map(v -> v.isNumeric()).orElse(false);
    }
}
