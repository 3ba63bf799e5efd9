package com.itrassist.backend.entities;

import java.math.BigDecimal;

/**
 * Income / deductions / taxable income of a single document. Unknown values are zero.
 */
public record ExtractionSummary(
        BigDecimal income,
        BigDecimal deductions,
        BigDecimal taxableIncome
) {
    public static final ExtractionSummary EMPTY = new ExtractionSummary(BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO);

    public ExtractionSummary {
        if (income == null) {
            income = BigDecimal.ZERO;
        }
        if (deductions == null) {
            deductions = BigDecimal.ZERO;
        }
        if (taxableIncome == null) {
            taxableIncome = BigDecimal.ZERO;
        }
    }
}
