package com.itrassist.backend.services.aggregate;

import java.math.BigDecimal;

/**
 * Filer-level totals over all extracted documents. Derived on every read, never stored.
 */
public record FilerAggregate(
        BigDecimal totalSalary,
        BigDecimal totalDeductions,
        BigDecimal taxableIncome,
        BigDecimal totalTDS,
        BigDecimal estimatedTax,
        BigDecimal refund,
        BigDecimal taxPayable,
        BigDecimal totalInvestments,
        BigDecimal totalInterest,
        int documentsCounted
) {
}
