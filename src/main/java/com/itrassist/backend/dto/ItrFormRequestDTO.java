package com.itrassist.backend.dto;

import java.math.BigDecimal;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * Full replacement of an ITR form's editable sections. Missing amounts count as zero.
 */
public record ItrFormRequestDTO(
        @Valid @NotNull(message = "income is required") Income income,
        @Valid @NotNull(message = "deductions is required") Deductions deductions,
        @Valid @NotNull(message = "investments is required") Investments investments,
        @Valid @NotNull(message = "taxesPaid is required") TaxesPaid taxesPaid,
        String notes
) {

    public record Income(
            @PositiveOrZero BigDecimal salary,
            @PositiveOrZero BigDecimal interest,
            @PositiveOrZero BigDecimal rentalIncome,
            @PositiveOrZero BigDecimal otherIncome
    ) {
    }

    public record Deductions(
            @PositiveOrZero BigDecimal section80C,
            @PositiveOrZero BigDecimal section80D,
            @PositiveOrZero BigDecimal charitableDonations
    ) {
    }

    public record Investments(
            @PositiveOrZero BigDecimal ppf,
            @PositiveOrZero BigDecimal elss,
            @PositiveOrZero BigDecimal nps
    ) {
    }

    public record TaxesPaid(
            @PositiveOrZero BigDecimal tds,
            @PositiveOrZero BigDecimal advanceTax,
            @PositiveOrZero BigDecimal selfAssessmentTax
    ) {
    }
}
