package com.itrassist.backend.entities;

import java.math.BigDecimal;
import java.time.LocalDateTime;

import com.itrassist.backend.enums.ItrFormStatus;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Consolidated filer-level return, reviewed and submitted from the ITR review screen.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ItrForm {

    private String id;
    private String ownerId;

    @Builder.Default
    private Income income = new Income();

    @Builder.Default
    private Deductions deductions = new Deductions();

    @Builder.Default
    private Investments investments = new Investments();

    @Builder.Default
    private TaxesPaid taxesPaid = new TaxesPaid();

    private String notes;

    @Builder.Default
    private ItrFormStatus status = ItrFormStatus.DRAFT;

    private LocalDateTime updatedAt;
    private LocalDateTime submittedAt;

    public BigDecimal totalIncome() {
        return income == null ? BigDecimal.ZERO : income.total();
    }

    public BigDecimal totalDeductions() {
        return deductions == null ? BigDecimal.ZERO : deductions.total();
    }

    public ItrForm copy() {
        return toBuilder()
                .income(income == null ? null : income.toBuilder().build())
                .deductions(deductions == null ? null : deductions.toBuilder().build())
                .investments(investments == null ? null : investments.toBuilder().build())
                .taxesPaid(taxesPaid == null ? null : taxesPaid.toBuilder().build())
                .build();
    }

    @Data
    @Builder(toBuilder = true)
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Income {
        @Builder.Default
        private BigDecimal salary = BigDecimal.ZERO;
        @Builder.Default
        private BigDecimal interest = BigDecimal.ZERO;
        @Builder.Default
        private BigDecimal rentalIncome = BigDecimal.ZERO;
        @Builder.Default
        private BigDecimal otherIncome = BigDecimal.ZERO;

        public BigDecimal total() {
            return nz(salary).add(nz(interest)).add(nz(rentalIncome)).add(nz(otherIncome));
        }
    }

    @Data
    @Builder(toBuilder = true)
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Deductions {
        @Builder.Default
        private BigDecimal section80C = BigDecimal.ZERO;
        @Builder.Default
        private BigDecimal section80D = BigDecimal.ZERO;
        @Builder.Default
        private BigDecimal charitableDonations = BigDecimal.ZERO;

        public BigDecimal total() {
            return nz(section80C).add(nz(section80D)).add(nz(charitableDonations));
        }
    }

    @Data
    @Builder(toBuilder = true)
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Investments {
        @Builder.Default
        private BigDecimal ppf = BigDecimal.ZERO;
        @Builder.Default
        private BigDecimal elss = BigDecimal.ZERO;
        @Builder.Default
        private BigDecimal nps = BigDecimal.ZERO;
    }

    @Data
    @Builder(toBuilder = true)
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TaxesPaid {
        @Builder.Default
        private BigDecimal tds = BigDecimal.ZERO;
        @Builder.Default
        private BigDecimal advanceTax = BigDecimal.ZERO;
        @Builder.Default
        private BigDecimal selfAssessmentTax = BigDecimal.ZERO;
    }

    static BigDecimal nz(BigDecimal value) {
        return value == null ? BigDecimal.ZERO : value;
    }
}
