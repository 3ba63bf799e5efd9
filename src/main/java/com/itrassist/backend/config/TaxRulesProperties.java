package com.itrassist.backend.config;

import java.math.BigDecimal;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Tax constants used by aggregation, reconciliation and ITR validation, prefix "itr.tax".
 *
 * The flat rate is a placeholder estimate, not a slab computation.
 */
@ConfigurationProperties(prefix = "itr.tax")
public record TaxRulesProperties(
        BigDecimal flatRate,
        BigDecimal section80cLimit,
        BigDecimal salaryTolerance,
        BigDecimal taxableIncomeTolerance,
        boolean blockSubmissionOnIssues
) {
    public TaxRulesProperties {
        if (flatRate == null) {
            flatRate = new BigDecimal("0.10");
        }
        if (section80cLimit == null) {
            section80cLimit = new BigDecimal("150000");
        }
        if (salaryTolerance == null) {
            salaryTolerance = new BigDecimal("0.02");
        }
        if (taxableIncomeTolerance == null) {
            taxableIncomeTolerance = new BigDecimal("0.05");
        }
    }

    public static TaxRulesProperties defaults() {
        return new TaxRulesProperties(null, null, null, null, false);
    }
}
