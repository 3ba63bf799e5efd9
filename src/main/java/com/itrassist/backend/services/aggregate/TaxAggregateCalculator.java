package com.itrassist.backend.services.aggregate;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Component;

import com.itrassist.backend.config.TaxRulesProperties;
import com.itrassist.backend.entities.ExtractionResult;
import com.itrassist.backend.entities.FieldNames;
import com.itrassist.backend.entities.TaxDocument;
import com.itrassist.backend.services.documents.extraction.AmountParser;
import com.itrassist.backend.services.documents.summary.KeySummaryProjector;

import lombok.extern.slf4j.Slf4j;

/**
 * Sums key-summary figures and TDS over a filer's extracted documents and estimates the tax at a
 * flat rate. Documents still processing or failed contribute nothing.
 */
@Slf4j
@Component
public class TaxAggregateCalculator {

    private final KeySummaryProjector keySummaryProjector;
    private final TaxRulesProperties taxRules;

    public TaxAggregateCalculator(KeySummaryProjector keySummaryProjector, TaxRulesProperties taxRules) {
        this.keySummaryProjector = keySummaryProjector;
        this.taxRules = taxRules;
    }

    public FilerAggregate aggregate(List<TaxDocument> documents) {
        BigDecimal totalSalary = BigDecimal.ZERO;
        BigDecimal taxableIncome = BigDecimal.ZERO;
        BigDecimal totalDeductions = BigDecimal.ZERO;
        BigDecimal totalTds = BigDecimal.ZERO;
        BigDecimal totalInvestments = BigDecimal.ZERO;
        BigDecimal totalInterest = BigDecimal.ZERO;
        int counted = 0;

        for (TaxDocument document : documents == null ? List.<TaxDocument>of() : documents) {
            if (!document.isExtracted() || document.getExtracted() == null) continue;
            ExtractionResult ex = document.getExtracted();
            Map<String, BigDecimal> keys = keySummaryProjector.project(ex);

            totalSalary = totalSalary.add(key(keys, KeySummaryProjector.SALARY));
            taxableIncome = taxableIncome.add(key(keys, KeySummaryProjector.TAXABLE_INCOME));
            totalDeductions = totalDeductions
                    .add(key(keys, KeySummaryProjector.DEDUCTIONS))
                    .add(key(keys, KeySummaryProjector.ELIGIBLE_80C_EST));

            totalTds = totalTds.add(ex.number(FieldNames.TDS).orElse(BigDecimal.ZERO));
            totalInvestments = totalInvestments.add(ex.number(FieldNames.ELIGIBLE_80C).orElse(BigDecimal.ZERO));
            totalInterest = totalInterest.add(ex.number(FieldNames.INTEREST_INCOME).orElse(BigDecimal.ZERO));
            counted++;
        }

        BigDecimal estimatedTax = AmountParser.roundWhole(taxableIncome.max(BigDecimal.ZERO).multiply(taxRules.flatRate()))
                .max(BigDecimal.ZERO);
        BigDecimal refund = totalTds.subtract(estimatedTax).max(BigDecimal.ZERO);
        BigDecimal payable = estimatedTax.subtract(totalTds).max(BigDecimal.ZERO);

        log.debug("[TaxAggregate] documents={} taxable={} tax={} tds={}", counted, taxableIncome, estimatedTax, totalTds);

        return new FilerAggregate(totalSalary, totalDeductions, taxableIncome, totalTds, estimatedTax, refund, payable,
                totalInvestments, totalInterest, counted);
    }

    private static BigDecimal key(Map<String, BigDecimal> keys, String name) {
        return keys.getOrDefault(name, BigDecimal.ZERO);
    }
}
