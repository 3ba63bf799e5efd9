package com.itrassist.backend.services.itr;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Component;

import com.itrassist.backend.config.TaxRulesProperties;
import com.itrassist.backend.entities.ItrForm;
import com.itrassist.backend.enums.ItrIssueCode;
import com.itrassist.backend.services.AmountFormats;

/**
 * Advisory checks on a consolidated ITR form. Reads the form only; calling it twice gives the same answer.
 */
@Component
public class ItrValidationEngine {

    private final TaxRulesProperties taxRules;

    public ItrValidationEngine(TaxRulesProperties taxRules) {
        this.taxRules = taxRules;
    }

    public ItrValidationResult validate(ItrForm form) {
        BigDecimal totalIncome = form.totalIncome();
        BigDecimal totalDeductions = form.totalDeductions();
        List<ItrValidationIssue> issues = new ArrayList<>();

        BigDecimal section80C = form.getDeductions() == null ? BigDecimal.ZERO : nz(form.getDeductions().getSection80C());
        BigDecimal tds = form.getTaxesPaid() == null ? BigDecimal.ZERO : nz(form.getTaxesPaid().getTds());

        if (section80C.compareTo(taxRules.section80cLimit()) > 0) {
            issues.add(new ItrValidationIssue("deductions.section80C", ItrIssueCode.LIMIT_80C,
                    "Section 80C exceeds limit (" + AmountFormats.indian(taxRules.section80cLimit()) + ")."));
        }
        if (tds.compareTo(totalIncome) > 0) {
            issues.add(new ItrValidationIssue("taxesPaid.tds", ItrIssueCode.TDS_GT_INCOME,
                    "TDS cannot exceed total income."));
        }
        if (totalDeductions.compareTo(totalIncome) > 0) {
            issues.add(new ItrValidationIssue("deductions.section80C", ItrIssueCode.DEDUCTIONS_GT_INCOME,
                    "Total deductions exceed total income."));
        }

        return new ItrValidationResult(issues, totalIncome, totalDeductions);
    }

    private static BigDecimal nz(BigDecimal value) {
        return value == null ? BigDecimal.ZERO : value;
    }
}
