package com.itrassist.backend.services.itr;

import java.math.BigDecimal;
import java.util.List;

public record ItrValidationResult(List<ItrValidationIssue> issues, BigDecimal totalIncome, BigDecimal totalDeductions) {

    public ItrValidationResult {
        issues = issues == null ? List.of() : List.copyOf(issues);
    }

    public boolean hasIssues() {
        return !issues.isEmpty();
    }
}
