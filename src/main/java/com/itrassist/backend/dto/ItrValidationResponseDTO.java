package com.itrassist.backend.dto;

import java.math.BigDecimal;
import java.util.List;

import com.itrassist.backend.services.itr.ItrValidationIssue;

public record ItrValidationResponseDTO(List<ItrValidationIssue> issues, Totals totals) {

    public record Totals(BigDecimal totalIncome, BigDecimal totalDeductions) {
    }
}
