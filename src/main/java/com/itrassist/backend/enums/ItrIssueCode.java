package com.itrassist.backend.enums;

public enum ItrIssueCode {
    LIMIT_80C,
    TDS_GT_INCOME,
    DEDUCTIONS_GT_INCOME
}
