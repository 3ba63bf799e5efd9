package com.itrassist.backend.enums;

public enum FindingType {
    SALARY_MISMATCH,
    TAXABLE_INCOME_MISMATCH
}
