package com.itrassist.backend.entities;

import java.util.Locale;

/**
 * Well-known field labels and the single case-folding rule used for every name comparison.
 */
public final class FieldNames {

    public static final String PAN = "PAN";
    public static final String EMPLOYER = "Employer";
    public static final String SALARY = "Salary";
    public static final String TAXABLE_INCOME = "Taxable Income";
    public static final String TDS = "TDS";
    public static final String DEDUCTIONS = "Deductions";
    public static final String REPORTED_INCOME = "Reported Income";
    public static final String ELIGIBLE_80C = "Eligible 80C";
    public static final String INTEREST_INCOME = "Interest Income";
    public static final String INTEREST_PAID = "Interest Paid";
    public static final String MEDICAL_EXPENSE = "Medical Expense";
    public static final String CAPITAL_GAINS = "Capital Gains";
    public static final String BUSINESS_INCOME = "Business Income";

    private FieldNames() {}

    /**
     * "  taxable   INCOME " and "Taxable Income" fold to the same key.
     */
    public static String canonical(String name) {
        if (name == null) return "";
        return name.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }

    public static boolean sameName(String a, String b) {
        return canonical(a).equals(canonical(b));
    }
}
