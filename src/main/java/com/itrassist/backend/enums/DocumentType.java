package com.itrassist.backend.enums;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Document category chosen by the filer at upload time. Never inferred from content.
 */
public enum DocumentType {

    FORM_16("Form 16", "form\\s*16"),
    ANNUAL_TAX_STATEMENT("Form 26AS/AIS", "26as|\\bais\\b|annual\\s*tax\\s*statement"),
    SALARY_SLIP("Salary Slip", "salary\\s*slip|pay\\s*slip"),
    BANK_STATEMENT("Bank Statement", "bank"),
    INVESTMENT_PROOF("Investment Proof", "investment"),
    RENT_RECEIPT("Rent Receipt", "\\brent\\b"),
    LOAN_STATEMENT("Loan Statement", "loan"),
    MEDICAL_BILL("Medical Bill", "medical"),
    CAPITAL_GAINS_REPORT("Capital Gains Report", "capital\\s*gains?"),
    BUSINESS_INCOME_DOCUMENT("Business Income Document", "business");

    private final String label;
    private final Pattern labelPattern;

    DocumentType(String label, String labelRegex) {
        this.label = label;
        this.labelPattern = Pattern.compile(labelRegex, Pattern.CASE_INSENSITIVE);
    }

    public String getLabel() {
        return label;
    }

    /**
     * Resolves a user-supplied label ("Form 16", "form16", "FORM_16", "26AS") to a type.
     * Returns null when nothing matches; callers then run only the type-independent rules.
     */
    public static DocumentType fromLabel(String raw) {
        if (raw == null || raw.isBlank()) return null;
        String value = raw.trim();

        for (DocumentType type : values()) {
            if (type.name().equalsIgnoreCase(value) || type.label.equalsIgnoreCase(value)) {
                return type;
            }
        }

        String spaced = value.replace('_', ' ').toLowerCase(Locale.ROOT);
        for (DocumentType type : values()) {
            if (type.labelPattern.matcher(spaced).find()) {
                return type;
            }
        }
        return null;
    }
}
