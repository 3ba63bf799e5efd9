package com.itrassist.backend.services.documents.corrections;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import org.springframework.stereotype.Component;

import com.itrassist.backend.entities.ExtractionResult;
import com.itrassist.backend.entities.FieldNames;
import com.itrassist.backend.enums.DocumentType;

/**
 * Fields a filer may enter by hand for each document type, with their kind and whether they are required.
 *
 * {@code knownOwnerFields} holds canonical names already known for the filer (from the Form 16, or the
 * first extracted document); identity fields already known there are not asked for again.
 */
@Component
public class ManualFieldCatalog {

    public enum FieldKind {
        TEXT,
        NUMBER
    }

    public record ManualFieldDefinition(String label, String name, FieldKind kind, boolean required) {
    }

    public List<ManualFieldDefinition> definitionsFor(DocumentType type, Set<String> knownOwnerFields) {
        Set<String> known = knownOwnerFields == null ? Set.of() : knownOwnerFields;
        List<ManualFieldDefinition> defs = new ArrayList<>();
        if (type == null) return defs;

        switch (type) {
            case FORM_16 -> {
                defs.add(text("PAN", FieldNames.PAN, true));
                defs.add(text("Employer", FieldNames.EMPLOYER, true));
                defs.add(number("Gross Salary", FieldNames.SALARY, true));
                defs.add(number("TDS Deducted", FieldNames.TDS, false));
                defs.add(number("Deductions (80C/80D etc)", FieldNames.DEDUCTIONS, false));
                defs.add(number("Taxable Income", FieldNames.TAXABLE_INCOME, false));
            }
            case ANNUAL_TAX_STATEMENT -> {
                if (!isKnown(known, FieldNames.PAN)) defs.add(text("PAN", FieldNames.PAN, true));
                defs.add(number("TDS", FieldNames.TDS, false));
                defs.add(number("Taxable Income", FieldNames.TAXABLE_INCOME, false));
            }
            case SALARY_SLIP -> {
                if (!isKnown(known, FieldNames.PAN)) defs.add(text("PAN", FieldNames.PAN, false));
                if (!isKnown(known, FieldNames.EMPLOYER)) defs.add(text("Employer", FieldNames.EMPLOYER, false));
                defs.add(number("Basic Salary", "Basic Salary", false));
                defs.add(number("HRA", "HRA", false));
                defs.add(number("Conveyance Allowance", "Conveyance Allowance", false));
                defs.add(number("Other Allowances", "Other Allowances", false));
                defs.add(number("Gross Salary", FieldNames.SALARY, true));
                defs.add(number("Deductions", FieldNames.DEDUCTIONS, false));
                defs.add(number("Net Salary", "Net Salary", false));
            }
            case BANK_STATEMENT -> defs.add(number("Interest Income", FieldNames.INTEREST_INCOME, true));
            case INVESTMENT_PROOF -> defs.add(number("Amount Invested (80C)", FieldNames.ELIGIBLE_80C, true));
            case RENT_RECEIPT -> defs.add(number("Total Rent Paid", FieldNames.DEDUCTIONS, true));
            case LOAN_STATEMENT -> defs.add(number("Interest Paid", FieldNames.INTEREST_PAID, true));
            case MEDICAL_BILL -> defs.add(number("Medical Expense", FieldNames.MEDICAL_EXPENSE, true));
            case CAPITAL_GAINS_REPORT -> {
                defs.add(number("Capital Gains", FieldNames.CAPITAL_GAINS, false));
                defs.add(number("Taxable Income", FieldNames.TAXABLE_INCOME, false));
            }
            case BUSINESS_INCOME_DOCUMENT -> {
                defs.add(number("Business Income", FieldNames.BUSINESS_INCOME, true));
                defs.add(number("Expenses", FieldNames.DEDUCTIONS, false));
            }
        }
        return defs;
    }

    /**
     * Names of required fields that the extraction lacks or holds blank; non-empty means "needs review".
     */
    public List<String> missingRequiredFields(ExtractionResult extraction, Set<String> knownOwnerFields) {
        if (extraction == null) return List.of();
        return definitionsFor(extraction.getDeclaredType(), knownOwnerFields).stream()
                .filter(ManualFieldDefinition::required)
                .filter(def -> extraction.field(def.name()).map(f -> f.value().isBlank()).orElse(true))
                .map(ManualFieldDefinition::name)
                .collect(Collectors.toList());
    }

    private static boolean isKnown(Set<String> known, String name) {
        return known.contains(FieldNames.canonical(name));
    }

    private static ManualFieldDefinition text(String label, String name, boolean required) {
        return new ManualFieldDefinition(label, name, FieldKind.TEXT, required);
    }

    private static ManualFieldDefinition number(String label, String name, boolean required) {
        return new ManualFieldDefinition(label, name, FieldKind.NUMBER, required);
    }
}
