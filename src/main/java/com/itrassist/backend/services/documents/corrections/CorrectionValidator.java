package com.itrassist.backend.services.documents.corrections;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.springframework.stereotype.Component;

import com.itrassist.backend.config.TaxRulesProperties;
import com.itrassist.backend.entities.ExtractedField;
import com.itrassist.backend.entities.ExtractionResult;
import com.itrassist.backend.entities.FieldNames;
import com.itrassist.backend.entities.FieldValue;
import com.itrassist.backend.exceptions.CorrectionRejectedException;
import com.itrassist.backend.exceptions.CorrectionRejectedException.FieldViolation;
import com.itrassist.backend.services.AmountFormats;
import com.itrassist.backend.services.documents.corrections.ManualFieldCatalog.FieldKind;
import com.itrassist.backend.services.documents.corrections.ManualFieldCatalog.ManualFieldDefinition;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Checks a batch of manual corrections against the document as it would look after merging.
 * The batch is rejected as a whole when any field fails.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CorrectionValidator {

    static final String REQUIRED = "Required";
    static final String INVALID_NUMBER = "Enter a valid number";

    private static final Set<String> NUMERIC_FIELDS = Set.of(
            FieldNames.canonical(FieldNames.SALARY),
            FieldNames.canonical(FieldNames.TAXABLE_INCOME),
            FieldNames.canonical(FieldNames.TDS),
            FieldNames.canonical(FieldNames.DEDUCTIONS),
            FieldNames.canonical(FieldNames.REPORTED_INCOME),
            FieldNames.canonical(FieldNames.ELIGIBLE_80C),
            FieldNames.canonical(FieldNames.INTEREST_INCOME),
            FieldNames.canonical(FieldNames.INTEREST_PAID),
            FieldNames.canonical(FieldNames.MEDICAL_EXPENSE),
            FieldNames.canonical(FieldNames.CAPITAL_GAINS),
            FieldNames.canonical(FieldNames.BUSINESS_INCOME)
    );

    private final ManualFieldCatalog catalog;
    private final TaxRulesProperties taxRules;

    public void validate(ExtractionResult current, List<FieldCorrection> corrections, Set<String> knownOwnerFields) {
        List<FieldViolation> violations = new ArrayList<>();
        List<ManualFieldDefinition> defs = catalog.definitionsFor(current.getDeclaredType(), knownOwnerFields);

        Map<String, FieldCorrection> submitted = new LinkedHashMap<>();
        for (FieldCorrection c : corrections == null ? List.<FieldCorrection>of() : corrections) {
            if (c.name().isEmpty()) {
                violations.add(new FieldViolation("name", "Field name is required"));
                continue;
            }
            submitted.put(FieldNames.canonical(c.name()), c);
        }

        if (submitted.isEmpty() && violations.isEmpty()) {
            violations.add(new FieldViolation("fields", "At least one field correction is required"));
        }

        for (FieldCorrection c : submitted.values()) {
            if (c.value().isBlank()) {
                violations.add(new FieldViolation(c.name(), REQUIRED));
                continue;
            }
            if (isNumericField(c.name(), defs)) {
                Optional<BigDecimal> n = c.value().asNumber();
                if (n.isEmpty() || n.get().signum() < 0) {
                    violations.add(new FieldViolation(c.name(), INVALID_NUMBER));
                }
            }
        }

        for (ManualFieldDefinition def : defs) {
            if (!def.required()) continue;
            String key = FieldNames.canonical(def.name());
            if (submitted.containsKey(key)) continue;
            boolean present = current.field(def.name()).map(f -> !f.value().isBlank()).orElse(false);
            if (!present) {
                violations.add(new FieldViolation(def.name(), REQUIRED));
            }
        }

        if (violations.isEmpty()) {
            crossFieldChecks(current, submitted, violations);
        }

        if (!violations.isEmpty()) {
            log.info("[CorrectionValidator] rejected {} correction(s): {} violation(s)", submitted.size(), violations.size());
            throw new CorrectionRejectedException(violations);
        }
    }

    private void crossFieldChecks(ExtractionResult current, Map<String, FieldCorrection> submitted, List<FieldViolation> violations) {
        String eligible80c = FieldNames.canonical(FieldNames.ELIGIBLE_80C);
        if (submitted.containsKey(eligible80c)) {
            BigDecimal amount = submitted.get(eligible80c).value().asNumber().orElse(BigDecimal.ZERO);
            if (amount.compareTo(taxRules.section80cLimit()) > 0) {
                violations.add(new FieldViolation(submitted.get(eligible80c).name(),
                        "Cannot exceed " + AmountFormats.indian(taxRules.section80cLimit()) + " under 80C"));
            }
        }

        Optional<BigDecimal> salary = merged(current, submitted, FieldNames.SALARY);
        if (salary.isEmpty()) return;

        for (String capped : List.of(FieldNames.TDS, FieldNames.TAXABLE_INCOME)) {
            boolean touched = submitted.containsKey(FieldNames.canonical(capped))
                    || submitted.containsKey(FieldNames.canonical(FieldNames.SALARY));
            if (!touched) continue;
            Optional<BigDecimal> value = merged(current, submitted, capped);
            if (value.isPresent() && value.get().compareTo(salary.get()) > 0) {
                violations.add(new FieldViolation(capped, capped + " cannot exceed Salary"));
            }
        }
    }

    private static Optional<BigDecimal> merged(ExtractionResult current, Map<String, FieldCorrection> submitted, String name) {
        FieldCorrection c = submitted.get(FieldNames.canonical(name));
        if (c != null) return c.value().asNumber();
        return current.field(name).map(ExtractedField::value).flatMap(FieldValue::asNumber);
    }

    private static boolean isNumericField(String name, List<ManualFieldDefinition> defs) {
        if (FieldCorrection.isTextField(name)) return false;
        for (ManualFieldDefinition def : defs) {
            if (FieldNames.sameName(def.name(), name)) {
                return def.kind() == FieldKind.NUMBER;
            }
        }
        return NUMERIC_FIELDS.contains(FieldNames.canonical(name));
    }
}
