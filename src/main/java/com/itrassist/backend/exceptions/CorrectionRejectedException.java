package com.itrassist.backend.exceptions;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Manual corrections failed validation. Nothing from the batch was applied.
 */
public class CorrectionRejectedException extends RuntimeException {

    private final List<FieldViolation> violations;

    public CorrectionRejectedException(List<FieldViolation> violations) {
        super("Corrections rejected: " + describe(violations));
        this.violations = violations == null ? List.of() : List.copyOf(violations);
    }

    public List<FieldViolation> getViolations() {
        return violations;
    }

    private static String describe(List<FieldViolation> violations) {
        if (violations == null || violations.isEmpty()) return "no details";
        return violations.stream()
                .map(v -> v.field() + " (" + v.message() + ")")
                .collect(Collectors.joining(", "));
    }

    public record FieldViolation(String field, String message) {
    }
}
