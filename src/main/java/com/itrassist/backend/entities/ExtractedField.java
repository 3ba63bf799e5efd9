package com.itrassist.backend.entities;

import java.math.BigDecimal;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.itrassist.backend.enums.FieldSource;

public record ExtractedField(
        String name,
        FieldValue value,
        double confidence,
        FieldSource source
) {
    public ExtractedField {
        if (name == null) {
            name = "";
        }
        if (value == null) {
            value = FieldValue.ofText("");
        }
        if (source == null) {
            source = FieldSource.RULE_REGEX;
        }
        if (source == FieldSource.USER_MANUAL) {
            confidence = 1.0;
        } else if (Double.isNaN(confidence)) {
            confidence = 0.0;
        } else {
            confidence = Math.max(0.0, Math.min(1.0, confidence));
        }
    }

    public static ExtractedField manual(String name, FieldValue value) {
        return new ExtractedField(name, value, 1.0, FieldSource.USER_MANUAL);
    }

    public Optional<BigDecimal> numericValue() {
        return value.asNumber();
    }

    @JsonIgnore
    public boolean isManual() {
        return source == FieldSource.USER_MANUAL;
    }
}
