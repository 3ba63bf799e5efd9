package com.itrassist.backend.enums;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ExtractionQuality {
    GOOD,
    LOW,
    UNREADABLE;

    @JsonValue
    public String getCode() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Coerces a verdict reported by an external extractor. Anything unrecognised counts as good.
     */
    public static ExtractionQuality fromExternal(String raw) {
        if (raw == null) return GOOD;
        String value = raw.trim().toLowerCase(Locale.ROOT);
        if ("unreadable".equals(value)) return UNREADABLE;
        if ("low".equals(value)) return LOW;
        return GOOD;
    }
}
