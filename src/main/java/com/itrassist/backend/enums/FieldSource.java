package com.itrassist.backend.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Provenance tag of an extracted field.
 */
public enum FieldSource {
    RULE_REGEX("rule:regex"),
    RULE_LINE("rule:line"),
    OCR_VISION("ocr:vision"),
    USER_MANUAL("user:manual");

    private final String tag;

    FieldSource(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String getTag() {
        return tag;
    }
}
