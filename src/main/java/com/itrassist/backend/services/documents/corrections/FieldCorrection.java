package com.itrassist.backend.services.documents.corrections;

import java.util.Set;
import java.util.regex.Pattern;

import com.itrassist.backend.entities.FieldNames;
import com.itrassist.backend.entities.FieldValue;

/**
 * One user-entered override. Values are coerced on construction: amount-looking input
 * ("1,20,000", "₹ 5000") becomes a number unless the field holds text by nature (PAN, Employer).
 */
public record FieldCorrection(String name, FieldValue value) {

    private static final Set<String> TEXT_FIELDS = Set.of(
            FieldNames.canonical(FieldNames.PAN),
            FieldNames.canonical(FieldNames.EMPLOYER)
    );

    private static final Pattern AMOUNT_NOISE = Pattern.compile("[,\\s₹]");

    public FieldCorrection {
        name = name == null ? "" : name.trim();
        value = value == null ? FieldValue.ofText("") : value;
    }

    public static FieldCorrection of(String name, Object rawValue) {
        return new FieldCorrection(name, coerce(name, rawValue));
    }

    public static boolean isTextField(String name) {
        return TEXT_FIELDS.contains(FieldNames.canonical(name));
    }

    static FieldValue coerce(String name, Object rawValue) {
        FieldValue value = FieldValue.fromJson(rawValue);
        if (isTextField(name)) {
            return value.isNumeric() ? FieldValue.ofText(value.asText()) : FieldValue.ofText(value.asText().trim());
        }
        if (value.isNumeric()) {
            return value;
        }
        String compact = AMOUNT_NOISE.matcher(value.asText()).replaceAll("");
        FieldValue parsed = FieldValue.parse(compact);
        return parsed.isNumeric() ? parsed : value;
    }
}
