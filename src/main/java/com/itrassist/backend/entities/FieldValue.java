package com.itrassist.backend.entities;

import java.math.BigDecimal;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Value of an extracted field: either an amount or free text (PAN, employer name...).
 * Serialised as a bare JSON number or string.
 */
public final class FieldValue {

    private static final Pattern NUMERIC = Pattern.compile("-?\\d+(\\.\\d+)?");

    private final BigDecimal number;
    private final String text;

    private FieldValue(BigDecimal number, String text) {
        this.number = number;
        this.text = text;
    }

    public static FieldValue ofNumber(BigDecimal number) {
        return new FieldValue(Objects.requireNonNull(number, "number"), null);
    }

    public static FieldValue ofNumber(long number) {
        return ofNumber(BigDecimal.valueOf(number));
    }

    public static FieldValue ofText(String text) {
        return new FieldValue(null, text == null ? "" : text);
    }

    /**
     * Numeric-looking strings ("150000", " 12.5 ") become numbers, everything else stays text.
     */
    public static FieldValue parse(String raw) {
        if (raw == null) return ofText("");
        String trimmed = raw.trim();
        if (NUMERIC.matcher(trimmed).matches()) {
            return ofNumber(new BigDecimal(trimmed));
        }
        return ofText(raw);
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static FieldValue fromJson(Object raw) {
        if (raw instanceof BigDecimal decimal) return ofNumber(decimal);
        if (raw instanceof Number n) {
            double d = n.doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) return ofText(String.valueOf(n));
            return ofNumber(new BigDecimal(n.toString()));
        }
        return ofText(raw == null ? "" : String.valueOf(raw));
    }

    public boolean isNumeric() {
        return number != null;
    }

    public Optional<BigDecimal> asNumber() {
        return Optional.ofNullable(number);
    }

    /**
     * Text form of the value; amounts render without exponent.
     */
    public String asText() {
        return number != null ? number.toPlainString() : text;
    }

    public boolean isBlank() {
        return number == null && (text == null || text.isBlank());
    }

    @JsonValue
    public Object toJson() {
        return number != null ? number : text;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FieldValue other)) return false;
        if (number != null) {
            return other.number != null && number.compareTo(other.number) == 0;
        }
        return other.number == null && Objects.equals(text, other.text);
    }

    @Override
    public int hashCode() {
        return number != null ? number.stripTrailingZeros().hashCode() : Objects.hashCode(text);
    }

    @Override
    public String toString() {
        return asText();
    }
}
