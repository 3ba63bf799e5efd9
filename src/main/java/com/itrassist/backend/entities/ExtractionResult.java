package com.itrassist.backend.entities;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.itrassist.backend.enums.DocumentType;
import com.itrassist.backend.enums.ExtractionQuality;

import lombok.Builder;
import lombok.Getter;

/**
 * Immutable outcome of extracting one document. Corrections produce a new instance.
 *
 * Field names are not unique. Lookups fold case through {@link FieldNames#canonical(String)};
 * among same-named fields a user:manual one wins, otherwise the earliest extracted.
 */
@Getter
public final class ExtractionResult {

    private final DocumentType declaredType;
    private final String declaredTypeLabel;
    private final ExtractionQuality quality;
    private final List<ExtractedField> fields;
    private final ExtractionSummary summary;
    private final List<String> messages;

    @JsonIgnore
    @Getter(lombok.AccessLevel.NONE)
    private final Map<String, ExtractedField> index;

    @Builder(toBuilder = true)
    public ExtractionResult(DocumentType declaredType,
                            String declaredTypeLabel,
                            ExtractionQuality quality,
                            List<ExtractedField> fields,
                            ExtractionSummary summary,
                            List<String> messages) {
        this.declaredType = declaredType;
        this.declaredTypeLabel = declaredTypeLabel != null
                ? declaredTypeLabel
                : (declaredType != null ? declaredType.getLabel() : "");
        this.quality = Objects.requireNonNull(quality, "quality");
        this.fields = fields == null ? List.of() : List.copyOf(fields);
        this.summary = summary == null ? ExtractionSummary.EMPTY : summary;
        this.messages = messages == null ? List.of() : List.copyOf(messages);

        if (this.quality != ExtractionQuality.GOOD && this.messages.isEmpty()) {
            throw new IllegalArgumentException("quality " + this.quality + " requires at least one advisory message");
        }
        this.index = buildIndex(this.fields);
    }

    public Optional<ExtractedField> field(String name) {
        return Optional.ofNullable(index.get(FieldNames.canonical(name)));
    }

    /**
     * Amount of the named field; empty when absent or when the field holds text.
     */
    public Optional<BigDecimal> number(String name) {
        return field(name).flatMap(ExtractedField::numericValue);
    }

    public boolean hasField(String name) {
        return index.containsKey(FieldNames.canonical(name));
    }

    private static Map<String, ExtractedField> buildIndex(List<ExtractedField> fields) {
        Map<String, ExtractedField> out = new LinkedHashMap<>();
        for (ExtractedField field : fields) {
            String key = FieldNames.canonical(field.name());
            ExtractedField existing = out.get(key);
            if (existing == null || (field.isManual() && !existing.isManual())) {
                out.put(key, field);
            }
        }
        return Collections.unmodifiableMap(out);
    }
}
