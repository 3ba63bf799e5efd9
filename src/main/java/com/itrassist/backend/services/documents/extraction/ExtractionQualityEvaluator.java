package com.itrassist.backend.services.documents.extraction;

import java.util.List;

import org.springframework.stereotype.Component;

import com.itrassist.backend.config.ExtractionProperties;
import com.itrassist.backend.entities.ExtractedField;
import com.itrassist.backend.entities.ExtractionResult;
import com.itrassist.backend.entities.FieldNames;
import com.itrassist.backend.enums.ExtractionQuality;

import lombok.extern.slf4j.Slf4j;

/**
 * Grades a heuristic extraction from the source text length and the critical signals found.
 */
@Slf4j
@Component
public class ExtractionQualityEvaluator {

    public static final String ADVISORY_MESSAGE =
            "We were unable to extract all necessary details accurately from this document. "
                    + "Please either upload a clearer / higher quality version or enter the details manually.";

    private final ExtractionProperties properties;

    public ExtractionQualityEvaluator(ExtractionProperties properties) {
        this.properties = properties;
    }

    /**
     * @param rawText text the fields were extracted from
     * @param fields  extracted fields, in extraction order
     */
    public ExtractionQuality evaluate(String rawText, List<ExtractedField> fields) {
        int textLength = rawText == null ? 0 : rawText.trim().length();
        if (textLength < properties.getMinReadableTextLength()) {
            log.debug("[QualityEvaluator] text too short: {} chars", textLength);
            return ExtractionQuality.UNREADABLE;
        }

        ExtractionResult lookup = ExtractionResult.builder()
                .quality(ExtractionQuality.GOOD)
                .fields(fields)
                .build();

        int signals = 0;
        if (lookup.hasField(FieldNames.PAN)) {
            signals++;
            log.debug("[QualityEvaluator] ✓ PAN found");
        }
        if (SummaryDeriver.hasAmount(lookup, FieldNames.SALARY)
                || SummaryDeriver.hasAmount(lookup, FieldNames.REPORTED_INCOME)) {
            signals++;
            log.debug("[QualityEvaluator] ✓ income amount found");
        }
        if (SummaryDeriver.hasAmount(lookup, FieldNames.TDS)) {
            signals++;
            log.debug("[QualityEvaluator] ✓ TDS found");
        }

        ExtractionQuality quality = signals < properties.getMinCriticalSignals()
                ? ExtractionQuality.LOW
                : ExtractionQuality.GOOD;

        log.debug("[QualityEvaluator] verdict={} (signals={}, text={} chars)", quality, signals, textLength);
        return quality;
    }
}
