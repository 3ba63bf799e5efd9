package com.itrassist.backend.services.documents.vision;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Component;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.itrassist.backend.entities.ExtractedField;
import com.itrassist.backend.entities.ExtractionResult;
import com.itrassist.backend.entities.ExtractionSummary;
import com.itrassist.backend.entities.FieldValue;
import com.itrassist.backend.enums.DocumentType;
import com.itrassist.backend.enums.ExtractionQuality;
import com.itrassist.backend.enums.FieldSource;
import com.itrassist.backend.services.documents.extraction.ExtractionQualityEvaluator;

import lombok.extern.slf4j.Slf4j;

/**
 * Coerces whatever a vision model answered into a well-formed {@link ExtractionResult}.
 *
 * Expected shape: {@code {fields:[{name,value,confidence}], summary:{income,deductions,taxableIncome},
 * quality, messages:[]}}; every part is optional.
 */
@Slf4j
@Component
public class VisionResultNormalizer {

    static final double DEFAULT_CONFIDENCE = 0.7;

    public ExtractionResult normalize(JsonNode payload, DocumentType declaredType, String declaredLabel) {
        JsonNode root = payload == null ? MissingNode.getInstance() : payload;

        List<ExtractedField> fields = new ArrayList<>();
        JsonNode rawFields = root.path("fields");
        if (rawFields.isArray()) {
            for (JsonNode f : rawFields) {
                String name = f.path("name").asText("").trim();
                if (name.isEmpty()) {
                    log.debug("[VisionNormalizer] skipping unnamed field: {}", f);
                    continue;
                }
                fields.add(new ExtractedField(name, value(f.path("value")), confidence(f.path("confidence")), FieldSource.OCR_VISION));
            }
        }

        JsonNode summaryNode = root.path("summary");
        BigDecimal income = nonNegative(summaryNode.path("income"));
        BigDecimal deductions = nonNegative(summaryNode.path("deductions"));
        JsonNode taxableNode = summaryNode.path("taxableIncome");
        BigDecimal taxable = taxableNode.isMissingNode() || taxableNode.isNull()
                ? income.subtract(deductions).max(BigDecimal.ZERO)
                : nonNegative(taxableNode);

        ExtractionQuality quality = ExtractionQuality.fromExternal(root.path("quality").isTextual() ? root.path("quality").asText() : null);

        List<String> messages = new ArrayList<>();
        JsonNode rawMessages = root.path("messages");
        if (rawMessages.isArray()) {
            for (JsonNode m : rawMessages) {
                if (!m.isNull()) messages.add(m.asText());
            }
        }
        if (quality != ExtractionQuality.GOOD && messages.isEmpty()) {
            messages.add(ExtractionQualityEvaluator.ADVISORY_MESSAGE);
        }

        return ExtractionResult.builder()
                .declaredType(declaredType)
                .declaredTypeLabel(declaredLabel)
                .quality(quality)
                .fields(fields)
                .summary(new ExtractionSummary(income, deductions, taxable))
                .messages(messages)
                .build();
    }

    private static FieldValue value(JsonNode node) {
        if (node.isNumber()) {
            return FieldValue.ofNumber(node.decimalValue());
        }
        if (node.isMissingNode() || node.isNull()) {
            return FieldValue.ofText("");
        }
        FieldValue compact = FieldValue.parse(node.asText().replaceAll("[,\\s₹]", ""));
        return compact.isNumeric() ? compact : FieldValue.parse(node.asText());
    }

    private static double confidence(JsonNode node) {
        BigDecimal number = number(node);
        if (number == null) return DEFAULT_CONFIDENCE;
        return Math.max(0.0, Math.min(1.0, number.doubleValue()));
    }

    private static BigDecimal nonNegative(JsonNode node) {
        BigDecimal number = number(node);
        return number == null ? BigDecimal.ZERO : number.max(BigDecimal.ZERO);
    }

    /**
     * Numbers and numeric strings ("1,20,000") become a decimal; anything else is null.
     */
    private static BigDecimal number(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) return null;
        if (node.isNumber()) {
            double d = node.doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) return null;
            return node.decimalValue();
        }
        if (node.isTextual()) {
            String compact = node.asText().replaceAll("[,\\s₹]", "");
            if (compact.isEmpty()) return null;
            try {
                return new BigDecimal(compact);
            } catch (NumberFormatException e) {
                log.debug("[VisionNormalizer] not a number: '{}'", node.asText());
                return null;
            }
        }
        return null;
    }
}
