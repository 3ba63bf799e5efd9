package com.itrassist.backend.services.documents.corrections;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import org.springframework.stereotype.Component;

import com.itrassist.backend.entities.ExtractedField;
import com.itrassist.backend.entities.ExtractionResult;
import com.itrassist.backend.entities.FieldNames;
import com.itrassist.backend.enums.ExtractionQuality;
import com.itrassist.backend.services.documents.extraction.SummaryDeriver;

/**
 * Folds manual corrections into an extraction. Pure: returns a new result, and applying the same
 * corrections again yields the same result.
 */
@Component
public class CorrectionMerger {

    private static final Pattern UNABLE_TO_EXTRACT = Pattern.compile("unable to extract", Pattern.CASE_INSENSITIVE);

    public ExtractionResult merge(ExtractionResult current, List<FieldCorrection> corrections) {
        List<ExtractedField> fields = new ArrayList<>(current.getFields());

        for (FieldCorrection c : corrections) {
            ExtractedField replacement = ExtractedField.manual(c.name(), c.value());
            int idx = indexOf(fields, c.name());
            if (idx >= 0) {
                fields.set(idx, replacement);
            } else {
                fields.add(replacement);
            }
        }

        List<String> messages = current.getMessages().stream()
                .filter(m -> !UNABLE_TO_EXTRACT.matcher(m).find())
                .collect(Collectors.toList());

        ExtractionResult merged = current.toBuilder()
                .quality(ExtractionQuality.GOOD)
                .fields(fields)
                .messages(messages)
                .build();

        return merged.toBuilder()
                .summary(SummaryDeriver.derive(merged, current.getSummary()))
                .build();
    }

    private static int indexOf(List<ExtractedField> fields, String name) {
        for (int i = 0; i < fields.size(); i++) {
            if (FieldNames.sameName(fields.get(i).name(), name)) return i;
        }
        return -1;
    }
}
