package com.itrassist.backend.services.documents.vision;

import java.util.Optional;

import com.itrassist.backend.entities.ExtractionResult;
import com.itrassist.backend.enums.DocumentType;

public class DisabledVisionExtractionAdapter implements VisionExtractionAdapter {

    @Override
    public String name() {
        return "disabled";
    }

    @Override
    public Optional<ExtractionResult> extract(byte[] imageBytes, String mimeType, DocumentType declaredType, String declaredLabel) {
        return Optional.empty();
    }
}
