package com.itrassist.backend.services.documents.vision;

import java.util.Locale;
import java.util.Optional;

import com.itrassist.backend.entities.ExtractionResult;
import com.itrassist.backend.enums.DocumentType;

/**
 * Model-backed extraction for image uploads, used when there is no text layer to run rules on.
 *
 * Implementations never throw for backend problems: an empty result means "unavailable" (no backend
 * configured, non-image input, transport or parse failure) and the caller falls back to heuristics.
 */
public interface VisionExtractionAdapter {

    /**
     * Short backend name for logs.
     */
    String name();

    Optional<ExtractionResult> extract(byte[] imageBytes, String mimeType, DocumentType declaredType, String declaredLabel);

    static boolean isImage(String mimeType) {
        return mimeType != null && mimeType.trim().toLowerCase(Locale.ROOT).startsWith("image/");
    }
}
