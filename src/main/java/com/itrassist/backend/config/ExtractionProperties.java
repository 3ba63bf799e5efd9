package com.itrassist.backend.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import org.springframework.boot.context.properties.ConfigurationProperties;

import lombok.Data;

/**
 * Upload and heuristic-extraction settings, prefix "itr.extraction".
 *
 * Example:
 * itr.extraction.min-readable-text-length=20
 * itr.extraction.min-critical-signals=2
 * itr.extraction.max-upload-bytes=10485760
 */
@Data
@ConfigurationProperties(prefix = "itr.extraction")
public class ExtractionProperties {

    /**
     * Trimmed source text shorter than this is considered unreadable.
     */
    private int minReadableTextLength = 20;

    /**
     * How many of {PAN, income amount, TDS} must be found for a "good" verdict.
     */
    private int minCriticalSignals = 2;

    /**
     * Largest accepted upload, in bytes.
     */
    private long maxUploadBytes = 10L * 1024 * 1024;

    private List<String> allowedMimeTypes = new ArrayList<>(List.of(
            "application/pdf",
            "image/jpeg",
            "image/png",
            "image/webp",
            "text/plain",
            "text/html"
    ));

    public boolean isAllowedMimeType(String mimeType) {
        if (mimeType == null || mimeType.isBlank() || allowedMimeTypes == null) return false;
        String base = baseMimeType(mimeType);
        return allowedMimeTypes.stream()
                .anyMatch(allowed -> allowed != null && allowed.trim().equalsIgnoreCase(base));
    }

    /**
     * "text/html; charset=UTF-8" becomes "text/html".
     */
    public static String baseMimeType(String mimeType) {
        if (mimeType == null) return "";
        int semicolon = mimeType.indexOf(';');
        String base = semicolon >= 0 ? mimeType.substring(0, semicolon) : mimeType;
        return base.trim().toLowerCase(Locale.ROOT);
    }
}
