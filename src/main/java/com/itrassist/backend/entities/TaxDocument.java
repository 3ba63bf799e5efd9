package com.itrassist.backend.entities;

import java.time.LocalDateTime;
import java.util.Objects;
import java.util.UUID;

import com.itrassist.backend.enums.DocumentStatus;
import com.itrassist.backend.enums.DocumentType;

import lombok.Getter;
import lombok.Setter;

/**
 * An uploaded tax document and its extraction state.
 *
 * {@code extracted} is non-null exactly when {@code status == EXTRACTED}; only the transition
 * methods below change either of them.
 */
@Getter
public class TaxDocument {

    @Setter
    private UUID id;

    @Setter
    private String ownerId;

    @Setter
    private DocumentType declaredType;

    @Setter
    private String declaredTypeLabel;

    @Setter
    private String mimeType;

    @Setter
    private long byteSize;

    @Setter
    private String originalFileName;

    @Setter
    private LocalDateTime uploadedAt;

    private DocumentStatus status = DocumentStatus.PENDING;

    private ExtractionResult extracted;

    private String error;

    private LocalDateTime processedAt;

    public void markProcessing() {
        if (status.isTerminal()) {
            throw new IllegalStateException("Document " + id + " already " + status);
        }
        this.status = DocumentStatus.PROCESSING;
        this.extracted = null;
        this.error = null;
    }

    public void markExtracted(ExtractionResult result) {
        this.extracted = Objects.requireNonNull(result, "result");
        this.status = DocumentStatus.EXTRACTED;
        this.error = null;
        this.processedAt = LocalDateTime.now();
    }

    public void markFailed(String message) {
        this.status = DocumentStatus.ERROR;
        this.extracted = null;
        this.error = message;
        this.processedAt = LocalDateTime.now();
    }

    /**
     * Swaps in a corrected extraction. Only valid once extraction finished.
     */
    public void replaceExtraction(ExtractionResult result) {
        if (status != DocumentStatus.EXTRACTED) {
            throw new IllegalStateException("Document " + id + " has no extracted data (status " + status + ")");
        }
        this.extracted = Objects.requireNonNull(result, "result");
    }

    public boolean isExtracted() {
        return status == DocumentStatus.EXTRACTED;
    }

    /**
     * Shallow snapshot; the immutable {@link ExtractionResult} is shared.
     */
    public TaxDocument copy() {
        TaxDocument c = new TaxDocument();
        c.id = id;
        c.ownerId = ownerId;
        c.declaredType = declaredType;
        c.declaredTypeLabel = declaredTypeLabel;
        c.mimeType = mimeType;
        c.byteSize = byteSize;
        c.originalFileName = originalFileName;
        c.uploadedAt = uploadedAt;
        c.status = status;
        c.extracted = extracted;
        c.error = error;
        c.processedAt = processedAt;
        return c;
    }
}
