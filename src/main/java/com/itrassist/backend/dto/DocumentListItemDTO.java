package com.itrassist.backend.dto;

import java.time.LocalDateTime;
import java.util.UUID;

import com.itrassist.backend.enums.DocumentStatus;
import com.itrassist.backend.enums.DocumentType;
import com.itrassist.backend.enums.ExtractionQuality;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class DocumentListItemDTO {
    private UUID id;
    private String name;
    private String mimeType;
    private long size;
    private DocumentType docType;
    private String docTypeLabel;
    private DocumentStatus status;
    // null until extraction finished
    private ExtractionQuality quality;
    private String error;
    private LocalDateTime uploadedAt;
}
