package com.itrassist.backend.dto;

import java.time.LocalDateTime;
import java.util.UUID;

import com.itrassist.backend.enums.DocumentStatus;
import com.itrassist.backend.enums.DocumentType;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class DocumentUploadResponseDTO {
    private UUID id;
    private DocumentStatus status;
    private String name;
    private String mimeType;
    private long size;
    private DocumentType docType;
    private String docTypeLabel;
    private LocalDateTime uploadedAt;
}
