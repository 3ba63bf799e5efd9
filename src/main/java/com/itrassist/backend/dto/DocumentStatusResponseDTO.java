package com.itrassist.backend.dto;

import java.time.LocalDateTime;
import java.util.UUID;

import com.itrassist.backend.enums.DocumentStatus;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class DocumentStatusResponseDTO {
    private UUID id;
    private DocumentStatus status;
    private String error;
    private LocalDateTime processedAt;
}
