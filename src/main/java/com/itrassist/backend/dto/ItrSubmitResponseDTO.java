package com.itrassist.backend.dto;

import java.time.LocalDateTime;
import java.util.List;

import com.itrassist.backend.enums.ItrFormStatus;
import com.itrassist.backend.services.itr.ItrValidationIssue;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class ItrSubmitResponseDTO {
    private String id;
    private ItrFormStatus status;
    private String message;
    private LocalDateTime submittedAt;
    private List<ItrValidationIssue> issues;
    private ItrValidationResponseDTO.Totals totals;
}
