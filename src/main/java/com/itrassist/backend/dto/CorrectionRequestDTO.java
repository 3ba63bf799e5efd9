package com.itrassist.backend.dto;

import java.util.List;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;

public record CorrectionRequestDTO(
        @NotEmpty(message = "At least one field correction is required") List<@Valid FieldCorrectionDTO> fields
) {
}
