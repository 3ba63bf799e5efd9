package com.itrassist.backend.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * {@code value} is a JSON number or string; blank values are rejected during correction validation.
 */
public record FieldCorrectionDTO(
        @NotBlank(message = "Field name is required") String name,
        Object value
) {
}
