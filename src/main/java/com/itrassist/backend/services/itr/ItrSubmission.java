package com.itrassist.backend.services.itr;

import com.itrassist.backend.entities.ItrForm;

public record ItrSubmission(ItrForm form, ItrValidationResult validation, String message) {
}
