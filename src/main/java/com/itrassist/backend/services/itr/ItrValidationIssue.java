package com.itrassist.backend.services.itr;

import com.itrassist.backend.enums.ItrIssueCode;

public record ItrValidationIssue(String field, ItrIssueCode code, String message) {
}
