package com.itrassist.backend.enums;

public enum ItrFormStatus {
    DRAFT,
    SUBMITTED
}
