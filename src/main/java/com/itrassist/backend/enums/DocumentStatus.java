package com.itrassist.backend.enums;

public enum DocumentStatus {
    PENDING,
    PROCESSING,
    EXTRACTED,
    ERROR;

    public boolean isTerminal() {
        return this == EXTRACTED || this == ERROR;
    }
}
