package com.itrassist.backend.enums;

public enum ItrFormType {
    ITR_1("ITR-1 (Sahaj)"),
    ITR_2("ITR-2"),
    ITR_3("ITR-3");

    private final String label;

    ItrFormType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
