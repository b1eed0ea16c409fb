package com.evidex.types;

public enum CaseStatus {
    OPEN("open"),
    CLOSED("closed");

    private final String label;

    CaseStatus(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static CaseStatus fromLabel(String label) {
        for (CaseStatus s : values()) {
            if (s.label.equalsIgnoreCase(label)) return s;
        }
        throw new IllegalArgumentException("Unknown case status: " + label);
    }
}
