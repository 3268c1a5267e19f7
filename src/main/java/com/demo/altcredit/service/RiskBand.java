package com.demo.altcredit.service;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RiskBand {
    LOW("Low"),
    MEDIUM("Medium"),
    HIGH("High");

    private final String label;

    RiskBand(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
