package com.dnobretech.contentalignerbackend.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum MatchStatus {
    MATCHED("Matched"),
    MISSING("Missing"),
    UNMATCHED_TARGET("Unmatched Target");

    private final String label;

    MatchStatus(String label) {
        this.label = label;
    }

    /** texto usado no export e no JSON */
    @JsonValue
    public String label() {
        return label;
    }
}
