package com.example.payrollarea.area;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum GeneratedBy {
    SYSTEM("system"),
    CONSULTANT("consultant");

    private final String value;

    GeneratedBy(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static GeneratedBy fromValue(String value) {
        if (value == null) {
            return null;
        }
        return CONSULTANT.value.equalsIgnoreCase(value.trim()) ? CONSULTANT : SYSTEM;
    }
}
