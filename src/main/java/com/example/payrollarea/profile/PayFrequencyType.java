package com.example.payrollarea.profile;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum PayFrequencyType {
    WEEKLY("weekly"),
    BIWEEKLY("biweekly"),
    SEMIMONTHLY("semimonthly"),
    MONTHLY("monthly");

    private final String value;

    PayFrequencyType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Unknown values map to {@code null}; the date generators treat a missing frequency as weekly.
     */
    @JsonCreator
    public static PayFrequencyType fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (PayFrequencyType type : values()) {
            if (type.value.equalsIgnoreCase(value.trim())) {
                return type;
            }
        }
        return null;
    }
}
