package com.example.payrollarea.profile;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Weekday range a pay period runs over.
 */
public enum CalendarPattern {
    MON_SUN("mon-sun"),
    SUN_SAT("sun-sat"),
    CUSTOM("custom");

    private final String value;

    CalendarPattern(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static CalendarPattern fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (CalendarPattern pattern : values()) {
            if (pattern.value.equalsIgnoreCase(value.trim())) {
                return pattern;
            }
        }
        return CUSTOM;
    }
}
