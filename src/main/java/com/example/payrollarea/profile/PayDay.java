package com.example.payrollarea.profile;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum PayDay {
    THURSDAY("thursday"),
    FRIDAY("friday"),
    CURRENT("current"),
    CUSTOM("custom");

    private final String value;

    PayDay(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static PayDay fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (PayDay payDay : values()) {
            if (payDay.value.equalsIgnoreCase(value.trim())) {
                return payDay;
            }
        }
        return CUSTOM;
    }
}
