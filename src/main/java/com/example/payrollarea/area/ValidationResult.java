package com.example.payrollarea.area;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record ValidationResult(
        @JsonProperty("isValid") boolean isValid,
        int employeesCovered,
        int totalEmployees,
        List<String> warnings,
        List<String> errors
) {

    public ValidationResult {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        errors = errors == null ? List.of() : List.copyOf(errors);
    }
}
