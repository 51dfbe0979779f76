package com.example.payrollarea.profile;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

/**
 * Time zone population of the company. Only zones whose offset moves processing deadlines
 * ({@code affectsProcessing}) can cause a split.
 */
public record TimeZone(
        @NotNull(message = "Time zone code is required") TimeZoneCode code,
        String name,
        @Min(value = 0, message = "Employee count must not be negative") int employeeCount,
        boolean affectsProcessing
) {
}
