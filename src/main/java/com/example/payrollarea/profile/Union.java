package com.example.payrollarea.profile;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

/**
 * @param code union local code such as "L11" or "L39"
 */
public record Union(
        @NotBlank(message = "Union code is required") String code,
        String name,
        @Min(value = 0, message = "Employee count must not be negative") int employeeCount,
        boolean uniqueCalendar,
        boolean uniqueFunding
) {

    public boolean qualifiesForSplit() {
        return uniqueCalendar || uniqueFunding;
    }
}
