package com.example.payrollarea.profile;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

public record BusinessUnit(
        @NotBlank(message = "Business unit code is required") String code,
        String name,
        @Min(value = 0, message = "Employee count must not be negative") int employeeCount,
        boolean requiresSeparateArea
) {

    public static final String ALL_CODE = "all";

    /**
     * Stand-in unit used when no business unit needs its own payroll area.
     */
    public static BusinessUnit allUnits(int employeeCount) {
        return new BusinessUnit(ALL_CODE, "All Business Units", employeeCount, false);
    }

    @JsonIgnore
    public boolean isAllUnits() {
        return ALL_CODE.equals(code);
    }
}
