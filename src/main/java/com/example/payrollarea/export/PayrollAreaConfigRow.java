package com.example.payrollarea.export;

import com.fasterxml.jackson.annotation.JsonProperty;

public record PayrollAreaConfigRow(
        @JsonProperty("payroll_area") String payrollArea,
        @JsonProperty("payroll_area_text") String payrollAreaText,
        @JsonProperty("period_parameters") String periodParameters,
        @JsonProperty("run_payroll") String runPayroll,
        @JsonProperty("date_modifier") String dateModifier
) {
}
