package com.example.payrollarea.calendar;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;

/**
 * One pay date of a calendar.
 *
 * @param payrollPeriod number of the pay date within its calendar year
 */
public record PayDateRow(
        @JsonProperty("molga") String molga,
        @JsonProperty("date_modifier") String dateModifier,
        @JsonProperty("period_parameters") String periodParameters,
        @JsonProperty("payroll_year") int payrollYear,
        @JsonProperty("payroll_period") int payrollPeriod,
        @JsonProperty("date_type") String dateType,
        @JsonProperty("date") @JsonFormat(pattern = "MM/dd/yyyy") LocalDate date
) {
}
