package com.example.payrollarea.calendar;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;

/**
 * One payroll period of a calendar (T549Q period row).
 *
 * @param payrollPeriod     running number over the whole generated series
 * @param priorPeriodPeriod number within the calendar year of {@code periodEndDate}
 */
public record PeriodRow(
        @JsonProperty("period_parameters") String periodParameters,
        @JsonProperty("payroll_year") int payrollYear,
        @JsonProperty("payroll_period") int payrollPeriod,
        @JsonProperty("period_begin_date") @JsonFormat(pattern = "MM/dd/yyyy") LocalDate periodBeginDate,
        @JsonProperty("period_end_date") @JsonFormat(pattern = "MM/dd/yyyy") LocalDate periodEndDate,
        @JsonProperty("prior_period_year") int priorPeriodYear,
        @JsonProperty("prior_period_period") int priorPeriodPeriod
) {
}
