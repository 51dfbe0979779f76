package com.example.payrollarea.area;

import com.example.payrollarea.profile.PayFrequencyType;
import com.example.payrollarea.profile.TimeZoneCode;

import java.util.List;

/**
 * A SAP payroll area (T549A entry) together with the reasons it was created.
 *
 * @param calendarId    SAP period parameter the area runs on
 * @param businessUnit  business unit code, {@code "all"} when units were not split
 * @param union         union code when the area was split for a union
 * @param periodPattern optional period pattern carried over from consultant input
 * @param payDay        weekday name for weekly/biweekly areas, {@code 15-last}/{@code 15-30} for
 *                      semimonthly and {@code last}/{@code 15}/{@code 1} for monthly areas
 * @param region        optional region that overrides the code in the area config export
 */
public record PayrollArea(
        String code,
        String description,
        PayFrequencyType frequency,
        String calendarId,
        String businessUnit,
        TimeZoneCode timeZone,
        String union,
        int employeeCount,
        GeneratedBy generatedBy,
        List<String> reasoning,
        String periodPattern,
        String payDay,
        String region
) {

    public PayrollArea {
        reasoning = reasoning == null ? List.of() : List.copyOf(reasoning);
    }

    public PayrollArea withEmployeeCount(int employeeCount) {
        return new PayrollArea(code, description, frequency, calendarId, businessUnit, timeZone, union,
                employeeCount, generatedBy, reasoning, periodPattern, payDay, region);
    }
}
