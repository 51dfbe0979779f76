package com.example.payrollarea.export;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record SapTables(
        @JsonProperty("T549Q") List<SapCalendarRow> calendars,
        @JsonProperty("T549A") List<SapPayrollAreaRow> areas
) {
}
