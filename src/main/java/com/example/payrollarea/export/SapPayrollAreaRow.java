package com.example.payrollarea.export;

/**
 * T549A payroll area entry.
 */
public record SapPayrollAreaRow(String areaCode, String description, String calendarId) {
}
