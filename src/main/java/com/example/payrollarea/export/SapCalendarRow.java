package com.example.payrollarea.export;

import com.example.payrollarea.profile.PayFrequencyType;

/**
 * T549Q payroll calendar entry.
 */
public record SapCalendarRow(String calendarId, String description, PayFrequencyType frequency,
                             String periodStart, String payDay) {
}
