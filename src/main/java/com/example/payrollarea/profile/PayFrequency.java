package com.example.payrollarea.profile;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

/**
 * One pay frequency of the company together with its period pattern and pay day.
 *
 * @param customPayDay free text describing the pay day when {@code payDay} is {@link PayDay#CUSTOM}
 */
public record PayFrequency(
        @NotNull(message = "Pay frequency type is required") PayFrequencyType type,
        @Min(value = 0, message = "Employee count must not be negative") int employeeCount,
        @NotNull(message = "Calendar pattern is required") CalendarPattern calendarPattern,
        @NotNull(message = "Pay day is required") PayDay payDay,
        String customPayDay
) {

    public static PayFrequency of(PayFrequencyType type, int employeeCount, CalendarPattern calendarPattern, PayDay payDay) {
        return new PayFrequency(type, employeeCount, calendarPattern, payDay, null);
    }

    /**
     * Semimonthly periods are always 1-15 / 16-end, whatever pattern was stored.
     */
    public CalendarPattern effectiveCalendarPattern() {
        if (type == PayFrequencyType.SEMIMONTHLY) {
            return CalendarPattern.MON_SUN;
        }
        return calendarPattern;
    }
}
