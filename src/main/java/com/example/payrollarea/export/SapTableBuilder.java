package com.example.payrollarea.export;

import com.example.payrollarea.area.PayrollArea;
import com.example.payrollarea.calendar.SapExportSettings;
import com.example.payrollarea.profile.PayFrequencyType;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Flattens payroll areas into the SAP configuration tables. Calendar based tables hold one
 * row per distinct calendar id, taken from the first area that uses it.
 */
@Component
public class SapTableBuilder {

    static final String DEFAULT_PERIOD_START = "mon-sun";
    static final String DEFAULT_PAY_DAY = "friday";

    private static final Map<PayFrequencyType, String> FREQUENCY_LABELS = new EnumMap<>(Map.of(
            PayFrequencyType.WEEKLY, "Weekly",
            PayFrequencyType.BIWEEKLY, "Bi-weekly",
            PayFrequencyType.SEMIMONTHLY, "Semi-monthly",
            PayFrequencyType.MONTHLY, "Monthly"
    ));

    private final SapExportSettings settings;

    public SapTableBuilder(SapExportSettings settings) {
        this.settings = settings;
    }

    /**
     * T549Q rows.
     */
    public List<SapCalendarRow> buildCalendars(List<PayrollArea> areas) {
        Map<String, SapCalendarRow> calendars = new LinkedHashMap<>();
        for (PayrollArea area : areas) {
            calendars.computeIfAbsent(area.calendarId(), id -> new SapCalendarRow(
                    id,
                    capitalize(frequencyValue(area)) + " Payroll Calendar",
                    area.frequency(),
                    area.periodPattern() == null ? DEFAULT_PERIOD_START : area.periodPattern(),
                    area.payDay() == null ? DEFAULT_PAY_DAY : area.payDay()));
        }
        return List.copyOf(calendars.values());
    }

    /**
     * T549A rows, one per area in list order.
     */
    public List<SapPayrollAreaRow> buildAreas(List<PayrollArea> areas) {
        return areas.stream()
                .map(area -> new SapPayrollAreaRow(area.code(), area.description(), area.calendarId()))
                .toList();
    }

    public List<CalendarIdRow> buildCalendarIdRows(List<PayrollArea> areas) {
        Map<String, CalendarIdRow> rows = new LinkedHashMap<>();
        for (PayrollArea area : areas) {
            String calendarId = settings.calendarIdOrDefault(area.calendarId());
            rows.computeIfAbsent(calendarId, id -> {
                String label = FREQUENCY_LABELS.getOrDefault(area.frequency(), frequencyValue(area));
                String name = area.description() == null || area.description().isEmpty()
                        ? label + " Payroll"
                        : area.description();
                return new CalendarIdRow(id, name, settings.getTimeUnit(), label, settings.getCalendarStartDate());
            });
        }
        return List.copyOf(rows.values());
    }

    public List<PayrollAreaConfigRow> buildAreaConfigRows(List<PayrollArea> areas) {
        return areas.stream()
                .map(area -> new PayrollAreaConfigRow(
                        area.region() == null || area.region().isEmpty() ? area.code() : area.region(),
                        settings.getPayrollAreaText(),
                        settings.calendarIdOrDefault(area.calendarId()),
                        settings.getRunPayroll(),
                        settings.getDateModifier()))
                .toList();
    }

    private static String frequencyValue(PayrollArea area) {
        return area.frequency() == null ? "" : area.frequency().value();
    }

    private static String capitalize(String value) {
        if (value.isEmpty()) {
            return value;
        }
        return Character.toUpperCase(value.charAt(0)) + value.substring(1);
    }
}
