package com.example.payrollarea.calendar;

import com.example.payrollarea.area.PayrollArea;
import com.example.payrollarea.profile.PayFrequencyType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Expands a payroll area into its pay dates, starting from the pay-date anchor.
 * <p>
 * How {@link PayrollArea#payDay()} is read depends on the frequency: a weekday name for
 * weekly/biweekly, {@code 15-last}/{@code 15-30} for semimonthly and {@code last}/{@code 15}/{@code 1}
 * for monthly areas. {@code payroll_period} restarts at 1 in every calendar year.
 */
@Component
public class PayDateSeriesGenerator {

    private static final Logger logger = LoggerFactory.getLogger(PayDateSeriesGenerator.class);

    static final String DEFAULT_WEEKDAY = "friday";

    private final SapExportSettings settings;

    public PayDateSeriesGenerator(SapExportSettings settings) {
        this.settings = settings;
    }

    public List<PayDateRow> generatePayDates(PayrollArea area) {
        return generatePayDates(area, 1);
    }

    public List<PayDateRow> generatePayDates(PayrollArea area, int years) {
        LocalDate anchor = settings.getPayDateAnchor();
        PayFrequencyType frequency = area.frequency() == null ? PayFrequencyType.WEEKLY : area.frequency();
        String payDay = area.payDay();

        LocalDate first;
        UnaryOperator<LocalDate> next;
        int rowCount;
        switch (frequency) {
            case BIWEEKLY -> {
                first = CalendarMath.nearestWeekday(anchor, payDay == null ? DEFAULT_WEEKDAY : payDay);
                next = date -> date.plusDays(14);
                rowCount = 26 * years;
            }
            case SEMIMONTHLY -> {
                String pattern = CalendarMath.normalizeSemiMonthlyPattern(payDay);
                first = CalendarMath.firstSemiMonthlyPayDate(anchor, pattern);
                next = date -> CalendarMath.nextSemiMonthlyPayDate(date, pattern);
                rowCount = 24 * years;
            }
            case MONTHLY -> {
                String pattern = payDay == null ? CalendarMath.MONTHLY_LAST : payDay;
                first = CalendarMath.firstMonthlyPayDate(anchor, pattern);
                next = date -> CalendarMath.nextMonthlyPayDate(date, pattern);
                rowCount = 12 * years;
            }
            default -> {
                first = CalendarMath.nearestWeekday(anchor, payDay == null ? DEFAULT_WEEKDAY : payDay);
                next = date -> date.plusDays(7);
                rowCount = 52 * years;
            }
        }

        String periodParameters = settings.calendarIdOrDefault(area.calendarId());
        List<PayDateRow> rows = new ArrayList<>(Math.max(rowCount, 0));
        Integer currentYear = null;
        int periodCounter = 0;
        LocalDate date = first;
        for (int i = 0; i < rowCount; i++) {
            int year = date.getYear();
            if (currentYear == null || currentYear != year) {
                currentYear = year;
                periodCounter = 1;
            } else {
                periodCounter++;
            }
            rows.add(new PayDateRow(settings.getMolga(), settings.getDateModifier(), periodParameters,
                    year, periodCounter, settings.getDateType(), date));
            date = next.apply(date);
        }

        logger.debug("Generated {} {} pay dates for calendar {} starting {}", rows.size(), frequency.value(),
                periodParameters, first);
        return List.copyOf(rows);
    }
}
