package com.example.payrollarea.calendar;

import com.example.payrollarea.area.PayrollArea;
import com.example.payrollarea.profile.PayFrequencyType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;

/**
 * Expands a payroll area into its period begin/end table, starting at the period anchor.
 * <p>
 * {@code payroll_period} counts through the whole series while {@code prior_period_period}
 * restarts at 1 whenever the end date moves into a new year. Existing exports depend on the
 * two counters behaving differently.
 */
@Component
public class PeriodSeriesGenerator {

    private static final Logger logger = LoggerFactory.getLogger(PeriodSeriesGenerator.class);

    private static final int WEEKS_PER_YEAR = 52;
    private static final int FORTNIGHTS_PER_YEAR = 26;
    private static final int MONTHS_PER_YEAR = 12;
    private static final int FIRST_HALF_END = 15;

    private final SapExportSettings settings;

    public PeriodSeriesGenerator(SapExportSettings settings) {
        this.settings = settings;
    }

    public List<PeriodRow> generatePeriods(PayrollArea area) {
        return generatePeriods(area, 1);
    }

    public List<PeriodRow> generatePeriods(PayrollArea area, int years) {
        PeriodCollector collector = new PeriodCollector(settings.calendarIdOrDefault(area.calendarId()));
        LocalDate start = settings.getPeriodAnchor();
        PayFrequencyType frequency = area.frequency() == null ? PayFrequencyType.WEEKLY : area.frequency();

        switch (frequency) {
            case BIWEEKLY -> fixedStep(collector, start, 14, FORTNIGHTS_PER_YEAR * years);
            case SEMIMONTHLY -> semiMonthly(collector, YearMonth.from(start), MONTHS_PER_YEAR * years);
            case MONTHLY -> monthly(collector, YearMonth.from(start), MONTHS_PER_YEAR * years);
            default -> fixedStep(collector, start, 7, WEEKS_PER_YEAR * years);
        }

        logger.debug("Generated {} {} periods for calendar {}", collector.rows.size(), frequency.value(),
                collector.periodParameters);
        return List.copyOf(collector.rows);
    }

    private void fixedStep(PeriodCollector collector, LocalDate start, int stepDays, int count) {
        for (int i = 0; i < count; i++) {
            LocalDate begin = start.plusDays((long) i * stepDays);
            collector.add(begin, begin.plusDays(stepDays - 1L));
        }
    }

    private void semiMonthly(PeriodCollector collector, YearMonth firstMonth, int months) {
        for (int m = 0; m < months; m++) {
            YearMonth month = firstMonth.plusMonths(m);
            collector.add(month.atDay(1), month.atDay(FIRST_HALF_END));
            collector.add(month.atDay(FIRST_HALF_END + 1), month.atEndOfMonth());
        }
    }

    private void monthly(PeriodCollector collector, YearMonth firstMonth, int months) {
        for (int m = 0; m < months; m++) {
            YearMonth month = firstMonth.plusMonths(m);
            collector.add(month.atDay(1), CalendarMath.endOfMonth(month.atDay(1)));
        }
    }

    private static final class PeriodCollector {
        private final String periodParameters;
        private final List<PeriodRow> rows = new ArrayList<>();
        private int payrollPeriod = 1;
        private Integer currentPriorYear;
        private int priorPeriodCounter;

        private PeriodCollector(String periodParameters) {
            this.periodParameters = periodParameters;
        }

        private void add(LocalDate begin, LocalDate end) {
            int year = end.getYear();
            if (currentPriorYear == null || currentPriorYear != year) {
                currentPriorYear = year;
                priorPeriodCounter = 1;
            } else {
                priorPeriodCounter++;
            }
            rows.add(new PeriodRow(periodParameters, year, payrollPeriod, begin, end, year, priorPeriodCounter));
            payrollPeriod++;
        }
    }
}
