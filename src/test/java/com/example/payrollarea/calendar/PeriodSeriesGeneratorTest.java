package com.example.payrollarea.calendar;

import com.example.payrollarea.area.PayrollArea;
import com.example.payrollarea.profile.PayFrequencyType;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static com.example.payrollarea.area.AreaFixtures.area;
import static com.example.payrollarea.area.AreaFixtures.weekly;
import static org.assertj.core.api.Assertions.assertThat;

class PeriodSeriesGeneratorTest {

    private final PeriodSeriesGenerator generator = new PeriodSeriesGenerator(SapExportSettings.DEFAULT);

    @Test
    void weekly_startsAtAnchorAndCoversFiftyTwoWeeks() {
        List<PeriodRow> rows = generator.generatePeriods(weekly("friday"));

        assertThat(rows).hasSize(52);
        assertThat(rows.get(0)).isEqualTo(new PeriodRow("80", 2024, 1,
                LocalDate.of(2024, 12, 23), LocalDate.of(2024, 12, 29), 2024, 1));
        assertThat(rows.get(1)).isEqualTo(new PeriodRow("80", 2025, 2,
                LocalDate.of(2024, 12, 30), LocalDate.of(2025, 1, 5), 2025, 1));
        assertThat(rows.get(51).periodBeginDate()).isEqualTo(LocalDate.of(2025, 12, 15));
        assertThat(rows.get(51).periodEndDate()).isEqualTo(LocalDate.of(2025, 12, 21));
        assertThat(rows.get(51).priorPeriodPeriod()).isEqualTo(51);
    }

    @Test
    void weekly_periodsAreContiguous() {
        List<PeriodRow> rows = generator.generatePeriods(weekly("friday"), 2);

        for (int i = 1; i < rows.size(); i++) {
            assertThat(rows.get(i).periodBeginDate()).isEqualTo(rows.get(i - 1).periodEndDate().plusDays(1));
        }
    }

    @Test
    void priorPeriodRestartsWithNewYearWhilePayrollPeriodKeepsCounting() {
        List<PeriodRow> rows = generator.generatePeriods(weekly("friday"), 2);

        assertThat(rows).hasSize(104);
        PeriodRow lastOf2025 = rows.get(52);
        PeriodRow firstOf2026 = rows.get(53);
        assertThat(lastOf2025.periodEndDate()).isEqualTo(LocalDate.of(2025, 12, 28));
        assertThat(lastOf2025.priorPeriodPeriod()).isEqualTo(52);
        assertThat(firstOf2026.periodBeginDate()).isEqualTo(LocalDate.of(2025, 12, 29));
        assertThat(firstOf2026.payrollYear()).isEqualTo(2026);
        assertThat(firstOf2026.payrollPeriod()).isEqualTo(54);
        assertThat(firstOf2026.priorPeriodYear()).isEqualTo(2026);
        assertThat(firstOf2026.priorPeriodPeriod()).isEqualTo(1);
    }

    @Test
    void biweekly_usesFourteenDayPeriods() {
        List<PeriodRow> rows = generator.generatePeriods(area("BF", PayFrequencyType.BIWEEKLY, "81", "friday"));

        assertThat(rows).hasSize(26);
        assertThat(rows.get(0).periodBeginDate()).isEqualTo(LocalDate.of(2024, 12, 23));
        assertThat(rows.get(0).periodEndDate()).isEqualTo(LocalDate.of(2025, 1, 5));
        assertThat(rows.get(0).payrollYear()).isEqualTo(2025);
        assertThat(rows.get(25).periodEndDate()).isEqualTo(LocalDate.of(2025, 12, 21));
        assertThat(rows.get(25).priorPeriodPeriod()).isEqualTo(26);
        assertThat(rows).allMatch(row -> row.periodParameters().equals("81"));
    }

    @Test
    void semiMonthly_splitsEachMonthAfterTheFifteenth() {
        List<PeriodRow> rows = generator.generatePeriods(area("SF", PayFrequencyType.SEMIMONTHLY, "20", "15-last"));

        assertThat(rows).hasSize(24);
        assertThat(rows.get(0).periodBeginDate()).isEqualTo(LocalDate.of(2024, 12, 1));
        assertThat(rows.get(0).periodEndDate()).isEqualTo(LocalDate.of(2024, 12, 15));
        assertThat(rows.get(1).periodBeginDate()).isEqualTo(LocalDate.of(2024, 12, 16));
        assertThat(rows.get(1).periodEndDate()).isEqualTo(LocalDate.of(2024, 12, 31));
        assertThat(rows.get(2).payrollPeriod()).isEqualTo(3);
        assertThat(rows.get(2).priorPeriodPeriod()).isEqualTo(1);
        assertThat(rows.get(5).periodBeginDate()).isEqualTo(LocalDate.of(2025, 2, 16));
        assertThat(rows.get(5).periodEndDate()).isEqualTo(LocalDate.of(2025, 2, 28));
        assertThat(rows.get(23).periodEndDate()).isEqualTo(LocalDate.of(2025, 11, 30));
    }

    @Test
    void monthly_coversCalendarMonthsFromAnchorMonth() {
        List<PeriodRow> rows = generator.generatePeriods(area("MF", PayFrequencyType.MONTHLY, "30", "last"));

        assertThat(rows).hasSize(12);
        assertThat(rows.get(0).periodBeginDate()).isEqualTo(LocalDate.of(2024, 12, 1));
        assertThat(rows.get(0).periodEndDate()).isEqualTo(LocalDate.of(2024, 12, 31));
        assertThat(rows.get(11).periodBeginDate()).isEqualTo(LocalDate.of(2025, 11, 1));
        assertThat(rows.get(11).periodEndDate()).isEqualTo(LocalDate.of(2025, 11, 30));
        assertThat(rows.get(11).priorPeriodPeriod()).isEqualTo(11);
    }

    @Test
    void missingCalendarIdFallsBackToDefault() {
        PayrollArea area = area("WF", PayFrequencyType.WEEKLY, null, "friday");

        assertThat(generator.generatePeriods(area)).allMatch(row -> row.periodParameters().equals("80"));
    }

    @Test
    void missingFrequencyIsTreatedAsWeekly() {
        assertThat(generator.generatePeriods(area("XX", null, "80", null))).hasSize(52);
    }

    @Test
    void nonPositiveYearsProduceNoRows() {
        assertThat(generator.generatePeriods(weekly("friday"), 0)).isEmpty();
    }

    @Test
    void anchorComesFromSettings() {
        SapExportSettings settings = SapExportSettings.builder()
                .periodAnchor(LocalDate.of(2025, 12, 22))
                .build();
        PeriodSeriesGenerator shifted = new PeriodSeriesGenerator(settings);

        PeriodRow first = shifted.generatePeriods(weekly("friday")).get(0);

        assertThat(first.periodBeginDate()).isEqualTo(LocalDate.of(2025, 12, 22));
        assertThat(first.periodEndDate()).isEqualTo(LocalDate.of(2025, 12, 28));
    }

    @Test
    void biweekly_twoYearsRestartPriorPeriodInSecondYear() {
        List<PeriodRow> rows = generator.generatePeriods(area("BF", PayFrequencyType.BIWEEKLY, "81", "friday"), 2);

        assertThat(rows).hasSize(52);
        assertThat(rows.get(25).periodEndDate()).isEqualTo(LocalDate.of(2025, 12, 21));
        assertThat(rows.get(25).priorPeriodPeriod()).isEqualTo(26);
        assertThat(rows.get(26)).isEqualTo(new PeriodRow("81", 2026, 27,
                LocalDate.of(2025, 12, 22), LocalDate.of(2026, 1, 4), 2026, 1));
        assertThat(rows.get(51).periodEndDate()).isEqualTo(LocalDate.of(2026, 12, 20));
        assertThat(rows.get(51).payrollPeriod()).isEqualTo(52);
        assertThat(rows.get(51).priorPeriodPeriod()).isEqualTo(26);
    }

    @Test
    void semiMonthly_twoYearsCrossIntoNextYear() {
        List<PeriodRow> rows = generator.generatePeriods(area("SF", PayFrequencyType.SEMIMONTHLY, "20", "15-last"), 2);

        assertThat(rows).hasSize(48);
        assertThat(rows.get(25).periodBeginDate()).isEqualTo(LocalDate.of(2025, 12, 16));
        assertThat(rows.get(25).periodEndDate()).isEqualTo(LocalDate.of(2025, 12, 31));
        assertThat(rows.get(25).priorPeriodPeriod()).isEqualTo(24);
        assertThat(rows.get(26)).isEqualTo(new PeriodRow("20", 2026, 27,
                LocalDate.of(2026, 1, 1), LocalDate.of(2026, 1, 15), 2026, 1));
        assertThat(rows.get(47).periodEndDate()).isEqualTo(LocalDate.of(2026, 11, 30));
        assertThat(rows.get(47).priorPeriodPeriod()).isEqualTo(22);
    }

    @Test
    void monthly_twoYearsCrossIntoNextYear() {
        List<PeriodRow> rows = generator.generatePeriods(area("MF", PayFrequencyType.MONTHLY, "30", "last"), 2);

        assertThat(rows).hasSize(24);
        assertThat(rows.get(12).periodBeginDate()).isEqualTo(LocalDate.of(2025, 12, 1));
        assertThat(rows.get(12).priorPeriodPeriod()).isEqualTo(12);
        assertThat(rows.get(13)).isEqualTo(new PeriodRow("30", 2026, 14,
                LocalDate.of(2026, 1, 1), LocalDate.of(2026, 1, 31), 2026, 1));
        assertThat(rows.get(23).periodEndDate()).isEqualTo(LocalDate.of(2026, 11, 30));
        assertThat(rows.get(23).priorPeriodPeriod()).isEqualTo(11);
    }
}
