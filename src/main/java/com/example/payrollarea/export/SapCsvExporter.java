package com.example.payrollarea.export;

import com.example.payrollarea.area.PayrollArea;
import com.example.payrollarea.calendar.PayDateRow;
import com.example.payrollarea.calendar.PayDateSeriesGenerator;
import com.example.payrollarea.calendar.PeriodRow;
import com.example.payrollarea.calendar.PeriodSeriesGenerator;
import com.example.payrollarea.calendar.SapExportSettings;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.StringJoiner;
import java.util.function.Function;

/**
 * Renders the SAP upload files. Values are escaped per RFC 4180 and rows are joined with
 * {@code \n} without a trailing line break.
 */
@Component
public class SapCsvExporter {

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("MM/dd/yyyy");

    private static final String[] AREA_HEADERS = {
            "Code", "Description", "Frequency", "Period Pattern", "Pay Day",
            "Calendar ID", "Employee Count", "Business Unit", "Region"
    };
    private static final String[] CALENDAR_ID_HEADERS = {
            "period_parameters", "period_parameter_name", "time_unit", "time_unit_desc", "start_date"
    };
    private static final String[] AREA_CONFIG_HEADERS = {
            "payroll_area", "payroll_area_text", "period_parameters", "run_payroll", "date_modifier"
    };
    private static final String[] PERIOD_HEADERS = {
            "period_parameters", "payroll_year", "payroll_period", "period_begin_date",
            "period_end_date", "prior_period_year", "prior_period_period"
    };
    private static final String[] PAY_DATE_HEADERS = {
            "molga", "date_modifier", "period_parameters", "payroll_year", "payroll_period", "date_type", "date"
    };

    private final SapTableBuilder tableBuilder;
    private final PeriodSeriesGenerator periodGenerator;
    private final PayDateSeriesGenerator payDateGenerator;
    private final SapExportSettings settings;

    public SapCsvExporter(SapTableBuilder tableBuilder,
                          PeriodSeriesGenerator periodGenerator,
                          PayDateSeriesGenerator payDateGenerator,
                          SapExportSettings settings) {
        this.tableBuilder = tableBuilder;
        this.periodGenerator = periodGenerator;
        this.payDateGenerator = payDateGenerator;
        this.settings = settings;
    }

    public CsvFile exportPayrollAreas(List<PayrollArea> areas) {
        return toCsv("payroll-areas.csv", AREA_HEADERS, areas, area -> new String[] {
                area.code(),
                area.description(),
                area.frequency() == null ? "" : area.frequency().value(),
                area.periodPattern(),
                area.payDay(),
                area.calendarId(),
                Integer.toString(area.employeeCount()),
                area.businessUnit(),
                area.region()
        });
    }

    public CsvFile exportCalendarIds(List<PayrollArea> areas) {
        return toCsv("calendar-id.csv", CALENDAR_ID_HEADERS, tableBuilder.buildCalendarIdRows(areas), row -> new String[] {
                row.periodParameters(),
                row.periodParameterName(),
                row.timeUnit(),
                row.timeUnitDesc(),
                row.startDate()
        });
    }

    public CsvFile exportAreaConfig(List<PayrollArea> areas) {
        return toCsv("payroll-area-config.csv", AREA_CONFIG_HEADERS, tableBuilder.buildAreaConfigRows(areas), row -> new String[] {
                row.payrollArea(),
                row.payrollAreaText(),
                row.periodParameters(),
                row.runPayroll(),
                row.dateModifier()
        });
    }

    public CsvFile exportPeriods(PayrollArea area, int years) {
        List<PeriodRow> rows = periodGenerator.generatePeriods(area, years);
        String filename = "pay-period-" + settings.calendarIdOrDefault(area.calendarId()) + ".csv";
        return toCsv(filename, PERIOD_HEADERS, rows, row -> new String[] {
                row.periodParameters(),
                Integer.toString(row.payrollYear()),
                formatPeriod(row.payrollPeriod()),
                formatDate(row.periodBeginDate()),
                formatDate(row.periodEndDate()),
                Integer.toString(row.priorPeriodYear()),
                formatPeriod(row.priorPeriodPeriod())
        });
    }

    public CsvFile exportPayDates(PayrollArea area, int years) {
        List<PayDateRow> rows = payDateGenerator.generatePayDates(area, years);
        String filename = "pay-date-" + settings.calendarIdOrDefault(area.calendarId()) + ".csv";
        return toCsv(filename, PAY_DATE_HEADERS, rows, row -> new String[] {
                row.molga(),
                row.dateModifier(),
                row.periodParameters(),
                Integer.toString(row.payrollYear()),
                formatPeriod(row.payrollPeriod()),
                row.dateType(),
                formatDate(row.date())
        });
    }

    /**
     * Area list, calendar ids, area config, then one period and one pay-date file per distinct calendar.
     */
    public List<CsvFile> exportAll(List<PayrollArea> areas, int years) {
        List<CsvFile> files = new ArrayList<>();
        files.add(exportPayrollAreas(areas));
        files.add(exportCalendarIds(areas));
        files.add(exportAreaConfig(areas));
        List<String> seenCalendars = new ArrayList<>();
        for (PayrollArea area : areas) {
            String calendarId = settings.calendarIdOrDefault(area.calendarId());
            if (seenCalendars.contains(calendarId)) {
                continue;
            }
            seenCalendars.add(calendarId);
            files.add(exportPeriods(area, years));
            files.add(exportPayDates(area, years));
        }
        return List.copyOf(files);
    }

    private <T> CsvFile toCsv(String filename, String[] headers, List<T> rows, Function<T, String[]> columns) {
        StringJoiner lines = new StringJoiner("\n");
        lines.add(joinRow(headers));
        rows.forEach(row -> lines.add(joinRow(columns.apply(row))));
        return new CsvFile(filename, lines.toString().getBytes(StandardCharsets.UTF_8), rows.size());
    }

    private String joinRow(String[] values) {
        StringJoiner joiner = new StringJoiner(",");
        for (String value : values) {
            joiner.add(escapeCsv(value));
        }
        return joiner.toString();
    }

    private String formatDate(LocalDate date) {
        return date == null ? "" : DATE_FORMAT.format(date);
    }

    private String formatPeriod(int period) {
        return String.format("%02d", period);
    }

    static String escapeCsv(String value) {
        String target = value == null ? "" : value;
        if (target.contains(",") || target.contains("\"") || target.contains("\n")) {
            return "\"" + target.replace("\"", "\"\"") + "\"";
        }
        return target;
    }

    public record CsvFile(String filename, byte[] data, int rowCount) {

        public String content() {
            return new String(data, StandardCharsets.UTF_8);
        }
    }
}
