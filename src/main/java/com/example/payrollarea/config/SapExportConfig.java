package com.example.payrollarea.config;

import com.example.payrollarea.calendar.SapExportSettings;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.LocalDate;

/**
 * SAP export constants, overridable under {@code payroll.export.*}.
 */
@Configuration
public class SapExportConfig {

    @Value("${payroll.export.period-anchor:2024-12-23}")
    private String periodAnchor;
    @Value("${payroll.export.pay-date-anchor:2025-01-03}")
    private String payDateAnchor;
    @Value("${payroll.export.default-calendar-id:80}")
    private String defaultCalendarId;
    @Value("${payroll.export.molga:10}")
    private String molga;
    @Value("${payroll.export.date-modifier:0}")
    private String dateModifier;
    @Value("${payroll.export.date-type:01}")
    private String dateType;
    @Value("${payroll.export.time-unit:03}")
    private String timeUnit;
    @Value("${payroll.export.calendar-start-date:1/1/1990}")
    private String calendarStartDate;
    @Value("${payroll.export.payroll-area-text:McCarthy}")
    private String payrollAreaText;
    @Value("${payroll.export.run-payroll:X}")
    private String runPayroll;

    @Bean
    public SapExportSettings sapExportSettings() {
        return SapExportSettings.builder()
                .periodAnchor(LocalDate.parse(periodAnchor))
                .payDateAnchor(LocalDate.parse(payDateAnchor))
                .defaultCalendarId(defaultCalendarId)
                .molga(molga)
                .dateModifier(dateModifier)
                .dateType(dateType)
                .timeUnit(timeUnit)
                .calendarStartDate(calendarStartDate)
                .payrollAreaText(payrollAreaText)
                .runPayroll(runPayroll)
                .build();
    }

    @Bean
    public Clock exportClock() {
        return Clock.systemUTC();
    }
}
