package com.example.payrollarea.calendar;

import java.time.LocalDate;

/**
 * Anchors and fixed SAP field values used when expanding payroll areas into date tables.
 * Passed into the generators explicitly so a different anchor year needs no shared state.
 */
public class SapExportSettings {

    private final LocalDate periodAnchor;
    private final LocalDate payDateAnchor;
    private final String defaultCalendarId;
    private final String molga;
    private final String dateModifier;
    private final String dateType;
    private final String timeUnit;
    private final String calendarStartDate;
    private final String payrollAreaText;
    private final String runPayroll;

    public static final SapExportSettings DEFAULT = builder().build();

    public SapExportSettings(LocalDate periodAnchor, LocalDate payDateAnchor, String defaultCalendarId,
                             String molga, String dateModifier, String dateType, String timeUnit,
                             String calendarStartDate, String payrollAreaText, String runPayroll) {
        this.periodAnchor = periodAnchor;
        this.payDateAnchor = payDateAnchor;
        this.defaultCalendarId = defaultCalendarId;
        this.molga = molga;
        this.dateModifier = dateModifier;
        this.dateType = dateType;
        this.timeUnit = timeUnit;
        this.calendarStartDate = calendarStartDate;
        this.payrollAreaText = payrollAreaText;
        this.runPayroll = runPayroll;
    }

    public LocalDate getPeriodAnchor() { return periodAnchor; }
    public LocalDate getPayDateAnchor() { return payDateAnchor; }
    public String getDefaultCalendarId() { return defaultCalendarId; }
    public String getMolga() { return molga; }
    public String getDateModifier() { return dateModifier; }
    public String getDateType() { return dateType; }
    public String getTimeUnit() { return timeUnit; }
    public String getCalendarStartDate() { return calendarStartDate; }
    public String getPayrollAreaText() { return payrollAreaText; }
    public String getRunPayroll() { return runPayroll; }

    /**
     * Calendar id written for areas that have none.
     */
    public String calendarIdOrDefault(String calendarId) {
        return calendarId == null || calendarId.isBlank() ? defaultCalendarId : calendarId;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private LocalDate periodAnchor = LocalDate.of(2024, 12, 23);
        private LocalDate payDateAnchor = LocalDate.of(2025, 1, 3);
        private String defaultCalendarId = "80";
        private String molga = "10";
        private String dateModifier = "0";
        private String dateType = "01";
        private String timeUnit = "03";
        private String calendarStartDate = "1/1/1990";
        private String payrollAreaText = "McCarthy";
        private String runPayroll = "X";

        public Builder periodAnchor(LocalDate periodAnchor) {
            this.periodAnchor = periodAnchor;
            return this;
        }

        public Builder payDateAnchor(LocalDate payDateAnchor) {
            this.payDateAnchor = payDateAnchor;
            return this;
        }

        public Builder defaultCalendarId(String defaultCalendarId) {
            this.defaultCalendarId = defaultCalendarId;
            return this;
        }

        public Builder molga(String molga) {
            this.molga = molga;
            return this;
        }

        public Builder dateModifier(String dateModifier) {
            this.dateModifier = dateModifier;
            return this;
        }

        public Builder dateType(String dateType) {
            this.dateType = dateType;
            return this;
        }

        public Builder timeUnit(String timeUnit) {
            this.timeUnit = timeUnit;
            return this;
        }

        public Builder calendarStartDate(String calendarStartDate) {
            this.calendarStartDate = calendarStartDate;
            return this;
        }

        public Builder payrollAreaText(String payrollAreaText) {
            this.payrollAreaText = payrollAreaText;
            return this;
        }

        public Builder runPayroll(String runPayroll) {
            this.runPayroll = runPayroll;
            return this;
        }

        public SapExportSettings build() {
            return new SapExportSettings(periodAnchor, payDateAnchor, defaultCalendarId, molga, dateModifier,
                    dateType, timeUnit, calendarStartDate, payrollAreaText, runPayroll);
        }
    }
}
