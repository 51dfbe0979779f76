package com.example.payrollarea.calendar;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Date rules shared by the period and pay-date generators.
 */
public final class CalendarMath {

    public static final String SEMIMONTHLY_15_LAST = "15-last";
    public static final String SEMIMONTHLY_15_30 = "15-30";
    public static final String MONTHLY_LAST = "last";
    public static final String MONTHLY_15 = "15";
    public static final String MONTHLY_1 = "1";

    private static final int MID_MONTH = 15;
    private static final int DAY_THIRTY = 30;

    private static final Map<String, DayOfWeek> WEEKDAYS = Map.of(
            "sunday", DayOfWeek.SUNDAY,
            "monday", DayOfWeek.MONDAY,
            "tuesday", DayOfWeek.TUESDAY,
            "wednesday", DayOfWeek.WEDNESDAY,
            "thursday", DayOfWeek.THURSDAY,
            "friday", DayOfWeek.FRIDAY,
            "saturday", DayOfWeek.SATURDAY
    );

    private CalendarMath() {
    }

    public static int lastDayOfMonth(int year, int month) {
        return YearMonth.of(year, month).lengthOfMonth();
    }

    public static LocalDate endOfMonth(LocalDate date) {
        return date.withDayOfMonth(date.lengthOfMonth());
    }

    public static Optional<DayOfWeek> weekdayOf(String payDay) {
        if (payDay == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(WEEKDAYS.get(payDay.trim().toLowerCase(Locale.ROOT)));
    }

    /**
     * Closest date to {@code base} falling on the weekday named by {@code payDay}. On a tie the
     * later date wins. Names that are not weekdays return {@code base} unchanged.
     */
    public static LocalDate nearestWeekday(LocalDate base, String payDay) {
        Optional<DayOfWeek> target = weekdayOf(payDay);
        if (target.isEmpty()) {
            return base;
        }
        int baseDow = base.getDayOfWeek().getValue() % 7;
        int targetDow = target.get().getValue() % 7;
        int forward = (targetDow - baseDow + 7) % 7;
        int backward = (baseDow - targetDow + 7) % 7;
        return forward <= backward ? base.plusDays(forward) : base.minusDays(backward);
    }

    /**
     * Anything other than {@code 15-30} is read as {@code 15-last}.
     */
    public static String normalizeSemiMonthlyPattern(String pattern) {
        return SEMIMONTHLY_15_30.equals(pattern) ? SEMIMONTHLY_15_30 : SEMIMONTHLY_15_LAST;
    }

    /**
     * Walks forward from {@code anchor} until it reaches the 15th or the second pay day of a month.
     */
    public static LocalDate firstSemiMonthlyPayDate(LocalDate anchor, String pattern) {
        String normalized = normalizeSemiMonthlyPattern(pattern);
        LocalDate date = anchor;
        while (!isSemiMonthlyPayDay(date, normalized)) {
            date = date.plusDays(1);
        }
        return date;
    }

    public static LocalDate nextSemiMonthlyPayDate(LocalDate current, String pattern) {
        YearMonth month = YearMonth.from(current);
        if (current.getDayOfMonth() != MID_MONTH) {
            return month.plusMonths(1).atDay(MID_MONTH);
        }
        if (SEMIMONTHLY_15_30.equals(normalizeSemiMonthlyPattern(pattern))) {
            return dayThirty(month);
        }
        return month.atEndOfMonth();
    }

    /**
     * Day 30 of the month, rolled over leniently into the next month when the month is shorter
     * (February 30th 2025 becomes March 2nd).
     */
    public static LocalDate dayThirty(YearMonth month) {
        return month.atDay(1).plusDays(DAY_THIRTY - 1L);
    }

    public static LocalDate firstMonthlyPayDate(LocalDate anchor, String pattern) {
        YearMonth month = YearMonth.from(anchor);
        LocalDate target = monthlyPayDate(month, pattern);
        if (!anchor.isAfter(target)) {
            return target;
        }
        return monthlyPayDate(month.plusMonths(1), pattern);
    }

    public static LocalDate nextMonthlyPayDate(LocalDate current, String pattern) {
        return monthlyPayDate(YearMonth.from(current).plusMonths(1), pattern);
    }

    /**
     * {@code last}, {@code 15} or {@code 1}; any other pattern pays on the 1st.
     */
    public static LocalDate monthlyPayDate(YearMonth month, String pattern) {
        if (MONTHLY_LAST.equals(pattern)) {
            return month.atEndOfMonth();
        }
        if (MONTHLY_15.equals(pattern)) {
            return month.atDay(MID_MONTH);
        }
        return month.atDay(1);
    }

    private static boolean isSemiMonthlyPayDay(LocalDate date, String pattern) {
        int day = date.getDayOfMonth();
        if (day == MID_MONTH) {
            return true;
        }
        if (SEMIMONTHLY_15_30.equals(pattern)) {
            return day == DAY_THIRTY;
        }
        return day == date.lengthOfMonth();
    }
}
