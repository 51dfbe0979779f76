package com.example.payrollarea.area;

import com.example.payrollarea.profile.PayFrequency;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Maps a pay frequency onto the SAP payroll calendar (T549Q period parameter) it runs on.
 */
@Component
public class CalendarIdResolver {

    private static final Logger logger = LoggerFactory.getLogger(CalendarIdResolver.class);

    public static final String UNKNOWN_CALENDAR_ID = "99";
    static final int UNION_CALENDAR_OFFSET = 100;

    /**
     * Partner calendar numbering keyed by {@code type-pattern-payday}.
     */
    public static final Map<String, String> DEFAULT_CALENDAR_IDS = Map.ofEntries(
            Map.entry("weekly-mon-sun-friday", "80"),
            Map.entry("weekly-sun-sat-friday", "81"),
            Map.entry("weekly-mon-sun-thursday", "82"),
            Map.entry("weekly-sun-sat-thursday", "83"),
            Map.entry("biweekly-mon-sun-thursday", "20"),
            Map.entry("biweekly-mon-sun-friday", "21"),
            Map.entry("biweekly-sun-sat-thursday", "22"),
            Map.entry("biweekly-sun-sat-friday", "23"),
            Map.entry("semimonthly-mon-sun-friday", "30"),
            Map.entry("semimonthly-mon-sun-thursday", "31"),
            Map.entry("monthly-mon-sun-friday", "40"),
            Map.entry("monthly-mon-sun-thursday", "41")
    );

    private final Map<String, String> calendarIds;

    public CalendarIdResolver() {
        this(DEFAULT_CALENDAR_IDS);
    }

    public CalendarIdResolver(Map<String, String> calendarIds) {
        this.calendarIds = Map.copyOf(calendarIds);
    }

    /**
     * Frequencies without a readable type resolve to {@value #UNKNOWN_CALENDAR_ID}.
     * Unions with their own calendar get the base id shifted by 100. This is placeholder
     * numbering: bases of 900 and above collide with other ranges.
     */
    public String resolveCalendarId(PayFrequency freq, boolean unionHasUniqueCalendar) {
        if (unionHasUniqueCalendar) {
            String base = resolveCalendarId(freq, false);
            return String.valueOf(parseCalendarNumber(base) + UNION_CALENDAR_OFFSET);
        }
        if (freq.type() == null) {
            return UNKNOWN_CALENDAR_ID;
        }
        String key = lookupKey(freq);
        String calendarId = calendarIds.get(key);
        if (calendarId == null) {
            logger.debug("No calendar mapping for {}, using {}", key, UNKNOWN_CALENDAR_ID);
            return UNKNOWN_CALENDAR_ID;
        }
        return calendarId;
    }

    static String lookupKey(PayFrequency freq) {
        return freq.type().value() + "-" + patternValue(freq) + "-" + (freq.payDay() == null ? "" : freq.payDay().value());
    }

    private static String patternValue(PayFrequency freq) {
        return freq.effectiveCalendarPattern() == null ? "" : freq.effectiveCalendarPattern().value();
    }

    private int parseCalendarNumber(String calendarId) {
        try {
            return Integer.parseInt(calendarId.trim());
        } catch (NumberFormatException e) {
            logger.warn("Calendar id '{}' is not numeric, offsetting from {}", calendarId, UNKNOWN_CALENDAR_ID);
            return Integer.parseInt(UNKNOWN_CALENDAR_ID);
        }
    }
}
