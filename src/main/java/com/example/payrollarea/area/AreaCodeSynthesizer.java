package com.example.payrollarea.area;

import com.example.payrollarea.profile.BusinessUnit;
import com.example.payrollarea.profile.PayDay;
import com.example.payrollarea.profile.PayFrequency;
import com.example.payrollarea.profile.PayFrequencyType;
import com.example.payrollarea.profile.TimeZone;
import com.example.payrollarea.profile.Union;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the SAP-facing identity of one payroll area: the 2-character code, the 20-character
 * description and the audit trail explaining why the area exists.
 * <p>
 * Union and time zone arguments may be {@code null} when the area was not split on them.
 * A frequency whose type could not be read gets the prefix {@code X}.
 */
@Component
public class AreaCodeSynthesizer {

    public static final int DESCRIPTION_MAX_LENGTH = 20;
    private static final int BUSINESS_UNIT_NAME_LENGTH = 8;
    private static final String UNKNOWN_FREQUENCY = "unknown";

    private static final Map<PayFrequencyType, String> FREQUENCY_ABBREVIATIONS = new EnumMap<>(Map.of(
            PayFrequencyType.WEEKLY, "Wkly",
            PayFrequencyType.BIWEEKLY, "BiWk",
            PayFrequencyType.SEMIMONTHLY, "SemiMo",
            PayFrequencyType.MONTHLY, "Mo"
    ));

    private static final Map<PayDay, String> PAY_DAY_ABBREVIATIONS = new EnumMap<>(Map.of(
            PayDay.FRIDAY, "Fri",
            PayDay.THURSDAY, "Thu",
            PayDay.CURRENT, "Cur",
            PayDay.CUSTOM, "Cus"
    ));

    /**
     * Frequency letter followed by the most specific split cause: union digit, time zone,
     * business unit, then pay day.
     */
    public String makeCode(PayFrequency freq, BusinessUnit bu, Union union, TimeZone tz) {
        return String.valueOf(frequencyPrefix(freq)) + secondCharacter(freq, bu, union, tz);
    }

    public String makeDescription(PayFrequency freq, BusinessUnit bu, Union union, TimeZone tz) {
        List<String> parts = new ArrayList<>();
        if (freq.type() != null) {
            parts.add(FREQUENCY_ABBREVIATIONS.get(freq.type()));
        }

        if (union == null && tz == null && !bu.requiresSeparateArea()) {
            parts.add(PAY_DAY_ABBREVIATIONS.getOrDefault(freq.payDay(), "Pay"));
        }
        if (splitsOnBusinessUnit(bu)) {
            String name = bu.name() == null ? bu.code() : bu.name();
            parts.add(name.length() > BUSINESS_UNIT_NAME_LENGTH ? name.substring(0, BUSINESS_UNIT_NAME_LENGTH) : name);
        }
        if (tz != null && tz.affectsProcessing()) {
            parts.add(tz.code().name());
        }
        if (union != null && union.qualifiesForSplit()) {
            parts.add(union.code());
        }

        String description = String.join(" ", parts);
        // SAP field length, cut mid-word if needed
        if (description.length() > DESCRIPTION_MAX_LENGTH) {
            description = description.substring(0, DESCRIPTION_MAX_LENGTH);
        }
        return description;
    }

    public List<String> makeReasoning(PayFrequency freq, BusinessUnit bu, Union union, TimeZone tz) {
        List<String> reasons = new ArrayList<>();
        reasons.add(String.format("Pay frequency: %s (%d employees)",
                freq.type() == null ? UNKNOWN_FREQUENCY : freq.type().value(), freq.employeeCount()));

        if (bu.requiresSeparateArea()) {
            reasons.add("Business unit requires separate area: " + bu.name());
        }
        if (union != null && union.uniqueCalendar()) {
            reasons.add("Union " + union.code() + " requires unique payroll calendar");
        }
        if (union != null && union.uniqueFunding()) {
            reasons.add("Union " + union.code() + " requires separate funding tracking");
        }
        if (tz != null && tz.affectsProcessing()) {
            reasons.add("Time zone " + tz.name() + " affects payroll processing timing");
        }
        return List.copyOf(reasons);
    }

    private char frequencyPrefix(PayFrequency freq) {
        // explicit so semimonthly never reads as a "services" unit letter
        if (freq.type() == null) {
            return 'X';
        }
        if (freq.type() == PayFrequencyType.SEMIMONTHLY) {
            return 'S';
        }
        return Character.toUpperCase(freq.type().value().charAt(0));
    }

    private char secondCharacter(PayFrequency freq, BusinessUnit bu, Union union, TimeZone tz) {
        if (union != null && union.qualifiesForSplit()) {
            String digits = union.code() == null ? "" : union.code().replaceAll("\\D", "");
            return digits.isEmpty() ? 'U' : digits.charAt(0);
        }
        if (tz != null && tz.affectsProcessing()) {
            return tz.code().name().charAt(0);
        }
        if (splitsOnBusinessUnit(bu) && !bu.code().isEmpty()) {
            return Character.toUpperCase(bu.code().charAt(0));
        }
        return payDayLetter(freq.payDay());
    }

    private char payDayLetter(PayDay payDay) {
        if (payDay == null) {
            return 'X';
        }
        return switch (payDay) {
            case FRIDAY -> 'F';
            case THURSDAY -> 'T';
            case CURRENT -> 'C';
            case CUSTOM -> 'X';
        };
    }

    private boolean splitsOnBusinessUnit(BusinessUnit bu) {
        return bu.requiresSeparateArea() && !bu.isAllUnits();
    }
}
