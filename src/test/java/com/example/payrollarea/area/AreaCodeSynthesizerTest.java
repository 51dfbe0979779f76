package com.example.payrollarea.area;

import com.example.payrollarea.profile.BusinessUnit;
import com.example.payrollarea.profile.CalendarPattern;
import com.example.payrollarea.profile.PayDay;
import com.example.payrollarea.profile.PayFrequency;
import com.example.payrollarea.profile.PayFrequencyType;
import com.example.payrollarea.profile.TimeZone;
import com.example.payrollarea.profile.TimeZoneCode;
import com.example.payrollarea.profile.Union;
import org.junit.jupiter.api.Test;

import static com.example.payrollarea.profile.ProfileFixtures.allUnits;
import static com.example.payrollarea.profile.ProfileFixtures.hawaii;
import static com.example.payrollarea.profile.ProfileFixtures.weeklyFriday;
import static org.assertj.core.api.Assertions.assertThat;

class AreaCodeSynthesizerTest {

    private final AreaCodeSynthesizer synthesizer = new AreaCodeSynthesizer();

    private final BusinessUnit construction = new BusinessUnit("construction", "Construction Services", 60, true);
    private final Union local39 = new Union("L39", "Local 39", 20, true, false);

    @Test
    void makeCode_withoutSplit_usesFrequencyAndPayDay() {
        assertThat(synthesizer.makeCode(weeklyFriday(100), allUnits(), null, null)).isEqualTo("WF");
        assertThat(synthesizer.makeCode(freq(PayFrequencyType.BIWEEKLY, PayDay.THURSDAY), allUnits(), null, null))
                .isEqualTo("BT");
        assertThat(synthesizer.makeCode(freq(PayFrequencyType.MONTHLY, PayDay.CURRENT), allUnits(), null, null))
                .isEqualTo("MC");
        assertThat(synthesizer.makeCode(freq(PayFrequencyType.MONTHLY, PayDay.CUSTOM), allUnits(), null, null))
                .isEqualTo("MX");
    }

    @Test
    void makeCode_semimonthlyAlwaysStartsWithS() {
        assertThat(synthesizer.makeCode(freq(PayFrequencyType.SEMIMONTHLY, PayDay.THURSDAY), allUnits(), null, null))
                .isEqualTo("ST");
    }

    @Test
    void makeCode_unionTakesPrecedenceOverTimeZoneAndBusinessUnit() {
        String code = synthesizer.makeCode(weeklyFriday(100), construction, local39, hawaii(20, true));

        assertThat(code).isEqualTo("W3");
    }

    @Test
    void makeCode_unionWithoutDigits_usesU() {
        Union teamsters = new Union("TEAM", "Teamsters", 10, false, true);

        assertThat(synthesizer.makeCode(weeklyFriday(100), allUnits(), teamsters, null)).isEqualTo("WU");
    }

    @Test
    void makeCode_nonQualifyingUnionIsIgnored() {
        Union plain = new Union("L50", "Local 50", 10, false, false);

        assertThat(synthesizer.makeCode(weeklyFriday(100), allUnits(), plain, null)).isEqualTo("WF");
    }

    @Test
    void makeCode_timeZoneBeforeBusinessUnit() {
        assertThat(synthesizer.makeCode(weeklyFriday(100), construction, null, hawaii(20, true))).isEqualTo("WH");
        assertThat(synthesizer.makeCode(weeklyFriday(100), construction, null, hawaii(20, false))).isEqualTo("WC");
    }

    @Test
    void makeDescription_withoutSplit_includesPayDay() {
        assertThat(synthesizer.makeDescription(weeklyFriday(100), allUnits(), null, null)).isEqualTo("Wkly Fri");
        assertThat(synthesizer.makeDescription(freq(PayFrequencyType.SEMIMONTHLY, PayDay.CURRENT), allUnits(), null, null))
                .isEqualTo("SemiMo Cur");
    }

    @Test
    void makeDescription_businessUnitNameIsShortened() {
        assertThat(synthesizer.makeDescription(weeklyFriday(100), construction, null, null)).isEqualTo("Wkly Construc");
    }

    @Test
    void makeDescription_isCutAtTwentyCharacters() {
        Union longCode = new Union("L1234567890", "Local", 5, true, true);
        BusinessUnit unit = new BusinessUnit("construction", "Construction", 60, true);
        PayFrequency biweekly = freq(PayFrequencyType.BIWEEKLY, PayDay.FRIDAY);

        String description = synthesizer.makeDescription(biweekly, unit, longCode, hawaii(20, true));

        assertThat(description).isEqualTo("BiWk Construc HI L12");
        assertThat(description).hasSize(AreaCodeSynthesizer.DESCRIPTION_MAX_LENGTH);
        assertThat(synthesizer.makeCode(biweekly, unit, longCode, hawaii(20, true))).isEqualTo("B1");
    }

    @Test
    void makeDescription_unionReplacesPayDay() {
        assertThat(synthesizer.makeDescription(weeklyFriday(100), allUnits(), local39, null)).isEqualTo("Wkly L39");
    }

    @Test
    void makeReasoning_listsCausesInFixedOrder() {
        Union both = new Union("L11", "Local 11", 30, true, true);
        TimeZone hawaii = new TimeZone(TimeZoneCode.HI, "Hawaii", 20, true);

        assertThat(synthesizer.makeReasoning(weeklyFriday(100), construction, both, hawaii)).containsExactly(
                "Pay frequency: weekly (100 employees)",
                "Business unit requires separate area: Construction Services",
                "Union L11 requires unique payroll calendar",
                "Union L11 requires separate funding tracking",
                "Time zone Hawaii affects payroll processing timing");
    }

    @Test
    void makeReasoning_withoutSplit_onlyFrequencyLine() {
        assertThat(synthesizer.makeReasoning(weeklyFriday(100), allUnits(), null, null))
                .containsExactly("Pay frequency: weekly (100 employees)");
    }

    private PayFrequency freq(PayFrequencyType type, PayDay payDay) {
        return PayFrequency.of(type, 50, CalendarPattern.MON_SUN, payDay);
    }
}
