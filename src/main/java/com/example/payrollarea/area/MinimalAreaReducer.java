package com.example.payrollarea.area;

import com.example.payrollarea.profile.BusinessUnit;
import com.example.payrollarea.profile.CompanyProfile;
import com.example.payrollarea.profile.PayFrequency;
import com.example.payrollarea.profile.TimeZone;
import com.example.payrollarea.profile.Union;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Derives the smallest set of payroll areas a profile needs.
 * <p>
 * Splitting criteria, evaluated per pay frequency in priority order:
 * <ol>
 *     <li>pay frequency, always</li>
 *     <li>business unit, only units flagged as requiring a separate area</li>
 *     <li>union, only unions with a unique calendar or unique funding; employees outside those
 *     unions get one remainder area</li>
 *     <li>time zone, only when no union split happened and more than one zone affects processing</li>
 * </ol>
 * The result keeps the order of the profile's lists. Identical frequencies yield identical codes;
 * {@link ConfigValidator} reports those.
 */
@Component
public class MinimalAreaReducer {

    private static final Logger logger = LoggerFactory.getLogger(MinimalAreaReducer.class);

    private final AreaCodeSynthesizer codeSynthesizer;
    private final CalendarIdResolver calendarIdResolver;

    public MinimalAreaReducer(AreaCodeSynthesizer codeSynthesizer, CalendarIdResolver calendarIdResolver) {
        this.codeSynthesizer = codeSynthesizer;
        this.calendarIdResolver = calendarIdResolver;
    }

    /**
     * Expects a profile without {@code null} list entries, as checked by
     * {@link PayrollAreaConfigurationService}. A frequency whose type is unknown still yields
     * areas, with code prefix {@code X} and calendar {@value CalendarIdResolver#UNKNOWN_CALENDAR_ID}.
     */
    public List<PayrollArea> deriveAreas(CompanyProfile profile) {
        List<BusinessUnit> separateUnits = profile.businessUnits().stream()
                .filter(BusinessUnit::requiresSeparateArea)
                .toList();
        List<Union> splittingUnions = profile.unions().stream()
                .filter(Union::qualifiesForSplit)
                .toList();
        List<TimeZone> processingZones = profile.timeZones().stream()
                .filter(TimeZone::affectsProcessing)
                .toList();

        List<PayrollArea> areas = profile.payFrequencies().stream()
                .flatMap(freq -> unitsFor(freq, separateUnits).stream()
                        .flatMap(bu -> areasFor(freq, bu, splittingUnions, processingZones)))
                .toList();

        logger.debug("Derived {} payroll areas from {} pay frequencies", areas.size(), profile.payFrequencies().size());
        return areas;
    }

    private List<BusinessUnit> unitsFor(PayFrequency freq, List<BusinessUnit> separateUnits) {
        if (separateUnits.isEmpty()) {
            return List.of(BusinessUnit.allUnits(freq.employeeCount()));
        }
        return separateUnits;
    }

    private Stream<PayrollArea> areasFor(PayFrequency freq, BusinessUnit bu,
                                         List<Union> splittingUnions, List<TimeZone> processingZones) {
        if (!splittingUnions.isEmpty()) {
            return unionAreas(freq, bu, splittingUnions).stream();
        }
        if (processingZones.size() > 1) {
            return processingZones.stream()
                    .map(tz -> createArea(freq, bu, null, tz).withEmployeeCount(tz.employeeCount()));
        }
        return Stream.of(createArea(freq, bu, null, null));
    }

    private List<PayrollArea> unionAreas(PayFrequency freq, BusinessUnit bu, List<Union> splittingUnions) {
        List<PayrollArea> areas = new ArrayList<>();
        int unionEmployees = 0;
        for (Union union : splittingUnions) {
            areas.add(createArea(freq, bu, union, null).withEmployeeCount(union.employeeCount()));
            unionEmployees += union.employeeCount();
        }
        int nonUnionEmployees = freq.employeeCount() - unionEmployees;
        if (nonUnionEmployees > 0) {
            areas.add(createArea(freq, bu, null, null).withEmployeeCount(nonUnionEmployees));
        }
        return List.copyOf(areas);
    }

    private PayrollArea createArea(PayFrequency freq, BusinessUnit bu, Union union, TimeZone tz) {
        String calendarId = calendarIdResolver.resolveCalendarId(freq, union != null && union.uniqueCalendar());
        return new PayrollArea(
                codeSynthesizer.makeCode(freq, bu, union, tz),
                codeSynthesizer.makeDescription(freq, bu, union, tz),
                freq.type(),
                calendarId,
                bu.code(),
                tz == null ? null : tz.code(),
                union == null ? null : union.code(),
                freq.employeeCount(),
                GeneratedBy.SYSTEM,
                codeSynthesizer.makeReasoning(freq, bu, union, tz),
                null,
                null,
                null
        );
    }
}
