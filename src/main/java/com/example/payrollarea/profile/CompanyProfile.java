package com.example.payrollarea.profile;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Payroll profile of one company. List order is kept as given since it drives the order of
 * the derived payroll areas.
 *
 * @param securitySplitting reserved for access-control splits, not evaluated yet
 */
public record CompanyProfile(
        String companyId,
        String companyName,
        @Min(value = 0, message = "Total employees must not be negative") int totalEmployees,
        List<@NotNull(message = "Pay frequency entries must not be null") @Valid PayFrequency> payFrequencies,
        List<@NotNull(message = "Business unit entries must not be null") @Valid BusinessUnit> businessUnits,
        List<@NotNull(message = "Time zone entries must not be null") @Valid TimeZone> timeZones,
        List<@NotNull(message = "Union entries must not be null") @Valid Union> unions,
        boolean securitySplitting
) {

    public CompanyProfile {
        payFrequencies = copyOf(payFrequencies);
        businessUnits = copyOf(businessUnits);
        timeZones = copyOf(timeZones);
        unions = copyOf(unions);
    }

    // keeps null entries, the element constraints reject them
    private static <T> List<T> copyOf(List<T> values) {
        return values == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(values));
    }

    public CompanyProfile withTotalEmployees(int totalEmployees) {
        return new CompanyProfile(companyId, companyName, totalEmployees, payFrequencies,
                businessUnits, timeZones, unions, securitySplitting);
    }
}
