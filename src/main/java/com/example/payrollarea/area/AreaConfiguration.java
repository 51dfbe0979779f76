package com.example.payrollarea.area;

import com.example.payrollarea.profile.CompanyProfile;

import java.util.List;

/**
 * A profile, the payroll areas currently configured for it and their validation.
 */
public record AreaConfiguration(CompanyProfile profile, List<PayrollArea> payrollAreas, ValidationResult validation) {

    public AreaConfiguration {
        payrollAreas = payrollAreas == null ? List.of() : List.copyOf(payrollAreas);
    }
}
