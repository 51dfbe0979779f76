package com.example.payrollarea.export;

import com.example.payrollarea.area.PayrollArea;
import com.example.payrollarea.area.ValidationResult;
import com.example.payrollarea.profile.CompanyProfile;

import java.util.List;

/**
 * Shape of the JSON configuration export.
 *
 * @param exportedAt ISO-8601 instant
 */
public record ConfigurationExport(
        CompanyProfile profile,
        List<PayrollArea> payrollAreas,
        SapTables sapTables,
        ValidationResult validation,
        String exportedAt
) {
}
