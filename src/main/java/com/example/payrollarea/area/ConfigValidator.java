package com.example.payrollarea.area;

import com.example.payrollarea.profile.CompanyProfile;
import com.example.payrollarea.profile.Union;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Cross-checks a list of payroll areas, generated or hand-edited, against the profile.
 * Every rule runs; warnings never make the configuration invalid.
 */
@Component
public class ConfigValidator {

    public ValidationResult validate(CompanyProfile profile, List<PayrollArea> areas) {
        List<String> warnings = new ArrayList<>();
        List<String> errors = new ArrayList<>();

        int employeesCovered = areas.stream().mapToInt(PayrollArea::employeeCount).sum();
        int totalEmployees = profile.totalEmployees();

        if (employeesCovered < totalEmployees) {
            warnings.add(String.format("Only %d of %d employees are assigned to payroll areas",
                    employeesCovered, totalEmployees));
        }
        if (employeesCovered > totalEmployees) {
            errors.add(String.format("Employee count mismatch: %d assigned but only %d total",
                    employeesCovered, totalEmployees));
        }

        for (Union union : profile.unions()) {
            if (union.uniqueCalendar() && areas.stream().noneMatch(a -> Objects.equals(a.union(), union.code()))) {
                warnings.add("Union " + union.code() + " requires unique calendar but no separate payroll area created");
            }
        }

        List<String> duplicates = duplicateCodes(areas);
        if (!duplicates.isEmpty()) {
            errors.add("Duplicate payroll area codes: " + String.join(", ", duplicates));
        }

        return new ValidationResult(errors.isEmpty(), employeesCovered, totalEmployees, warnings, errors);
    }

    /**
     * Every occurrence after the first, in list order.
     */
    private List<String> duplicateCodes(List<PayrollArea> areas) {
        Set<String> seen = new HashSet<>();
        List<String> duplicates = new ArrayList<>();
        for (PayrollArea area : areas) {
            if (!seen.add(area.code())) {
                duplicates.add(area.code());
            }
        }
        return duplicates;
    }
}
