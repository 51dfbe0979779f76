package com.example.payrollarea.area;

import com.example.payrollarea.exception.BusinessException;
import com.example.payrollarea.profile.CompanyProfile;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Entry point for callers holding a profile. Every profile change is answered with a full
 * recomputation; consultant edits skip the reducer but are always re-validated.
 */
@Service
@Validated
public class PayrollAreaConfigurationService {

    private static final Logger logger = LoggerFactory.getLogger(PayrollAreaConfigurationService.class);

    private final MinimalAreaReducer reducer;
    private final ConfigValidator validator;

    public PayrollAreaConfigurationService(MinimalAreaReducer reducer, ConfigValidator validator) {
        this.reducer = reducer;
        this.validator = validator;
    }

    public AreaConfiguration recalculate(@NotNull @Valid CompanyProfile profile) {
        List<PayrollArea> areas = reducer.deriveAreas(profile);
        ValidationResult validation = validator.validate(profile, areas);
        logResult(profile, areas, validation);
        return new AreaConfiguration(profile, areas, validation);
    }

    public AreaConfiguration applyEdit(@NotNull AreaConfiguration configuration, int index,
                                       @NotNull @Valid PayrollAreaEdit edit) {
        List<PayrollArea> areas = new ArrayList<>(configuration.payrollAreas());
        if (index < 0 || index >= areas.size()) {
            throw new BusinessException("AREA_NOT_FOUND",
                    "No payroll area at position " + index + " (" + areas.size() + " configured)", index);
        }
        PayrollArea edited = edit.applyTo(areas.get(index));
        areas.set(index, edited);
        logger.info("Consultant edit applied to payroll area {} at position {}", edited.code(), index);
        return replaceAreas(configuration, areas);
    }

    public AreaConfiguration replaceAreas(@NotNull AreaConfiguration configuration, @NotNull List<PayrollArea> areas) {
        ValidationResult validation = validator.validate(configuration.profile(), areas);
        logResult(configuration.profile(), areas, validation);
        return new AreaConfiguration(configuration.profile(), areas, validation);
    }

    private void logResult(CompanyProfile profile, List<PayrollArea> areas, ValidationResult validation) {
        logger.info("Company {}: {} payroll areas covering {} of {} employees",
                profile.companyId(), areas.size(), validation.employeesCovered(), validation.totalEmployees());
        if (!validation.isValid()) {
            logger.warn("Company {} payroll area configuration is invalid: {}", profile.companyId(), validation.errors());
        }
        if (logger.isDebugEnabled()) {
            areas.forEach(area -> logger.debug("  {} {} calendar={} employees={}",
                    area.code(), area.description(), area.calendarId(), area.employeeCount()));
        }
    }
}
