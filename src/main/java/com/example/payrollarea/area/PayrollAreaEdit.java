package com.example.payrollarea.area;

import com.example.payrollarea.profile.TimeZoneCode;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;

/**
 * Partial change a consultant makes to one generated area. {@code null} fields keep the
 * current value.
 */
public record PayrollAreaEdit(
        @Size(min = 2, max = 2, message = "Area code must be exactly 2 characters") String code,
        @Size(max = 20, message = "Description must not exceed 20 characters") String description,
        String calendarId,
        @Min(value = 0, message = "Employee count must not be negative") Integer employeeCount,
        String businessUnit,
        TimeZoneCode timeZone,
        String union,
        String periodPattern,
        String payDay,
        String region
) {

    public PayrollArea applyTo(PayrollArea area) {
        return new PayrollArea(
                code != null ? code : area.code(),
                description != null ? description : area.description(),
                area.frequency(),
                calendarId != null ? calendarId : area.calendarId(),
                businessUnit != null ? businessUnit : area.businessUnit(),
                timeZone != null ? timeZone : area.timeZone(),
                union != null ? union : area.union(),
                employeeCount != null ? employeeCount : area.employeeCount(),
                GeneratedBy.CONSULTANT,
                area.reasoning(),
                periodPattern != null ? periodPattern : area.periodPattern(),
                payDay != null ? payDay : area.payDay(),
                region != null ? region : area.region()
        );
    }
}
