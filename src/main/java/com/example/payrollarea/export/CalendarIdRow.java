package com.example.payrollarea.export;

import com.fasterxml.jackson.annotation.JsonProperty;

public record CalendarIdRow(
        @JsonProperty("period_parameters") String periodParameters,
        @JsonProperty("period_parameter_name") String periodParameterName,
        @JsonProperty("time_unit") String timeUnit,
        @JsonProperty("time_unit_desc") String timeUnitDesc,
        @JsonProperty("start_date") String startDate
) {
}
