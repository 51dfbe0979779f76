package com.example.payrollarea.export;

import com.example.payrollarea.area.AreaConfiguration;
import com.example.payrollarea.exception.ExportGenerationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

@Component
public class ConfigurationJsonExporter {

    private static final Logger logger = LoggerFactory.getLogger(ConfigurationJsonExporter.class);

    private final ObjectMapper objectMapper;
    private final SapTableBuilder tableBuilder;
    private final Clock clock;

    public ConfigurationJsonExporter(ObjectMapper objectMapper, SapTableBuilder tableBuilder, Clock clock) {
        this.objectMapper = objectMapper;
        this.tableBuilder = tableBuilder;
        this.clock = clock;
    }

    public ConfigurationExport buildExport(AreaConfiguration configuration) {
        SapTables sapTables = new SapTables(
                tableBuilder.buildCalendars(configuration.payrollAreas()),
                tableBuilder.buildAreas(configuration.payrollAreas()));
        return new ConfigurationExport(
                configuration.profile(),
                configuration.payrollAreas(),
                sapTables,
                configuration.validation(),
                Instant.now(clock).toString());
    }

    public String export(AreaConfiguration configuration) {
        ConfigurationExport export = buildExport(configuration);
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(export);
        } catch (JsonProcessingException e) {
            logger.error("Failed to serialize payroll area configuration for company {}",
                    configuration.profile().companyId(), e);
            throw new ExportGenerationException("Payroll area configuration could not be exported", e);
        }
    }
}
