package com.archebuild.core.report.impl;

import com.archebuild.core.report.EnvelopeReport;
import com.archebuild.core.report.ReportGenerator;
import com.archebuild.core.renderer.GeneratedFile;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * Writes the report snapshot as pretty printed JSON, one object per building.
 */
public class JsonReportGenerator implements ReportGenerator {

    private final ObjectMapper objectMapper = new ObjectMapper()
        .enable(SerializationFeature.INDENT_OUTPUT);

    @Override
    public String getId() {
        return "json";
    }

    @Override
    public String getDisplayName() {
        return "JSON Envelope Report";
    }

    @Override
    public String getFileExtension() {
        return "json";
    }

    @Override
    public GeneratedFile generate(EnvelopeReport report) {
        try {
            String content = objectMapper.writeValueAsString(report);
            return new GeneratedFile(fileNameFor(report), content, "application/json");
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize report of building '" + report.buildingName() + "'", e);
        }
    }
}
