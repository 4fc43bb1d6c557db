package com.precheck.engine.runtime.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.precheck.engine.api.json.JsonMappers;
import com.precheck.engine.api.model.ComplianceReport;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;

/**
 * Serializes reports for the API layer: snake_case fields, lowercase enum
 * values for verdicts, ISO-8601 {@code generated_at}.
 */
public final class ReportJsonWriter {

    private final ObjectWriter writer;

    public ReportJsonWriter() {
        this(false);
    }

    public ReportJsonWriter(boolean pretty) {
        ObjectWriter base = JsonMappers.create().writerFor(ComplianceReport.class);
        this.writer = pretty ? base.with(SerializationFeature.INDENT_OUTPUT) : base;
    }

    public String toJson(ComplianceReport report) {
        try {
            return writer.writeValueAsString(report);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize report " + report.reportId(), e);
        }
    }

    public void write(ComplianceReport report, OutputStream out) throws IOException {
        writer.writeValue(out, report);
    }
}
