package com.vidnyan.statute.adapter.out.report;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.statute.application.port.out.VerificationReportWriter;
import com.vidnyan.statute.domain.verification.VerificationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;

/**
 * Writes verification results as JSON.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JsonVerificationReportWriter implements VerificationReportWriter {

    private final ObjectMapper objectMapper;

    @Override
    public String render(VerificationResult result) {
        try {
            return objectMapper.writeValueAsString(VerificationReport.build(result));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to render verification report", e);
        }
    }

    @Override
    public void write(VerificationResult result, OutputStream out) throws IOException {
        VerificationReport report = VerificationReport.build(result);
        objectMapper.writer().without(JsonGenerator.Feature.AUTO_CLOSE_TARGET)
                .writeValue(out, report);
        log.debug("Wrote verification report with {} findings", report.getSummary().getTotalFindings());
    }
}
