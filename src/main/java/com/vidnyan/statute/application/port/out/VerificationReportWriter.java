package com.vidnyan.statute.application.port.out;

import com.vidnyan.statute.domain.verification.VerificationResult;

import java.io.IOException;
import java.io.OutputStream;

/**
 * Port for exporting verification results.
 */
public interface VerificationReportWriter {

    /**
     * Render a result as text.
     */
    String render(VerificationResult result);

    /**
     * Write a rendered result to a stream. The stream is left open.
     */
    void write(VerificationResult result, OutputStream out) throws IOException;
}
