package org.iceforge.influxexporter.api;

import jakarta.servlet.http.HttpServletRequest;
import org.iceforge.influxexporter.core.ExporterContext;
import org.iceforge.influxexporter.ingest.SampleIngestor;
import org.iceforge.influxexporter.lineprotocol.LineProtocolException;
import org.iceforge.influxexporter.lineprotocol.Precision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.util.Objects;

/**
 * InfluxDB-compatible write endpoint.
 *
 * <p>The body is read straight from the servlet stream so that the last-push gauge is
 * updated before anything else happens, and so that form-encoded bodies are not consumed
 * as request parameters.
 */
@RestController
public class WriteController {
    private static final Logger log = LoggerFactory.getLogger(WriteController.class);

    private final ExporterContext context;
    private final SampleIngestor ingestor;

    public WriteController(ExporterContext context, SampleIngestor ingestor) {
        this.context = Objects.requireNonNull(context);
        this.ingestor = Objects.requireNonNull(ingestor);
    }

    @PostMapping("/write")
    public ResponseEntity<String> write(HttpServletRequest request) {
        context.markPush();

        byte[] body;
        try {
            body = request.getInputStream().readAllBytes();
        } catch (IOException e) {
            log.warn("Failed to read write request body from {}: {}", request.getRemoteAddr(), e.toString());
            return error(HttpStatus.INTERNAL_SERVER_ERROR, "error reading body: " + e.getMessage());
        }

        Precision precision = Precision.fromQueryValue(request.getParameter("precision"));
        try {
            int forwarded = ingestor.ingest(body, precision);
            log.debug("Write of {} bytes (precision={}) forwarded {} samples", body.length, precision, forwarded);
        } catch (LineProtocolException e) {
            log.debug("Rejecting write from {}: {}", request.getRemoteAddr(), e.getMessage());
            return error(HttpStatus.BAD_REQUEST, "error parsing request: " + e.getMessage());
        }

        // InfluxDB acknowledges writes with 204.
        return ResponseEntity.noContent().build();
    }

    private static ResponseEntity<String> error(HttpStatus status, String message) {
        return ResponseEntity.status(status)
                .contentType(MediaType.TEXT_PLAIN)
                .body(message + "\n");
    }
}
