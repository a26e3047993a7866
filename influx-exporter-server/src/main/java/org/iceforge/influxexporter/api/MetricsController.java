package org.iceforge.influxexporter.api;

import io.prometheus.client.exporter.common.TextFormat;
import org.iceforge.influxexporter.core.ExporterContext;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.util.Objects;

/**
 * Prometheus scrape endpoint. Serves the text format, or OpenMetrics when the scraper asks for it.
 */
@RestController
public class MetricsController {

    private static final int SCRAPE_CHARS_EXTRA = 1024;

    private final ExporterContext context;

    private volatile int nextScrapeSize = 256;

    public MetricsController(ExporterContext context) {
        this.context = Objects.requireNonNull(context);
    }

    @GetMapping("${influx-exporter.metrics-path:/metrics}")
    public ResponseEntity<String> scrape(@RequestHeader(value = HttpHeaders.ACCEPT, required = false) String accept) {
        String contentType = TextFormat.chooseContentType(accept);
        Writer writer = new StringWriter(nextScrapeSize);
        try {
            TextFormat.writeFormat(contentType, writer, context.registry().metricFamilySamples());
        } catch (IOException e) {
            // StringWriter does not throw
            throw new IllegalStateException("Writing metrics failed", e);
        }

        String page = writer.toString();
        nextScrapeSize = page.length() + SCRAPE_CHARS_EXTRA;
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_TYPE, contentType)
                .body(page);
    }
}
