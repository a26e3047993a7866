package org.iceforge.influxexporter.api;

import org.iceforge.influxexporter.config.ExporterProperties;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.util.HtmlUtils;

@RestController
public class LandingController {

    private final String page;

    public LandingController(ExporterProperties props) {
        String metricsPath = HtmlUtils.htmlEscape(props.metricsPath());
        this.page = """
                <html>
                <head><title>InfluxDB Exporter</title></head>
                <body>
                <h1>InfluxDB Exporter</h1>
                <p><a href="%s">Metrics</a></p>
                </body>
                </html>
                """.formatted(metricsPath);
    }

    @GetMapping(value = "/", produces = MediaType.TEXT_HTML_VALUE)
    public String index() {
        return page;
    }
}
