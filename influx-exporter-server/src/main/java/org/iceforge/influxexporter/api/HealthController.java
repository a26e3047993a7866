package org.iceforge.influxexporter.api;

import org.iceforge.influxexporter.core.ExporterContext;
import org.iceforge.influxexporter.sample.SampleStore;
import org.springframework.boot.actuate.health.HealthComponent;
import org.springframework.boot.actuate.health.HealthEndpoint;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Compact health summary for load balancers and humans.
 *
 * <p>Status comes from Actuator, so a DOWN ingestion indicator propagates.
 */
@RestController
@RequestMapping("/api")
public class HealthController {

    private final HealthEndpoint healthEndpoint;
    private final SampleStore store;
    private final ExporterContext context;

    public HealthController(HealthEndpoint healthEndpoint, SampleStore store, ExporterContext context) {
        this.healthEndpoint = Objects.requireNonNull(healthEndpoint);
        this.store = Objects.requireNonNull(store);
        this.context = Objects.requireNonNull(context);
    }

    @GetMapping("/health")
    public Map<String, Object> health() {
        HealthComponent hc = healthEndpoint.health();
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("status", hc.getStatus().getCode());
        out.put("samples", store.size());
        out.put("udpParseErrors", (long) context.udpParseErrors().get());
        return out;
    }
}
