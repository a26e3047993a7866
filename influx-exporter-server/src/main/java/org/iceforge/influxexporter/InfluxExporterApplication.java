package org.iceforge.influxexporter;

import org.iceforge.influxexporter.config.ExporterProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(ExporterProperties.class)
public class InfluxExporterApplication {

    public static void main(String[] args) {
        SpringApplication.run(InfluxExporterApplication.class, args);
    }
}
