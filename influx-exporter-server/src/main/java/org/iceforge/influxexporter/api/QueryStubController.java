package org.iceforge.influxexporter.api;

import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RestController;

/**
 * Some InfluxDB clients try to create a database before writing. Answer with an empty
 * result set so they carry on.
 */
@RestController
public class QueryStubController {

    static final String EMPTY_RESULTS = "{\"results\": []}";

    @RequestMapping(value = "/query", method = {RequestMethod.GET, RequestMethod.POST},
            produces = MediaType.APPLICATION_JSON_VALUE)
    public String query() {
        return EMPTY_RESULTS;
    }
}
