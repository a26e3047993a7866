package org.iceforge.influxexporter.api;

import jakarta.servlet.http.HttpServletRequest;
import org.iceforge.influxexporter.core.ExporterContext;
import org.iceforge.influxexporter.ingest.SampleIngestor;
import org.iceforge.influxexporter.lineprotocol.LineProtocolParser;
import org.iceforge.influxexporter.sample.Sample;
import org.iceforge.influxexporter.sample.SampleStore;
import org.iceforge.influxexporter.sample.SampleTranslator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

class WriteControllerTest {

    private final Clock clock = Clock.fixed(Instant.ofEpochSecond(60), ZoneOffset.UTC);
    private ExporterContext context;
    private SampleStore store;
    private WriteController controller;
    private MockMvc mockMvc;

    @BeforeEach
    void setup() {
        context = new ExporterContext(clock, Duration.ofMinutes(5));
        store = new SampleStore(context, Duration.ofMinutes(1));
        store.start();
        SampleIngestor ingestor = new SampleIngestor(new LineProtocolParser(), new SampleTranslator(), store, clock);
        controller = new WriteController(context, ingestor);
        mockMvc = MockMvcBuilders.standaloneSetup(controller).build();
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    @Test
    void write_acceptsValidBodyWith204() throws Exception {
        mockMvc.perform(post("/write").content("cpu,host=a value=42 1000000000"))
                .andExpect(status().isNoContent())
                .andExpect(content().string(""));

        await().atMost(Duration.ofSeconds(5)).until(() -> store.size() == 1);
        Sample s = store.snapshot().get(0);
        assertThat(s.name()).isEqualTo("cpu");
        assertThat(s.value()).isEqualTo(42.0);
        assertThat(s.timestamp()).isEqualTo(Instant.ofEpochSecond(1));
        assertThat(context.lastPush().get()).isEqualTo(60.0);
    }

    @Test
    void write_emptyBodyIsAccepted() throws Exception {
        mockMvc.perform(post("/write"))
                .andExpect(status().isNoContent());
        assertThat(context.lastPush().get()).isEqualTo(60.0);
    }

    @Test
    void write_appliesPrecisionParameter() throws Exception {
        mockMvc.perform(post("/write").param("precision", "s").content("cpu value=1 1700000000"))
                .andExpect(status().isNoContent());

        await().atMost(Duration.ofSeconds(5)).until(() -> store.size() == 1);
        assertThat(store.snapshot().get(0).timestamp()).isEqualTo(Instant.ofEpochSecond(1_700_000_000L));
    }

    @Test
    void write_malformedBodyReturns400AndStoresNothing() throws Exception {
        mockMvc.perform(post("/write").content("cpu value=1 1\nbroken"))
                .andExpect(status().isBadRequest())
                .andExpect(content().contentTypeCompatibleWith(MediaType.TEXT_PLAIN))
                .andExpect(content().string("error parsing request: unable to parse 'broken': missing fields\n"));

        assertThat(store.size()).isZero();
        // the push is recorded even though the body was rejected
        assertThat(context.lastPush().get()).isEqualTo(60.0);
    }

    @Test
    void write_unreadableBodyReturns500() throws Exception {
        HttpServletRequest request = Mockito.mock(HttpServletRequest.class);
        Mockito.when(request.getInputStream()).thenThrow(new IOException("connection reset"));

        ResponseEntity<String> response = controller.write(request);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody()).isEqualTo("error reading body: connection reset\n");
        assertThat(context.lastPush().get()).isEqualTo(60.0);
    }
}
