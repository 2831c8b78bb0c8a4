package com.webcrawler.app;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.webcrawler.core.api.FetchException;
import com.webcrawler.core.model.FetchRequest;
import org.junit.jupiter.api.Test;

import java.io.StringWriter;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class JsonlResultWriterTest {

    private final ObjectMapper om = new ObjectMapper();

    @Test
    void writesOneJsonObjectPerPage() throws Exception {
        StringWriter sw = new StringWriter();
        try (JsonlResultWriter w = new JsonlResultWriter(sw)) {
            w.onPage(FetchRequest.of("https://example.com"), Map.of("title", "Home"), null);
            w.onPage(FetchRequest.of("https://example.com/x"), null, new FetchException("https://example.com/x", "boom"));
        }

        String[] lines = sw.toString().split("\n");
        assertThat(lines).hasSize(2);

        JsonNode ok = om.readTree(lines[0]);
        assertThat(ok.get("ok").asBoolean()).isTrue();
        assertThat(ok.get("error").isNull()).isTrue();
        assertThat(ok.get("parsed").get("title").asText()).isEqualTo("Home");

        JsonNode failed = om.readTree(lines[1]);
        assertThat(failed.get("url").asText()).isEqualTo("https://example.com/x");
        assertThat(failed.get("ok").asBoolean()).isFalse();
        assertThat(failed.get("error").asText()).isEqualTo("boom");
    }

    @Test
    void concurrentPages_doNotInterleave() throws Exception {
        StringWriter sw = new StringWriter();
        JsonlResultWriter w = new JsonlResultWriter(sw);
        ExecutorService ex = Executors.newFixedThreadPool(8);
        for (int i = 0; i < 200; i++) {
            String url = "https://example.com/p" + i;
            ex.submit(() -> w.onPage(FetchRequest.of(url), Map.of("n", url), null));
        }
        ex.shutdown();
        assertThat(ex.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

        assertThat(w.lineCount()).isEqualTo(200);
        for (String line : sw.toString().split("\n")) {
            assertThat(om.readTree(line).get("url").asText()).startsWith("https://example.com/p");
        }
    }
}
