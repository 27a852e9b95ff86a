package com.dnobretech.contentalignerbackend.client;

import com.dnobretech.contentalignerbackend.dto.ContentRecord;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;

class TranslateClientTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private HttpServer server;
    private TranslateClient client;
    private final List<JsonNode> requests = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/translate/batch", this::handle);
        server.start();

        client = new TranslateClient();
        ReflectionTestUtils.setField(client, "baseUrl", "http://127.0.0.1:" + server.getAddress().getPort());
        ReflectionTestUtils.setField(client, "batchSize", 10);
        ReflectionTestUtils.setField(client, "timeoutSeconds", 5L);
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    // traduz como "EN:<texto>" e devolve também um id que ninguém pediu
    private void handle(HttpExchange ex) throws IOException {
        JsonNode body = MAPPER.readTree(ex.getRequestBody());
        requests.add(body);
        List<Map<String, Object>> results = new ArrayList<>();
        for (JsonNode it : body.get("items")) {
            results.add(Map.of("id", it.get("id").asText(), "translation", "EN:" + it.get("text").asText(), "cached", false));
        }
        results.add(Map.of("id", "intruso", "translation", "??", "cached", false));

        byte[] bytes = MAPPER.writeValueAsString(Map.of("results", results, "model_id", "test"))
                .getBytes(StandardCharsets.UTF_8);
        ex.getResponseHeaders().add("Content-Type", "application/json");
        ex.sendResponseHeaders(200, bytes.length);
        try (OutputStream os = ex.getResponseBody()) {
            os.write(bytes);
        }
    }

    @Test
    void translatesByIdAndDropsUnrequestedIds() {
        List<ContentRecord> rows = List.of(
                ContentRecord.of("k1", "안녕", 0),
                ContentRecord.of("k2", "<b>감사</b>", 1).withCleanText("감사"));

        Map<Integer, String> out = client.translateBatch(rows, "ko", "en");

        assertThat(out).containsOnly(Map.entry(0, "EN:안녕"), Map.entry(1, "EN:감사"));
        JsonNode first = requests.get(0).get("items").get(0);
        assertThat(first.get("id").asText()).isEqualTo("0");
        assertThat(first.get("src_lang").asText()).isEqualTo("ko");
        assertThat(first.get("tgt_lang").asText()).isEqualTo("en");
    }

    @Test
    void blankAndRepeatedIdsStillGetTheirOwnTranslation() {
        List<ContentRecord> rows = List.of(
                ContentRecord.of("", "primeira", 0),
                ContentRecord.of("", "segunda", 1),
                ContentRecord.of("x", "terceira", 2),
                ContentRecord.of("x", "quarta", 3));

        Map<Integer, String> out = client.translateBatch(rows, "pt", "en");

        assertThat(out).containsOnly(
                Map.entry(0, "EN:primeira"), Map.entry(1, "EN:segunda"),
                Map.entry(2, "EN:terceira"), Map.entry(3, "EN:quarta"));
    }

    @Test
    void unreachableServiceGivesEmptyMap() {
        ReflectionTestUtils.setField(client, "baseUrl", "http://127.0.0.1:1");
        assertThat(client.translateBatch(List.of(ContentRecord.of("k1", "x", 0)), "ko", "en")).isEmpty();
    }
}
