package com.dnobretech.contentalignerbackend.client;

import com.dnobretech.contentalignerbackend.exception.CollaboratorException;
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
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EmbeddingsClientTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private HttpServer server;
    private EmbeddingsClient client;
    private final List<JsonNode> requests = new CopyOnWriteArrayList<>();
    private final AtomicInteger calls = new AtomicInteger();

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/embed", this::handleEmbed);
        server.start();

        client = new EmbeddingsClient();
        ReflectionTestUtils.setField(client, "baseUrl", "http://127.0.0.1:" + server.getAddress().getPort());
        ReflectionTestUtils.setField(client, "batchSize", 2);
        ReflectionTestUtils.setField(client, "timeoutSeconds", 5L);
        ReflectionTestUtils.setField(client, "normalize", true);
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    private void handleEmbed(HttpExchange ex) throws IOException {
        calls.incrementAndGet();
        JsonNode body = MAPPER.readTree(ex.getRequestBody());
        requests.add(body);

        List<List<Double>> vectors = new ArrayList<>();
        for (JsonNode t : body.get("texts")) {
            String text = t.asText();
            // lote com texto "boom..." responde 500
            if (text.startsWith("boom")) {
                respond(ex, 500, "{\"error\":\"boom\"}");
                return;
            }
            vectors.add(List.of((double) text.length(), 1.0));
        }
        respond(ex, 200, MAPPER.writeValueAsString(Map.of("model", "test", "dims", 2, "vectors", vectors)));
    }

    private static void respond(HttpExchange ex, int status, String json) throws IOException {
        byte[] bytes = json.getBytes(StandardCharsets.UTF_8);
        ex.getResponseHeaders().add("Content-Type", "application/json");
        ex.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = ex.getResponseBody()) {
            os.write(bytes);
        }
    }

    @Test
    void embedsInSlicesKeepingOrder() {
        List<float[]> out = client.embed(List.of("a", "bb", "ccc", "dddd", "eeeee"));

        assertThat(out).hasSize(5);
        assertThat(out).extracting(v -> v[0]).containsExactly(1f, 2f, 3f, 4f, 5f);
        assertThat(requests).hasSize(3);
        assertThat(requests.get(0).get("normalize").asBoolean()).isTrue();
        assertThat(requests.get(2).get("texts")).hasSize(1);
    }

    @Test
    void failedSliceLeavesNullsAndOthersSurvive() {
        List<float[]> out = client.embed(List.of("ok1", "ok2", "boom", "x"));

        assertThat(out).hasSize(4);
        assertThat(out.get(0)).isNotNull();
        assertThat(out.get(1)).isNotNull();
        assertThat(out.get(2)).isNull();
        assertThat(out.get(3)).isNull();
        // 1 lote ok + 1 lote com 2 retries
        assertThat(calls.get()).isEqualTo(4);
    }

    @Test
    void availabilityProbeUsesEmbedEndpoint() {
        assertThat(client.isAvailable()).isTrue();

        ReflectionTestUtils.setField(client, "baseUrl", "http://127.0.0.1:1");
        assertThat(client.isAvailable()).isFalse();
    }

    @Test
    void missingBaseUrlIsCollaboratorError() {
        ReflectionTestUtils.setField(client, "baseUrl", "");
        assertThatThrownBy(() -> client.embed(List.of("x")))
                .isInstanceOf(CollaboratorException.class);
    }

    @Test
    void emptyInputMakesNoCall() {
        assertThat(client.embed(List.of())).isEmpty();
        assertThat(calls.get()).isZero();
    }
}
