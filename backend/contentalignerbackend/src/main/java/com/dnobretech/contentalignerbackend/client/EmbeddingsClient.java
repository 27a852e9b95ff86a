package com.dnobretech.contentalignerbackend.client;

import com.dnobretech.contentalignerbackend.dto.EmbedResponse;
import com.dnobretech.contentalignerbackend.exception.CollaboratorException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

@Slf4j
@Component
@RequiredArgsConstructor
public class EmbeddingsClient implements EmbeddingProvider {

    private final WebClient webClient = WebClient.builder()
            .clientConnector(new ReactorClientHttpConnector(
                    HttpClient.create().responseTimeout(Duration.ofSeconds(90))
            ))
            // vetores de 768 floats x lote: 16MB dá folga
            .exchangeStrategies(ExchangeStrategies.builder()
                    .codecs(c -> c.defaultCodecs().maxInMemorySize(16 * 1024 * 1024))
                    .build())
            .build();

    @Value("${aligner.embeddings.base-url:}")
    private String baseUrl;                                                 // ex.: http://localhost:8001

    @Value("${aligner.embeddings.batch-size:50}")
    private int batchSize;

    @Value("${aligner.embeddings.timeout-seconds:60}")
    private long timeoutSeconds;

    @Value("${aligner.embeddings.normalize:true}")
    private boolean normalize;

    // POST /embed { "texts": [...], "normalize": true } → { "vectors": [[...],[...]] }
    @Override
    public List<float[]> embed(List<String> texts) {
        if (texts == null || texts.isEmpty()) return List.of();
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new CollaboratorException("aligner.embeddings.base-url não configurado");
        }

        int B = Math.max(1, batchSize);
        List<float[]> out = new ArrayList<>(texts.size());
        for (int i = 0; i < texts.size(); i += B) {
            int to = Math.min(i + B, texts.size());
            out.addAll(embedSlice(texts.subList(i, to), i, to));
        }
        long failed = out.stream().filter(v -> v == null).count();
        log.info("EmbeddingsClient: textos={}, sem embedding={}", texts.size(), failed);
        return out;
    }

    private List<float[]> embedSlice(List<String> slice, int from, int to) {
        float[][] vectors = new float[slice.size()][];
        try {
            EmbedResponse resp = webClient.post()
                    .uri(baseUrl + "/embed")
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of("texts", slice, "normalize", normalize))
                    .retrieve()
                    .bodyToMono(EmbedResponse.class)
                    .timeout(Duration.ofSeconds(timeoutSeconds))
                    .retryWhen(
                            Retry.backoff(2, Duration.ofMillis(300))  // 2 tentativas
                                    .maxBackoff(Duration.ofSeconds(2))
                    )
                    .block();

            List<double[]> got = (resp != null && resp.vectors() != null) ? resp.vectors() : List.of();
            if (got.size() != slice.size()) {
                log.warn("[embed] tamanhos diferentes no lote {}..{} ({} != {}), faltantes ficam sem embedding",
                        from, to, got.size(), slice.size());
            }
            for (int k = 0; k < slice.size() && k < got.size(); k++) {
                vectors[k] = toFloat(got.get(k));
            }
        } catch (Exception e) {
            // degrada: o lote inteiro fica sem embedding e vira gap/sobra no alinhamento
            log.warn("[embed] falha/timeout no lote {}..{}: {}", from, to, e.toString());
        }
        return Arrays.asList(vectors);
    }

    private static float[] toFloat(double[] v) {
        if (v == null || v.length == 0) return null;
        float[] f = new float[v.length];
        for (int i = 0; i < v.length; i++) f[i] = (float) v[i];
        return f;
    }
}
