package com.dnobretech.contentalignerbackend.client;

import com.dnobretech.contentalignerbackend.dto.ContentRecord;
import com.dnobretech.contentalignerbackend.exception.CollaboratorException;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Slf4j
@Component
@RequiredArgsConstructor
public class TranslateClient implements TranslationProvider {

    private final WebClient webClient = WebClient.builder()
            .clientConnector(new ReactorClientHttpConnector(
                    HttpClient.create().responseTimeout(Duration.ofSeconds(90))
            ))
            .build();

    @Value("${aligner.translate.base-url:}")
    private String baseUrl;  // ex.: http://127.0.0.1:8010

    @Value("${aligner.translate.batch-size:50}")
    private int batchSize;

    @Value("${aligner.translate.timeout-seconds:60}")
    private long timeoutSeconds;

    // ===== DTOs =====
    @Data
    public static class BatchItemIn {
        private String id;
        private String text;
        @JsonProperty("src_lang") private String srcLang;
        @JsonProperty("tgt_lang") private String tgtLang;
        public BatchItemIn() {}
        public BatchItemIn(String id, String text, String srcLang, String tgtLang) {
            this.id = id; this.text = text; this.srcLang = srcLang; this.tgtLang = tgtLang;
        }
    }

    @Data
    public static class BatchTranslateIn {
        private List<BatchItemIn> items;
        public BatchTranslateIn() {}
        public BatchTranslateIn(List<BatchItemIn> items) { this.items = items; }
    }

    @Data
    public static class BatchTranslateOutItem {
        private String id;
        private String translation;
        private boolean cached;
    }

    @Data
    public static class BatchTranslateOut {
        private List<BatchTranslateOutItem> results;
        @JsonProperty("model_id") private String modelId;
    }

    // ===== Métodos =====
    @Override
    public Map<Integer, String> translateBatch(List<ContentRecord> rows, String srcLang, String tgtLang) {
        if (rows == null || rows.isEmpty()) return Map.of();
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new CollaboratorException("aligner.translate.base-url não configurado");
        }

        int B = Math.max(1, batchSize);
        Map<Integer, String> out = new LinkedHashMap<>();
        for (int i = 0; i < rows.size(); i += B) {
            int to = Math.min(i + B, rows.size());
            List<BatchItemIn> items = new ArrayList<>(to - i);
            Set<String> requested = new HashSet<>();
            for (ContentRecord r : rows.subList(i, to)) {
                // manda o texto já limpo quando houver (sem HTML)
                String text = (r.cleanText() != null && !r.cleanText().isBlank()) ? r.cleanText() : r.rawText();
                // id do item = originalIndex
                String key = String.valueOf(r.originalIndex());
                items.add(new BatchItemIn(key, text, srcLang, tgtLang));
                requested.add(key);
            }

            try {
                BatchTranslateOut resp = webClient.post()
                        .uri(baseUrl + "/translate/batch")
                        .contentType(MediaType.APPLICATION_JSON)
                        .accept(MediaType.APPLICATION_JSON)
                        .bodyValue(new BatchTranslateIn(items))
                        .retrieve()
                        .bodyToMono(BatchTranslateOut.class)
                        .timeout(Duration.ofSeconds(timeoutSeconds))
                        .block();

                if (resp == null || resp.getResults() == null) {
                    log.warn("[translate] resposta vazia (lote {}..{})", i, to);
                    continue;
                }
                for (BatchTranslateOutItem it : resp.getResults()) {
                    // descarta ids que não foram pedidos neste lote
                    if (it.getId() == null || !requested.contains(it.getId())) continue;
                    if (it.getTranslation() == null || it.getTranslation().isBlank()) continue;
                    out.put(Integer.valueOf(it.getId()), it.getTranslation().trim());
                }
            } catch (Exception e) {
                log.warn("[translate] falha/timeout no lote {}..{}: {}", i, to, e.toString());
            }
        }
        log.info("TranslateClient: pedidos={}, traduzidos={} ({} -> {})", rows.size(), out.size(), srcLang, tgtLang);
        return out;
    }
}
