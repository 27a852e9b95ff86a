package com.dnobretech.contentalignerbackend.service.impl;

import com.dnobretech.contentalignerbackend.client.EmbeddingProvider;
import com.dnobretech.contentalignerbackend.client.TranslationProvider;
import com.dnobretech.contentalignerbackend.dto.ContentRecord;
import com.dnobretech.contentalignerbackend.dto.PreparationOptions;
import com.dnobretech.contentalignerbackend.service.ContentPreparationService;
import com.dnobretech.contentalignerbackend.util.TextNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class ContentPreparationServiceImpl implements ContentPreparationService {

    private final TextNormalizer norm;
    private final EmbeddingProvider embeddingProvider;
    private final TranslationProvider translationProvider;

    @Value("${aligner.translate.target-lang:en}")
    private String translateTargetLang = "en";

    @Override
    public List<ContentRecord> prepare(List<ContentRecord> records, PreparationOptions options) {
        if (records == null || records.isEmpty()) return List.of();
        PreparationOptions opts = options != null ? options : PreparationOptions.none();

        // 1) limpeza
        List<ContentRecord> out = new ArrayList<>(records.size());
        for (ContentRecord r : records) out.add(r.withCleanText(norm.clean(r.sourceTextForEmbedding())));

        // 2) tradução por originalIndex; o original fica em rawText
        if (opts.translate()) {
            Map<Integer, String> tr = translationProvider.translateBatch(out, opts.sourceLang(), translateTargetLang);
            for (int k = 0; k < out.size(); k++) {
                String t = tr.get(out.get(k).originalIndex());
                if (t == null) continue;
                ContentRecord translated = out.get(k).withTranslatedText(t);
                out.set(k, translated.withCleanText(norm.clean(translated.sourceTextForEmbedding())));
            }
            log.info("[prepare] traduzidos {}/{}", tr.size(), out.size());
        }

        // 3) embeddings só para texto válido; o resto fica sem vetor (gap/sobra)
        List<Integer> positions = new ArrayList<>();
        List<String> texts = new ArrayList<>();
        for (int k = 0; k < out.size(); k++) {
            String clean = out.get(k).cleanText();
            if (norm.isContentValid(clean)) {
                positions.add(k);
                texts.add(clean);
            }
        }

        List<float[]> vectors = texts.isEmpty() ? List.of() : embeddingProvider.embed(texts);
        int embedded = 0;
        for (int n = 0; n < positions.size(); n++) {
            float[] v = n < vectors.size() ? vectors.get(n) : null;
            if (v == null) continue;
            int k = positions.get(n);
            out.set(k, out.get(k).withEmbedding(v));
            embedded++;
        }

        log.info("[prepare] registros={}, válidos={}, com embedding={}", out.size(), texts.size(), embedded);
        return out;
    }
}
