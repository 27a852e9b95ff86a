package com.dnobretech.contentalignerbackend.service.impl;

import com.dnobretech.contentalignerbackend.client.EmbeddingProvider;
import com.dnobretech.contentalignerbackend.client.TranslationProvider;
import com.dnobretech.contentalignerbackend.dto.ContentRecord;
import com.dnobretech.contentalignerbackend.dto.PreparationOptions;
import com.dnobretech.contentalignerbackend.util.TextNormalizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ContentPreparationServiceImplTest {

    @Mock EmbeddingProvider embeddingProvider;
    @Mock TranslationProvider translationProvider;

    private ContentPreparationServiceImpl service;

    @BeforeEach
    void setUp() {
        service = new ContentPreparationServiceImpl(new TextNormalizer(), embeddingProvider, translationProvider);
    }

    @SuppressWarnings("unchecked")
    @Test
    void cleansAndEmbedsOnlyValidTexts() {
        List<ContentRecord> in = List.of(
                ContentRecord.of("1", "<p>Olá mundo</p>", 0),
                ContentRecord.of("2", "!!", 1),
                ContentRecord.of("3", "Segunda linha", 2));
        when(embeddingProvider.embed(anyList()))
                .thenReturn(List.of(new float[]{1, 0}, new float[]{0, 1}));

        List<ContentRecord> out = service.prepare(in, PreparationOptions.none());

        ArgumentCaptor<List<String>> texts = ArgumentCaptor.forClass(List.class);
        verify(embeddingProvider).embed(texts.capture());
        assertThat(texts.getValue()).containsExactly("Olá mundo", "Segunda linha");

        assertThat(out).extracting(ContentRecord::originalIndex).containsExactly(0, 1, 2);
        assertThat(out.get(0).cleanText()).isEqualTo("Olá mundo");
        assertThat(out.get(0).embedding()).containsExactly(1f, 0f);
        assertThat(out.get(1).hasEmbedding()).isFalse();
        assertThat(out.get(2).embedding()).containsExactly(0f, 1f);
        assertThat(out.get(0).rawText()).isEqualTo("<p>Olá mundo</p>");
        verifyNoInteractions(translationProvider);
    }

    @Test
    void failedEmbeddingLeavesRecordWithoutVector() {
        List<ContentRecord> in = List.of(ContentRecord.of("1", "primeira", 0), ContentRecord.of("2", "segunda", 1));
        when(embeddingProvider.embed(anyList())).thenReturn(Arrays.asList(null, new float[]{1, 1}));

        List<ContentRecord> out = service.prepare(in, PreparationOptions.none());

        assertThat(out.get(0).hasEmbedding()).isFalse();
        assertThat(out.get(1).hasEmbedding()).isTrue();
    }

    @Test
    void translationReplacesEmbeddingSourceAndKeepsOriginal() {
        List<ContentRecord> in = List.of(ContentRecord.of("k1", "안녕하세요", 0), ContentRecord.of("k2", "감사합니다", 1));
        when(translationProvider.translateBatch(anyList(), eq("ko"), eq("en")))
                .thenReturn(Map.of(0, "Hello there"));
        when(embeddingProvider.embed(anyList())).thenReturn(List.of(new float[]{1}, new float[]{2}));

        List<ContentRecord> out = service.prepare(in, new PreparationOptions(true, "ko"));

        assertThat(out.get(0).translatedText()).isEqualTo("Hello there");
        assertThat(out.get(0).cleanText()).isEqualTo("Hello there");
        assertThat(out.get(0).rawText()).isEqualTo("안녕하세요");
        // sem tradução: segue com o texto original
        assertThat(out.get(1).translatedText()).isNull();
        assertThat(out.get(1).cleanText()).isEqualTo("감사합니다");
        verify(embeddingProvider).embed(List.of("Hello there", "감사합니다"));
    }

    @Test
    void translationsFollowOriginalIndexEvenWithBlankOrRepeatedIds() {
        List<ContentRecord> in = List.of(
                ContentRecord.of("", "primeira linha", 0),
                ContentRecord.of("", "segunda linha", 1),
                ContentRecord.of("dup", "terceira linha", 2),
                ContentRecord.of("dup", "quarta linha", 3));
        // tradutor devolve uma tradução por registro pedido, chaveada por originalIndex
        when(translationProvider.translateBatch(anyList(), any(), any())).thenAnswer(inv -> {
            List<ContentRecord> rows = inv.getArgument(0);
            Map<Integer, String> tr = new HashMap<>();
            for (ContentRecord r : rows) tr.put(r.originalIndex(), "EN " + r.cleanText());
            return tr;
        });
        when(embeddingProvider.embed(anyList())).thenReturn(List.of());

        List<ContentRecord> out = service.prepare(in, new PreparationOptions(true, "pt"));

        assertThat(out).extracting(ContentRecord::translatedText).containsExactly(
                "EN primeira linha", "EN segunda linha", "EN terceira linha", "EN quarta linha");
        assertThat(out).extracting(ContentRecord::cleanText).containsExactly(
                "EN primeira linha", "EN segunda linha", "EN terceira linha", "EN quarta linha");
    }

    @Test
    void nothingValidSkipsEmbeddingCall() {
        List<ContentRecord> out = service.prepare(List.of(ContentRecord.of("1", "  ", 0)), null);

        assertThat(out).hasSize(1);
        assertThat(out.get(0).hasEmbedding()).isFalse();
        verifyNoInteractions(embeddingProvider);
    }

    @Test
    void emptyInputGivesEmptyOutput() {
        assertThat(service.prepare(List.of(), PreparationOptions.none())).isEmpty();
        verifyNoInteractions(embeddingProvider, translationProvider);
    }
}
