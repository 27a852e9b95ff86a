package com.dnobretech.contentalignerbackend.client;

import java.util.List;

/**
 * Gera embeddings para uma lista de textos.
 * A saída tem o mesmo tamanho e ordem da entrada; {@code null} = texto que falhou.
 */
public interface EmbeddingProvider {

    List<float[]> embed(List<String> texts);

    /** teste de conexão simples */
    default boolean isAvailable() {
        List<float[]> probe = embed(List.of("Test connection"));
        return !probe.isEmpty() && probe.get(0) != null;
    }
}
