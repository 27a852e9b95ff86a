package com.dnobretech.contentalignerbackend.dto;

/**
 * Uma linha da planilha de conteúdo (reference ou target).
 *
 * <p>{@code originalIndex} é a posição estável (0-based) na lista de origem e é a
 * única identidade usada para casar registros. Os {@code with*} devolvem uma cópia
 * nova com o mesmo id e o mesmo originalIndex, então nunca compare por referência.
 */
public record ContentRecord(
        String id,
        String rawText,          // conteúdo original (pode ter HTML)
        String cleanText,        // texto limpo usado no embedding
        String translatedText,   // preenchido pelo tradutor, se houver
        int originalIndex,
        float[] embedding        // null = não participa do scoring
) {

    public static ContentRecord of(String id, String rawText, int originalIndex) {
        return new ContentRecord(id, rawText, null, null, originalIndex, null);
    }

    public static ContentRecord withVector(String id, String rawText, int originalIndex, float... embedding) {
        return new ContentRecord(id, rawText, null, null, originalIndex, embedding);
    }

    public boolean hasEmbedding() {
        return embedding != null;
    }

    /** texto que deve ser limpo/embedado: a tradução quando existir, senão o original */
    public String sourceTextForEmbedding() {
        if (translatedText != null && !translatedText.isBlank()) return translatedText;
        return rawText == null ? "" : rawText;
    }

    public ContentRecord withCleanText(String clean) {
        return new ContentRecord(id, rawText, clean, translatedText, originalIndex, embedding);
    }

    public ContentRecord withTranslatedText(String translation) {
        return new ContentRecord(id, rawText, cleanText, translation, originalIndex, embedding);
    }

    public ContentRecord withEmbedding(float[] vector) {
        return new ContentRecord(id, rawText, cleanText, translatedText, originalIndex, vector);
    }
}
