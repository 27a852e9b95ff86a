package com.dnobretech.contentalignerbackend.client;

import com.dnobretech.contentalignerbackend.dto.ContentRecord;

import java.util.List;
import java.util.Map;

public interface TranslationProvider {

    /**
     * Traduz o texto de cada registro.
     *
     * @return originalIndex -> tradução; o id da planilha pode repetir ou vir vazio,
     *         então não serve de chave. Registros que o provedor não devolveu ficam de fora
     */
    Map<Integer, String> translateBatch(List<ContentRecord> rows, String srcLang, String tgtLang);
}
