package com.dnobretech.contentalignerbackend.service;

import com.dnobretech.contentalignerbackend.dto.ContentRecord;
import com.dnobretech.contentalignerbackend.dto.PreparationOptions;

import java.util.List;

public interface ContentPreparationService {
    // limpa, traduz (opcional) e gera embeddings; devolve registros novos na mesma ordem
    List<ContentRecord> prepare(List<ContentRecord> records, PreparationOptions options);
}
