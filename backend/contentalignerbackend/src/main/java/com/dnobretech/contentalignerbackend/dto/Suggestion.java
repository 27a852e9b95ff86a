package com.dnobretech.contentalignerbackend.dto;

import com.dnobretech.contentalignerbackend.enums.QualityBand;

// melhor reference para um target fraco no modo linha-a-linha; não é vinculante
public record Suggestion(ContentRecord referenceRecord, double score, boolean good, QualityBand quality) {}
