package com.dnobretech.contentalignerbackend.dto;

import com.dnobretech.contentalignerbackend.enums.MatchStatus;
import com.dnobretech.contentalignerbackend.enums.QualityBand;
import com.dnobretech.contentalignerbackend.enums.RowType;

// linha pronta pra tela e pro export (as duas saem da mesma lista)
public record DisplayRow(
        RowType rowType,
        Integer refLineNumber,      // 1-based; null em UNMATCHED_TARGET
        String refContent,
        Integer targetLineNumber,   // originalIndex + 1; null em gap
        String targetContent,
        String translatedContent,
        String targetContentId,
        MatchStatus status,
        Double score,
        QualityBand quality
) {}
