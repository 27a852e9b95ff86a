package com.dnobretech.contentalignerbackend.dto;

import com.dnobretech.contentalignerbackend.enums.QualityBand;

public record LineByLineDiagnostic(
        ContentRecord targetRecord,
        ContentRecord referenceRecord,   // null para targets além do fim da reference
        double positionalScore,
        boolean good,
        QualityBand quality,
        Suggestion suggestion
) {

    public boolean hasPositionalReference() {
        return referenceRecord != null;
    }
}
