package com.dnobretech.contentalignerbackend.dto;

import com.dnobretech.contentalignerbackend.enums.MatchStatus;

/**
 * Uma linha por reference. {@code targetRecord == null} é um gap.
 */
public record AlignedRow(
        int referenceIndex,
        ContentRecord referenceRecord,
        ContentRecord targetRecord,
        Double score
) {

    public static AlignedRow gap(int referenceIndex, ContentRecord referenceRecord) {
        return new AlignedRow(referenceIndex, referenceRecord, null, null);
    }

    public boolean hasMatch() {
        return targetRecord != null;
    }

    public MatchStatus status() {
        return hasMatch() ? MatchStatus.MATCHED : MatchStatus.MISSING;
    }
}
