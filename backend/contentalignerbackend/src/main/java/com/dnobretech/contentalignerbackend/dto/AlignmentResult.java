package com.dnobretech.contentalignerbackend.dto;

import java.util.List;

/**
 * matchedCount + missingCount == totalReference e leftoverCount == leftoverTargets.size().
 */
public record AlignmentResult(
        List<AlignedRow> alignedRows,
        List<ContentRecord> leftoverTargets,
        int totalReference,
        int matchedCount,
        int missingCount,
        int leftoverCount
) {

    public static AlignmentResult of(List<AlignedRow> rows, List<ContentRecord> leftovers) {
        int matched = (int) rows.stream().filter(AlignedRow::hasMatch).count();
        return new AlignmentResult(
                List.copyOf(rows),
                List.copyOf(leftovers),
                rows.size(),
                matched,
                rows.size() - matched,
                leftovers.size()
        );
    }
}
