package com.dnobretech.contentalignerbackend.dto;

import java.util.List;

public record AlignmentReport(
        AlignmentResult result,
        List<DisplayRow> displayRows,
        AlignmentStatistics statistics
) {}
