package com.dnobretech.contentalignerbackend.dto;

public record AlignmentStatistics(
        int totalReference,
        int matchedCount,
        int missingCount,
        int leftoverCount,
        int highCount,
        int mediumCount,
        int lowCount,
        int poorCount,
        double averageScore,
        double matchPercentage
) {}
