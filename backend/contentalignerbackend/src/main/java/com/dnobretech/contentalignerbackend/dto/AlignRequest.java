package com.dnobretech.contentalignerbackend.dto;

import jakarta.validation.constraints.NotNull;

import java.util.List;

// threshold null = usa aligner.similarity-threshold
public record AlignRequest(
        @NotNull List<ContentRecord> reference,
        @NotNull List<ContentRecord> target,
        Double threshold
) {}
