package com.dnobretech.contentalignerbackend.alignment;

import com.dnobretech.contentalignerbackend.dto.ContentRecord;

import java.util.List;

/**
 * Escolhe pares sem conflito a partir da matriz. Trocar por um Hungarian aqui
 * não mexe no {@link AlignmentAssembler}.
 */
public interface AssignmentStrategy {
    Assignment assign(double[][] matrix, List<ContentRecord> reference, List<ContentRecord> target, double threshold);
}
