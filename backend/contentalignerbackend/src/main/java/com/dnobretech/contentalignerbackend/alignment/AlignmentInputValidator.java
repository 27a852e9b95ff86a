package com.dnobretech.contentalignerbackend.alignment;

import com.dnobretech.contentalignerbackend.dto.ContentRecord;
import com.dnobretech.contentalignerbackend.enums.ErrorCategory;
import com.dnobretech.contentalignerbackend.exception.AlignmentValidationException;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Checagens feitas antes de qualquer cálculo. Registro sem embedding não é erro.
 */
public final class AlignmentInputValidator {

    private AlignmentInputValidator() {
    }

    public static void validate(List<ContentRecord> reference, List<ContentRecord> target, double threshold) {
        requireRecords(reference, "reference");
        requireRecords(target, "target");
        validateThreshold(threshold);
    }

    public static void validateThreshold(double threshold) {
        if (Double.isNaN(threshold) || threshold < 0.0 || threshold > 1.0) {
            throw new AlignmentValidationException(
                    ErrorCategory.USER_INPUT,
                    "Threshold de similaridade deve estar entre 0.0 e 1.0 (recebido: " + threshold + ")",
                    "Informe um threshold entre 0.0 e 1.0, ex.: 0.5.");
        }
    }

    private static void requireRecords(List<ContentRecord> records, String side) {
        if (records == null || records.isEmpty()) {
            throw new AlignmentValidationException(
                    ErrorCategory.DATA_VALIDATION,
                    "Nenhum registro de " + side + " para comparar",
                    "Verifique se o arquivo de " + side + " tem dados válidos.");
        }
        Set<Integer> seen = new HashSet<>(records.size() * 2);
        for (ContentRecord r : records) {
            if (r == null) {
                throw new AlignmentValidationException(
                        ErrorCategory.DATA_VALIDATION,
                        "Registro nulo na lista de " + side,
                        "Remova as linhas vazias do arquivo de " + side + ".");
            }
            if (!seen.add(r.originalIndex())) {
                throw new AlignmentValidationException(
                        ErrorCategory.DATA_VALIDATION,
                        "originalIndex duplicado em " + side + ": " + r.originalIndex(),
                        "Cada linha de " + side + " precisa de um originalIndex único.");
            }
        }
    }
}
