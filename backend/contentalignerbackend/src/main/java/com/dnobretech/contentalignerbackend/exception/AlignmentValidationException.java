package com.dnobretech.contentalignerbackend.exception;

import com.dnobretech.contentalignerbackend.enums.ErrorCategory;
import lombok.Getter;

/**
 * Entrada rejeitada antes de qualquer cálculo (lista vazia, threshold inválido...).
 */
@Getter
public class AlignmentValidationException extends RuntimeException {

    private final ErrorCategory category;
    private final String suggestedAction;

    public AlignmentValidationException(ErrorCategory category, String message, String suggestedAction) {
        super(message);
        this.category = category;
        this.suggestedAction = suggestedAction;
    }
}
