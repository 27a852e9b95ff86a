package com.dnobretech.contentalignerbackend.exception;

import lombok.Getter;

/**
 * Dois embeddings com tamanhos diferentes: o provedor de embedding quebrou o contrato
 * (modelo trocado no meio do lote, vetor truncado etc.).
 */
@Getter
public class DimensionMismatchException extends RuntimeException {

    private final int leftLength;
    private final int rightLength;

    public DimensionMismatchException(int leftLength, int rightLength) {
        super("Vetores com dimensões diferentes: " + leftLength + " != " + rightLength);
        this.leftLength = leftLength;
        this.rightLength = rightLength;
    }
}
