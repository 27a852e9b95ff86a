package com.dnobretech.contentalignerbackend.exception;

/**
 * Falha que não dá pra degradar em dado parcial (ex.: base-url não configurada).
 * Falhas por lote/registro nunca chegam aqui, viram embedding/tradução null.
 */
public class CollaboratorException extends RuntimeException {

    public CollaboratorException(String message) {
        super(message);
    }
}
