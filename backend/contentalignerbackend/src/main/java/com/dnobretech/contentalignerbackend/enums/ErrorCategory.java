package com.dnobretech.contentalignerbackend.enums;

public enum ErrorCategory {
    DATA_VALIDATION,     // listas vazias, índices duplicados
    USER_INPUT,          // threshold fora de [0,1]
    EMBEDDING_CONTRACT,  // vetores de tamanhos diferentes
    COLLABORATOR,        // provedor de embedding/tradução indisponível
    UNEXPECTED
}
