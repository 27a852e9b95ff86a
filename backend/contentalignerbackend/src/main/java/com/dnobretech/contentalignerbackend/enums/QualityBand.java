package com.dnobretech.contentalignerbackend.enums;

/**
 * Faixa ordinal de qualidade de um par, da pior para a melhor.
 */
public enum QualityBand {
    POOR,
    LOW,
    MEDIUM,
    HIGH
}
