package com.dnobretech.contentalignerbackend.dto;

public record PreparationOptions(boolean translate, String sourceLang) {

    public static PreparationOptions none() {
        return new PreparationOptions(false, null);
    }
}
