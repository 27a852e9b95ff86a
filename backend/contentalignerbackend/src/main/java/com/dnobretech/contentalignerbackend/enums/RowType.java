package com.dnobretech.contentalignerbackend.enums;

public enum RowType {
    REFERENCE_ALIGNED,   // uma linha por reference, na ordem original
    UNMATCHED_TARGET     // target que sobrou, no fim da lista
}
