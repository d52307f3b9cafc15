package com.polyglot.domain.language;

public enum GrammaticalNumber {
    SINGULAR,
    PLURAL
}
