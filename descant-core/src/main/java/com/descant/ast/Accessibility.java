package com.descant.ast;

public enum Accessibility {
    DEFAULT,
    PUBLIC,
    PROTECTED,
    PRIVATE;

    /** Spelling in source, empty for the default. */
    public String spelling() {
        return this == DEFAULT ? "" : name().toLowerCase();
    }
}
