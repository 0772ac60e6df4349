package com.descant;

/**
 * A source comment. Comments are kept apart from grammar tokens so that they
 * never perturb parsing; the emitter re-interleaves them by position.
 */
public record Comment(Kind kind, SourcePosition start, SourcePosition end, String text) {

    public enum Kind {
        LINE,
        BLOCK
    }
}
