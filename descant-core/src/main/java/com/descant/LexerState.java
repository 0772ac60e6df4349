package com.descant;

/**
 * State the lexer carries from one line to the next: an open block comment
 * and an open raw string literal.
 */
public final class LexerState {

    /** A raw string literal still waiting for its closing sequence. */
    static final class OpenRawString {
        final SourcePosition start;
        final StringBuilder text = new StringBuilder();
        final String closingSeq;
        final boolean interpolate;

        OpenRawString(SourcePosition start, String closingSeq, boolean interpolate) {
            this.start = start;
            this.closingSeq = closingSeq;
            this.interpolate = interpolate;
        }
    }

    boolean inComment;
    final StringBuilder currentComment = new StringBuilder();
    SourcePosition currentCommentStart = SourcePosition.NONE;
    OpenRawString rawString;

    public boolean inComment() {
        return inComment;
    }

    public boolean inRawString() {
        return rawString != null;
    }

    public SourcePosition currentCommentStart() {
        return currentCommentStart;
    }

    /** Where the open raw string started, or null if none is open. */
    public SourcePosition rawStringStart() {
        return rawString == null ? null : rawString.start;
    }
}
