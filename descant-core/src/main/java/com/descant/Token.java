package com.descant;

/**
 * An immutable token: its text, where it starts and its lexeme.
 *
 * Tokens for generated code live in the token store's append-only
 * generated buffer, so tree nodes can keep them for the life of the tree.
 */
public record Token(String text, SourcePosition position, Lexeme type) {

    public Token {
        if (text == null || position == null || type == null) {
            throw new IllegalArgumentException("token text, position and type are required");
        }
    }

    public int length() {
        return text.length();
    }

    public int line() {
        return position.lineno();
    }

    public int column() {
        return position.colno();
    }

    /** Column just past the last character of this token. */
    public int endColumn() {
        return position.colno() + text.length();
    }

    public boolean is(String s) {
        return text.equals(s);
    }

    public boolean is(Lexeme l) {
        return type == l;
    }

    public Token withType(Lexeme l) {
        return new Token(text, position, l);
    }

    @Override
    public String toString() {
        return text;
    }

    /** "type: text" description used in diagnostics, e.g. {@code Identifier: x}. */
    public String labelized() {
        return type.name() + ": " + text;
    }
}
