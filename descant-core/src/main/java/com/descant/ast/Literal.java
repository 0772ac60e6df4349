package com.descant.ast;

import com.descant.SourcePosition;
import com.descant.Token;

/** A literal, including {@code true}, {@code false} and {@code nullptr}. */
public record Literal(Token token) implements Expression {

    @Override
    public Kind kind() {
        return Kind.LITERAL;
    }

    @Override
    public SourcePosition position() {
        return token.position();
    }
}
