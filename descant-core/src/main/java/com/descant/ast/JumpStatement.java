package com.descant.ast;

import com.descant.SourcePosition;
import com.descant.Token;

/** {@code break} or {@code continue}, with an optional label (may be null). */
public record JumpStatement(Token keyword, Token label) implements Statement {

    @Override
    public Kind kind() {
        return Kind.JUMP;
    }

    @Override
    public SourcePosition position() {
        return keyword.position();
    }

    public boolean isBreak() {
        return keyword.is("break");
    }
}
