package com.descant.ast;

import com.descant.SourcePosition;
import com.descant.Token;

/** {@code return expr?;} with {@code expression} null for a bare return. */
public record ReturnStatement(Token keyword, Expression expression) implements Statement {

    @Override
    public Kind kind() {
        return Kind.RETURN;
    }

    @Override
    public SourcePosition position() {
        return keyword.position();
    }
}
