package com.descant.ast;

import com.descant.SourcePosition;

/** An inspect used as a statement, without a result type. */
public record InspectStatement(InspectExpression inspect) implements Statement {

    @Override
    public Kind kind() {
        return Kind.INSPECT;
    }

    @Override
    public SourcePosition position() {
        return inspect.position();
    }
}
