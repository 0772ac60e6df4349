package com.descant.ast;

import com.descant.SourcePosition;

/** An unnamed declaration used as a value, e.g. a function expression. */
public record UnnamedDeclarationExpression(Declaration declaration) implements Expression {

    @Override
    public Kind kind() {
        return Kind.UNNAMED_DECLARATION;
    }

    @Override
    public SourcePosition position() {
        return declaration.position();
    }
}
