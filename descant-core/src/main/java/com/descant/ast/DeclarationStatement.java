package com.descant.ast;

import com.descant.SourcePosition;

/** A declaration in statement position; it owns the declaration. */
public record DeclarationStatement(Declaration declaration) implements Statement {

    @Override
    public Kind kind() {
        return Kind.DECLARATION;
    }

    @Override
    public SourcePosition position() {
        return declaration.position();
    }
}
