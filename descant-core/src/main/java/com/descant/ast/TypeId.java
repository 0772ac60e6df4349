package com.descant.ast;

import com.descant.SourcePosition;
import com.descant.Token;

import java.util.List;

/**
 * A type: leading {@code const} and {@code *} qualifiers followed by a name.
 */
public record TypeId(List<Token> qualifiers, IdExpression id) implements Node {

    @Override
    public SourcePosition position() {
        return qualifiers.isEmpty() ? id.position() : qualifiers.get(0).position();
    }

    public boolean isWildcard() {
        return qualifiers.isEmpty() && id.isWildcard();
    }

    public boolean isPointerQualified() {
        return qualifiers.stream().anyMatch(q -> q.is("*"));
    }

    public boolean isConst() {
        return !qualifiers.isEmpty() && qualifiers.get(0).is("const");
    }

    @Override
    public String toString() {
        return TreePrinter.print(this);
    }
}
