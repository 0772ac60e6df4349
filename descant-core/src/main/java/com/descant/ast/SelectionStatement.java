package com.descant.ast;

import com.descant.SourcePosition;
import com.descant.Token;

/**
 * {@code if constexpr? cond { } else { }}. An {@code else if} chain is
 * stored as a false branch holding a single nested selection.
 *
 * @param falseBranch the else branch, or null if none was written
 */
public record SelectionStatement(Token keyword, boolean constexpr, Expression condition,
                                 CompoundStatement trueBranch, CompoundStatement falseBranch)
        implements Statement {

    @Override
    public Kind kind() {
        return Kind.SELECTION;
    }

    @Override
    public SourcePosition position() {
        return keyword.position();
    }

    public boolean hasElse() {
        return falseBranch != null;
    }
}
