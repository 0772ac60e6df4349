package com.descant.ast;

import com.descant.Lexeme;
import com.descant.SourcePosition;

import java.util.List;

/**
 * A parenthesized (or bracketed) comma-separated list. Each element may
 * carry an explicit passing direction, as in {@code f(out x, move y)}.
 */
public record ExpressionList(SourcePosition position, Lexeme opener, List<Term> terms) implements Expression {

    /** One list element; {@code direction} is null unless written. */
    public record Term(PassingStyle direction, Expression expression) {
    }

    @Override
    public Kind kind() {
        return Kind.LIST;
    }

    public boolean isEmpty() {
        return terms.isEmpty();
    }
}
