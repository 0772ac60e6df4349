package com.descant.ast;

import com.descant.SourcePosition;
import com.descant.Token;

import java.util.List;

/**
 * {@code lhs op rhs op rhs ...} at one precedence level, associating left to
 * right. Only built when at least one operator was matched.
 */
public record BinaryExpression(BinaryLevel level, Expression lhs, List<Term> terms) implements Expression {

    public record Term(Token op, Expression rhs) {
    }

    public BinaryExpression {
        if (terms.isEmpty()) {
            throw new IllegalArgumentException("a binary expression needs at least one operator");
        }
    }

    @Override
    public Kind kind() {
        return Kind.BINARY;
    }

    @Override
    public SourcePosition position() {
        return lhs.position();
    }
}
