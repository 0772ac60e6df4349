package com.descant.ast;

import com.descant.SourcePosition;
import com.descant.Token;

import java.util.List;

/**
 * {@code x is T}, {@code x is 0} or {@code x as T}, possibly chained.
 */
public record IsAsExpression(Expression operand, List<Term> terms) implements Expression {

    /** Exactly one of {@code type} and {@code value} is set. */
    public record Term(Token op, TypeId type, Expression value) {
    }

    @Override
    public Kind kind() {
        return Kind.IS_AS;
    }

    @Override
    public SourcePosition position() {
        return operand.position();
    }
}
