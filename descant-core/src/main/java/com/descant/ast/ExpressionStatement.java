package com.descant.ast;

import com.descant.SourcePosition;

/**
 * An expression used as a statement. {@code hasSemicolon} is false for the
 * body of a function expression such as {@code :(x) = x + 1} and for
 * parameter default values, which are not terminated by their own semicolon.
 */
public record ExpressionStatement(Expression expression, boolean hasSemicolon) implements Statement {

    @Override
    public Kind kind() {
        return Kind.EXPRESSION;
    }

    @Override
    public SourcePosition position() {
        return expression.position();
    }
}
