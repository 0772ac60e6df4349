package com.descant.ast;

import com.descant.SourcePosition;
import com.descant.Token;

/**
 * {@code while}, {@code do} and {@code for} loops.
 *
 * @param label     optional loop label, may be null
 * @param keyword   {@code while}, {@code do} or {@code for}
 * @param condition loop condition of while/do loops, null for for loops
 * @param range     the range of a for loop, null otherwise
 * @param next      optional {@code next} step expression, may be null
 * @param parameter the loop variable of a for loop, null otherwise
 * @param body      the loop body
 */
public record IterationStatement(Token label, Token keyword, Expression condition, Expression range,
                                 Expression next, ParameterDeclaration parameter, CompoundStatement body)
        implements Statement {

    @Override
    public Kind kind() {
        return Kind.ITERATION;
    }

    @Override
    public SourcePosition position() {
        return label != null ? label.position() : keyword.position();
    }

    public boolean isFor() {
        return keyword.is("for");
    }

    public boolean isDo() {
        return keyword.is("do");
    }
}
