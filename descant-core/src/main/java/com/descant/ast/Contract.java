package com.descant.ast;

import com.descant.SourcePosition;
import com.descant.Token;

/**
 * {@code pre}, {@code post} or {@code assert}, with an optional group,
 * condition and optional message. Every contract has its own capture group
 * for the {@code $} captures in its condition.
 *
 * @param group   the {@code <group>} name, may be null
 * @param message the message expression, may be null
 */
public record Contract(Token keyword, IdExpression group, Expression condition, Expression message,
                       CaptureGroup captures) implements Statement {

    @Override
    public Kind kind() {
        return Kind.CONTRACT;
    }

    @Override
    public SourcePosition position() {
        return keyword.position();
    }

    public boolean isPrecondition() {
        return keyword.is("pre");
    }

    public boolean isPostcondition() {
        return keyword.is("post");
    }

    public boolean isAssertion() {
        return keyword.is("assert");
    }
}
