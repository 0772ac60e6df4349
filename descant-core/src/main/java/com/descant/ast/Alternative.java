package com.descant.ast;

import com.descant.SourcePosition;
import com.descant.Token;

/**
 * One {@code inspect} alternative: {@code name: is T = statement}. Exactly
 * one of {@code type} and {@code value} is set.
 *
 * @param name      optional binding name, may be null
 * @param isAs      the {@code is} or {@code as} keyword
 * @param type      the tested or target type, or null
 * @param value     the tested value, or null
 * @param statement what runs when this alternative matches
 */
public record Alternative(Token name, Token isAs, TypeId type, Expression value, Statement statement)
        implements Node {

    @Override
    public SourcePosition position() {
        return name != null ? name.position() : isAs.position();
    }

    public boolean isTypeTest() {
        return type != null;
    }

    public boolean isCast() {
        return isAs.is("as");
    }
}
