package com.descant.ast;

import com.descant.SourcePosition;
import com.descant.Token;

import java.util.List;

/**
 * {@code inspect subject -> T { alternatives }}. Alternatives are tried in
 * order and the first one that matches is the only one that runs.
 */
public record InspectExpression(Token keyword, boolean constexpr, Expression subject, TypeId resultType,
                                List<Alternative> alternatives) implements Expression {

    @Override
    public Kind kind() {
        return Kind.INSPECT;
    }

    @Override
    public SourcePosition position() {
        return keyword.position();
    }
}
