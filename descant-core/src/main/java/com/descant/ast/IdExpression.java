package com.descant.ast;

import com.descant.SourcePosition;
import com.descant.Token;

import java.util.List;

/**
 * A possibly qualified name such as {@code x}, {@code std::vector<int>} or
 * {@code ::global}.
 */
public record IdExpression(boolean global, List<UnqualifiedId> ids) implements Expression {

    public IdExpression {
        if (ids.isEmpty()) {
            throw new IllegalArgumentException("an id-expression needs at least one name");
        }
    }

    public static IdExpression of(Token identifier) {
        return new IdExpression(false, List.of(new UnqualifiedId(identifier)));
    }

    @Override
    public Kind kind() {
        return Kind.ID;
    }

    @Override
    public SourcePosition position() {
        return ids.get(0).position();
    }

    public boolean isQualified() {
        return global || ids.size() > 1;
    }

    /** True for a single name without template arguments. */
    public boolean isSimple() {
        return !isQualified() && !ids.get(0).templated();
    }

    public UnqualifiedId last() {
        return ids.get(ids.size() - 1);
    }

    public boolean isWildcard() {
        return isSimple() && ids.get(0).identifier().is("_");
    }
}
