package com.descant.ast;

import com.descant.SourcePosition;

/** A template argument: either a type or an expression, never both. */
public record TemplateArgument(TypeId type, Expression expression) implements Node {

    public TemplateArgument {
        if ((type == null) == (expression == null)) {
            throw new IllegalArgumentException("a template argument is exactly one of a type or an expression");
        }
    }

    @Override
    public SourcePosition position() {
        return type != null ? type.position() : expression.position();
    }
}
