package com.descant.ast;

import com.descant.SourcePosition;
import com.descant.Token;

import java.util.List;

public record PrefixExpression(List<Token> ops, Expression operand) implements Expression {

    @Override
    public Kind kind() {
        return Kind.PREFIX;
    }

    @Override
    public SourcePosition position() {
        return ops.get(0).position();
    }
}
