package com.descant.ast;

import com.descant.SourcePosition;
import com.descant.Token;

/** {@code using std::string;} or {@code using namespace std;}. */
public record UsingStatement(Token keyword, boolean forNamespace, IdExpression id) implements Statement {

    @Override
    public Kind kind() {
        return Kind.USING;
    }

    @Override
    public SourcePosition position() {
        return keyword.position();
    }
}
