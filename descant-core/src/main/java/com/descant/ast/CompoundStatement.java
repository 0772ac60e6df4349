package com.descant.ast;

import com.descant.SourcePosition;

import java.util.ArrayList;
import java.util.List;

/**
 * A braced statement list. Type and namespace bodies are compound
 * statements too, which is why the list is mutable: metafunctions add and
 * sweep members here.
 */
public final class CompoundStatement implements Statement {

    private final SourcePosition open;
    private SourcePosition close;
    private final List<Statement> statements = new ArrayList<>();

    public CompoundStatement(SourcePosition open) {
        this.open = open;
        this.close = open;
    }

    @Override
    public Kind kind() {
        return Kind.COMPOUND;
    }

    @Override
    public SourcePosition position() {
        return open;
    }

    public SourcePosition close() {
        return close;
    }

    public void setClose(SourcePosition close) {
        this.close = close;
    }

    public List<Statement> statements() {
        return statements;
    }

    public void add(Statement statement) {
        statements.add(statement);
    }

    public boolean isEmpty() {
        return statements.isEmpty();
    }
}
