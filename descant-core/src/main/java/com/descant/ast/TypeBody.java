package com.descant.ast;

import com.descant.SourcePosition;

/** {@code type} or {@code final type}; its members live in the initializer. */
public final class TypeBody implements DeclarationBody {

    private final SourcePosition position;
    private boolean finalType;

    public TypeBody(SourcePosition position, boolean finalType) {
        this.position = position;
        this.finalType = finalType;
    }

    @Override
    public Kind kind() {
        return Kind.TYPE;
    }

    @Override
    public SourcePosition position() {
        return position;
    }

    public boolean isFinal() {
        return finalType;
    }

    public void setFinal(boolean finalType) {
        this.finalType = finalType;
    }
}
