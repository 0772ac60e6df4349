package com.descant.ast;

import com.descant.SourcePosition;

/**
 * An object declaration's type; {@code type} is null when it was omitted
 * ({@code x := 0;}) and is deduced downstream.
 */
public record ObjectType(SourcePosition position, TypeId type) implements DeclarationBody {

    @Override
    public Kind kind() {
        return Kind.OBJECT;
    }

    public boolean hasWildcardType() {
        return type == null || type.isWildcard();
    }
}
