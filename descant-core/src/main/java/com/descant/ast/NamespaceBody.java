package com.descant.ast;

import com.descant.SourcePosition;

public record NamespaceBody(SourcePosition position) implements DeclarationBody {

    @Override
    public Kind kind() {
        return Kind.NAMESPACE;
    }
}
