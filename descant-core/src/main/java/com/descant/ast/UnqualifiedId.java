package com.descant.ast;

import com.descant.SourcePosition;
import com.descant.Token;

import java.util.List;

/**
 * One name component, optionally with a template-argument list.
 *
 * @param identifier        the name token
 * @param templated         true if a {@code <...>} list was written, even an empty one
 * @param templateArguments the arguments, empty unless {@code templated}
 */
public record UnqualifiedId(Token identifier, boolean templated, List<TemplateArgument> templateArguments)
        implements Node {

    public UnqualifiedId(Token identifier) {
        this(identifier, false, List.of());
    }

    @Override
    public SourcePosition position() {
        return identifier.position();
    }

    public String name() {
        return identifier.text();
    }
}
