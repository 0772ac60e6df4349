package com.descant.ast;

import com.descant.Token;

import java.util.List;

/**
 * An {@code @name<args>} request on a declaration. Arguments are kept as the
 * raw text between the angle brackets, split at top-level commas.
 */
public record MetafunctionRequest(Token name, List<String> arguments) {

    public MetafunctionRequest {
        arguments = List.copyOf(arguments);
    }

    public String nameText() {
        return name.text();
    }
}
