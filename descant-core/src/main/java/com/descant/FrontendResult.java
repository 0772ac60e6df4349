package com.descant;

import com.descant.ast.TranslationUnit;

import java.util.List;

/**
 * What one run of the front end produced.
 *
 * @param unit   the program tree, including members added by metafunctions
 * @param errors every diagnostic, sorted by position
 * @param tokens the lexed sections and comments
 */
public record FrontendResult(TranslationUnit unit, List<ErrorEntry> errors, TokenStore tokens) {

    public FrontendResult {
        errors = List.copyOf(errors);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
