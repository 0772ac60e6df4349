package com.descant.ast;

import com.descant.SourcePosition;

/**
 * Base interface for the nodes of a candidate-syntax program tree.
 *
 * Ownership runs strictly parent to child; the only upward links are the
 * non-owning parent/statement lookups on {@link Declaration}.
 */
public sealed interface Node permits
    Expression,
    Statement,
    Declaration,
    DeclarationBody,
    ParameterDeclaration,
    TypeId,
    UnqualifiedId,
    TemplateArgument,
    Alternative,
    TranslationUnit {

    SourcePosition position();
}
