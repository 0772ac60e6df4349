package com.descant.ast;

/**
 * A statement. The set of kinds is closed; consumers switch over
 * {@link #kind()} exhaustively.
 */
public sealed interface Statement extends Node permits
    ExpressionStatement,
    CompoundStatement,
    SelectionStatement,
    DeclarationStatement,
    ReturnStatement,
    IterationStatement,
    UsingStatement,
    Contract,
    InspectStatement,
    JumpStatement {

    enum Kind {
        EXPRESSION,
        COMPOUND,
        SELECTION,
        DECLARATION,
        RETURN,
        ITERATION,
        USING,
        CONTRACT,
        INSPECT,
        JUMP
    }

    Kind kind();
}
