package com.descant.ast;

/**
 * An expression. Each precedence level collapses to its operand when no
 * operator at that level was matched, so a bare literal is a {@link Literal}
 * and not a chain of single-child wrappers.
 */
public sealed interface Expression extends Node permits
    Literal,
    IdExpression,
    ExpressionList,
    InspectExpression,
    UnnamedDeclarationExpression,
    PostfixExpression,
    PrefixExpression,
    IsAsExpression,
    BinaryExpression {

    enum Kind {
        LITERAL,
        ID,
        LIST,
        INSPECT,
        UNNAMED_DECLARATION,
        POSTFIX,
        PREFIX,
        IS_AS,
        BINARY
    }

    Kind kind();
}
