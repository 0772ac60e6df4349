package com.descant.ast;

/**
 * The body variant of a declaration: exactly one of function, object,
 * type, namespace or alias.
 */
public sealed interface DeclarationBody extends Node permits
    FunctionType,
    ObjectType,
    TypeBody,
    NamespaceBody,
    AliasBody {

    enum Kind {
        FUNCTION,
        OBJECT,
        TYPE,
        NAMESPACE,
        ALIAS
    }

    Kind kind();
}
