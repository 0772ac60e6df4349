package com.descant.ast;

import com.descant.SourcePosition;

/**
 * A {@code ==} alias.
 *
 * <ul>
 *   <li>type alias: {@code N: type == std::vector<int>;} sets {@code type}</li>
 *   <li>namespace alias: {@code N: namespace == std::chrono;} sets {@code namespaceName}</li>
 *   <li>object alias: {@code N: int == 42;} sets {@code value} and optionally {@code type}</li>
 * </ul>
 */
public record AliasBody(SourcePosition position, AliasKind aliasKind, TypeId type, IdExpression namespaceName,
                        Expression value) implements DeclarationBody {

    public enum AliasKind {
        TYPE,
        NAMESPACE,
        OBJECT
    }

    @Override
    public Kind kind() {
        return Kind.ALIAS;
    }
}
