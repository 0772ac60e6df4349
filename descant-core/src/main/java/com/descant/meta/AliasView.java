package com.descant.meta;

import com.descant.ast.AliasBody;
import com.descant.ast.Declaration;
import com.descant.ast.TreePrinter;

/** Reflection view over a type, namespace or object alias. */
public class AliasView extends DeclarationView {

    public AliasView(Declaration n, CompilerServices s) {
        super(n, s);
        if (!n.isAlias()) {
            throw new IllegalArgumentException("'" + n.name() + "' is not an alias");
        }
    }

    /** What the alias stands for, as text. */
    public String aliasedText() {
        AliasBody a = n.alias();
        return switch (a.aliasKind()) {
            case TYPE -> TreePrinter.print(a.type());
            case NAMESPACE -> TreePrinter.print(a.namespaceName());
            case OBJECT -> TreePrinter.print(a.value());
        };
    }
}
