package com.descant.meta;

import com.descant.ast.Declaration;
import com.descant.ast.ExpressionStatement;
import com.descant.ast.TreePrinter;

/** Reflection view over an object declaration. */
public class ObjectView extends DeclarationView {

    public ObjectView(Declaration n, CompilerServices s) {
        super(n, s);
        if (!n.isObject()) {
            throw new IllegalArgumentException("'" + n.name() + "' is not an object");
        }
    }

    public boolean isConst() {
        return n.object().type() != null && n.object().type().isConst();
    }

    public boolean hasWildcardType() {
        return n.object().hasWildcardType();
    }

    /** The declared type as text; {@code _} when it is deduced. */
    public String type() {
        return n.object().type() == null ? "_" : TreePrinter.print(n.object().type());
    }

    /** The initializer as text, or "" if there is none. */
    public String initializer() {
        if (n.initializer() == null) {
            return "";
        }
        if (n.initializer() instanceof ExpressionStatement es) {
            return TreePrinter.print(es.expression());
        }
        return TreePrinter.print(n.initializer());
    }
}
