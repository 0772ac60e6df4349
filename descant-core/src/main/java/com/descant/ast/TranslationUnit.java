package com.descant.ast;

import com.descant.SourcePosition;

import java.util.ArrayList;
import java.util.List;

/**
 * The program tree: top-level declarations in source order.
 */
public final class TranslationUnit implements Node {

    private final List<Declaration> declarations = new ArrayList<>();

    @Override
    public SourcePosition position() {
        return declarations.isEmpty() ? SourcePosition.NONE : declarations.get(0).position();
    }

    public List<Declaration> declarations() {
        return declarations;
    }

    public void add(Declaration declaration) {
        declarations.add(declaration);
    }

    public int size() {
        return declarations.size();
    }

    /** Top-level declaration with this name, or null. */
    public Declaration find(String name) {
        for (Declaration d : declarations) {
            if (d.hasName(name)) {
                return d;
            }
        }
        return null;
    }
}
