package com.descant.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The {@code $} captures found inside one function expression or contract.
 * Entries are non-owning: the expressions stay owned by the tree.
 */
public final class CaptureGroup {

    private final List<PostfixExpression> members = new ArrayList<>();

    /** Registers a capture and assigns it a unique symbol within this group. */
    public void add(PostfixExpression capture) {
        for (PostfixExpression existing : members) {
            if (existing == capture) {
                return;
            }
        }
        members.add(capture);
        capture.setCaptureSymbol("_" + String.format("%03d", members.size()) + "_"
                + TreePrinter.print(capture.primary()).replaceAll("[^A-Za-z0-9_]", "_"));
    }

    public boolean remove(PostfixExpression capture) {
        return members.removeIf(m -> m == capture);
    }

    /** Drops every capture registered after the first {@code size}. */
    public void truncate(int size) {
        while (members.size() > size) {
            members.remove(members.size() - 1);
        }
    }

    public List<PostfixExpression> members() {
        return Collections.unmodifiableList(members);
    }

    public boolean isEmpty() {
        return members.isEmpty();
    }
}
