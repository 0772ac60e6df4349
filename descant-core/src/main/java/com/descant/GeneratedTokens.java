package com.descant;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Append-only home for tokens synthesized after lexing, by the parser or by
 * metafunctions. Entries are never removed or replaced, so any tree node
 * holding one of these tokens stays valid for the life of the tree.
 */
public final class GeneratedTokens {

    private final List<Token> tokens = new ArrayList<>();

    public Token add(Token token) {
        tokens.add(token);
        return token;
    }

    public List<Token> addAll(List<Token> more) {
        int from = tokens.size();
        tokens.addAll(more);
        return List.copyOf(tokens.subList(from, tokens.size()));
    }

    public int size() {
        return tokens.size();
    }

    public Token get(int index) {
        return tokens.get(index);
    }

    public List<Token> view() {
        return Collections.unmodifiableList(tokens);
    }
}
