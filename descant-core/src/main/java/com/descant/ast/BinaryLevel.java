package com.descant.ast;

import com.descant.Lexeme;

import java.util.EnumSet;
import java.util.Set;

/**
 * The twelve binary precedence levels, tightest first.
 */
public enum BinaryLevel {
    MULTIPLICATIVE(EnumSet.of(Lexeme.MULTIPLY, Lexeme.SLASH, Lexeme.MODULO)),
    ADDITIVE(EnumSet.of(Lexeme.PLUS, Lexeme.MINUS)),
    SHIFT(EnumSet.of(Lexeme.LEFT_SHIFT, Lexeme.RIGHT_SHIFT)),
    COMPARE(EnumSet.of(Lexeme.SPACESHIP)),
    RELATIONAL(EnumSet.of(Lexeme.LESS, Lexeme.GREATER, Lexeme.LESS_EQ, Lexeme.GREATER_EQ)),
    EQUALITY(EnumSet.of(Lexeme.EQUAL_COMPARISON, Lexeme.NOT_EQUAL_COMPARISON)),
    BIT_AND(EnumSet.of(Lexeme.AMPERSAND)),
    BIT_XOR(EnumSet.of(Lexeme.CARET)),
    BIT_OR(EnumSet.of(Lexeme.PIPE)),
    LOGICAL_AND(EnumSet.of(Lexeme.LOGICAL_AND)),
    LOGICAL_OR(EnumSet.of(Lexeme.LOGICAL_OR)),
    ASSIGNMENT(EnumSet.of(Lexeme.ASSIGNMENT, Lexeme.MULTIPLY_EQ, Lexeme.SLASH_EQ, Lexeme.MODULO_EQ,
            Lexeme.PLUS_EQ, Lexeme.MINUS_EQ, Lexeme.RIGHT_SHIFT_EQ, Lexeme.LEFT_SHIFT_EQ,
            Lexeme.AMPERSAND_EQ, Lexeme.CARET_EQ, Lexeme.PIPE_EQ));

    private final Set<Lexeme> operators;

    BinaryLevel(Set<Lexeme> operators) {
        this.operators = operators;
    }

    public boolean accepts(Lexeme l) {
        return operators.contains(l);
    }

    /** The next looser level, or null after assignment. */
    public BinaryLevel looser() {
        BinaryLevel[] all = values();
        return ordinal() + 1 < all.length ? all[ordinal() + 1] : null;
    }
}
