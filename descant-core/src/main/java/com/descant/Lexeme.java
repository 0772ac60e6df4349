package com.descant;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * The classified kind of a token.
 *
 * Operator and punctuation constants carry their spelling; the lexer matches
 * them longest first (see {@link #operatorsLongestFirst()}).
 */
public enum Lexeme {
    SLASH_EQ("/="),
    SLASH("/"),
    LEFT_SHIFT_EQ("<<="),
    LEFT_SHIFT("<<"),
    SPACESHIP("<=>"),
    LESS_EQ("<="),
    LESS("<"),
    RIGHT_SHIFT_EQ(">>="),
    RIGHT_SHIFT(">>"),
    GREATER_EQ(">="),
    GREATER(">"),
    PLUS_PLUS("++"),
    PLUS_EQ("+="),
    PLUS("+"),
    MINUS_MINUS("--"),
    MINUS_EQ("-="),
    ARROW("->"),
    MINUS("-"),
    LOGICAL_OR_EQ("||="),
    LOGICAL_OR("||"),
    PIPE_EQ("|="),
    PIPE("|"),
    LOGICAL_AND_EQ("&&="),
    LOGICAL_AND("&&"),
    MULTIPLY_EQ("*="),
    MULTIPLY("*"),
    MODULO_EQ("%="),
    MODULO("%"),
    AMPERSAND_EQ("&="),
    AMPERSAND("&"),
    CARET_EQ("^="),
    CARET("^"),
    TILDE_EQ("~="),
    TILDE("~"),
    EQUAL_COMPARISON("=="),
    ASSIGNMENT("="),
    NOT_EQUAL_COMPARISON("!="),
    NOT("!"),
    LEFT_BRACE("{"),
    RIGHT_BRACE("}"),
    LEFT_PAREN("("),
    RIGHT_PAREN(")"),
    LEFT_BRACKET("["),
    RIGHT_BRACKET("]"),
    SCOPE("::"),
    COLON(":"),
    SEMICOLON(";"),
    COMMA(","),
    ELLIPSIS("..."),
    DOT("."),
    QUESTION_MARK("?"),
    AT("@"),
    DOLLAR("$"),
    FLOAT_LITERAL(null),
    BINARY_LITERAL(null),
    DECIMAL_LITERAL(null),
    HEXADECIMAL_LITERAL(null),
    STRING_LITERAL(null),
    CHARACTER_LITERAL(null),
    KEYWORD(null),
    MULTI_KEYWORD(null),
    FIXED_TYPE(null),
    IDENTIFIER(null),
    NONE(null);

    private static final List<Lexeme> OPERATORS_LONGEST_FIRST;

    static {
        List<Lexeme> ops = new ArrayList<>();
        for (Lexeme l : values()) {
            if (l.symbol != null) {
                ops.add(l);
            }
        }
        // stable: ties keep declaration order
        ops.sort(Comparator.comparingInt((Lexeme l) -> l.symbol.length()).reversed());
        OPERATORS_LONGEST_FIRST = Collections.unmodifiableList(ops);
    }

    private final String symbol;

    Lexeme(String symbol) {
        this.symbol = symbol;
    }

    /** The fixed spelling, or null for literal/word lexemes. */
    public String symbol() {
        return symbol;
    }

    public static List<Lexeme> operatorsLongestFirst() {
        return OPERATORS_LONGEST_FIRST;
    }

    public boolean isLiteral() {
        return switch (this) {
            case FLOAT_LITERAL, BINARY_LITERAL, DECIMAL_LITERAL, HEXADECIMAL_LITERAL,
                 STRING_LITERAL, CHARACTER_LITERAL -> true;
            default -> false;
        };
    }

    public boolean isAssignmentOperator() {
        return switch (this) {
            case ASSIGNMENT, SLASH_EQ, LEFT_SHIFT_EQ, RIGHT_SHIFT_EQ, PLUS_EQ, MINUS_EQ,
                 MULTIPLY_EQ, MODULO_EQ, AMPERSAND_EQ, CARET_EQ, PIPE_EQ,
                 LOGICAL_AND_EQ, LOGICAL_OR_EQ -> true;
            default -> false;
        };
    }

    /** Operators that read as a comparison or shift and clash with template brackets. */
    public boolean isAngleOperator() {
        return switch (this) {
            case LESS, GREATER, LESS_EQ, GREATER_EQ, SPACESHIP, LEFT_SHIFT, RIGHT_SHIFT,
                 LEFT_SHIFT_EQ, RIGHT_SHIFT_EQ -> true;
            default -> false;
        };
    }

    public boolean isOperator() {
        return symbol != null && this != LEFT_BRACE && this != RIGHT_BRACE
                && this != SEMICOLON && this != COMMA && this != AT;
    }

    /** The lexeme that closes this opening bracket, or NONE. */
    public Lexeme closeParenType() {
        return switch (this) {
            case LEFT_BRACE -> RIGHT_BRACE;
            case LEFT_BRACKET -> RIGHT_BRACKET;
            case LEFT_PAREN -> RIGHT_PAREN;
            default -> NONE;
        };
    }
}
