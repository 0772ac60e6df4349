package com.descant.ast;

import com.descant.Token;

/**
 * Parameter passing direction.
 */
public enum PassingStyle {
    IN,
    COPY,
    INOUT,
    OUT,
    MOVE,
    FORWARD;

    public String spelling() {
        return name().toLowerCase();
    }

    /** The style a token spells, or null if it is not a direction keyword. */
    public static PassingStyle fromToken(Token t) {
        return switch (t.text()) {
            case "in" -> IN;
            case "copy" -> COPY;
            case "inout" -> INOUT;
            case "out" -> OUT;
            case "move" -> MOVE;
            case "forward" -> FORWARD;
            default -> null;
        };
    }
}
