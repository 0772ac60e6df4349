package com.descant;

/**
 * One line of program source, tagged by the line classifier.
 */
public record SourceLine(String text, Category category) {

    public enum Category {
        EMPTY,
        PREPROCESSOR,
        COMMENT,
        IMPORT,
        LEGACY,
        CANDIDATE,
        RAW_STRING
    }

    public SourceLine {
        if (text == null) {
            text = "";
        }
        if (category == null) {
            category = Category.EMPTY;
        }
    }

    public static SourceLine candidate(String text) {
        return new SourceLine(text, Category.CANDIDATE);
    }

    public int indent() {
        int i = 0;
        while (i < text.length() && Character.isWhitespace(text.charAt(i))) {
            i++;
        }
        return i;
    }
}
