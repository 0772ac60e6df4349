package com.descant;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Tracks {@code {}} and {@code ()} nesting across a file and reports
 * mismatches.
 *
 * <p>Preprocessor conditionals are understood: when the {@code #if} and
 * {@code #else} branches of one conditional each leave the same net number
 * of braces open, those braces were counted twice and are dropped again at
 * {@code #endif}.</p>
 */
public final class BracesTracker {

    public enum PreprocessorConditional {
        NONE,
        IF,
        ELSE,
        ENDIF
    }

    private record Open(char kind, int lineno) {}

    private static final class ConditionalDepth {
        int ifNetBraces;
        boolean foundElse;
        int elseNetBraces;

        void foundOpen() {
            if (foundElse) {
                elseNetBraces++;
            } else {
                ifNetBraces++;
            }
        }

        void foundClose() {
            if (foundElse) {
                elseNetBraces--;
            } else {
                ifNetBraces--;
            }
        }

        int bracesToIgnore() {
            if (foundElse && ifNetBraces == elseNetBraces && ifNetBraces > 0) {
                return ifNetBraces;
            }
            return 0;
        }
    }

    private final List<ErrorEntry> errors;
    private final Deque<Open> open = new ArrayDeque<>();
    // first entry is a sentinel for code outside any conditional
    private final List<ConditionalDepth> preprocessor = new ArrayList<>(List.of(new ConditionalDepth()));

    public BracesTracker(List<ErrorEntry> errors) {
        this.errors = errors;
    }

    public void foundOpenBrace(int lineno, char brace) {
        open.push(new Open(brace, lineno));
        current().foundOpen();
    }

    public void foundCloseBrace(SourcePosition pos, char brace) {
        char expected = brace == '}' ? '{' : '(';
        if (open.isEmpty()) {
            ErrorEntry.report(errors, new ErrorEntry(pos,
                    "closing " + brace + " does not match a prior " + expected));
            return;
        }
        Open top = open.peek();
        if (top.kind() != expected) {
            ErrorEntry.report(errors, new ErrorEntry(pos,
                    "closing " + brace + " does not match the " + top.kind() + " opened on line " + top.lineno()));
        }
        open.pop();
        current().foundClose();
    }

    public void foundEof(SourcePosition pos) {
        if (!open.isEmpty()) {
            Open last = open.peek();
            char closer = last.kind() == '{' ? '}' : ')';
            ErrorEntry.report(errors, new ErrorEntry(pos,
                    "end of file reached with " + open.size() + " missing " + closer
                            + " to match earlier " + last.kind() + " on line " + last.lineno()));
        }
    }

    public int currentDepth() {
        return open.size();
    }

    public void foundPreIf() {
        preprocessor.add(new ConditionalDepth());
    }

    public void foundPreElse() {
        current().foundElse = true;
    }

    public void foundPreEndif() {
        if (preprocessor.size() > 1) {
            int ignore = current().bracesToIgnore();
            for (int i = 0; i < ignore && !open.isEmpty(); i++) {
                open.pop();
            }
            preprocessor.remove(preprocessor.size() - 1);
        }
    }

    /** Feeds one preprocessor line; returns which conditional it was, if any. */
    public PreprocessorConditional foundPreprocessorLine(String line) {
        PreprocessorConditional kind = classify(line);
        switch (kind) {
            case IF -> foundPreIf();
            case ELSE -> foundPreElse();
            case ENDIF -> foundPreEndif();
            case NONE -> { }
        }
        return kind;
    }

    static PreprocessorConditional classify(String line) {
        String s = line.strip();
        if (!s.startsWith("#")) {
            return PreprocessorConditional.NONE;
        }
        s = s.substring(1).stripLeading();
        if (s.startsWith("if")) {
            return PreprocessorConditional.IF;
        }
        if (s.startsWith("else") || s.startsWith("elif")) {
            return PreprocessorConditional.ELSE;
        }
        if (s.startsWith("endif")) {
            return PreprocessorConditional.ENDIF;
        }
        return PreprocessorConditional.NONE;
    }

    private ConditionalDepth current() {
        return preprocessor.get(preprocessor.size() - 1);
    }
}
