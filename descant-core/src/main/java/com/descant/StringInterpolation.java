package com.descant;

import java.util.ArrayList;
import java.util.List;
import java.util.function.BiFunction;

/**
 * Expands {@code (expr)$} interpolation markers inside string literals.
 *
 * <p>{@code "sum is (a + b)$!"} becomes
 * {@code "sum is " + cpp2::to_string(a + b) + "!"}. Each embedded expression
 * is handed back to the lexer so malformed code inside a string is diagnosed
 * like any other code.</p>
 */
final class StringInterpolation {

    private sealed interface Part permits Text, Code {}

    private record Text(String text) implements Part {}

    private record Code(String code) implements Part {}

    private StringInterpolation() {
    }

    /**
     * @param interior text between the opening and closing sequences
     * @param openSeq  opening sequence, e.g. {@code "} or {@code u8R"x(}
     * @param closeSeq closing sequence, e.g. {@code "} or {@code )x"}
     * @param pos      position of the literal
     * @param relex    re-tokenizes an embedded expression found at a position
     * @param errors   error sink
     * @return the expanded literal text, or the original literal if it has no markers
     */
    static String expand(String interior, String openSeq, String closeSeq, SourcePosition pos,
                         BiFunction<String, SourcePosition, List<Token>> relex,
                         List<ErrorEntry> errors) {
        List<Part> parts = new ArrayList<>();
        int partStart = 0;
        int i = 0;
        while (i < interior.length()) {
            char c = interior.charAt(i);
            if (c == '\\' && !openSeq.contains("R\"")) {
                i += 2;
                continue;
            }
            if (c == ')' && i + 1 < interior.length() && interior.charAt(i + 1) == '$') {
                int open = matchingOpenParen(interior, partStart, i);
                SourcePosition at = pos.shifted(openSeq.length() + Math.max(open, 0) + 1);
                if (open < 0) {
                    ErrorEntry.report(errors, new ErrorEntry(pos.shifted(openSeq.length() + i),
                            "no matching ( for string interpolation ending in )$"));
                    i += 2;
                    continue;
                }
                String code = interior.substring(open + 1, i);
                if (code.isBlank()) {
                    ErrorEntry.report(errors, new ErrorEntry(at, "string interpolation must not be empty"));
                } else {
                    relex.apply(code, at);
                }
                if (open > partStart) {
                    parts.add(new Text(interior.substring(partStart, open)));
                }
                parts.add(new Code(code.trim()));
                i += 2;
                partStart = i;
                continue;
            }
            i++;
        }

        if (parts.isEmpty()) {
            return openSeq + interior + closeSeq;
        }
        if (partStart < interior.length()) {
            parts.add(new Text(interior.substring(partStart)));
        }

        StringBuilder out = new StringBuilder();
        for (Part part : parts) {
            if (out.length() > 0) {
                out.append(" + ");
            }
            if (part instanceof Text t) {
                out.append(openSeq).append(t.text()).append(closeSeq);
            } else if (part instanceof Code code) {
                out.append("cpp2::to_string(").append(code.code()).append(')');
            }
        }
        return out.toString();
    }

    private static int matchingOpenParen(String s, int lowerBound, int close) {
        int depth = 0;
        for (int j = close; j >= lowerBound; j--) {
            char c = s.charAt(j);
            if (c == ')') {
                depth++;
            } else if (c == '(') {
                depth--;
                if (depth == 0) {
                    return j;
                }
            }
        }
        return -1;
    }
}
