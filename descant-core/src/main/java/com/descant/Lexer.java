package com.descant;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Tokenizes candidate-syntax source one line at a time.
 *
 * <p>The lexer is stateless between calls except for the {@link LexerState}
 * the caller threads through: an open block comment or raw string literal
 * continues on the next line. A malformed line is never thrown away; the
 * lexer records a positioned error and keeps emitting best-effort tokens so
 * that parsing can carry on.</p>
 */
public final class Lexer {

    static final Set<String> KEYWORDS = Set.of(
        "alignas", "alignof", "asm", "as", "auto", "bool", "break", "case", "catch",
        "char", "char16_t", "char32_t", "char8_t", "class", "co_await", "co_return",
        "co_yield", "concept", "const", "const_cast", "consteval", "constexpr",
        "constinit", "continue", "decltype", "default", "double", "do",
        "dynamic_cast", "else", "enum", "explicit", "export", "extern", "float",
        "for", "friend", "goto", "if", "import", "inline", "int", "is", "long",
        "module", "mutable", "namespace", "noexcept", "nullptr", "operator",
        "private", "protected", "public", "register", "reinterpret_cast",
        "requires", "return", "short", "signed", "sizeof", "static",
        "static_assert", "static_cast", "struct", "switch", "template", "this",
        "thread_local", "throw", "throws", "true", "false", "try", "typedef",
        "typeid", "typename", "unsigned", "using", "virtual", "void", "volatile",
        "wchar_t", "while"
    );

    static final Set<String> MULTI_KEYWORD_PARTS = Set.of(
        "unsigned", "signed", "long", "short", "int", "char", "double"
    );

    static final Set<String> FIXED_TYPES = Set.of(
        "i8", "i16", "i32", "i64", "u8", "u16", "u32", "u64", "f32", "f64",
        "ushort", "uint", "ulong", "longlong", "ulonglong", "longdouble",
        "_schar", "_uchar"
    );

    private final List<Token> tokens;
    private final List<Comment> comments;
    private final List<ErrorEntry> errors;

    public Lexer(List<Token> tokens, List<Comment> comments, List<ErrorEntry> errors) {
        this.tokens = tokens;
        this.comments = comments;
        this.errors = errors;
    }

    /**
     * Tokenizes one line.
     *
     * @param line   the line text
     * @param lineno the line number to stamp on tokens
     * @param state  state carried over from the previous line; updated
     * @return true if no error was recorded for this line
     */
    public boolean lexLine(String line, int lineno, LexerState state) {
        return lexLine(line, lineno, 0, state);
    }

    private boolean lexLine(String line, int lineno, int colOffset, LexerState state) {
        int errorsBefore = errors.size();
        int n = line.length();
        int i = 0;

        if (state.rawString != null) {
            i = continueRawString(line, lineno, colOffset, state);
            if (i < 0) {
                return true;
            }
        }

        if (state.inComment) {
            int end = line.indexOf("*/");
            if (end < 0) {
                state.currentComment.append(line).append('\n');
                return true;
            }
            state.currentComment.append(line, 0, end + 2);
            comments.add(new Comment(Comment.Kind.BLOCK, state.currentCommentStart,
                    new SourcePosition(lineno, colOffset + end + 3), state.currentComment.toString()));
            state.inComment = false;
            state.currentComment.setLength(0);
            i = end + 2;
        }

        while (i < n) {
            char c = line.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
                continue;
            }
            SourcePosition pos = new SourcePosition(lineno, colOffset + i + 1);

            if (line.startsWith("//", i)) {
                comments.add(new Comment(Comment.Kind.LINE, pos,
                        new SourcePosition(lineno, colOffset + n + 1), line.substring(i)));
                break;
            }
            if (line.startsWith("/*", i)) {
                int end = line.indexOf("*/", i + 2);
                if (end < 0) {
                    state.inComment = true;
                    state.currentCommentStart = pos;
                    state.currentComment.setLength(0);
                    state.currentComment.append(line, i, n).append('\n');
                    break;
                }
                comments.add(new Comment(Comment.Kind.BLOCK, pos,
                        new SourcePosition(lineno, colOffset + end + 3), line.substring(i, end + 2)));
                i = end + 2;
                continue;
            }

            int rawPrefix = rawStringPrefixLength(line, i);
            if (rawPrefix > 0) {
                i = lexRawString(line, i, rawPrefix, pos, lineno, colOffset, state);
                continue;
            }
            int quotePrefix = encodingPrefixLength(line, i, '"');
            if (quotePrefix >= 0) {
                i = lexQuoted(line, i, i + quotePrefix, '"', pos, lineno);
                continue;
            }
            int charPrefix = encodingPrefixLength(line, i, '\'');
            if (charPrefix >= 0 && (charPrefix > 0 || !isDigit(previousChar(line, i)))) {
                i = lexQuoted(line, i, i + charPrefix, '\'', pos, lineno);
                continue;
            }
            if (isDigit(c) || (c == '.' && i + 1 < n && isDigit(line.charAt(i + 1)))) {
                i = lexNumber(line, i, pos);
                continue;
            }
            if (isIdentifierStart(c)) {
                i = lexWord(line, i, pos);
                continue;
            }
            Lexeme op = matchOperator(line, i);
            if (op != null) {
                tokens.add(new Token(op.symbol(), pos, op));
                i += op.symbol().length();
                continue;
            }
            error(pos, "unexpected text '" + c + "'");
            i++;
        }
        return errors.size() == errorsBefore;
    }

    // -----------------------------------------------------------------------
    // Raw strings

    /** Length of a raw string opener before the delimiter ({@code R"}, {@code u8R"}, {@code $R"}), or 0. */
    private static int rawStringPrefixLength(String line, int i) {
        int j = i;
        if (j < line.length() && line.charAt(j) == '$') {
            j++;
        }
        j += Math.max(0, encodingPrefixLengthAt(line, j));
        if (line.startsWith("R\"", j)) {
            return j + 2 - i;
        }
        return 0;
    }

    private int lexRawString(String line, int i, int prefixLen, SourcePosition pos, int lineno,
                             int colOffset, LexerState state) {
        boolean interpolate = line.charAt(i) == '$';
        int delimStart = i + prefixLen;
        int open = line.indexOf('(', delimStart);
        if (open < 0 || open - delimStart > 16 || containsAny(line.substring(delimStart, open), " )\\\t")) {
            error(pos, "invalid raw string literal delimiter");
            tokens.add(new Token(line.substring(i), pos, Lexeme.STRING_LITERAL));
            return line.length();
        }
        String delim = line.substring(delimStart, open);
        String closingSeq = ")" + delim + "\"";
        int close = line.indexOf(closingSeq, open + 1);
        if (close < 0) {
            state.rawString = new LexerState.OpenRawString(pos, closingSeq, interpolate);
            state.rawString.text.append(line, i, line.length()).append('\n');
            return line.length();
        }
        int end = close + closingSeq.length();
        String text = line.substring(i, end);
        emitRawString(text, interpolate, closingSeq, pos);
        return end;
    }

    /** Returns the index to resume at, or -1 if the whole line was consumed. */
    private int continueRawString(String line, int lineno, int colOffset, LexerState state) {
        LexerState.OpenRawString raw = state.rawString;
        int close = line.indexOf(raw.closingSeq);
        if (close < 0) {
            raw.text.append(line).append('\n');
            return -1;
        }
        int end = close + raw.closingSeq.length();
        raw.text.append(line, 0, end);
        state.rawString = null;
        emitRawString(raw.text.toString(), raw.interpolate, raw.closingSeq, raw.start);
        return end;
    }

    private void emitRawString(String text, boolean interpolate, String closingSeq, SourcePosition pos) {
        if (interpolate) {
            String body = text.substring(1);
            int open = body.indexOf('(');
            String openSeq = body.substring(0, open + 1);
            String interior = body.substring(open + 1, body.length() - closingSeq.length());
            text = StringInterpolation.expand(interior, openSeq, closingSeq, pos, this::relex, errors);
        }
        tokens.add(new Token(text, pos, Lexeme.STRING_LITERAL));
    }

    // -----------------------------------------------------------------------
    // String and character literals

    /** Length of an encoding prefix ending right before {@code quote}, or -1 if no quote follows. */
    private static int encodingPrefixLength(String line, int i, char quote) {
        int len = Math.max(0, encodingPrefixLengthAt(line, i));
        if (i + len < line.length() && line.charAt(i + len) == quote) {
            return len;
        }
        return -1;
    }

    private static int encodingPrefixLengthAt(String line, int i) {
        if (line.startsWith("u8", i)) {
            return 2;
        }
        if (i < line.length() && "uUL".indexOf(line.charAt(i)) >= 0) {
            return 1;
        }
        return 0;
    }

    private int lexQuoted(String line, int start, int quoteAt, char quote, SourcePosition pos, int lineno) {
        int j = quoteAt + 1;
        int n = line.length();
        while (j < n && line.charAt(j) != quote) {
            if (line.charAt(j) == '\\') {
                j++;
            }
            j++;
        }
        boolean isString = quote == '"';
        if (j >= n) {
            String text = line.substring(start);
            error(pos, (isString ? "string" : "character") + " literal " + text
                    + " is missing its closing " + quote);
            tokens.add(new Token(text + quote, pos, isString ? Lexeme.STRING_LITERAL : Lexeme.CHARACTER_LITERAL));
            return n;
        }
        String text = line.substring(start, j + 1);
        if (!isString) {
            if (j == quoteAt + 1) {
                error(pos, "character literal '' must contain a character");
            }
            tokens.add(new Token(text, pos, Lexeme.CHARACTER_LITERAL));
            return j + 1;
        }
        if (text.contains(")$")) {
            String openSeq = line.substring(start, quoteAt + 1);
            String interior = line.substring(quoteAt + 1, j);
            text = StringInterpolation.expand(interior, openSeq, "\"", pos, this::relex, errors);
        }
        tokens.add(new Token(text, pos, Lexeme.STRING_LITERAL));
        return j + 1;
    }

    /** Re-tokenizes an interpolated expression; its tokens are only used for validation. */
    private List<Token> relex(String text, SourcePosition at) {
        List<Token> nested = new ArrayList<>();
        Lexer lexer = new Lexer(nested, new ArrayList<>(), errors);
        LexerState state = new LexerState();
        lexer.lexLine(text, at.lineno(), at.colno() - 1, state);
        if (state.inComment || state.rawString != null) {
            error(at, "an interpolated expression must be complete on one line");
        }
        return nested;
    }

    // -----------------------------------------------------------------------
    // Numbers

    private int lexNumber(String line, int start, SourcePosition pos) {
        int n = line.length();
        int j = start;
        Lexeme type;

        if (line.startsWith("0b", start) || line.startsWith("0B", start)) {
            j = start + 2;
            int digitsStart = j;
            j = scanDigits(line, j, 2, pos);
            if (j == digitsStart) {
                error(pos, "binary literal cannot be empty (0B must be followed by binary digits)");
            }
            if (j < n && isDigit(line.charAt(j))) {
                error(pos, "invalid binary digit '" + line.charAt(j) + "' - binary digits can only be 0 or 1");
                while (j < n && isDigit(line.charAt(j))) {
                    j++;
                }
            }
            type = Lexeme.BINARY_LITERAL;
        } else if (line.startsWith("0x", start) || line.startsWith("0X", start)) {
            j = start + 2;
            int digitsStart = j;
            j = scanDigits(line, j, 16, pos);
            if (j == digitsStart) {
                error(pos, "hexadecimal literal cannot be empty (0X must be followed by hexadecimal digits)");
            }
            type = Lexeme.HEXADECIMAL_LITERAL;
        } else {
            j = scanDigits(line, j, 10, pos);
            type = Lexeme.DECIMAL_LITERAL;
            if (j + 1 < n && line.charAt(j) == '.' && isDigit(line.charAt(j + 1))) {
                j = scanDigits(line, j + 1, 10, pos);
                type = Lexeme.FLOAT_LITERAL;
            } else if (j + 1 < n && line.charAt(j) == '.' && !isIdentifierStart(line.charAt(j + 1))
                    && line.charAt(j + 1) != '.') {
                j++;
                type = Lexeme.FLOAT_LITERAL;
            }
            if (j < n && (line.charAt(j) == 'e' || line.charAt(j) == 'E')) {
                int k = j + 1;
                if (k < n && (line.charAt(k) == '+' || line.charAt(k) == '-')) {
                    k++;
                }
                if (k < n && isDigit(line.charAt(k))) {
                    j = scanDigits(line, k, 10, pos);
                    type = Lexeme.FLOAT_LITERAL;
                }
            }
        }

        // literal suffix, e.g. 10u or 1.5f
        while (j < n && isIdentifierContinue(line.charAt(j))) {
            j++;
        }
        tokens.add(new Token(line.substring(start, j), pos, type));
        return j;
    }

    private int scanDigits(String line, int j, int radix, SourcePosition pos) {
        int n = line.length();
        while (j < n) {
            char c = line.charAt(j);
            if (c == '\'') {
                if (j + 1 >= n || !isDigitOf(line.charAt(j + 1), radix)) {
                    error(pos, "a digit separator (') must be followed by a digit");
                    return j + 1;
                }
                j++;
                continue;
            }
            if (!isDigitOf(c, radix)) {
                break;
            }
            j++;
        }
        return j;
    }

    // -----------------------------------------------------------------------
    // Words

    private int lexWord(String line, int start, SourcePosition pos) {
        int j = wordEnd(line, start);
        String word = line.substring(start, j);

        if (word.equals("operator")) {
            int k = skipSpaces(line, j);
            String op = operatorNameAt(line, k);
            if (op != null) {
                tokens.add(new Token("operator" + op, pos, Lexeme.IDENTIFIER));
                return k + op.length();
            }
        }

        if (MULTI_KEYWORD_PARTS.contains(word)) {
            StringBuilder text = new StringBuilder(word);
            int end = j;
            int words = 1;
            while (true) {
                int k = skipSpaces(line, end);
                if (k == end || k >= line.length() || !isIdentifierStart(line.charAt(k))) {
                    break;
                }
                int e = wordEnd(line, k);
                String next = line.substring(k, e);
                if (!MULTI_KEYWORD_PARTS.contains(next)) {
                    break;
                }
                text.append(' ').append(next);
                end = e;
                words++;
            }
            if (words > 1) {
                tokens.add(new Token(text.toString(), pos, Lexeme.MULTI_KEYWORD));
                return end;
            }
        }

        Lexeme type;
        if (KEYWORDS.contains(word)) {
            type = Lexeme.KEYWORD;
        } else if (FIXED_TYPES.contains(word)) {
            type = Lexeme.FIXED_TYPE;
        } else {
            type = Lexeme.IDENTIFIER;
        }
        tokens.add(new Token(word, pos, type));
        return j;
    }

    /** Operator spelled after the {@code operator} keyword, or null. */
    private static String operatorNameAt(String line, int k) {
        if (line.startsWith("()", k) || line.startsWith("[]", k)) {
            return line.substring(k, k + 2);
        }
        Lexeme op = matchOperator(line, k);
        if (op == null || !op.isOperator()) {
            return null;
        }
        return switch (op) {
            case LEFT_PAREN, RIGHT_PAREN, LEFT_BRACKET, RIGHT_BRACKET, SCOPE, COLON, DOT,
                 ELLIPSIS, QUESTION_MARK, DOLLAR, ARROW -> null;
            default -> op.symbol();
        };
    }

    private static Lexeme matchOperator(String line, int i) {
        for (Lexeme op : Lexeme.operatorsLongestFirst()) {
            if (line.startsWith(op.symbol(), i)) {
                return op;
            }
        }
        return null;
    }

    // -----------------------------------------------------------------------
    // Helpers

    private void error(SourcePosition pos, String msg) {
        ErrorEntry.report(errors, new ErrorEntry(pos, msg));
    }

    private static int wordEnd(String line, int j) {
        while (j < line.length() && isIdentifierContinue(line.charAt(j))) {
            j++;
        }
        return j;
    }

    private static int skipSpaces(String line, int j) {
        while (j < line.length() && (line.charAt(j) == ' ' || line.charAt(j) == '\t')) {
            j++;
        }
        return j;
    }

    private static char previousChar(String line, int i) {
        return i > 0 ? line.charAt(i - 1) : ' ';
    }

    private static boolean containsAny(String s, String chars) {
        for (int i = 0; i < chars.length(); i++) {
            if (s.indexOf(chars.charAt(i)) >= 0) {
                return true;
            }
        }
        return false;
    }

    static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    static boolean isDigitOf(char c, int radix) {
        return switch (radix) {
            case 2 -> c == '0' || c == '1';
            case 16 -> isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
            default -> isDigit(c);
        };
    }

    static boolean isIdentifierStart(char c) {
        return c == '_' || (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    static boolean isIdentifierContinue(char c) {
        return isIdentifierStart(c) || isDigit(c);
    }
}
