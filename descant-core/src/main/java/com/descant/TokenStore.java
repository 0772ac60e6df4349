package com.descant;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * The tokens of one source file.
 *
 * <p>Grammar tokens are grouped by candidate section, keyed by the line the
 * section starts on. Comments are kept in a separate list so parsing never
 * has to skip them; they are only re-interleaved when the tree is emitted.
 * Tokens synthesized later go to the append-only {@link GeneratedTokens}
 * buffer.</p>
 */
public final class TokenStore {

    private static final Logger log = LoggerFactory.getLogger(TokenStore.class);

    /** Line numbers for generated code start here, well away from user lines. */
    public static final int GENERATED_LINE_BASE = -1_000_000;

    private final List<ErrorEntry> errors;
    private final SortedMap<Integer, List<Token>> grammarMap = new TreeMap<>();
    private final List<Comment> comments = new ArrayList<>();
    private final GeneratedTokens generated = new GeneratedTokens();

    public TokenStore(List<ErrorEntry> errors) {
        this.errors = errors;
    }

    /**
     * Tokenizes the candidate sections of {@code lines}.
     *
     * @param lines     tagged source lines, line N at index N-1
     * @param generated true for code synthesized by a metafunction
     */
    public void lex(List<SourceLine> lines, boolean generated) {
        int base = generated ? GENERATED_LINE_BASE : 0;
        LexerState state = new LexerState();
        BracesTracker braces = new BracesTracker(errors);
        List<Token> section = null;
        Lexer lexer = null;

        for (int i = 0; i < lines.size(); i++) {
            SourceLine line = lines.get(i);
            int lineno = base + i + 1;
            boolean continuing = state.inComment() || state.inRawString();

            if (!continuing) {
                switch (line.category()) {
                    case CANDIDATE, RAW_STRING -> {
                        if (section == null) {
                            section = new ArrayList<>();
                            grammarMap.put(lineno, section);
                            lexer = new Lexer(section, comments, errors);
                        }
                    }
                    case EMPTY, COMMENT -> {
                        if (section == null) {
                            continue;
                        }
                    }
                    case PREPROCESSOR -> {
                        braces.foundPreprocessorLine(line.text());
                        section = null;
                        continue;
                    }
                    case LEGACY, IMPORT -> {
                        section = null;
                        continue;
                    }
                }
            }

            int before = section.size();
            lexer.lexLine(line.text(), lineno, state);
            for (int t = before; t < section.size(); t++) {
                Token token = section.get(t);
                switch (token.type()) {
                    case LEFT_BRACE -> braces.foundOpenBrace(lineno, '{');
                    case LEFT_PAREN -> braces.foundOpenBrace(lineno, '(');
                    case RIGHT_BRACE -> braces.foundCloseBrace(token.position(), '}');
                    case RIGHT_PAREN -> braces.foundCloseBrace(token.position(), ')');
                    default -> { }
                }
            }
        }

        if (state.inComment()) {
            ErrorEntry.report(errors, new ErrorEntry(state.currentCommentStart(),
                    "unexpected end of source file while in a comment - did you forget to close a /* comment?"));
        }
        if (state.inRawString()) {
            ErrorEntry.report(errors, new ErrorEntry(state.rawStringStart(),
                    "unterminated raw string literal - its closing sequence was never found"));
        }
        braces.foundEof(new SourcePosition(base + lines.size(), 1));

        grammarMap.values().removeIf(List::isEmpty);
        if (log.isDebugEnabled()) {
            log.debug("lexed {} line(s) into {} section(s), {} comment(s)",
                    lines.size(), grammarMap.size(), comments.size());
        }
    }

    /** Tokens per candidate section, keyed by the section's first line. */
    public SortedMap<Integer, List<Token>> getMap() {
        return Collections.unmodifiableSortedMap(grammarMap);
    }

    public List<Comment> getComments() {
        return Collections.unmodifiableList(comments);
    }

    public GeneratedTokens getGenerated() {
        return generated;
    }

    /** All section tokens in source order. */
    public List<Token> allTokens() {
        List<Token> all = new ArrayList<>();
        grammarMap.values().forEach(all::addAll);
        return all;
    }

    public String debugPrint() {
        StringBuilder out = new StringBuilder();
        for (Map.Entry<Integer, List<Token>> entry : grammarMap.entrySet()) {
            out.append("--- Section starting at line ").append(entry.getKey()).append('\n');
            for (Token token : entry.getValue()) {
                out.append("    ").append(token.position()).append(' ')
                   .append(token.labelized()).append('\n');
            }
        }
        out.append("--- Comments\n");
        for (Comment comment : comments) {
            out.append("    ").append(comment.start()).append('-').append(comment.end())
               .append(' ').append(comment.text()).append('\n');
        }
        out.append("--- Generated tokens\n");
        for (Token token : generated.view()) {
            out.append("    ").append(token.position()).append(' ').append(token.labelized()).append('\n');
        }
        return out.toString();
    }
}
