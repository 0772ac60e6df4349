package com.descant;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Bracket matching across a file, including preprocessor conditionals.
 */
public class BracesTrackerTest {

    private final List<ErrorEntry> errors = new ArrayList<>();

    // ==================== Matching ====================

    @Test
    @DisplayName("Balanced braces and parentheses report nothing")
    void testBalanced() {
        BracesTracker braces = new BracesTracker(errors);
        braces.foundOpenBrace(1, '{');
        braces.foundOpenBrace(2, '(');
        braces.foundCloseBrace(new SourcePosition(2, 9), ')');
        braces.foundCloseBrace(new SourcePosition(3, 1), '}');
        braces.foundEof(new SourcePosition(3, 1));

        assertTrue(errors.isEmpty(), () -> "unexpected errors: " + errors);
        assertEquals(0, braces.currentDepth());
    }

    @Test
    @DisplayName("A closer of the wrong kind names the opener's line")
    void testMismatchedCloser() {
        BracesTracker braces = new BracesTracker(errors);
        braces.foundOpenBrace(4, '(');
        braces.foundCloseBrace(new SourcePosition(5, 3), '}');

        assertEquals(1, errors.size());
        assertEquals(new SourcePosition(5, 3), errors.get(0).where());
        assertEquals("closing } does not match the ( opened on line 4", errors.get(0).msg());
    }

    @Test
    @DisplayName("A closer with nothing open is an error")
    void testUnmatchedCloser() {
        BracesTracker braces = new BracesTracker(errors);
        braces.foundCloseBrace(new SourcePosition(1, 7), ')');

        assertEquals("closing ) does not match a prior (", errors.get(0).msg());
    }

    @Test
    @DisplayName("Braces still open at end of file are reported once")
    void testMissingCloserAtEof() {
        BracesTracker braces = new BracesTracker(errors);
        braces.foundOpenBrace(1, '{');
        braces.foundOpenBrace(2, '{');
        braces.foundEof(new SourcePosition(9, 1));

        assertEquals(1, errors.size());
        assertEquals("end of file reached with 2 missing } to match earlier { on line 2", errors.get(0).msg());
    }

    // ==================== Preprocessor ====================

    @Test
    @DisplayName("#if and #else opening the same braces are counted once")
    void testConditionalBranchesReconciled() {
        BracesTracker braces = new BracesTracker(errors);
        assertEquals(BracesTracker.PreprocessorConditional.IF, braces.foundPreprocessorLine("#if WIDE"));
        braces.foundOpenBrace(2, '{');
        assertEquals(BracesTracker.PreprocessorConditional.ELSE, braces.foundPreprocessorLine("  # else"));
        braces.foundOpenBrace(4, '{');
        assertEquals(BracesTracker.PreprocessorConditional.ENDIF, braces.foundPreprocessorLine("#endif"));

        assertEquals(1, braces.currentDepth());
        braces.foundCloseBrace(new SourcePosition(6, 1), '}');
        braces.foundEof(new SourcePosition(6, 1));
        assertTrue(errors.isEmpty(), () -> "unexpected errors: " + errors);
    }

    @Test
    @DisplayName("Branches that open different counts are left alone")
    void testConditionalBranchesDiffer() {
        BracesTracker braces = new BracesTracker(errors);
        braces.foundPreprocessorLine("#ifdef A");
        braces.foundOpenBrace(2, '{');
        braces.foundPreprocessorLine("#else");
        braces.foundPreprocessorLine("#endif");

        assertEquals(1, braces.currentDepth());
        assertEquals(BracesTracker.PreprocessorConditional.NONE, braces.foundPreprocessorLine("#include <vector>"));
    }

    @Test
    @DisplayName("Preprocessor branches reconcile through the token store")
    void testTokenStoreReconcilesBranches() {
        TokenStore store = new TokenStore(errors);
        store.lex(List.of(
                new SourceLine("#if WIDE", SourceLine.Category.PREPROCESSOR),
                SourceLine.candidate("f: (x: i64) = {"),
                new SourceLine("#else", SourceLine.Category.PREPROCESSOR),
                SourceLine.candidate("f: (x: i32) = {"),
                new SourceLine("#endif", SourceLine.Category.PREPROCESSOR),
                SourceLine.candidate("}")), false);

        assertTrue(errors.isEmpty(), () -> "unexpected errors: " + errors);
    }

    @Test
    @DisplayName("Mismatches found while lexing are positioned errors")
    void testTokenStoreReportsMismatch() {
        TokenStore store = new TokenStore(errors);
        store.lex(List.of(SourceLine.candidate("f: () = { g(1 }")), false);

        assertEquals(2, errors.size());
        assertEquals(new SourcePosition(1, 15), errors.get(0).where());
        assertEquals("closing } does not match the ( opened on line 1", errors.get(0).msg());
        assertEquals("end of file reached with 1 missing } to match earlier { on line 1", errors.get(1).msg());
    }
}
