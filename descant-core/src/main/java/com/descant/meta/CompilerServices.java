package com.descant.meta;

import com.descant.ErrorEntry;
import com.descant.GeneratedTokens;
import com.descant.Parser;
import com.descant.SourceLine;
import com.descant.SourcePosition;
import com.descant.Token;
import com.descant.TokenStore;
import com.descant.ast.Declaration;
import com.descant.ast.DeclarationStatement;
import com.descant.ast.Statement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * What a metafunction can ask of the front end: report errors, read its
 * arguments, and compile source text into tree nodes.
 *
 * <p>Every view is a {@code CompilerServices}. Views made from the same
 * services share one context, so an argument read through a member view
 * counts as used for the whole application, and all errors land in the one
 * shared list.</p>
 */
public class CompilerServices {

    private static final Logger log = LoggerFactory.getLogger(CompilerServices.class);

    /** A declaration waiting to be inserted next to {@code anchor}'s namespace-level ancestor. */
    record PendingDeclaration(Declaration anchor, DeclarationStatement declaration) {
    }

    private static final class Context {
        final List<ErrorEntry> errors;
        final GeneratedTokens generatedTokens;
        final Consumer<String> printSink;
        final List<PendingDeclaration> pending = new ArrayList<>();
        String metafunctionName = "";
        List<String> metafunctionArgs = List.of();
        boolean argumentsUsed;

        Context(List<ErrorEntry> errors, GeneratedTokens generatedTokens, Consumer<String> printSink) {
            this.errors = errors;
            this.generatedTokens = generatedTokens;
            this.printSink = printSink;
        }
    }

    private final Context context;

    public CompilerServices(List<ErrorEntry> errors, GeneratedTokens generatedTokens, Consumer<String> printSink) {
        if (errors == null || generatedTokens == null || printSink == null) {
            throw new IllegalArgumentException("errors, generated tokens and print sink are required");
        }
        this.context = new Context(errors, generatedTokens, printSink);
    }

    /** Shares {@code that}'s context. */
    protected CompilerServices(CompilerServices that) {
        this.context = that.context;
    }

    // -----------------------------------------------------------------------
    // Metafunction name and arguments

    public void setMetafunctionName(String name, List<String> args) {
        context.metafunctionName = name;
        context.metafunctionArgs = List.copyOf(args);
        context.argumentsUsed = false;
    }

    public String metafunctionName() {
        return context.metafunctionName;
    }

    /** The argument at {@code index}, or "" if there is none. Marks the arguments used. */
    public String argument(int index) {
        context.argumentsUsed = true;
        if (index < 0 || index >= context.metafunctionArgs.size()) {
            return "";
        }
        return context.metafunctionArgs.get(index);
    }

    public List<String> arguments() {
        context.argumentsUsed = true;
        return context.metafunctionArgs;
    }

    public boolean argumentsWereUsed() {
        return context.argumentsUsed || context.metafunctionArgs.isEmpty();
    }

    // -----------------------------------------------------------------------
    // Compiling source text

    /**
     * Lexes {@code source} as generated candidate code. The tokens are kept
     * in the shared generated buffer, so nodes built from them stay valid.
     */
    protected List<Token> tokenize(String source, List<ErrorEntry> scratch) {
        List<SourceLine> lines = source.lines().map(SourceLine::candidate).collect(Collectors.toList());
        TokenStore store = new TokenStore(scratch);
        store.lex(lines, true);
        return context.generatedTokens.addAll(store.allTokens());
    }

    /**
     * Compiles one statement. On failure, reports an error at this view's
     * position quoting the source, and returns null.
     */
    protected Statement parseStatement(String source) {
        List<ErrorEntry> scratch = new ArrayList<>();
        List<Token> tokens = tokenize(source, scratch);
        Statement result = null;
        if (scratch.isEmpty()) {
            result = new Parser(scratch).parseOneStatement(tokens, context.generatedTokens);
        }
        if (!scratch.isEmpty()) {
            log.debug("generated source failed to compile: {}", scratch);
            error("parse failed - the source string is not a valid statement: "
                    + ErrorEntry.sorted(scratch).get(0).msg() + "\n" + source);
            return null;
        }
        return result;
    }

    /** Compiles a declaration statement, or returns null after reporting an error. */
    protected DeclarationStatement parseDeclaration(String source) {
        Statement s = parseStatement(source);
        if (s == null) {
            return null;
        }
        if (!(s instanceof DeclarationStatement ds)) {
            error("cannot add a member that is not a declaration:\n" + source);
            return null;
        }
        return ds;
    }

    void deferNamespaceDeclaration(Declaration anchor, DeclarationStatement declaration) {
        context.pending.add(new PendingDeclaration(anchor, declaration));
    }

    /** Takes the declarations queued for insertion at namespace scope. */
    List<PendingDeclaration> drainPendingDeclarations() {
        List<PendingDeclaration> drained = new ArrayList<>(context.pending);
        context.pending.clear();
        return Collections.unmodifiableList(drained);
    }

    // -----------------------------------------------------------------------
    // Diagnostics

    /** Where errors reported through these services point. */
    public SourcePosition position() {
        return SourcePosition.NONE;
    }

    public void require(boolean condition, String message) {
        if (!condition) {
            error(message);
        }
    }

    public void error(String message) {
        String text = message;
        if (!context.metafunctionName.isEmpty()) {
            text = "while applying @" + context.metafunctionName + " - " + message;
        }
        ErrorEntry.report(context.errors, new ErrorEntry(position(), text));
    }

    List<ErrorEntry> errors() {
        return context.errors;
    }

    void emit(String text) {
        context.printSink.accept(text);
    }
}
