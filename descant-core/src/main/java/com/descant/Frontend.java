package com.descant;

import com.descant.ast.TranslationUnit;
import com.descant.meta.CompilerServices;
import com.descant.meta.MetafunctionEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Runs the whole pipeline over one source file: lex, parse every candidate
 * section, then apply metafunctions.
 *
 * <p>A {@code Frontend} keeps no state between calls, so one instance can
 * process many files.</p>
 */
public final class Frontend {

    private static final Logger log = LoggerFactory.getLogger(Frontend.class);

    private final FrontendOptions options;

    public Frontend() {
        this(FrontendOptions.defaults());
    }

    public Frontend(FrontendOptions options) {
        if (options == null) {
            throw new IllegalArgumentException("options are required");
        }
        this.options = options;
    }

    public FrontendOptions options() {
        return options;
    }

    /** Processes source in which every line is candidate code. */
    public FrontendResult process(String source) {
        return process(source.lines().map(SourceLine::candidate).collect(Collectors.toList()));
    }

    /** Processes lines already tagged by a line classifier. */
    public FrontendResult process(List<SourceLine> lines) {
        List<ErrorEntry> errors = new ArrayList<>();

        TokenStore tokens = new TokenStore(errors);
        tokens.lex(lines, false);

        Parser parser = new Parser(errors);
        for (Map.Entry<Integer, List<Token>> section : tokens.getMap().entrySet()) {
            log.debug("parsing section starting at line {}", section.getKey());
            parser.parse(section.getValue(), tokens.getGenerated());
        }
        TranslationUnit unit = parser.translationUnit();

        if (options.runMetafunctions()) {
            CompilerServices services = new CompilerServices(errors, tokens.getGenerated(), options.printSink());
            new MetafunctionEngine(options.registry(), services).apply(unit);
        }

        List<ErrorEntry> sorted = ErrorEntry.sorted(errors);
        log.debug("processed {} line(s): {} declaration(s), {} error(s)", lines.size(), unit.size(), sorted.size());
        return new FrontendResult(unit, sorted, tokens);
    }
}
