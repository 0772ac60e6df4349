package com.descant;

import com.descant.ast.Accessibility;
import com.descant.ast.Alternative;
import com.descant.ast.AliasBody;
import com.descant.ast.BinaryExpression;
import com.descant.ast.BinaryLevel;
import com.descant.ast.CaptureGroup;
import com.descant.ast.CompoundStatement;
import com.descant.ast.Contract;
import com.descant.ast.Declaration;
import com.descant.ast.DeclarationStatement;
import com.descant.ast.Expression;
import com.descant.ast.ExpressionList;
import com.descant.ast.ExpressionStatement;
import com.descant.ast.FunctionType;
import com.descant.ast.IdExpression;
import com.descant.ast.InspectExpression;
import com.descant.ast.InspectStatement;
import com.descant.ast.IsAsExpression;
import com.descant.ast.IterationStatement;
import com.descant.ast.JumpStatement;
import com.descant.ast.Literal;
import com.descant.ast.MetafunctionRequest;
import com.descant.ast.NamespaceBody;
import com.descant.ast.ObjectType;
import com.descant.ast.ParameterDeclaration;
import com.descant.ast.PassingStyle;
import com.descant.ast.PostfixExpression;
import com.descant.ast.PrefixExpression;
import com.descant.ast.ReturnStatement;
import com.descant.ast.SelectionStatement;
import com.descant.ast.Statement;
import com.descant.ast.TemplateArgument;
import com.descant.ast.TranslationUnit;
import com.descant.ast.TypeBody;
import com.descant.ast.TypeId;
import com.descant.ast.UnnamedDeclarationExpression;
import com.descant.ast.UnqualifiedId;
import com.descant.ast.UsingStatement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Recursive-descent parser for candidate-syntax sections.
 *
 * <p>Each call to {@link #parse} adds one section's declarations to the
 * accumulated {@link TranslationUnit}. Errors go to the shared list; a parse
 * always returns, with whatever part of the tree it could build.</p>
 *
 * <p>The stacks of open declarations and open capture groups live in the
 * parser instance, so independent parsers never see each other's state.</p>
 */
public final class Parser {

    private static final Logger log = LoggerFactory.getLogger(Parser.class);

    /** Keywords that can be used where a name is expected. */
    private static final Set<String> NAME_KEYWORDS = Set.of(
        "this", "auto", "bool", "char", "char8_t", "char16_t", "char32_t", "double",
        "float", "int", "long", "short", "signed", "unsigned", "void", "wchar_t",
        "sizeof", "alignof", "typeid", "decltype", "const_cast", "static_cast",
        "dynamic_cast", "reinterpret_cast"
    );

    private static final Set<String> DIRECTIONS = Set.of("in", "copy", "inout", "out", "move", "forward");

    private static final Set<String> PARAMETER_MODIFIERS = Set.of("implicit", "virtual", "override", "final");

    /** A function body's line range, first and last line inclusive. */
    private record LineRange(int first, int last) {

        boolean contains(int lineno) {
            return lineno >= first && lineno <= last;
        }
    }

    private final List<ErrorEntry> errors;
    private final TranslationUnit unit = new TranslationUnit();
    private final List<LineRange> functionBodyExtents = new ArrayList<>();

    private List<Token> tokens = new ArrayList<>();
    private GeneratedTokens generated = new GeneratedTokens();
    private Token eof = new Token("", SourcePosition.NONE, Lexeme.NONE);
    private int current;

    private final Deque<CaptureGroup> captureGroups = new ArrayDeque<>();
    private final Deque<Declaration> currentDeclarations = new ArrayDeque<>();

    public Parser(List<ErrorEntry> errors) {
        this.errors = errors;
    }

    /** A fresh parser that shares only the error list with {@code that}. */
    public Parser(Parser that) {
        this(that.errors);
    }

    // -----------------------------------------------------------------------
    // Entry points

    /**
     * Parses one candidate section and appends its declarations to
     * {@link #translationUnit()}.
     *
     * @return true if no error was recorded
     */
    public boolean parse(List<Token> section, GeneratedTokens generatedTokens) {
        int errorsBefore = errors.size();
        reset(section, generatedTokens);

        while (!isAtEnd()) {
            int start = current;
            try {
                Declaration d = namespaceScopeDeclaration(null);
                if (d != null) {
                    unit.add(d);
                }
            } catch (ExpectedTokenException e) {
                ErrorEntry.report(errors, e.toErrorEntry());
                recover(start);
            }
        }

        if (log.isDebugEnabled()) {
            log.debug("parsed section of {} token(s): {} top-level declaration(s), {} new error(s)",
                    section.size(), unit.size(), errors.size() - errorsBefore);
        }
        return errors.size() == errorsBefore;
    }

    /**
     * Parses exactly one declaration, as used when a metafunction adds a
     * member from source text.
     *
     * @return the declaration statement, or null if it did not parse cleanly
     */
    public DeclarationStatement parseOneDeclaration(List<Token> section, GeneratedTokens generatedTokens) {
        int errorsBefore = errors.size();
        reset(section, generatedTokens);
        try {
            Declaration d = declaration(null);
            if (!isAtEnd()) {
                throw new ExpectedTokenException("unexpected text after the declaration", peek().position());
            }
            DeclarationStatement statement = new DeclarationStatement(d);
            d.setStatement(statement);
            return errors.size() == errorsBefore ? statement : null;
        } catch (ExpectedTokenException e) {
            ErrorEntry.report(errors, e.toErrorEntry());
            return null;
        }
    }

    /** Parses exactly one statement; null if it did not parse cleanly. */
    public Statement parseOneStatement(List<Token> section, GeneratedTokens generatedTokens) {
        int errorsBefore = errors.size();
        reset(section, generatedTokens);
        try {
            Statement s = statement();
            if (!isAtEnd()) {
                throw new ExpectedTokenException("unexpected text after the statement", peek().position());
            }
            return errors.size() == errorsBefore ? s : null;
        } catch (ExpectedTokenException e) {
            ErrorEntry.report(errors, e.toErrorEntry());
            return null;
        }
    }

    /**
     * Parses one expression from the front of {@code section}, stopping at
     * the first token that cannot continue it.
     *
     * @param templateArgumentPosition true to parse as a template argument:
     *        angle operators are disabled and a name followed by {@code <}
     *        always opens a template-argument list
     * @return the expression, or null if none could be parsed
     */
    public Expression parseExpression(List<Token> section, GeneratedTokens generatedTokens,
                                      boolean templateArgumentPosition) {
        reset(section, generatedTokens);
        try {
            return expression(!templateArgumentPosition);
        } catch (ExpectedTokenException e) {
            ErrorEntry.report(errors, e.toErrorEntry());
            return null;
        }
    }

    public TranslationUnit translationUnit() {
        return unit;
    }

    /** True if {@code position} lies on a line inside a parsed function body. */
    public boolean isWithinFunctionBody(SourcePosition position) {
        for (LineRange range : functionBodyExtents) {
            if (range.contains(position.lineno())) {
                return true;
            }
        }
        return false;
    }

    public List<ErrorEntry> errors() {
        return errors;
    }

    private void reset(List<Token> section, GeneratedTokens generatedTokens) {
        // a private copy, because splitting '>>' edits the sequence
        this.tokens = new ArrayList<>(section);
        this.generated = generatedTokens;
        this.current = 0;
        this.captureGroups.clear();
        this.currentDeclarations.clear();
        if (section.isEmpty()) {
            eof = new Token("", SourcePosition.NONE, Lexeme.NONE);
        } else {
            Token last = section.get(section.size() - 1);
            eof = new Token("", new SourcePosition(last.line(), last.endColumn()), Lexeme.NONE);
        }
    }

    /**
     * Skips the declaration that started at {@code start}: up to and including
     * its top-level {@code ;} or the brace that closes its body.
     */
    private void recover(int start) {
        current = start;
        int depth = 0;
        while (!isAtEnd()) {
            Token t = advance();
            switch (t.type()) {
                case LEFT_BRACE -> depth++;
                case RIGHT_BRACE -> {
                    depth--;
                    if (depth <= 0) {
                        return;
                    }
                }
                case SEMICOLON -> {
                    if (depth <= 0) {
                        return;
                    }
                }
                default -> { }
            }
        }
    }

    // -----------------------------------------------------------------------
    // Declarations

    /**
     * A declaration at namespace or type scope. Unnamed declarations are not
     * allowed there; one is parsed anyway so parsing can continue, then
     * dropped.
     */
    private Declaration namespaceScopeDeclaration(Declaration scope) {
        if (check(Lexeme.COLON)) {
            error("a declaration at namespace or type scope must have a name", peek().position());
            Declaration unnamed = new Declaration(advance().position());
            unnamedDeclaration(unnamed, true);
            return null;
        }
        if (scope != null && scope.isType() && isName(peek()) && peekAhead(1).is(Lexeme.SEMICOLON)) {
            // enumerator shorthand: "name;" declares an object of deduced type
            Token name = advance();
            advance();
            Declaration d = new Declaration(name.position());
            d.setIdentifier(name);
            d.setParent(scope);
            d.setBody(new ObjectType(name.position(), null));
            return d;
        }
        if (!startsDeclaration()) {
            String message = scope == null
                    ? "unexpected text at end of Cpp2 code section"
                    : "expected a member declaration";
            throw new ExpectedTokenException(message, peek().position(), true);
        }
        return declaration(scope);
    }

    private boolean startsDeclaration() {
        int i = 0;
        if (isAccessKeyword(peekAhead(0))) {
            i++;
        }
        if (!isName(peekAhead(i))) {
            return false;
        }
        i++;
        if (peekAhead(i).is(Lexeme.ELLIPSIS)) {
            i++;
        }
        return peekAhead(i).is(Lexeme.COLON);
    }

    private Declaration declaration(Declaration parent) {
        SourcePosition start = peek().position();
        Accessibility access = Accessibility.DEFAULT;
        if (isAccessKeyword(peek())) {
            access = Accessibility.valueOf(advance().text().toUpperCase());
        }
        Token name = consumeName("expected a declaration name");
        Declaration d = new Declaration(start);
        d.setIdentifier(name);
        d.setAccess(access);
        d.setVariadic(match(Lexeme.ELLIPSIS));
        d.setParent(parent != null ? parent : currentDeclarations.peek());
        consume(Lexeme.COLON, "expected : after the declaration name");
        unnamedDeclaration(d, true);
        return d;
    }

    /**
     * Everything after the colon of a declaration.
     *
     * @param named false for a function or object expression, whose body
     *              does not end with a semicolon of its own
     */
    private void unnamedDeclaration(Declaration d, boolean named) {
        if (d.parent() == null && !currentDeclarations.isEmpty()) {
            d.setParent(currentDeclarations.peek());
        }
        currentDeclarations.push(d);
        try {
            while (check(Lexeme.AT)) {
                advance();
                // enum and struct are keywords but name metafunctions here
                if (!isName(peek()) && !check(Lexeme.KEYWORD)) {
                    throw new ExpectedTokenException("expected a metafunction name after @", peek().position());
                }
                Token mf = advance();
                List<String> args = check(Lexeme.LESS) ? rawTemplateArguments() : List.of();
                d.metafunctions().add(new MetafunctionRequest(mf, args));
            }

            if (check(Lexeme.LESS)) {
                advance();
                List<ParameterDeclaration> params = parameterList(true);
                closeAngle();
                d.setTemplateParameters(params);
            }

            if (check(Lexeme.LEFT_PAREN)) {
                functionDeclaration(d, named);
            } else if (isIdentifier("type") || (isIdentifier("final") && peekAhead(1).is("type"))) {
                typeDeclaration(d);
            } else if (isKeyword("namespace")) {
                namespaceDeclaration(d);
            } else {
                objectDeclaration(d, named);
            }
        } finally {
            currentDeclarations.pop();
        }
    }

    private void functionDeclaration(Declaration d, boolean named) {
        d.setBody(functionType());
        if (isKeyword("requires")) {
            advance();
            d.setRequiresClause(binary(BinaryLevel.LOGICAL_OR, false));
        }
        if (match(Lexeme.SEMICOLON)) {
            return;
        }
        if (check(Lexeme.EQUAL_COMPARISON)) {
            d.setConstexpr(true);
        } else if (!check(Lexeme.ASSIGNMENT)) {
            throw new ExpectedTokenException("expected = or == before the function body, or ; for a declaration",
                    peek().position());
        }
        advance();

        // a function expression collects the captures in its body
        if (!named) {
            captureGroups.push(d.captures());
        }
        try {
            Statement body = initializer(named);
            d.setInitializer(body);
            if (body instanceof CompoundStatement c) {
                functionBodyExtents.add(new LineRange(c.position().lineno(), c.close().lineno()));
            }
        } finally {
            if (!named) {
                captureGroups.pop();
            }
        }
    }

    private FunctionType functionType() {
        SourcePosition pos = consume(Lexeme.LEFT_PAREN, "expected ( to start a parameter list").position();
        List<ParameterDeclaration> params = parameterList(false);
        consume(Lexeme.RIGHT_PAREN, "expected ) at end of parameter list");
        boolean throwsSpecified = false;
        if (isKeyword("throws")) {
            advance();
            throwsSpecified = true;
        }

        PassingStyle returnPassing = null;
        TypeId returnType = null;
        List<ParameterDeclaration> namedReturns = null;
        if (match(Lexeme.ARROW)) {
            if (match(Lexeme.LEFT_PAREN)) {
                namedReturns = parameterList(false);
                consume(Lexeme.RIGHT_PAREN, "expected ) at end of return list");
            } else {
                if (isDirectionWord(peek()) && isName(peekAhead(1))) {
                    returnPassing = PassingStyle.fromToken(advance());
                }
                returnType = typeId();
            }
        }

        FunctionType f = new FunctionType(pos, params, throwsSpecified, returnPassing, returnType, namedReturns);
        while (startsContract()) {
            Contract c = contract();
            if (c.isAssertion()) {
                error("assert is not allowed on a function signature; use it in the body", c.position());
            }
            f.contracts().add(c);
        }
        return f;
    }

    private List<ParameterDeclaration> parameterList(boolean template) {
        List<ParameterDeclaration> params = new ArrayList<>();
        Lexeme closer = template ? Lexeme.GREATER : Lexeme.RIGHT_PAREN;
        if (check(closer) || (template && check(Lexeme.RIGHT_SHIFT))) {
            return params;
        }
        Set<String> seen = new HashSet<>();
        do {
            ParameterDeclaration p = parameter(template);
            if (!seen.add(p.name()) && !"_".equals(p.name())) {
                error("parameter '" + p.name() + "' is declared more than once", p.position());
            }
            if (p.isThis() && !params.isEmpty()) {
                error("'this' must be the first parameter", p.position());
            }
            params.add(p);
        } while (match(Lexeme.COMMA));
        return params;
    }

    private ParameterDeclaration parameter(boolean template) {
        SourcePosition pos = peek().position();
        PassingStyle direction = null;
        ParameterDeclaration.Modifier modifier = ParameterDeclaration.Modifier.NONE;
        // modifier and direction may come in either order
        for (int i = 0; i < 2; i++) {
            if (modifier == ParameterDeclaration.Modifier.NONE && PARAMETER_MODIFIERS.contains(peek().text())
                    && isName(peekAhead(1))) {
                modifier = ParameterDeclaration.Modifier.valueOf(advance().text().toUpperCase());
            } else if (direction == null && isDirectionWord(peek()) && isName(peekAhead(1))) {
                direction = PassingStyle.fromToken(advance());
            }
        }

        Token name = consumeName("expected a parameter name");
        Declaration d = new Declaration(pos);
        d.setIdentifier(name);
        d.setParent(currentDeclarations.peek());
        d.setVariadic(match(Lexeme.ELLIPSIS));
        if (match(Lexeme.COLON)) {
            if (template && isIdentifier("type")) {
                d.setBody(new TypeBody(advance().position(), false));
            } else {
                d.setBody(new ObjectType(peek().position(), typeId()));
            }
        } else {
            d.setBody(new ObjectType(name.position(), null));
        }
        if (match(Lexeme.ASSIGNMENT)) {
            d.setInitializer(new ExpressionStatement(expression(!template), false));
        }
        return new ParameterDeclaration(pos, direction, modifier, d);
    }

    private void typeDeclaration(Declaration d) {
        boolean finalType = false;
        if (isIdentifier("final")) {
            advance();
            finalType = true;
        }
        Token typeKeyword = advance();

        if (match(Lexeme.EQUAL_COMPARISON)) {
            if (finalType) {
                error("a type alias cannot be final", typeKeyword.position());
            }
            d.setBody(new AliasBody(typeKeyword.position(), AliasBody.AliasKind.TYPE, typeId(), null, null));
            consume(Lexeme.SEMICOLON, "expected ; at end of type alias");
            return;
        }

        d.setBody(new TypeBody(typeKeyword.position(), finalType));
        if (isKeyword("requires")) {
            advance();
            d.setRequiresClause(binary(BinaryLevel.LOGICAL_OR, false));
        }
        consume(Lexeme.ASSIGNMENT, "expected = before the type body");
        d.setInitializer(scopeBody(d));
    }

    private void namespaceDeclaration(Declaration d) {
        Token keyword = advance();
        if (match(Lexeme.EQUAL_COMPARISON)) {
            d.setBody(new AliasBody(keyword.position(), AliasBody.AliasKind.NAMESPACE, null,
                    idExpression(true), null));
            consume(Lexeme.SEMICOLON, "expected ; at end of namespace alias");
            return;
        }
        d.setBody(new NamespaceBody(keyword.position()));
        consume(Lexeme.ASSIGNMENT, "expected = before the namespace body");
        d.setInitializer(scopeBody(d));
    }

    /** A type or namespace body: braces around member declarations only. */
    private CompoundStatement scopeBody(Declaration owner) {
        Token open = consume(Lexeme.LEFT_BRACE, "expected { to start the body");
        CompoundStatement body = new CompoundStatement(open.position());
        while (!check(Lexeme.RIGHT_BRACE) && !isAtEnd()) {
            Declaration member = namespaceScopeDeclaration(owner);
            if (member != null) {
                DeclarationStatement s = new DeclarationStatement(member);
                member.setStatement(s);
                member.setParent(owner);
                body.add(s);
            }
        }
        body.setClose(consume(Lexeme.RIGHT_BRACE, "expected } at end of the body").position());
        return body;
    }

    private void objectDeclaration(Declaration d, boolean named) {
        SourcePosition pos = peek().position();
        TypeId type = null;
        if (!check(Lexeme.ASSIGNMENT) && !check(Lexeme.EQUAL_COMPARISON) && !check(Lexeme.SEMICOLON)) {
            type = typeId();
        }

        if (match(Lexeme.EQUAL_COMPARISON)) {
            Expression value = expression(true);
            d.setBody(new AliasBody(pos, AliasBody.AliasKind.OBJECT, type, null, value));
            d.setConstexpr(true);
            if (named) {
                consume(Lexeme.SEMICOLON, "expected ; at end of object alias");
            }
            return;
        }

        d.setBody(new ObjectType(pos, type));
        if (match(Lexeme.ASSIGNMENT)) {
            d.setInitializer(initializer(named));
        } else if (named) {
            consume(Lexeme.SEMICOLON, "expected ; at end of declaration");
        } else if (type == null) {
            throw new ExpectedTokenException("ill-formed unnamed declaration", peek().position());
        }
    }

    /** The statement after {@code =}: a compound, or an expression. */
    private Statement initializer(boolean semicolonRequired) {
        if (check(Lexeme.LEFT_BRACE)) {
            return compound();
        }
        if (isKeyword("return") || isKeyword("if") || isKeyword("while") || isKeyword("for")) {
            return statement();
        }
        Expression e = expression(true);
        if (semicolonRequired) {
            consume(Lexeme.SEMICOLON, "expected ; at end of declaration");
            return new ExpressionStatement(e, true);
        }
        return new ExpressionStatement(e, false);
    }

    /**
     * The raw text of a metafunction's {@code <...>} arguments, split at
     * top-level commas. Arguments are not parsed here.
     */
    private List<String> rawTemplateArguments() {
        consume(Lexeme.LESS, "expected <");
        List<String> args = new ArrayList<>();
        StringBuilder arg = new StringBuilder();
        Token prev = null;
        int depth = 1;
        while (!isAtEnd()) {
            Token t = peek();
            if (t.is(Lexeme.LESS)) {
                depth++;
            } else if (t.is(Lexeme.GREATER) || t.is(Lexeme.RIGHT_SHIFT)) {
                depth -= t.length();
                if (depth <= 0) {
                    if (depth < 0) {
                        splitRightShift();
                    }
                    advance();
                    break;
                }
            } else if (t.is(Lexeme.COMMA) && depth == 1) {
                args.add(arg.toString());
                arg.setLength(0);
                prev = null;
                advance();
                continue;
            }
            if (prev != null && (prev.line() != t.line() || prev.endColumn() != t.column())) {
                arg.append(' ');
            }
            arg.append(t.text());
            prev = t;
            advance();
        }
        if (depth > 0) {
            throw new ExpectedTokenException("expected > at end of metafunction argument list", peek().position());
        }
        if (arg.length() > 0 || !args.isEmpty()) {
            args.add(arg.toString());
        }
        return args;
    }

    // -----------------------------------------------------------------------
    // Statements

    private Statement statement() {
        Token t = peek();

        if (t.is(Lexeme.LEFT_BRACE)) {
            return compound();
        }
        if (isName(t) && peekAhead(1).is(Lexeme.COLON) && isLoopKeyword(peekAhead(2))) {
            return iteration(advance());
        }
        if (startsDeclaration()) {
            Declaration d = declaration(currentDeclarations.peek());
            DeclarationStatement s = new DeclarationStatement(d);
            d.setStatement(s);
            return s;
        }
        if (t.is(Lexeme.KEYWORD)) {
            switch (t.text()) {
                case "if":
                    return selection();
                case "while":
                case "do":
                case "for":
                    return iteration(null);
                case "return":
                    return returnStatement();
                case "break":
                case "continue":
                    return jump();
                case "using":
                    return using();
                default:
                    break;
            }
        }
        if (startsContract()) {
            Contract c = contract();
            if (!c.isAssertion()) {
                error("pre and post conditions are only allowed on a function declaration", c.position());
            }
            consume(Lexeme.SEMICOLON, "expected ; after the contract");
            return c;
        }
        if (startsInspect()) {
            InspectExpression inspect = inspect();
            match(Lexeme.SEMICOLON);
            return new InspectStatement(inspect);
        }

        Expression e = expression(true);
        consume(Lexeme.SEMICOLON, "expected ; at end of statement");
        return new ExpressionStatement(e, true);
    }

    private CompoundStatement compound() {
        Token open = consume(Lexeme.LEFT_BRACE, "expected {");
        CompoundStatement c = new CompoundStatement(open.position());
        while (!check(Lexeme.RIGHT_BRACE)) {
            if (isAtEnd()) {
                throw new ExpectedTokenException("expected } at end of compound statement", open.position());
            }
            c.add(statement());
        }
        c.setClose(advance().position());
        return c;
    }

    private SelectionStatement selection() {
        Token keyword = advance();
        boolean constexpr = false;
        if (isKeyword("constexpr")) {
            advance();
            constexpr = true;
        }
        Expression condition = expression(true);
        CompoundStatement trueBranch = compound();
        CompoundStatement falseBranch = null;
        if (isKeyword("else")) {
            advance();
            if (isKeyword("if")) {
                // else-if chains nest as a single selection in the else branch
                SelectionStatement nested = selection();
                falseBranch = new CompoundStatement(nested.position());
                falseBranch.add(nested);
            } else {
                falseBranch = compound();
            }
        }
        return new SelectionStatement(keyword, constexpr, condition, trueBranch, falseBranch);
    }

    private IterationStatement iteration(Token label) {
        if (label != null) {
            consume(Lexeme.COLON, "expected : after the loop label");
        }
        Token keyword = advance();
        switch (keyword.text()) {
            case "while" -> {
                Expression condition = expression(true);
                Expression next = nextClause();
                CompoundStatement body = compound();
                return new IterationStatement(label, keyword, condition, null, next, null, body);
            }
            case "do" -> {
                CompoundStatement body = compound();
                Expression next = nextClause();
                if (!isKeyword("while")) {
                    throw new ExpectedTokenException("expected while after the do loop body", peek().position());
                }
                advance();
                Expression condition = expression(true);
                consume(Lexeme.SEMICOLON, "expected ; at end of do loop");
                return new IterationStatement(label, keyword, condition, null, next, null, body);
            }
            default -> {
                Expression range = expression(true);
                Expression next = nextClause();
                if (!isKeyword("do")) {
                    throw new ExpectedTokenException("expected do after the for range", peek().position());
                }
                advance();
                consume(Lexeme.LEFT_PAREN, "expected ( before the for loop parameter");
                ParameterDeclaration parameter = parameter(false);
                consume(Lexeme.RIGHT_PAREN, "expected ) after the for loop parameter");
                CompoundStatement body = compound();
                return new IterationStatement(label, keyword, null, range, next, parameter, body);
            }
        }
    }

    private Expression nextClause() {
        if (isIdentifier("next")) {
            advance();
            return expression(true);
        }
        return null;
    }

    private ReturnStatement returnStatement() {
        Token keyword = advance();
        Expression value = check(Lexeme.SEMICOLON) ? null : expression(true);
        consume(Lexeme.SEMICOLON, "expected ; at end of return statement");
        return new ReturnStatement(keyword, value);
    }

    private JumpStatement jump() {
        Token keyword = advance();
        Token label = isName(peek()) ? advance() : null;
        consume(Lexeme.SEMICOLON, "expected ; at end of " + keyword.text() + " statement");
        return new JumpStatement(keyword, label);
    }

    private UsingStatement using() {
        Token keyword = advance();
        boolean forNamespace = false;
        if (isKeyword("namespace")) {
            advance();
            forNamespace = true;
        }
        IdExpression id = idExpression(true);
        consume(Lexeme.SEMICOLON, "expected ; at end of using statement");
        return new UsingStatement(keyword, forNamespace, id);
    }

    private boolean startsContract() {
        Token t = peek();
        return t.is(Lexeme.IDENTIFIER) && (t.is("pre") || t.is("post") || t.is("assert"))
                && (peekAhead(1).is(Lexeme.LEFT_PAREN) || peekAhead(1).is(Lexeme.LESS));
    }

    private Contract contract() {
        Token keyword = advance();
        IdExpression group = null;
        if (match(Lexeme.LESS)) {
            group = idExpression(true);
            closeAngle();
        }
        consume(Lexeme.LEFT_PAREN, "expected ( after " + keyword.text());

        CaptureGroup captures = new CaptureGroup();
        captureGroups.push(captures);
        try {
            Expression condition = expression(true);
            Expression message = null;
            if (match(Lexeme.COMMA)) {
                message = expression(true);
            }
            consume(Lexeme.RIGHT_PAREN, "expected ) at end of " + keyword.text() + " condition");
            return new Contract(keyword, group, condition, message, captures);
        } finally {
            captureGroups.pop();
        }
    }

    private InspectExpression inspect() {
        Token keyword = advance();
        boolean constexpr = false;
        if (isKeyword("constexpr")) {
            advance();
            constexpr = true;
        }
        Expression subject = expression(true);
        TypeId resultType = null;
        if (match(Lexeme.ARROW)) {
            resultType = typeId();
        }
        consume(Lexeme.LEFT_BRACE, "expected { to start the inspect alternatives");
        List<Alternative> alternatives = new ArrayList<>();
        while (!check(Lexeme.RIGHT_BRACE)) {
            if (isAtEnd()) {
                throw new ExpectedTokenException("expected } at end of inspect", keyword.position());
            }
            alternatives.add(alternative());
        }
        advance();
        if (alternatives.isEmpty()) {
            error("an inspect must have at least one alternative", keyword.position());
        }
        return new InspectExpression(keyword, constexpr, subject, resultType, alternatives);
    }

    private Alternative alternative() {
        Token name = null;
        if (isName(peek()) && peekAhead(1).is(Lexeme.COLON)) {
            name = advance();
            advance();
        }
        if (!isKeyword("is") && !isKeyword("as")) {
            throw new ExpectedTokenException("expected 'is' or 'as' to start an inspect alternative",
                    peek().position());
        }
        Token isAs = advance();
        TypeId type = null;
        Expression value = null;
        if (isAs.is("as") || !startsValue()) {
            type = typeId();
        } else {
            value = prefix(true);
        }
        consume(Lexeme.ASSIGNMENT, "expected = before the alternative's statement");
        Statement statement = statement();
        return new Alternative(name, isAs, type, value, statement);
    }

    // -----------------------------------------------------------------------
    // Expressions

    /**
     * @param allowAngle false inside template-argument lists, where
     *                   {@code <}, {@code >} and the shifts are not operators
     */
    private Expression expression(boolean allowAngle) {
        return binary(BinaryLevel.ASSIGNMENT, allowAngle);
    }

    /** One precedence level: a term followed by zero or more (op, term) pairs. */
    private Expression binary(BinaryLevel level, boolean allowAngle) {
        Expression lhs = term(level, allowAngle);
        List<BinaryExpression.Term> terms = null;
        while (level.accepts(peek().type()) && (allowAngle || !peek().type().isAngleOperator())) {
            Token op = advance();
            Expression rhs = term(level, allowAngle);
            if (terms == null) {
                terms = new ArrayList<>();
            }
            terms.add(new BinaryExpression.Term(op, rhs));
        }
        return terms == null ? lhs : new BinaryExpression(level, lhs, terms);
    }

    private Expression term(BinaryLevel level, boolean allowAngle) {
        if (level == BinaryLevel.MULTIPLICATIVE) {
            return isAs(allowAngle);
        }
        return binary(BinaryLevel.values()[level.ordinal() - 1], allowAngle);
    }

    private Expression isAs(boolean allowAngle) {
        Expression operand = prefix(allowAngle);
        List<IsAsExpression.Term> terms = null;
        while (isKeyword("is") || isKeyword("as")) {
            Token op = advance();
            IsAsExpression.Term term;
            if (op.is("as") || !startsValue()) {
                term = new IsAsExpression.Term(op, typeId(), null);
            } else {
                term = new IsAsExpression.Term(op, null, prefix(allowAngle));
            }
            if (terms == null) {
                terms = new ArrayList<>();
            }
            terms.add(term);
        }
        return terms == null ? operand : new IsAsExpression(operand, terms);
    }

    /** True if the next tokens are a value rather than a type after {@code is}. */
    private boolean startsValue() {
        Token t = peek();
        return t.type().isLiteral() || isLiteralKeyword(t) || t.is(Lexeme.LEFT_PAREN)
                || t.is(Lexeme.MINUS) || t.is(Lexeme.PLUS) || t.is(Lexeme.NOT);
    }

    private Expression prefix(boolean allowAngle) {
        List<Token> ops = null;
        while (isPrefixOperator(peek())) {
            if (ops == null) {
                ops = new ArrayList<>();
            }
            ops.add(advance());
        }
        Expression operand = postfix(allowAngle);
        return ops == null ? operand : new PrefixExpression(ops, operand);
    }

    private static boolean isPrefixOperator(Token t) {
        return switch (t.type()) {
            case NOT, MINUS, PLUS, AMPERSAND, TILDE, PLUS_PLUS, MINUS_MINUS -> true;
            default -> false;
        };
    }

    private Expression postfix(boolean allowAngle) {
        Expression primary = primary(allowAngle);
        List<PostfixExpression.Op> ops = new ArrayList<>();
        List<PostfixExpression.Op> captures = new ArrayList<>();
        while (true) {
            Token t = peek();
            switch (t.type()) {
                case LEFT_PAREN, LEFT_BRACKET -> {
                    advance();
                    ExpressionList args = expressionListTail(t);
                    ops.add(new PostfixExpression.Op(t, args, null));
                }
                case DOT -> {
                    advance();
                    ops.add(new PostfixExpression.Op(t, null, idExpression(!allowAngle)));
                }
                case PLUS_PLUS, MINUS_MINUS, ELLIPSIS -> ops.add(new PostfixExpression.Op(advance(), null, null));
                case DOLLAR -> {
                    PostfixExpression.Op op = new PostfixExpression.Op(advance(), null, null);
                    ops.add(op);
                    captures.add(op);
                }
                case MULTIPLY, AMPERSAND, TILDE -> {
                    // binary when an operand follows: a * b, a & b
                    if (startsOperand(peekAhead(1))) {
                        return finishPostfix(primary, ops, captures);
                    }
                    ops.add(new PostfixExpression.Op(advance(), null, null));
                }
                default -> {
                    return finishPostfix(primary, ops, captures);
                }
            }
        }
    }

    private Expression finishPostfix(Expression primary, List<PostfixExpression.Op> ops,
                                     List<PostfixExpression.Op> captures) {
        if (ops.isEmpty()) {
            return primary;
        }
        PostfixExpression p = new PostfixExpression(primary, ops);
        for (PostfixExpression.Op capture : captures) {
            if (captureGroups.isEmpty()) {
                error("$ (capture) can only appear in a function expression or a contract condition",
                        capture.op().position());
            } else {
                captureGroups.peek().add(p);
            }
        }
        return p;
    }

    private boolean startsOperand(Token t) {
        return isName(t) || t.type().isLiteral() || isLiteralKeyword(t) || t.is(Lexeme.LEFT_PAREN)
                || t.is(Lexeme.SCOPE) || t.is(Lexeme.NOT) || t.is(Lexeme.MINUS) || t.is(Lexeme.PLUS);
    }

    private Expression primary(boolean allowAngle) {
        Token t = peek();
        if (t.type().isLiteral() || isLiteralKeyword(t)) {
            return new Literal(advance());
        }
        if (t.is(Lexeme.LEFT_PAREN)) {
            advance();
            return expressionListTail(t);
        }
        if (t.is(Lexeme.COLON)) {
            Declaration d = new Declaration(advance().position());
            unnamedDeclaration(d, false);
            return new UnnamedDeclarationExpression(d);
        }
        if (startsInspect()) {
            return inspect();
        }
        if (isName(t) || t.is(Lexeme.SCOPE)) {
            return idExpression(!allowAngle);
        }
        throw new ExpectedTokenException("ill-formed expression, unexpected '" + t.text() + "'", t.position());
    }

    /**
     * True at {@code inspect} when it opens an inspect expression rather than
     * naming a function: the subject must be followed by {@code ->} or an opening brace.
     */
    private boolean startsInspect() {
        if (!isIdentifier("inspect")) {
            return false;
        }
        if (!peekAhead(1).is(Lexeme.LEFT_PAREN)) {
            return true;
        }
        Checkpoint saved = checkpoint();
        try {
            advance();
            expression(true);
            return check(Lexeme.ARROW) || check(Lexeme.LEFT_BRACE);
        } catch (ExpectedTokenException e) {
            log.trace("not an inspect at {}: {}", e.position(), e.getMessage());
            return false;
        } finally {
            rollback(saved);
        }
    }

    /** The rest of a list whose opening bracket was just consumed. */
    private ExpressionList expressionListTail(Token open) {
        Lexeme closer = open.type().closeParenType();
        List<ExpressionList.Term> terms = new ArrayList<>();
        if (!check(closer)) {
            do {
                PassingStyle direction = null;
                if (isDirectionWord(peek()) && startsOperand(peekAhead(1))) {
                    direction = PassingStyle.fromToken(advance());
                }
                terms.add(new ExpressionList.Term(direction, expression(true)));
            } while (match(Lexeme.COMMA));
        }
        consume(closer, "expected " + closer.symbol() + " at end of expression list");
        return new ExpressionList(open.position(), open.type(), terms);
    }

    // -----------------------------------------------------------------------
    // Names and types

    /**
     * @param alwaysTemplate true where a following {@code <} must open a
     *                       template-argument list (types, template arguments)
     */
    private IdExpression idExpression(boolean alwaysTemplate) {
        boolean global = match(Lexeme.SCOPE);
        List<UnqualifiedId> ids = new ArrayList<>();
        ids.add(unqualifiedId(alwaysTemplate));
        while (check(Lexeme.SCOPE) && isName(peekAhead(1))) {
            advance();
            ids.add(unqualifiedId(alwaysTemplate));
        }
        return new IdExpression(global, ids);
    }

    private UnqualifiedId unqualifiedId(boolean alwaysTemplate) {
        Token name = consumeName("expected a name");
        if (!check(Lexeme.LESS)) {
            return new UnqualifiedId(name);
        }
        if (alwaysTemplate) {
            return new UnqualifiedId(name, true, templateArguments());
        }

        // In plain expressions, accept the '<' only if the whole list parses and
        // is followed by '(' or '::'. Otherwise this is a comparison.
        Checkpoint saved = checkpoint();
        try {
            List<TemplateArgument> args = templateArguments();
            if (check(Lexeme.LEFT_PAREN) || check(Lexeme.SCOPE)) {
                return new UnqualifiedId(name, true, args);
            }
        } catch (ExpectedTokenException e) {
            log.trace("not a template-id at {}: {}", name.position(), e.getMessage());
        }
        rollback(saved);
        return new UnqualifiedId(name);
    }

    /** Parser state needed to undo a tentative parse. */
    private record Checkpoint(int current, List<Token> tokens, int errors, int[] captureSizes, int bodyExtents) {
    }

    private Checkpoint checkpoint() {
        int[] sizes = new int[captureGroups.size()];
        int i = 0;
        for (CaptureGroup group : captureGroups) {
            sizes[i++] = group.members().size();
        }
        return new Checkpoint(current, new ArrayList<>(tokens), errors.size(), sizes, functionBodyExtents.size());
    }

    /** Restores a checkpoint, dropping errors, captures and body extents recorded since. */
    private void rollback(Checkpoint saved) {
        current = saved.current();
        tokens = saved.tokens();
        while (errors.size() > saved.errors()) {
            errors.remove(errors.size() - 1);
        }
        int i = 0;
        for (CaptureGroup group : captureGroups) {
            group.truncate(saved.captureSizes()[i++]);
        }
        while (functionBodyExtents.size() > saved.bodyExtents()) {
            functionBodyExtents.remove(functionBodyExtents.size() - 1);
        }
    }

    private List<TemplateArgument> templateArguments() {
        consume(Lexeme.LESS, "expected <");
        List<TemplateArgument> args = new ArrayList<>();
        if (!check(Lexeme.GREATER) && !check(Lexeme.RIGHT_SHIFT)) {
            do {
                args.add(templateArgument());
            } while (match(Lexeme.COMMA));
        }
        closeAngle();
        return args;
    }

    /** A type if one parses and ends the argument, otherwise an expression. */
    private TemplateArgument templateArgument() {
        if (!startsValue()) {
            Checkpoint saved = checkpoint();
            try {
                TypeId type = typeId();
                if (check(Lexeme.COMMA) || check(Lexeme.GREATER) || check(Lexeme.RIGHT_SHIFT)) {
                    return new TemplateArgument(type, null);
                }
            } catch (ExpectedTokenException e) {
                log.trace("template argument is not a type: {}", e.getMessage());
            }
            rollback(saved);
        }
        return new TemplateArgument(null, expression(false));
    }

    /** Consumes a closing {@code >}, splitting a {@code >>} in place if needed. */
    private void closeAngle() {
        if (check(Lexeme.RIGHT_SHIFT)) {
            splitRightShift();
        }
        consume(Lexeme.GREATER, "expected > at end of template argument list");
    }

    private void splitRightShift() {
        Token shift = peek();
        Token first = generated.add(new Token(">", shift.position(), Lexeme.GREATER));
        Token second = generated.add(new Token(">", shift.position().shifted(1), Lexeme.GREATER));
        tokens.set(current, first);
        tokens.add(current + 1, second);
    }

    private TypeId typeId() {
        List<Token> qualifiers = new ArrayList<>();
        while (check(Lexeme.MULTIPLY) || isKeyword("const")) {
            qualifiers.add(advance());
        }
        if (!isName(peek()) && !check(Lexeme.SCOPE)) {
            throw new ExpectedTokenException("expected a type", peek().position());
        }
        return new TypeId(qualifiers, idExpression(true));
    }

    // -----------------------------------------------------------------------
    // Token helpers

    private boolean isName(Token t) {
        return switch (t.type()) {
            case IDENTIFIER, FIXED_TYPE, MULTI_KEYWORD -> true;
            case KEYWORD -> NAME_KEYWORDS.contains(t.text());
            default -> false;
        };
    }

    private static boolean isLiteralKeyword(Token t) {
        return t.is(Lexeme.KEYWORD) && (t.is("true") || t.is("false") || t.is("nullptr"));
    }

    private static boolean isAccessKeyword(Token t) {
        return t.is(Lexeme.KEYWORD) && (t.is("public") || t.is("protected") || t.is("private"));
    }

    private static boolean isLoopKeyword(Token t) {
        return t.is(Lexeme.KEYWORD) && (t.is("while") || t.is("do") || t.is("for"));
    }

    private static boolean isDirectionWord(Token t) {
        return t.is(Lexeme.IDENTIFIER) && DIRECTIONS.contains(t.text());
    }

    private boolean isKeyword(String text) {
        Token t = peek();
        return t.is(Lexeme.KEYWORD) && t.is(text);
    }

    private boolean isIdentifier(String text) {
        Token t = peek();
        return t.is(Lexeme.IDENTIFIER) && t.is(text);
    }

    private Token consumeName(String message) {
        if (isName(peek())) {
            return advance();
        }
        throw new ExpectedTokenException(message, peek().position());
    }

    private boolean match(Lexeme type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    private boolean check(Lexeme type) {
        return peek().type() == type;
    }

    private Token consume(Lexeme type, String message) {
        if (check(type)) {
            return advance();
        }
        throw new ExpectedTokenException(message, peek().position());
    }

    private Token advance() {
        Token t = peek();
        if (!isAtEnd()) {
            current++;
        }
        return t;
    }

    private boolean isAtEnd() {
        return current >= tokens.size();
    }

    private Token peek() {
        return isAtEnd() ? eof : tokens.get(current);
    }

    private Token peekAhead(int offset) {
        int i = current + offset;
        return i < tokens.size() ? tokens.get(i) : eof;
    }

    /** Records an error without abandoning the production. */
    private void error(String message, SourcePosition where) {
        ErrorEntry.report(errors, new ErrorEntry(where, message));
    }
}
