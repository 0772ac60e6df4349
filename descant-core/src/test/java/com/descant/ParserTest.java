package com.descant;

import com.descant.ast.BinaryExpression;
import com.descant.ast.BinaryLevel;
import com.descant.ast.CompoundStatement;
import com.descant.ast.Contract;
import com.descant.ast.Declaration;
import com.descant.ast.DeclarationStatement;
import com.descant.ast.Expression;
import com.descant.ast.ExpressionStatement;
import com.descant.ast.IdExpression;
import com.descant.ast.InspectExpression;
import com.descant.ast.IterationStatement;
import com.descant.ast.Literal;
import com.descant.ast.PassingStyle;
import com.descant.ast.PostfixExpression;
import com.descant.ast.SelectionStatement;
import com.descant.ast.Statement;
import com.descant.ast.TranslationUnit;
import com.descant.ast.TreePrinter;
import com.descant.ast.UnnamedDeclarationExpression;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Parse tree shapes and parser diagnostics.
 */
public class ParserTest {

    private final List<ErrorEntry> errors = new ArrayList<>();

    private TranslationUnit parse(String source) {
        TokenStore store = new TokenStore(errors);
        store.lex(source.lines().map(SourceLine::candidate).collect(Collectors.toList()), false);
        Parser parser = new Parser(errors);
        for (List<Token> section : store.getMap().values()) {
            parser.parse(section, store.getGenerated());
        }
        return parser.translationUnit();
    }

    private TranslationUnit parseClean(String source) {
        TranslationUnit unit = parse(source);
        assertTrue(errors.isEmpty(), () -> "unexpected errors: " + errors);
        return unit;
    }

    private Expression expression(String source, boolean templateArgumentPosition) {
        TokenStore store = new TokenStore(errors);
        store.lex(List.of(SourceLine.candidate(source)), false);
        return new Parser(errors).parseExpression(store.allTokens(), store.getGenerated(), templateArgumentPosition);
    }

    private boolean hasError(String text) {
        return errors.stream().anyMatch(e -> e.msg().contains(text));
    }

    private static Statement bodyStatement(Declaration function, int index) {
        return ((CompoundStatement) function.initializer()).statements().get(index);
    }

    @Test
    @DisplayName("Arithmetic precedence nests multiplication under addition")
    void testPrecedence() {
        TranslationUnit unit = parseClean("x: int = 1 + 2 * 3;");

        Declaration x = unit.find("x");
        assertTrue(x.isObject());
        assertEquals("int", TreePrinter.print(x.object().type()));

        Expression init = ((ExpressionStatement) x.initializer()).expression();
        BinaryExpression sum = assertInstanceOf(BinaryExpression.class, init);
        assertEquals(BinaryLevel.ADDITIVE, sum.level());
        assertInstanceOf(Literal.class, sum.lhs());
        assertEquals(1, sum.terms().size());
        BinaryExpression product = assertInstanceOf(BinaryExpression.class, sum.terms().get(0).rhs());
        assertEquals(BinaryLevel.MULTIPLICATIVE, product.level());

        assertEquals("x: int = 1 + 2 * 3;", TreePrinter.print(x));
    }

    @Test
    @DisplayName("a<b>c is a comparison chain in expression context")
    void testAngleAsComparison() {
        Expression e = expression("a<b>c", false);

        BinaryExpression b = assertInstanceOf(BinaryExpression.class, e);
        assertEquals(BinaryLevel.RELATIONAL, b.level());
        assertEquals(2, b.terms().size());
        assertTrue(errors.isEmpty());
    }

    @Test
    @DisplayName("a<b>c opens a template-argument list in template-argument position")
    void testAngleAsTemplateArguments() {
        Expression e = expression("a<b>c", true);

        IdExpression id = assertInstanceOf(IdExpression.class, e);
        assertTrue(id.last().templated());
        assertEquals("a", id.last().name());
        assertEquals(1, id.last().templateArguments().size());
        assertEquals("a<b>", TreePrinter.print(id));
    }

    @Test
    @DisplayName("A name followed by a template list and a call is a template-id")
    void testTemplateCall() {
        Expression e = expression("f<int>(x)", false);

        PostfixExpression call = assertInstanceOf(PostfixExpression.class, e);
        IdExpression callee = assertInstanceOf(IdExpression.class, call.primary());
        assertTrue(callee.last().templated());
        assertTrue(call.ops().get(0).isCall());
    }

    @Test
    @DisplayName(">> closes two nested template lists")
    void testRightShiftSplit() {
        TranslationUnit unit = parseClean("v: std::vector<std::vector<int>> = ();");

        assertEquals("std::vector<std::vector<int>>", TreePrinter.print(unit.find("v").object().type()));
    }

    @Test
    @DisplayName("Function parameters, passing styles and return type")
    void testFunctionDeclaration() {
        TranslationUnit unit = parseClean("f: (in x: int, inout y: std::string) -> int = { return x; }");

        Declaration f = unit.find("f");
        assertTrue(f.isFunction());
        assertEquals(2, f.parameterCount());
        assertEquals(PassingStyle.IN, f.parameter(0).passing());
        assertEquals(PassingStyle.INOUT, f.parameter(1).passing());
        assertEquals("int", TreePrinter.print(f.function().returnType()));
        assertFalse(f.isFunctionWithThis());
    }

    @Test
    @DisplayName("Omitted direction means in")
    void testDefaultPassing() {
        TranslationUnit unit = parseClean("g: (x: int) = { }");

        assertNull(unit.find("g").parameter(0).direction());
        assertEquals(PassingStyle.IN, unit.find("g").parameter(0).passing());
    }

    @Test
    @DisplayName("Duplicate parameter names are reported")
    void testDuplicateParameter() {
        parse("f: (x: int, x: int) = { }");

        assertTrue(hasError("parameter 'x' is declared more than once"));
    }

    @Test
    @DisplayName("this must come first")
    void testThisNotFirst() {
        parse("T: type = {\n    f: (x: int, this) = { }\n}");

        assertTrue(hasError("'this' must be the first parameter"));
    }

    @Test
    @DisplayName("Captures outside a function expression are rejected")
    void testCaptureOutsideFunctionExpression() {
        parse("f: () = {\n    y := x$;\n}");

        assertTrue(hasError("$ (capture) can only appear in a function expression or a contract condition"));
    }

    @Test
    @DisplayName("Captures in a function expression join its capture group")
    void testCaptureInFunctionExpression() {
        TranslationUnit unit = parseClean("f: () = {\n    g := :() = x$ + 1;\n}");

        Declaration g = ((DeclarationStatement) bodyStatement(unit.find("f"), 0)).declaration();
        Expression init = ((ExpressionStatement) g.initializer()).expression();
        Declaration lambda = assertInstanceOf(UnnamedDeclarationExpression.class, init).declaration();
        assertEquals(1, lambda.captures().members().size());
        assertTrue(lambda.captures().members().get(0).captureSymbol().startsWith("_001_"));
    }

    @Test
    @DisplayName("A comparison against a capture registers the capture once")
    void testCaptureAfterLessThan() {
        TranslationUnit unit = parseClean("f: () = {\n    g := :(e) = e < limit$;\n}");

        Declaration g = ((DeclarationStatement) bodyStatement(unit.find("f"), 0)).declaration();
        Expression init = ((ExpressionStatement) g.initializer()).expression();
        Declaration lambda = assertInstanceOf(UnnamedDeclarationExpression.class, init).declaration();
        Expression body = ((ExpressionStatement) lambda.initializer()).expression();
        BinaryExpression comparison = assertInstanceOf(BinaryExpression.class, body);
        assertEquals(BinaryLevel.RELATIONAL, comparison.level());

        assertEquals(1, lambda.captures().members().size());
        PostfixExpression capture = lambda.captures().members().get(0);
        assertSame(comparison.terms().get(0).rhs(), capture);
        assertEquals("_001_limit", capture.captureSymbol());
    }

    @Test
    @DisplayName("A postcondition comparing against a capture holds one capture")
    void testPostconditionCapture() {
        TranslationUnit unit = parseClean("f: (x: int) post(x < old$) = { }");

        Contract post = unit.find("f").function().contracts().get(0);
        assertTrue(post.isPostcondition());
        assertEquals(1, post.captures().members().size());
        assertEquals("_001_old", post.captures().members().get(0).captureSymbol());
    }

    @Test
    @DisplayName("Preconditions attach to the function signature")
    void testPrecondition() {
        TranslationUnit unit = parseClean("f: (x: int) pre(x > 0) = { }");

        List<Contract> contracts = unit.find("f").function().contracts();
        assertEquals(1, contracts.size());
        assertTrue(contracts.get(0).isPrecondition());
    }

    @Test
    @DisplayName("pre in a function body is an error")
    void testPreconditionInBody() {
        parse("f: () = {\n    pre(true);\n}");

        assertTrue(hasError("pre and post conditions are only allowed on a function declaration"));
    }

    @Test
    @DisplayName("Unnamed declarations at namespace scope are rejected")
    void testUnnamedAtNamespaceScope() {
        TranslationUnit unit = parse(": int = 5;");

        assertTrue(hasError("a declaration at namespace or type scope must have a name"));
        assertEquals(0, unit.size());
    }

    @Test
    @DisplayName("Parsing resumes after a broken declaration")
    void testRecovery() {
        TranslationUnit unit = parse("a: int = ;\nb: int = 2;");

        assertEquals(1, errors.size());
        assertEquals("ill-formed expression, unexpected ';'", errors.get(0).msg());
        assertNull(unit.find("a"));
        assertNotNull(unit.find("b"));
    }

    @Test
    @DisplayName("Members link back to their enclosing scopes")
    void testNestedScopes() {
        TranslationUnit unit = parseClean("N: namespace = {\n    T: type = {\n        x: int = 0;\n    }\n}");

        Declaration n = unit.find("N");
        assertTrue(n.isNamespace());
        Declaration t = n.scopeDeclarations().get(0);
        assertTrue(t.isType());
        assertSame(n, t.parent());
        Declaration x = t.scopeDeclarations().get(0);
        assertSame(t, x.parent());
        assertTrue(x.parentIsType());
        assertFalse(t.isGlobal());
        assertTrue(n.isGlobal());
    }

    @Test
    @DisplayName("A bare name in a type body declares an enumerator")
    void testEnumeratorShorthand() {
        TranslationUnit unit = parseClean("Color: type = {\n    red;\n    green;\n}");

        List<Declaration> members = unit.find("Color").scopeDeclarations();
        assertEquals(2, members.size());
        assertTrue(members.get(0).isObject());
        assertNull(members.get(0).object().type());
    }

    @Test
    @DisplayName("== declares aliases")
    void testAliases() {
        TranslationUnit unit = parseClean("v: int == 42;\nU: type == std::vector<int>;\nns: namespace == std::chrono;");

        assertTrue(unit.find("v").isObjectAlias());
        assertTrue(unit.find("U").isTypeAlias());
        assertTrue(unit.find("ns").isNamespaceAlias());
        assertEquals("v: int == 42;", TreePrinter.print(unit.find("v")));
    }

    @Test
    @DisplayName("Loops and selections in a function body")
    void testStatements() {
        TranslationUnit unit = parseClean(String.join("\n",
                "f: (items: std::vector<int>) = {",
                "    i := 0;",
                "    while i < 10 next i++ {",
                "        i += 1;",
                "    }",
                "    for items do (item) {",
                "        i += item;",
                "    }",
                "    if i == 10 {",
                "        return;",
                "    } else {",
                "    }",
                "}"));

        Declaration f = unit.find("f");
        IterationStatement loop = assertInstanceOf(IterationStatement.class, bodyStatement(f, 1));
        assertNotNull(loop.next());
        IterationStatement forLoop = assertInstanceOf(IterationStatement.class, bodyStatement(f, 2));
        assertTrue(forLoop.isFor());
        assertEquals("item", forLoop.parameter().name());
        SelectionStatement selection = assertInstanceOf(SelectionStatement.class, bodyStatement(f, 3));
        assertNotNull(selection.falseBranch());
    }

    @Test
    @DisplayName("Metafunction requests keep their raw arguments")
    void testMetafunctionRequests() {
        TranslationUnit unit = parseClean("E: @enum<u8> @print type = {\n    a;\n}");

        Declaration e = unit.find("E");
        assertEquals(2, e.metafunctions().size());
        assertEquals("enum", e.metafunctions().get(0).nameText());
        assertEquals(List.of("u8"), e.metafunctions().get(0).arguments());
        assertEquals("print", e.metafunctions().get(1).nameText());
    }

    @Test
    @DisplayName("inspect with a parenthesized subject is an inspect expression")
    void testInspectParenthesizedSubject() {
        TranslationUnit unit = parseClean("v: int = inspect (x) -> int { is _ = 0; };");

        Expression init = ((ExpressionStatement) unit.find("v").initializer()).expression();
        InspectExpression inspect = assertInstanceOf(InspectExpression.class, init);
        assertEquals(1, inspect.alternatives().size());
        assertEquals("int", TreePrinter.print(inspect.resultType()));
    }

    @Test
    @DisplayName("inspect followed only by an argument list is a call")
    void testInspectAsFunctionName() {
        TranslationUnit unit = parseClean("f: () = {\n    inspect(x);\n}");

        Expression call = ((ExpressionStatement) bodyStatement(unit.find("f"), 0)).expression();
        PostfixExpression postfix = assertInstanceOf(PostfixExpression.class, call);
        assertTrue(postfix.ops().get(0).isCall());
    }

    @Test
    @DisplayName("Function bodies record the lines they span")
    void testFunctionBodyExtent() {
        TokenStore store = new TokenStore(errors);
        store.lex(List.of(
                SourceLine.candidate("x: int = 1;"),
                SourceLine.candidate("f: () = {"),
                SourceLine.candidate("    y := 2;"),
                SourceLine.candidate("}"),
                SourceLine.candidate("z: int = 3;")), false);
        Parser parser = new Parser(errors);
        for (List<Token> section : store.getMap().values()) {
            parser.parse(section, store.getGenerated());
        }

        assertTrue(errors.isEmpty(), () -> "unexpected errors: " + errors);
        assertFalse(parser.isWithinFunctionBody(new SourcePosition(1, 1)));
        assertTrue(parser.isWithinFunctionBody(new SourcePosition(2, 9)));
        assertTrue(parser.isWithinFunctionBody(new SourcePosition(3, 5)));
        assertTrue(parser.isWithinFunctionBody(new SourcePosition(4, 1)));
        assertFalse(parser.isWithinFunctionBody(new SourcePosition(5, 1)));
    }
}
