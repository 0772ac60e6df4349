package com.descant.meta;

import com.descant.ErrorEntry;
import com.descant.ast.Alternative;
import com.descant.ast.BinaryExpression;
import com.descant.ast.CompoundStatement;
import com.descant.ast.Contract;
import com.descant.ast.Declaration;
import com.descant.ast.DeclarationStatement;
import com.descant.ast.Expression;
import com.descant.ast.ExpressionList;
import com.descant.ast.ExpressionStatement;
import com.descant.ast.FunctionType;
import com.descant.ast.InspectExpression;
import com.descant.ast.InspectStatement;
import com.descant.ast.IsAsExpression;
import com.descant.ast.IterationStatement;
import com.descant.ast.MetafunctionRequest;
import com.descant.ast.ParameterDeclaration;
import com.descant.ast.PostfixExpression;
import com.descant.ast.PrefixExpression;
import com.descant.ast.ReturnStatement;
import com.descant.ast.SelectionStatement;
import com.descant.ast.Statement;
import com.descant.ast.TranslationUnit;
import com.descant.ast.UnnamedDeclarationExpression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Applies the {@code @name} requests written on type definitions.
 *
 * <p>Types nested inside another declaration are processed before it, and
 * one type's requests run strictly in the order written. Errors accumulate
 * in the shared list without stopping the walk; a declaration that received
 * any is marked not emittable.</p>
 */
public final class MetafunctionEngine {

    private static final Logger log = LoggerFactory.getLogger(MetafunctionEngine.class);

    private final MetafunctionRegistry registry;
    private final CompilerServices services;

    public MetafunctionEngine(MetafunctionRegistry registry, CompilerServices services) {
        if (registry == null || services == null) {
            throw new IllegalArgumentException("registry and services are required");
        }
        this.registry = registry;
        this.services = services;
    }

    /**
     * Processes every declaration of {@code unit}.
     *
     * @return true if no new error was recorded
     */
    public boolean apply(TranslationUnit unit) {
        int errorsBefore = services.errors().size();
        for (Declaration d : List.copyOf(unit.declarations())) {
            visit(d);
        }
        insertPending(unit);
        int added = services.errors().size() - errorsBefore;
        log.debug("metafunction pass over {} declaration(s): {} new error(s)", unit.size(), added);
        return added == 0;
    }

    /** Processes one declaration and everything nested in it. */
    public boolean apply(Declaration declaration, TranslationUnit unit) {
        int errorsBefore = services.errors().size();
        visit(declaration);
        insertPending(unit);
        return services.errors().size() == errorsBefore;
    }

    private void visit(Declaration d) {
        for (Declaration member : d.scopeDeclarations()) {
            visit(member);
        }
        for (Declaration local : nestedDeclarations(d)) {
            visit(local);
        }
        if (!d.metafunctions().isEmpty()) {
            applyRequests(d);
        }
    }

    /**
     * Declarations found anywhere inside {@code d} apart from its scope
     * members: locals, function expressions, parameters and the like.
     */
    private static List<Declaration> nestedDeclarations(Declaration d) {
        List<Declaration> out = new ArrayList<>();
        if (d.body() != null) {
            switch (d.body().kind()) {
                case FUNCTION -> {
                    FunctionType f = d.function();
                    for (ParameterDeclaration p : f.parameters()) {
                        out.add(p.declaration());
                    }
                    if (f.namedReturns() != null) {
                        for (ParameterDeclaration p : f.namedReturns()) {
                            out.add(p.declaration());
                        }
                    }
                    for (Contract c : f.contracts()) {
                        collect(c, out);
                    }
                }
                case ALIAS -> collect(d.alias().value(), out);
                case OBJECT, TYPE, NAMESPACE -> {
                    // types and namespaces hold only scope members
                }
            }
        }
        if (!d.isType() && !d.isNamespace()) {
            collect(d.initializer(), out);
        }
        return out;
    }

    private static void collect(Statement s, List<Declaration> out) {
        if (s == null) {
            return;
        }
        switch (s.kind()) {
            case EXPRESSION -> collect(((ExpressionStatement) s).expression(), out);
            case COMPOUND -> {
                for (Statement inner : ((CompoundStatement) s).statements()) {
                    collect(inner, out);
                }
            }
            case SELECTION -> {
                SelectionStatement sel = (SelectionStatement) s;
                collect(sel.condition(), out);
                collect(sel.trueBranch(), out);
                collect(sel.falseBranch(), out);
            }
            case DECLARATION -> out.add(((DeclarationStatement) s).declaration());
            case RETURN -> collect(((ReturnStatement) s).expression(), out);
            case ITERATION -> {
                IterationStatement loop = (IterationStatement) s;
                collect(loop.condition(), out);
                collect(loop.range(), out);
                collect(loop.next(), out);
                if (loop.parameter() != null) {
                    out.add(loop.parameter().declaration());
                }
                collect(loop.body(), out);
            }
            case CONTRACT -> {
                Contract c = (Contract) s;
                collect(c.condition(), out);
                collect(c.message(), out);
            }
            case INSPECT -> collect(((InspectStatement) s).inspect(), out);
            case USING, JUMP -> {
                // no nested expressions
            }
        }
    }

    private static void collect(Expression e, List<Declaration> out) {
        if (e == null) {
            return;
        }
        switch (e.kind()) {
            case LITERAL, ID -> {
                // leaves
            }
            case LIST -> {
                for (ExpressionList.Term term : ((ExpressionList) e).terms()) {
                    collect(term.expression(), out);
                }
            }
            case INSPECT -> {
                InspectExpression inspect = (InspectExpression) e;
                collect(inspect.subject(), out);
                for (Alternative a : inspect.alternatives()) {
                    collect(a.value(), out);
                    collect(a.statement(), out);
                }
            }
            case UNNAMED_DECLARATION -> out.add(((UnnamedDeclarationExpression) e).declaration());
            case POSTFIX -> {
                PostfixExpression p = (PostfixExpression) e;
                collect(p.primary(), out);
                for (PostfixExpression.Op op : p.ops()) {
                    collect(op.arguments(), out);
                }
            }
            case PREFIX -> collect(((PrefixExpression) e).operand(), out);
            case IS_AS -> {
                IsAsExpression isAs = (IsAsExpression) e;
                collect(isAs.operand(), out);
                for (IsAsExpression.Term term : isAs.terms()) {
                    collect(term.value(), out);
                }
            }
            case BINARY -> {
                BinaryExpression b = (BinaryExpression) e;
                collect(b.lhs(), out);
                for (BinaryExpression.Term term : b.terms()) {
                    collect(term.rhs(), out);
                }
            }
        }
    }

    private void applyRequests(Declaration d) {
        List<ErrorEntry> errors = services.errors();
        int errorsBefore = errors.size();

        if (!d.isType()) {
            MetafunctionRequest first = d.metafunctions().get(0);
            ErrorEntry.report(errors, new ErrorEntry(first.name().position(),
                    "@" + first.nameText() + " - metafunctions can only be applied to type definitions, but '"
                            + d.name() + "' is not a type"));
            d.setEmittable(false);
            return;
        }

        TypeView target = new TypeView(d, services);
        for (MetafunctionRequest request : d.metafunctions()) {
            String name = request.nameText();
            Optional<Metafunction> metafunction = registry.lookup(name);
            if (metafunction.isEmpty()) {
                ErrorEntry.report(errors, new ErrorEntry(request.name().position(),
                        "unrecognized metafunction name: " + name));
                continue;
            }
            log.debug("applying @{} to {}", name, d.name());
            target.setMetafunctionName(name, request.arguments());
            metafunction.get().apply(target);
            if (!target.argumentsWereUsed()) {
                ErrorEntry.report(errors, new ErrorEntry(request.name().position(),
                        name + " did not use its template arguments - did you mean to write '"
                                + name + " <" + request.arguments().get(0) + ">' (with the spaces)?"));
            }
        }
        target.setMetafunctionName("", List.of());

        if (errors.size() > errorsBefore) {
            d.setEmittable(false);
        }
    }

    private void insertPending(TranslationUnit unit) {
        for (CompilerServices.PendingDeclaration p : services.drainPendingDeclarations()) {
            Declaration anchor = p.anchor();
            while (anchor.parent() != null && !anchor.parent().isNamespace()) {
                anchor = anchor.parent();
            }
            Declaration added = p.declaration().declaration();
            Declaration namespace = anchor.parent();
            if (namespace == null) {
                int at = unit.declarations().indexOf(anchor);
                unit.declarations().add(at < 0 ? unit.size() : at + 1, added);
                added.setParent(null);
                added.setStatement(null);
            } else {
                List<Statement> members = ((CompoundStatement) namespace.initializer()).statements();
                int at = members.indexOf(anchor.statement());
                members.add(at < 0 ? members.size() : at + 1, p.declaration());
                added.setParent(namespace);
                added.setStatement(p.declaration());
            }
        }
    }
}
