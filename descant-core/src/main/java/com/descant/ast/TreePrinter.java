package com.descant.ast;

import com.descant.Lexeme;
import com.descant.Token;

import java.util.List;

/**
 * Renders tree nodes back to candidate-syntax text.
 *
 * <p>The output re-parses to an equivalent tree, which is what lets
 * metafunctions splice the text of one member (a type, an initializer) into
 * source for another.</p>
 */
public final class TreePrinter {

    private static final String INDENT = "    ";

    private final StringBuilder out = new StringBuilder();
    private int depth;

    private TreePrinter() {
    }

    public static String print(Node node) {
        TreePrinter printer = new TreePrinter();
        printer.node(node);
        return printer.out.toString();
    }

    private void node(Node node) {
        if (node instanceof Expression e) {
            expression(e);
        } else if (node instanceof Statement s) {
            statement(s);
        } else if (node instanceof Declaration d) {
            declaration(d);
        } else if (node instanceof TypeId t) {
            typeId(t);
        } else if (node instanceof ParameterDeclaration p) {
            parameter(p);
        } else if (node instanceof UnqualifiedId u) {
            unqualifiedId(u);
        } else if (node instanceof TemplateArgument a) {
            templateArgument(a);
        } else if (node instanceof Alternative a) {
            alternative(a);
        } else if (node instanceof DeclarationBody b) {
            declarationHead(b);
        } else if (node instanceof TranslationUnit unit) {
            for (Declaration d : unit.declarations()) {
                declaration(d);
                out.append('\n');
            }
        }
    }

    // -----------------------------------------------------------------------
    // Expressions

    private void expression(Expression e) {
        switch (e.kind()) {
            case LITERAL -> out.append(((Literal) e).token().text());
            case ID -> idExpression((IdExpression) e);
            case LIST -> expressionList((ExpressionList) e);
            case INSPECT -> inspect((InspectExpression) e);
            case UNNAMED_DECLARATION -> {
                out.append(':');
                declarationAfterColon(((UnnamedDeclarationExpression) e).declaration());
            }
            case POSTFIX -> postfix((PostfixExpression) e);
            case PREFIX -> {
                PrefixExpression p = (PrefixExpression) e;
                p.ops().forEach(op -> out.append(op.text()));
                expression(p.operand());
            }
            case IS_AS -> {
                IsAsExpression isAs = (IsAsExpression) e;
                expression(isAs.operand());
                for (IsAsExpression.Term term : isAs.terms()) {
                    out.append(' ').append(term.op().text()).append(' ');
                    if (term.type() != null) {
                        typeId(term.type());
                    } else {
                        expression(term.value());
                    }
                }
            }
            case BINARY -> {
                BinaryExpression b = (BinaryExpression) e;
                expression(b.lhs());
                for (BinaryExpression.Term term : b.terms()) {
                    out.append(' ').append(term.op().text()).append(' ');
                    expression(term.rhs());
                }
            }
        }
    }

    private void idExpression(IdExpression id) {
        if (id.global()) {
            out.append("::");
        }
        for (int i = 0; i < id.ids().size(); i++) {
            if (i > 0) {
                out.append("::");
            }
            unqualifiedId(id.ids().get(i));
        }
    }

    private void unqualifiedId(UnqualifiedId u) {
        out.append(u.name());
        if (u.templated()) {
            out.append('<');
            List<TemplateArgument> args = u.templateArguments();
            for (int i = 0; i < args.size(); i++) {
                if (i > 0) {
                    out.append(", ");
                }
                templateArgument(args.get(i));
            }
            out.append('>');
        }
    }

    private void templateArgument(TemplateArgument a) {
        if (a.type() != null) {
            typeId(a.type());
        } else {
            expression(a.expression());
        }
    }

    private void expressionList(ExpressionList list) {
        boolean bracket = list.opener() == Lexeme.LEFT_BRACKET;
        out.append(bracket ? '[' : '(');
        listTerms(list);
        out.append(bracket ? ']' : ')');
    }

    private void listTerms(ExpressionList list) {
        for (int i = 0; i < list.terms().size(); i++) {
            if (i > 0) {
                out.append(", ");
            }
            ExpressionList.Term term = list.terms().get(i);
            if (term.direction() != null) {
                out.append(term.direction().spelling()).append(' ');
            }
            expression(term.expression());
        }
    }

    private void postfix(PostfixExpression p) {
        expression(p.primary());
        for (PostfixExpression.Op op : p.ops()) {
            switch (op.op().type()) {
                case LEFT_PAREN -> {
                    out.append('(');
                    listTerms(op.arguments());
                    out.append(')');
                }
                case LEFT_BRACKET -> {
                    out.append('[');
                    listTerms(op.arguments());
                    out.append(']');
                }
                case DOT -> {
                    out.append('.');
                    idExpression(op.member());
                }
                default -> out.append(op.op().text());
            }
        }
    }

    private void inspect(InspectExpression inspect) {
        out.append("inspect ");
        if (inspect.constexpr()) {
            out.append("constexpr ");
        }
        expression(inspect.subject());
        if (inspect.resultType() != null) {
            out.append(" -> ");
            typeId(inspect.resultType());
        }
        out.append(" {");
        depth++;
        for (Alternative a : inspect.alternatives()) {
            newline();
            alternative(a);
        }
        depth--;
        newline();
        out.append('}');
    }

    private void alternative(Alternative a) {
        if (a.name() != null) {
            out.append(a.name().text()).append(": ");
        }
        out.append(a.isAs().text()).append(' ');
        if (a.type() != null) {
            typeId(a.type());
        } else {
            expression(a.value());
        }
        out.append(" = ");
        statement(a.statement());
    }

    private void typeId(TypeId t) {
        for (Token q : t.qualifiers()) {
            out.append(q.text()).append(' ');
        }
        idExpression(t.id());
    }

    // -----------------------------------------------------------------------
    // Statements

    private void statement(Statement s) {
        switch (s.kind()) {
            case EXPRESSION -> {
                ExpressionStatement es = (ExpressionStatement) s;
                expression(es.expression());
                if (es.hasSemicolon()) {
                    out.append(';');
                }
            }
            case COMPOUND -> compound((CompoundStatement) s);
            case SELECTION -> selection((SelectionStatement) s);
            case DECLARATION -> declaration(((DeclarationStatement) s).declaration());
            case RETURN -> {
                ReturnStatement r = (ReturnStatement) s;
                out.append("return");
                if (r.expression() != null) {
                    out.append(' ');
                    expression(r.expression());
                }
                out.append(';');
            }
            case ITERATION -> iteration((IterationStatement) s);
            case USING -> {
                UsingStatement u = (UsingStatement) s;
                out.append("using ");
                if (u.forNamespace()) {
                    out.append("namespace ");
                }
                idExpression(u.id());
                out.append(';');
            }
            case CONTRACT -> {
                contract((Contract) s);
                out.append(';');
            }
            case INSPECT -> inspect(((InspectStatement) s).inspect());
            case JUMP -> {
                JumpStatement j = (JumpStatement) s;
                out.append(j.keyword().text());
                if (j.label() != null) {
                    out.append(' ').append(j.label().text());
                }
                out.append(';');
            }
        }
    }

    private void compound(CompoundStatement c) {
        out.append('{');
        depth++;
        for (Statement s : c.statements()) {
            newline();
            statement(s);
        }
        depth--;
        if (!c.isEmpty()) {
            newline();
        } else {
            out.append(' ');
        }
        out.append('}');
    }

    private void selection(SelectionStatement s) {
        out.append("if ");
        if (s.constexpr()) {
            out.append("constexpr ");
        }
        expression(s.condition());
        out.append(' ');
        compound(s.trueBranch());
        if (s.falseBranch() != null) {
            out.append(" else ");
            compound(s.falseBranch());
        }
    }

    private void iteration(IterationStatement it) {
        if (it.label() != null) {
            out.append(it.label().text()).append(": ");
        }
        if (it.isDo()) {
            out.append("do ");
            compound(it.body());
            next(it);
            out.append(" while ");
            expression(it.condition());
            out.append(';');
        } else if (it.isFor()) {
            out.append("for ");
            expression(it.range());
            next(it);
            out.append(" do (");
            parameter(it.parameter());
            out.append(") ");
            compound(it.body());
        } else {
            out.append("while ");
            expression(it.condition());
            next(it);
            out.append(' ');
            compound(it.body());
        }
    }

    private void next(IterationStatement it) {
        if (it.next() != null) {
            out.append(" next ");
            expression(it.next());
        }
    }

    private void contract(Contract c) {
        out.append(c.keyword().text());
        if (c.group() != null) {
            out.append('<');
            idExpression(c.group());
            out.append('>');
        }
        out.append('(');
        expression(c.condition());
        if (c.message() != null) {
            out.append(", ");
            expression(c.message());
        }
        out.append(')');
    }

    // -----------------------------------------------------------------------
    // Declarations

    private void declaration(Declaration d) {
        if (d.access() != Accessibility.DEFAULT) {
            out.append(d.access().spelling()).append(' ');
        }
        if (d.hasName()) {
            out.append(d.name());
        }
        if (d.isVariadic()) {
            out.append("...");
        }
        out.append(": ");
        declarationAfterColon(d);
        if (d.initializer() == null && !d.isAlias()) {
            out.append(';');
        }
    }

    private void declarationAfterColon(Declaration d) {
        for (MetafunctionRequest m : d.metafunctions()) {
            out.append('@').append(m.nameText());
            if (!m.arguments().isEmpty()) {
                out.append('<').append(String.join(", ", m.arguments())).append('>');
            }
            out.append(' ');
        }
        if (d.templateParameters() != null) {
            out.append('<');
            parameters(d.templateParameters());
            out.append("> ");
        }
        if (d.body() != null) {
            declarationHead(d.body());
        }
        if (d.requiresClause() != null) {
            out.append(" requires ");
            expression(d.requiresClause());
        }
        if (d.isAlias()) {
            aliasTail(d.alias());
            return;
        }
        if (d.initializer() != null) {
            out.append(d.isConstexpr() ? " == " : " = ");
            statement(d.initializer());
        }
    }

    private void declarationHead(DeclarationBody body) {
        switch (body.kind()) {
            case FUNCTION -> functionType((FunctionType) body);
            case OBJECT -> {
                ObjectType o = (ObjectType) body;
                if (o.type() != null) {
                    typeId(o.type());
                } else {
                    out.append('_');
                }
            }
            case TYPE -> out.append(((TypeBody) body).isFinal() ? "final type" : "type");
            case NAMESPACE -> out.append("namespace");
            case ALIAS -> {
                AliasBody a = (AliasBody) body;
                switch (a.aliasKind()) {
                    case TYPE -> out.append("type");
                    case NAMESPACE -> out.append("namespace");
                    case OBJECT -> {
                        if (a.type() != null) {
                            typeId(a.type());
                        }
                    }
                }
            }
        }
    }

    private void aliasTail(AliasBody a) {
        out.append(" == ");
        switch (a.aliasKind()) {
            case TYPE -> typeId(a.type());
            case NAMESPACE -> idExpression(a.namespaceName());
            case OBJECT -> expression(a.value());
        }
        out.append(';');
    }

    private void functionType(FunctionType f) {
        out.append('(');
        parameters(f.parameters());
        out.append(')');
        if (f.throwsSpecified()) {
            out.append(" throws");
        }
        if (f.returnType() != null) {
            out.append(" -> ");
            if (f.returnPassing() != null) {
                out.append(f.returnPassing().spelling()).append(' ');
            }
            typeId(f.returnType());
        } else if (f.namedReturns() != null) {
            out.append(" -> (");
            parameters(f.namedReturns());
            out.append(')');
        }
        for (Contract c : f.contracts()) {
            out.append(' ');
            contract(c);
        }
    }

    private void parameters(List<ParameterDeclaration> params) {
        for (int i = 0; i < params.size(); i++) {
            if (i > 0) {
                out.append(", ");
            }
            parameter(params.get(i));
        }
    }

    private void parameter(ParameterDeclaration p) {
        if (p.modifier() != ParameterDeclaration.Modifier.NONE) {
            out.append(p.modifier().name().toLowerCase()).append(' ');
        }
        if (p.direction() != null) {
            out.append(p.direction().spelling()).append(' ');
        }
        Declaration d = p.declaration();
        out.append(d.name());
        if (d.isVariadic()) {
            out.append("...");
        }
        if (d.body() instanceof ObjectType o && o.type() != null) {
            out.append(": ");
            typeId(o.type());
        } else if (d.body() instanceof TypeBody) {
            out.append(": type");
        }
        if (d.initializer() instanceof ExpressionStatement es) {
            out.append(" = ");
            expression(es.expression());
        }
    }

    private void newline() {
        out.append('\n');
        out.append(INDENT.repeat(depth));
    }
}
