package com.descant.ast;

import com.descant.SourcePosition;
import com.descant.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A declaration: the central node of the tree.
 *
 * <p>A declaration owns its name, template parameters, requires-clause,
 * metafunction requests, body variant and initializer. {@link #parent()} and
 * {@link #statement()} are non-owning lookups: a declaration is owned by its
 * {@link DeclarationStatement} (or the translation unit), and removing a
 * member always detaches it from its parent first, so a parent link never
 * points at a node that no longer holds the child.</p>
 */
public final class Declaration implements Node {

    private final SourcePosition position;
    private Token identifier;
    private Accessibility access = Accessibility.DEFAULT;
    private boolean variadic;
    private boolean constexpr;
    private List<ParameterDeclaration> templateParameters;
    private Expression requiresClause;
    private final List<MetafunctionRequest> metafunctions = new ArrayList<>();
    private DeclarationBody body;
    private Statement initializer;
    private final CaptureGroup captures = new CaptureGroup();

    private Declaration parent;
    private DeclarationStatement statement;

    private boolean memberFunctionGeneration = true;
    private boolean markedForRemoval;
    private boolean emittable = true;

    public Declaration(SourcePosition position) {
        this.position = position;
    }

    @Override
    public SourcePosition position() {
        return identifier != null ? identifier.position() : position;
    }

    // -----------------------------------------------------------------------
    // Name and access

    /** The name token, or null for an unnamed declaration. */
    public Token identifier() {
        return identifier;
    }

    public void setIdentifier(Token identifier) {
        this.identifier = identifier;
    }

    public String name() {
        return identifier == null ? null : identifier.text();
    }

    public boolean hasName() {
        return identifier != null;
    }

    public boolean hasName(String s) {
        return identifier != null && identifier.is(s);
    }

    public Accessibility access() {
        return access;
    }

    public void setAccess(Accessibility access) {
        this.access = access;
    }

    /** Sets public if no access was written; true if the result is public. */
    public boolean makePublic() {
        return makeAccess(Accessibility.PUBLIC);
    }

    public boolean makeProtected() {
        return makeAccess(Accessibility.PROTECTED);
    }

    public boolean makePrivate() {
        return makeAccess(Accessibility.PRIVATE);
    }

    private boolean makeAccess(Accessibility wanted) {
        if (access == Accessibility.DEFAULT) {
            access = wanted;
            return true;
        }
        return access == wanted;
    }

    public boolean isVariadic() {
        return variadic;
    }

    public void setVariadic(boolean variadic) {
        this.variadic = variadic;
    }

    /** True if declared with {@code ==}: a compile-time value or function. */
    public boolean isConstexpr() {
        return constexpr;
    }

    public void setConstexpr(boolean constexpr) {
        this.constexpr = constexpr;
    }

    // -----------------------------------------------------------------------
    // Template parameters, requires, metafunctions

    /** Template parameters, or null when no {@code <...>} list was written. */
    public List<ParameterDeclaration> templateParameters() {
        return templateParameters;
    }

    public void setTemplateParameters(List<ParameterDeclaration> templateParameters) {
        this.templateParameters = templateParameters == null ? null : List.copyOf(templateParameters);
    }

    public boolean isTemplate() {
        return templateParameters != null;
    }

    public Expression requiresClause() {
        return requiresClause;
    }

    public void setRequiresClause(Expression requiresClause) {
        this.requiresClause = requiresClause;
    }

    public List<MetafunctionRequest> metafunctions() {
        return metafunctions;
    }

    // -----------------------------------------------------------------------
    // Body and initializer

    public DeclarationBody body() {
        return body;
    }

    public void setBody(DeclarationBody body) {
        this.body = body;
    }

    /** The initializer statement, or null for {@code x: int;} or {@code f: ();}. */
    public Statement initializer() {
        return initializer;
    }

    public void setInitializer(Statement initializer) {
        this.initializer = initializer;
    }

    public boolean hasInitializer() {
        return initializer != null;
    }

    public CaptureGroup captures() {
        return captures;
    }

    public boolean isFunction() {
        return body != null && body.kind() == DeclarationBody.Kind.FUNCTION;
    }

    public boolean isObject() {
        return body != null && body.kind() == DeclarationBody.Kind.OBJECT;
    }

    public boolean isType() {
        return body != null && body.kind() == DeclarationBody.Kind.TYPE;
    }

    public boolean isNamespace() {
        return body != null && body.kind() == DeclarationBody.Kind.NAMESPACE;
    }

    public boolean isAlias() {
        return body != null && body.kind() == DeclarationBody.Kind.ALIAS;
    }

    public boolean isTypeAlias() {
        return isAlias() && alias().aliasKind() == AliasBody.AliasKind.TYPE;
    }

    public boolean isNamespaceAlias() {
        return isAlias() && alias().aliasKind() == AliasBody.AliasKind.NAMESPACE;
    }

    public boolean isObjectAlias() {
        return isAlias() && alias().aliasKind() == AliasBody.AliasKind.OBJECT;
    }

    public FunctionType function() {
        if (body instanceof FunctionType f) {
            return f;
        }
        throw new IllegalStateException("'" + name() + "' is not a function");
    }

    public ObjectType object() {
        if (body instanceof ObjectType o) {
            return o;
        }
        throw new IllegalStateException("'" + name() + "' is not an object");
    }

    public TypeBody type() {
        if (body instanceof TypeBody t) {
            return t;
        }
        throw new IllegalStateException("'" + name() + "' is not a type");
    }

    public AliasBody alias() {
        if (body instanceof AliasBody a) {
            return a;
        }
        throw new IllegalStateException("'" + name() + "' is not an alias");
    }

    // -----------------------------------------------------------------------
    // Tree links

    /** The enclosing declaration, or null at the top level. */
    public Declaration parent() {
        return parent;
    }

    public void setParent(Declaration parent) {
        this.parent = parent;
    }

    /** The statement that owns this declaration, or null at the top level. */
    public DeclarationStatement statement() {
        return statement;
    }

    public void setStatement(DeclarationStatement statement) {
        this.statement = statement;
    }

    public boolean isGlobal() {
        return parent == null;
    }

    public boolean parentIsType() {
        return parent != null && parent.isType();
    }

    public boolean parentIsFunction() {
        return parent != null && parent.isFunction();
    }

    public boolean parentIsNamespace() {
        return parent == null || parent.isNamespace();
    }

    // -----------------------------------------------------------------------
    // Flags used by metafunctions

    public boolean memberFunctionGeneration() {
        return memberFunctionGeneration;
    }

    public void disableMemberFunctionGeneration() {
        this.memberFunctionGeneration = false;
    }

    public boolean isMarkedForRemoval() {
        return markedForRemoval;
    }

    public void markForRemoval() {
        this.markedForRemoval = true;
    }

    /** False once a metafunction reported an error against this declaration. */
    public boolean isEmittable() {
        return emittable;
    }

    public void setEmittable(boolean emittable) {
        this.emittable = emittable;
    }

    // -----------------------------------------------------------------------
    // Scope members (types and namespaces)

    /**
     * Declarations directly inside this type or namespace body, in order.
     * Computed on every call.
     */
    public List<Declaration> scopeDeclarations() {
        if (!(isType() || isNamespace()) || !(initializer instanceof CompoundStatement scope)) {
            return List.of();
        }
        List<Declaration> result = new ArrayList<>();
        for (Statement s : scope.statements()) {
            if (s instanceof DeclarationStatement ds) {
                result.add(ds.declaration());
            }
        }
        return Collections.unmodifiableList(result);
    }

    /** Appends a member to this type or namespace and links it back here. */
    public void addScopeMember(DeclarationStatement member) {
        CompoundStatement scope = scopeBody();
        scope.add(member);
        member.declaration().setParent(this);
        member.declaration().setStatement(member);
    }

    /** Removes every member marked for removal; returns how many were removed. */
    public int removeMarkedMembers() {
        CompoundStatement scope = scopeBody();
        int before = scope.statements().size();
        scope.statements().removeIf(s -> {
            if (s instanceof DeclarationStatement ds && ds.declaration().isMarkedForRemoval()) {
                ds.declaration().detach();
                return true;
            }
            return false;
        });
        return before - scope.statements().size();
    }

    public void removeAllMembers() {
        CompoundStatement scope = scopeBody();
        for (Statement s : scope.statements()) {
            if (s instanceof DeclarationStatement ds) {
                ds.declaration().detach();
            }
        }
        scope.statements().clear();
    }

    private void detach() {
        parent = null;
        statement = null;
    }

    private CompoundStatement scopeBody() {
        if (!(isType() || isNamespace())) {
            throw new IllegalStateException("'" + name() + "' is not a type or namespace");
        }
        if (initializer instanceof CompoundStatement c) {
            return c;
        }
        throw new IllegalStateException("'" + name() + "' has no body");
    }

    // -----------------------------------------------------------------------
    // Function shape queries

    public ParameterDeclaration thisParameter() {
        return isFunction() ? function().thisParameter() : null;
    }

    public boolean isFunctionWithThis() {
        return thisParameter() != null;
    }

    public boolean isVirtualFunction() {
        ParameterDeclaration p = thisParameter();
        if (p == null) {
            return false;
        }
        return switch (p.modifier()) {
            case VIRTUAL, OVERRIDE, FINAL -> true;
            case NONE, IMPLICIT -> false;
        };
    }

    /** True for a type that has a base object or any virtual function. */
    public boolean isPolymorphic() {
        for (Declaration m : scopeDeclarations()) {
            if (m.hasName("this") || m.isVirtualFunction()) {
                return true;
            }
        }
        return false;
    }

    public int parameterCount() {
        return isFunction() ? function().parameters().size() : 0;
    }

    public ParameterDeclaration parameter(int index) {
        return function().parameters().get(index);
    }

    @Override
    public String toString() {
        return TreePrinter.print(this);
    }
}
