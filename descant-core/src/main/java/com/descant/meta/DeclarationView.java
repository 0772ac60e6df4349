package com.descant.meta;

import com.descant.SourcePosition;
import com.descant.ast.Accessibility;
import com.descant.ast.Declaration;
import com.descant.ast.TreePrinter;

/**
 * Reflection view over any declaration: access, name and kind queries,
 * and the bounded set of mutations a metafunction may make.
 */
public class DeclarationView extends CompilerServices {

    final Declaration n;

    public DeclarationView(Declaration n, CompilerServices s) {
        super(s);
        if (n == null) {
            throw new IllegalArgumentException("a declaration view must refer to a declaration, not null");
        }
        this.n = n;
    }

    @Override
    public SourcePosition position() {
        return n.position();
    }

    /** The declaration rendered as candidate-syntax source. */
    public String print() {
        return TreePrinter.print(n);
    }

    // -----------------------------------------------------------------------
    // Access

    public boolean isPublic() {
        return n.access() == Accessibility.PUBLIC;
    }

    public boolean isProtected() {
        return n.access() == Accessibility.PROTECTED;
    }

    public boolean isPrivate() {
        return n.access() == Accessibility.PRIVATE;
    }

    public boolean isDefaultAccess() {
        return n.access() == Accessibility.DEFAULT;
    }

    public void defaultToPublic() {
        n.makePublic();
    }

    public void defaultToProtected() {
        n.makeProtected();
    }

    public void defaultToPrivate() {
        n.makePrivate();
    }

    /** Makes this public unless other access was written; true if it is now public. */
    public boolean makePublic() {
        return n.makePublic();
    }

    public boolean makeProtected() {
        return n.makeProtected();
    }

    public boolean makePrivate() {
        return n.makePrivate();
    }

    // -----------------------------------------------------------------------
    // Name and kind

    public boolean hasName() {
        return n.hasName();
    }

    public boolean hasName(String s) {
        return n.hasName(s);
    }

    public String name() {
        return n.hasName() ? n.name() : "";
    }

    public boolean hasInitializer() {
        return n.hasInitializer();
    }

    public boolean isGlobal() {
        return n.isGlobal();
    }

    public boolean isFunction() {
        return n.isFunction();
    }

    public boolean isObject() {
        return n.isObject();
    }

    /** An object named {@code this}: a base-class subobject. */
    public boolean isBaseObject() {
        return n.isObject() && n.hasName("this");
    }

    public boolean isMemberObject() {
        return n.isObject() && n.parentIsType() && !n.hasName("this");
    }

    public boolean isType() {
        return n.isType();
    }

    public boolean isNamespace() {
        return n.isNamespace();
    }

    public boolean isAlias() {
        return n.isAlias();
    }

    public boolean isTypeAlias() {
        return n.isTypeAlias();
    }

    public boolean isNamespaceAlias() {
        return n.isNamespaceAlias();
    }

    public boolean isObjectAlias() {
        return n.isObjectAlias();
    }

    public boolean isFunctionExpression() {
        return n.isFunction() && !n.hasName();
    }

    public FunctionView asFunction() {
        if (!isFunction()) {
            throw new IllegalStateException("'" + name() + "' is not a function");
        }
        return new FunctionView(n, this);
    }

    public ObjectView asObject() {
        if (!isObject()) {
            throw new IllegalStateException("'" + name() + "' is not an object");
        }
        return new ObjectView(n, this);
    }

    public TypeView asType() {
        if (!isType()) {
            throw new IllegalStateException("'" + name() + "' is not a type");
        }
        return new TypeView(n, this);
    }

    public AliasView asAlias() {
        if (!isAlias()) {
            throw new IllegalStateException("'" + name() + "' is not an alias");
        }
        return new AliasView(n, this);
    }

    // -----------------------------------------------------------------------
    // Parent

    public DeclarationView parent() {
        if (n.parent() == null) {
            throw new IllegalStateException("'" + name() + "' has no parent declaration");
        }
        return new DeclarationView(n.parent(), this);
    }

    public boolean parentIsFunction() {
        return n.parentIsFunction();
    }

    public boolean parentIsObject() {
        return n.parent() != null && n.parent().isObject();
    }

    public boolean parentIsType() {
        return n.parentIsType();
    }

    public boolean parentIsNamespace() {
        return n.parentIsNamespace();
    }

    public boolean parentIsAlias() {
        return n.parent() != null && n.parent().isAlias();
    }

    public boolean parentIsPolymorphic() {
        return n.parent() != null && n.parent().isPolymorphic();
    }

    /**
     * Marks this member for removal by the enclosing type's next
     * {@link TypeView#removeMarkedMembers()} sweep.
     */
    public void markForRemovalFromEnclosingType() {
        if (!parentIsType()) {
            throw new IllegalStateException("'" + name() + "' is not a member of a type");
        }
        n.markForRemoval();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + name() + " at " + position() + "]";
    }
}
