package com.descant.meta;

import com.descant.ast.Declaration;
import com.descant.ast.DeclarationStatement;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Reflection view over a type definition. Member lists are recomputed on
 * every call, so they always reflect members added or removed so far.
 */
public class TypeView extends DeclarationView {

    /** Which copy and move special members a type declares itself. */
    public record ValueSetFunctions(boolean outThisInThat, boolean outThisMoveThat,
                                    boolean inoutThisInThat, boolean inoutThisMoveThat) {

        public boolean any() {
            return outThisInThat || outThisMoveThat || inoutThisInThat || inoutThisMoveThat;
        }

        public boolean all() {
            return outThisInThat && outThisMoveThat && inoutThisInThat && inoutThisMoveThat;
        }
    }

    public TypeView(Declaration n, CompilerServices s) {
        super(n, s);
        if (!n.isType()) {
            throw new IllegalArgumentException("'" + n.name() + "' is not a type");
        }
    }

    /** Reports an error for every member that already uses one of {@code names}. */
    public void reserveNames(String... names) {
        for (String name : names) {
            for (DeclarationView m : getMembers()) {
                m.require(!m.hasName(name), "in a '" + metafunctionName() + "' type, the name '" + name
                        + "' is reserved for use by the '" + metafunctionName() + "' implementation");
            }
        }
    }

    public boolean isPolymorphic() {
        return n.isPolymorphic();
    }

    public boolean isFinal() {
        return n.type().isFinal();
    }

    public boolean makeFinal() {
        n.type().setFinal(true);
        return true;
    }

    // -----------------------------------------------------------------------
    // Members

    private <T extends DeclarationView> List<T> members(Predicate<Declaration> which,
                                                        Function<Declaration, T> view) {
        List<T> result = new ArrayList<>();
        for (Declaration d : n.scopeDeclarations()) {
            if (which.test(d)) {
                result.add(view.apply(d));
            }
        }
        return result;
    }

    public List<DeclarationView> getMembers() {
        return members(d -> true, d -> new DeclarationView(d, this));
    }

    public List<FunctionView> getMemberFunctions() {
        return members(Declaration::isFunction, d -> new FunctionView(d, this));
    }

    /** Functions with no body that are neither virtual nor defaultable comparisons. */
    public List<FunctionView> getMemberFunctionsNeedingInitializer() {
        List<FunctionView> result = new ArrayList<>();
        for (FunctionView f : getMemberFunctions()) {
            if (!f.hasInitializer() && !f.isVirtual() && !f.isDefaultable()) {
                result.add(f);
            }
        }
        return result;
    }

    public List<ObjectView> getMemberObjects() {
        return members(Declaration::isObject, d -> new ObjectView(d, this));
    }

    public List<TypeView> getMemberTypes() {
        return members(Declaration::isType, d -> new TypeView(d, this));
    }

    public List<AliasView> getMemberAliases() {
        return members(Declaration::isAlias, d -> new AliasView(d, this));
    }

    public ValueSetFunctions queryDeclaredValueSetFunctions() {
        boolean outIn = false;
        boolean outMove = false;
        boolean inoutIn = false;
        boolean inoutMove = false;
        for (FunctionView f : getMemberFunctions()) {
            outIn |= f.isConstructorWithInThat();
            outMove |= f.isConstructorWithMoveThat();
            inoutIn |= f.isAssignmentWithInThat();
            inoutMove |= f.isAssignmentWithMoveThat();
        }
        return new ValueSetFunctions(outIn, outMove, inoutIn, inoutMove);
    }

    // -----------------------------------------------------------------------
    // Mutation

    /** Compiles {@code source} as a declaration and appends it as a member. */
    public void addMember(String source) {
        DeclarationStatement member = parseDeclaration(source);
        if (member != null) {
            n.addScopeMember(member);
        }
    }

    /**
     * Compiles {@code source} as a declaration to be placed in the enclosing
     * namespace, right after the namespace-level declaration containing this
     * type. The insertion happens once all metafunctions on the type ran.
     */
    public void addDeclarationToParentNamespace(String source) {
        DeclarationStatement decl = parseDeclaration(source);
        if (decl != null) {
            deferNamespaceDeclaration(n, decl);
        }
    }

    public void removeMarkedMembers() {
        n.removeMarkedMembers();
    }

    public void removeAllMembers() {
        n.removeAllMembers();
    }

    public void disableMemberFunctionGeneration() {
        n.disableMemberFunctionGeneration();
    }

    public boolean memberFunctionGenerationDisabled() {
        return !n.memberFunctionGeneration();
    }
}
