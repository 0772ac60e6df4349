package com.descant.meta;

import com.descant.ast.Declaration;
import com.descant.ast.FunctionType;
import com.descant.ast.ParameterDeclaration;
import com.descant.ast.PassingStyle;
import com.descant.ast.TreePrinter;

import java.util.List;
import java.util.Set;

/**
 * Reflection view over a function declaration.
 *
 * <p>Special members are recognized by shape: constructors are
 * {@code operator=} with {@code out this}, assignments {@code operator=}
 * with {@code inout this}, and the destructor is {@code operator=} with a
 * single {@code move this}.</p>
 */
public class FunctionView extends DeclarationView {

    private static final Set<String> BINARY_COMPARISONS = Set.of(
        "operator==", "operator!=", "operator<", "operator<=", "operator>", "operator>="
    );

    public FunctionView(Declaration n, CompilerServices s) {
        super(n, s);
        if (!n.isFunction()) {
            throw new IllegalArgumentException("'" + n.name() + "' is not a function");
        }
    }

    private FunctionType f() {
        return n.function();
    }

    private List<ParameterDeclaration> params() {
        return f().parameters();
    }

    // -----------------------------------------------------------------------
    // Parameters

    public int indexOfParameterNamed(String s) {
        List<ParameterDeclaration> params = params();
        for (int i = 0; i < params.size(); i++) {
            if (s.equals(params.get(i).name())) {
                return i;
            }
        }
        return -1;
    }

    public boolean hasParameterNamed(String s) {
        return indexOfParameterNamed(s) >= 0;
    }

    public boolean hasInParameterNamed(String s) {
        return hasParameterWithNameAndPass(s, PassingStyle.IN);
    }

    public boolean hasOutParameterNamed(String s) {
        return hasParameterWithNameAndPass(s, PassingStyle.OUT);
    }

    public boolean hasMoveParameterNamed(String s) {
        return hasParameterWithNameAndPass(s, PassingStyle.MOVE);
    }

    public boolean hasParameterWithNameAndPass(String s, PassingStyle pass) {
        int i = indexOfParameterNamed(s);
        return i >= 0 && params().get(i).passing() == pass;
    }

    public int parameterCount() {
        return params().size();
    }

    // -----------------------------------------------------------------------
    // Shape

    public boolean isFunctionWithThis() {
        return n.isFunctionWithThis();
    }

    public boolean isVirtual() {
        return n.isVirtualFunction();
    }

    /** {@code operator==} or {@code operator<=>} of {@code (this, that)} with no body. */
    public boolean isDefaultable() {
        return (n.hasName("operator==") || n.hasName("operator<=>"))
                && params().size() == 2
                && params().get(0).isThis() && params().get(0).passing() == PassingStyle.IN
                && params().get(1).isThat() && params().get(1).passing() == PassingStyle.IN
                && f().returnType() != null;
    }

    private boolean firstIsThisWith(PassingStyle pass) {
        return !params().isEmpty() && params().get(0).isThis() && params().get(0).passing() == pass;
    }

    private boolean secondIsThatWith(PassingStyle pass) {
        return params().size() == 2 && params().get(1).isThat()
                && (pass == null || params().get(1).passing() == pass);
    }

    public boolean isConstructor() {
        return n.hasName("operator=") && firstIsThisWith(PassingStyle.OUT);
    }

    public boolean isDefaultConstructor() {
        return isConstructor() && params().size() == 1;
    }

    public boolean isMove() {
        return (isConstructor() || isAssignment()) && params().size() == 2
                && params().get(1).passing() == PassingStyle.MOVE;
    }

    public boolean isSwap() {
        return n.hasName("swap") && params().size() == 2 && params().get(1).isThat();
    }

    public boolean isConstructorWithThat() {
        return isConstructor() && secondIsThatWith(null);
    }

    public boolean isConstructorWithInThat() {
        return isConstructor() && secondIsThatWith(PassingStyle.IN);
    }

    public boolean isConstructorWithMoveThat() {
        return isConstructor() && secondIsThatWith(PassingStyle.MOVE);
    }

    public boolean isAssignment() {
        return n.hasName("operator=") && params().size() > 1 && firstIsThisWith(PassingStyle.INOUT);
    }

    public boolean isAssignmentWithThat() {
        return isAssignment() && secondIsThatWith(null);
    }

    public boolean isAssignmentWithInThat() {
        return isAssignment() && secondIsThatWith(PassingStyle.IN);
    }

    public boolean isAssignmentWithMoveThat() {
        return isAssignment() && secondIsThatWith(PassingStyle.MOVE);
    }

    public boolean isDestructor() {
        return n.hasName("operator=") && params().size() == 1 && firstIsThisWith(PassingStyle.MOVE);
    }

    public boolean isCopyOrMove() {
        return isConstructorWithThat() || isAssignmentWithThat();
    }

    // -----------------------------------------------------------------------
    // Return type

    public boolean hasDeclaredReturnType() {
        return f().returnType() != null || (f().namedReturns() != null && !f().namedReturns().isEmpty());
    }

    public boolean hasBoolReturnType() {
        return "bool".equals(unnamedReturnType());
    }

    public boolean hasNonVoidReturnType() {
        return hasDeclaredReturnType() && !"void".equals(unnamedReturnType());
    }

    /** The single declared return type as text, or "" if there is none. */
    public String unnamedReturnType() {
        return f().returnType() == null ? "" : TreePrinter.print(f().returnType());
    }

    public boolean isBinaryComparisonFunction() {
        return n.hasName() && BINARY_COMPARISONS.contains(n.name());
    }

    // -----------------------------------------------------------------------
    // Virtuality

    public void defaultToVirtual() {
        makeVirtual();
    }

    /**
     * Makes a member function with {@code this} virtual if nothing else was
     * written; true if it is virtual afterwards.
     */
    public boolean makeVirtual() {
        ParameterDeclaration self = n.thisParameter();
        if (self == null) {
            return false;
        }
        if (self.modifier() == ParameterDeclaration.Modifier.NONE) {
            self.setModifier(ParameterDeclaration.Modifier.VIRTUAL);
        }
        return n.isVirtualFunction();
    }
}
