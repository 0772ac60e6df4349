package com.descant.ast;

import com.descant.SourcePosition;

import java.util.ArrayList;
import java.util.List;

/**
 * A function signature: parameters, {@code throws}, return shape and
 * contracts.
 *
 * <p>The return shape is one of: nothing, a single type with an optional
 * passing style ({@code -> forward T}), or a list of named return
 * parameters ({@code -> (x: int, y: int)}).</p>
 */
public final class FunctionType implements DeclarationBody {

    private final SourcePosition position;
    private final List<ParameterDeclaration> parameters;
    private final boolean throwsSpecified;
    private final PassingStyle returnPassing;
    private final TypeId returnType;
    private final List<ParameterDeclaration> namedReturns;
    private final List<Contract> contracts = new ArrayList<>();

    public FunctionType(SourcePosition position, List<ParameterDeclaration> parameters, boolean throwsSpecified,
                        PassingStyle returnPassing, TypeId returnType, List<ParameterDeclaration> namedReturns) {
        this.position = position;
        this.parameters = List.copyOf(parameters);
        this.throwsSpecified = throwsSpecified;
        this.returnPassing = returnPassing;
        this.returnType = returnType;
        this.namedReturns = namedReturns == null ? null : List.copyOf(namedReturns);
    }

    @Override
    public Kind kind() {
        return Kind.FUNCTION;
    }

    @Override
    public SourcePosition position() {
        return position;
    }

    public List<ParameterDeclaration> parameters() {
        return parameters;
    }

    public boolean throwsSpecified() {
        return throwsSpecified;
    }

    /** Passing style of a single return type, or null. */
    public PassingStyle returnPassing() {
        return returnPassing;
    }

    /** The single return type, or null. */
    public TypeId returnType() {
        return returnType;
    }

    /** Named return parameters, or null when the function has none. */
    public List<ParameterDeclaration> namedReturns() {
        return namedReturns;
    }

    public List<Contract> contracts() {
        return contracts;
    }

    public ParameterDeclaration thisParameter() {
        if (!parameters.isEmpty() && parameters.get(0).isThis()) {
            return parameters.get(0);
        }
        return null;
    }
}
