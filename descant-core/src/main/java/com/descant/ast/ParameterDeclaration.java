package com.descant.ast;

import com.descant.SourcePosition;

/**
 * A function, template or loop parameter.
 */
public final class ParameterDeclaration implements Node {

    public enum Modifier {
        NONE,
        IMPLICIT,
        VIRTUAL,
        OVERRIDE,
        FINAL
    }

    private final SourcePosition position;
    private final PassingStyle direction;
    private Modifier modifier;
    private final Declaration declaration;

    /**
     * @param direction the written direction, or null when omitted
     */
    public ParameterDeclaration(SourcePosition position, PassingStyle direction, Modifier modifier,
                                Declaration declaration) {
        this.position = position;
        this.direction = direction;
        this.modifier = modifier;
        this.declaration = declaration;
    }

    @Override
    public SourcePosition position() {
        return position;
    }

    /** The written direction, or null. */
    public PassingStyle direction() {
        return direction;
    }

    /** The effective direction; omitted means {@code in}. */
    public PassingStyle passing() {
        return direction == null ? PassingStyle.IN : direction;
    }

    public Modifier modifier() {
        return modifier;
    }

    public void setModifier(Modifier modifier) {
        this.modifier = modifier;
    }

    public Declaration declaration() {
        return declaration;
    }

    public String name() {
        return declaration.name();
    }

    public boolean isThis() {
        return "this".equals(declaration.name());
    }

    public boolean isThat() {
        return "that".equals(declaration.name());
    }
}
