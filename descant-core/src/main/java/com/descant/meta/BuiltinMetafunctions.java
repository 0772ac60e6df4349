package com.descant.meta;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.BinaryOperator;

/**
 * The metafunctions that ship with the front end.
 *
 * <p>Each one validates the type it is applied to, reporting problems
 * through the views, and then adds the members the type needs. Members are
 * only added when the type does not already declare them, so applying a
 * metafunction a second time adds nothing.</p>
 */
public final class BuiltinMetafunctions implements MetafunctionRegistry {

    public static final BuiltinMetafunctions INSTANCE = new BuiltinMetafunctions();

    private final Map<String, Metafunction> metafunctions;

    private BuiltinMetafunctions() {
        Map<String, Metafunction> m = new LinkedHashMap<>();
        m.put("interface", BuiltinMetafunctions::interfaceType);
        m.put("polymorphic_base", BuiltinMetafunctions::polymorphicBase);
        m.put("ordered", BuiltinMetafunctions::ordered);
        m.put("weakly_ordered", BuiltinMetafunctions::weaklyOrdered);
        m.put("partially_ordered", BuiltinMetafunctions::partiallyOrdered);
        m.put("copyable", BuiltinMetafunctions::copyable);
        m.put("basic_value", BuiltinMetafunctions::basicValue);
        m.put("value", BuiltinMetafunctions::value);
        m.put("weakly_ordered_value", BuiltinMetafunctions::weaklyOrderedValue);
        m.put("partially_ordered_value", BuiltinMetafunctions::partiallyOrderedValue);
        m.put("struct", BuiltinMetafunctions::structType);
        m.put("enum", BuiltinMetafunctions::enumType);
        m.put("flag_enum", BuiltinMetafunctions::flagEnum);
        m.put("union", BuiltinMetafunctions::unionType);
        m.put("print", BuiltinMetafunctions::print);
        this.metafunctions = Collections.unmodifiableMap(m);
    }

    @Override
    public Optional<Metafunction> lookup(String name) {
        return Optional.ofNullable(metafunctions.get(name));
    }

    @Override
    public Set<String> names() {
        return metafunctions.keySet();
    }

    // -----------------------------------------------------------------------
    // interface, polymorphic_base

    private static void addVirtualDestructor(TypeView t) {
        t.addMember("operator=: (virtual move this) = { }");
    }

    /** An abstract base: no data, every function public and virtual with no body. */
    public static void interfaceType(TypeView t) {
        boolean hasDestructor = false;
        for (DeclarationView m : t.getMembers()) {
            m.require(!m.isObject(), "interfaces may not contain data objects");
            if (m.isFunction()) {
                FunctionView mf = m.asFunction();
                mf.require(!mf.isCopyOrMove(), "interfaces may not copy or move; consider a virtual clone() instead");
                mf.require(!mf.hasInitializer(),
                        "interface functions must not have a function body; remove the '=' initializer");
                mf.require(mf.makePublic(), "interface functions must be public");
                mf.defaultToVirtual();
                hasDestructor |= mf.isDestructor();
            }
        }
        if (!hasDestructor) {
            addVirtualDestructor(t);
        }
    }

    /** A base meant for run-time dispatch; it may not be copied or moved. */
    public static void polymorphicBase(TypeView t) {
        boolean hasDestructor = false;
        for (FunctionView mf : t.getMemberFunctions()) {
            if (mf.isDefaultAccess()) {
                mf.defaultToPublic();
            }
            mf.require(!mf.isCopyOrMove(),
                    "polymorphic base types may not copy or move; consider a virtual clone() instead");
            if (mf.isDestructor()) {
                hasDestructor = true;
                mf.require((mf.isPublic() && mf.isVirtual()) || (mf.isProtected() && !mf.isVirtual()),
                        "a polymorphic base type destructor must be public and virtual, or protected and nonvirtual");
            }
        }
        if (!hasDestructor) {
            addVirtualDestructor(t);
        }
    }

    // -----------------------------------------------------------------------
    // Ordering

    private static void orderedWith(TypeView t, String ordering) {
        boolean hasSpaceship = false;
        for (FunctionView mf : t.getMemberFunctions()) {
            if (mf.hasName("operator<=>")) {
                hasSpaceship = true;
                if (!mf.unnamedReturnType().contains(ordering)) {
                    mf.error("operator<=> must return std::" + ordering);
                }
            }
        }
        if (!hasSpaceship) {
            t.addMember("operator<=>: (this, that) -> std::" + ordering + ";");
        }
    }

    public static void ordered(TypeView t) {
        orderedWith(t, "strong_ordering");
    }

    public static void weaklyOrdered(TypeView t) {
        orderedWith(t, "weak_ordering");
    }

    public static void partiallyOrdered(TypeView t) {
        orderedWith(t, "partial_ordering");
    }

    // -----------------------------------------------------------------------
    // Value types

    /** Adds the general copy constructor unless the type declares one. */
    public static void copyable(TypeView t) {
        TypeView.ValueSetFunctions smfs = t.queryDeclaredValueSetFunctions();
        if (!smfs.outThisInThat() && smfs.any()) {
            t.error("this type is partially copyable/movable - when you provide any of the more-specific operator= "
                    + "signatures, you must also provide the one with the general signature (out this, that); "
                    + "alternatively, consider removing all the operator= functions and let them all be generated "
                    + "for you with default memberwise semantics");
        } else if (!smfs.outThisInThat()) {
            t.addMember("operator=: (out this, that) = { }");
        }
    }

    public static void basicValue(TypeView t) {
        copyable(t);

        boolean hasDefaultConstructor = false;
        for (FunctionView mf : t.getMemberFunctions()) {
            hasDefaultConstructor |= mf.isDefaultConstructor();
            mf.require(!mf.isProtected() && !mf.isVirtual(),
                    "a value type may not have a protected or virtual function");
            mf.require(!mf.isDestructor() || mf.isPublic() || mf.isDefaultAccess(),
                    "a value type may not have a non-public destructor");
        }
        if (!hasDefaultConstructor) {
            t.addMember("operator=: (out this) = { }");
        }
    }

    public static void value(TypeView t) {
        ordered(t);
        basicValue(t);
    }

    public static void weaklyOrderedValue(TypeView t) {
        weaklyOrdered(t);
        basicValue(t);
    }

    public static void partiallyOrderedValue(TypeView t) {
        partiallyOrdered(t);
        basicValue(t);
    }

    // -----------------------------------------------------------------------
    // struct

    public static void structType(TypeView t) {
        for (DeclarationView m : t.getMembers()) {
            m.require(m.makePublic(), "all struct members must be public");
            if (m.isFunction()) {
                FunctionView mf = m.asFunction();
                t.require(!mf.isVirtual(), "a struct may not have a virtual function");
                t.require(!mf.hasName("operator="), "a struct may not have a user-defined operator=");
            }
        }
        t.disableMemberFunctionGeneration();
    }

    // -----------------------------------------------------------------------
    // enum, flag_enum

    private record ValueMember(String name, String type, String value) {
    }

    private static boolean isEmptyOrDecimalNumber(String s) {
        String trimmed = s.strip();
        for (int i = 0; i < trimmed.length(); i++) {
            if (!Character.isDigit(trimmed.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    /** The integer at the start of {@code s}, or 0 if it does not start with one. */
    static long leadingLong(String s) {
        String trimmed = s.strip();
        int end = 0;
        if (end < trimmed.length() && (trimmed.charAt(end) == '-' || trimmed.charAt(end) == '+')) {
            end++;
        }
        int digitsStart = end;
        while (end < trimmed.length() && Character.isDigit(trimmed.charAt(end))) {
            end++;
        }
        if (end == digitsStart) {
            return 0;
        }
        try {
            return Long.parseLong(trimmed.substring(0, end));
        } catch (NumberFormatException e) {
            return trimmed.charAt(0) == '-' ? Long.MIN_VALUE : Long.MAX_VALUE;
        }
    }

    /**
     * Shared implementation of {@code enum} and {@code flag_enum}.
     *
     * @param nextValue given the previous value and an enumerator's written
     *        initializer ("" if none), yields that enumerator's value
     */
    private static void basicEnum(TypeView t, BinaryOperator<String> nextValue, boolean bitwise) {
        List<ValueMember> enumerators = new ArrayList<>();
        long minValue = 0;
        long maxValue = 0;
        String underlyingType = t.argument(0);

        t.reserveNames("operator=", "operator<=>");
        if (bitwise) {
            t.reserveNames("has", "set", "clear", "to_string", "get_raw_value", "none");
        }

        // Collect the enumerators
        String value = "-1";
        boolean foundNonNumeric = false;
        for (DeclarationView m : t.getMembers()) {
            if (!m.isMemberObject()) {
                continue;
            }
            m.require(m.isPublic() || m.isDefaultAccess(), "an enumerator cannot be protected or private");

            ObjectView mo = m.asObject();
            if (!mo.hasWildcardType()) {
                mo.error("an explicit underlying type should be specified as a template argument to the "
                        + "metafunction - try 'enum<u16>' or 'flag_enum<u64>'");
            }

            String init = mo.initializer();
            boolean isDefaultOrNumeric = isEmptyOrDecimalNumber(init);
            foundNonNumeric |= !init.isEmpty() && !isDefaultOrNumeric;
            mo.require(!isDefaultOrNumeric || !foundNonNumeric || mo.hasName("none"),
                    mo.name() + ": enumerators with non-numeric values must come after all default and numeric values");

            value = nextValue.apply(value, init);

            long v = leadingLong(value);
            minValue = Math.min(minValue, v);
            maxValue = Math.max(maxValue, v);

            enumerators.add(new ValueMember(mo.name(), "", value));
            mo.markForRemovalFromEnclosingType();
        }

        if (enumerators.isEmpty()) {
            t.error("an enumeration must contain at least one enumerator value");
            return;
        }

        if (underlyingType.isEmpty()) {
            if (bitwise) {
                long umax = maxValue * 2;
                if (umax <= 0xFFL) {
                    underlyingType = "u8";
                } else if (umax <= 0xFFFFL) {
                    underlyingType = "u16";
                } else if (umax <= 0xFFFF_FFFFL) {
                    underlyingType = "u32";
                } else {
                    underlyingType = "u64";
                }
            } else if (Byte.MIN_VALUE <= minValue && maxValue <= Byte.MAX_VALUE) {
                underlyingType = "i8";
            } else if (Short.MIN_VALUE <= minValue && maxValue <= Short.MAX_VALUE) {
                underlyingType = "i16";
            } else if (Integer.MIN_VALUE <= minValue && maxValue <= Integer.MAX_VALUE) {
                underlyingType = "i32";
            } else {
                underlyingType = "i64";
            }
        }

        t.removeMarkedMembers();

        String typeName = t.name();
        String defaultValue = bitwise ? "none" : enumerators.get(0).name();

        t.addMember("_value : " + underlyingType + ";");
        t.addMember("private operator= : (implicit out this, _val: i64) == _value = cpp2::unsafe_narrow<"
                + underlyingType + ">(_val);");

        if (bitwise) {
            t.addMember("operator|= : (inout this, that) == _value |= that._value;");
            t.addMember("operator&= : (inout this, that) == _value &= that._value;");
            t.addMember("operator^= : (inout this, that) == _value ^= that._value;");
            t.addMember("operator| : (this, that) -> " + typeName + " == _value | that._value;");
            t.addMember("operator& : (this, that) -> " + typeName + " == _value & that._value;");
            t.addMember("operator^ : (this, that) -> " + typeName + " == _value ^ that._value;");
            t.addMember("has : (this, that) -> bool == _value & that._value;");
            t.addMember("set : (inout this, that) == _value |= that._value;");
            t.addMember("clear : (inout this, that) == _value &= that._value~;");
        }

        for (ValueMember e : enumerators) {
            t.addMember(e.name() + " : " + typeName + " == " + e.value() + ";");
        }
        if (bitwise) {
            t.addMember("none : " + typeName + " == 0;");
        }

        t.addMember("get_raw_value : (this) -> " + underlyingType + " == _value;");
        t.addMember("operator= : (out this) == { _value = " + defaultValue + "._value; }");
        t.addMember("operator= : (out this, that) == { }");
        t.addMember("operator<=> : (this, that) -> std::strong_ordering;");

        StringBuilder toString = new StringBuilder("to_string : (this) -> std::string = {\n");
        if (bitwise) {
            toString.append("    _ret : std::string = \"(\";\n");
            toString.append("    _comma : std::string = ();\n");
            toString.append("    if this == none { return \"(none)\"; }\n");
            for (ValueMember e : enumerators) {
                toString.append("    if (this & ").append(e.name()).append(") == ").append(e.name())
                        .append(" { _ret += _comma + \"").append(e.name()).append("\"; _comma = \", \"; }\n");
            }
            toString.append("    return _ret + \")\";\n}\n");
        } else {
            for (ValueMember e : enumerators) {
                toString.append("    if this == ").append(e.name())
                        .append(" { return \"").append(e.name()).append("\"; }\n");
            }
            toString.append("    return \"invalid ").append(typeName).append(" value\";\n}\n");
        }
        t.addMember(toString.toString());
    }

    /** Enumerators count up from 0, or from the last written value. */
    public static void enumType(TypeView t) {
        basicEnum(t, (previous, init) -> init.isEmpty() ? Long.toString(leadingLong(previous) + 1) : init, false);
    }

    /** Enumerators are successive powers of two, starting at 1. */
    public static void flagEnum(TypeView t) {
        basicEnum(t, (previous, init) -> {
            if (!init.isEmpty()) {
                return init;
            }
            long v = leadingLong(previous);
            return v < 1 ? "1" : Long.toString(v * 2);
        }, true);
    }

    // -----------------------------------------------------------------------
    // union

    /** A tagged union: one storage buffer plus a discriminator. */
    public static void unionType(TypeView t) {
        List<ValueMember> alternatives = new ArrayList<>();
        int value = 0;
        for (DeclarationView m : t.getMembers()) {
            if (m.isMemberObject()) {
                m.require(m.isPublic() || m.isDefaultAccess(), "a union alternative cannot be protected or private");
                m.require(!m.name().startsWith("is_") && !m.name().startsWith("set_"),
                        "a union alternative's name cannot start with 'is_' or 'set_' - that could cause user "
                                + "confusion with the 'is_alternative' and 'set_alternative' generated functions");
                ObjectView mo = m.asObject();
                mo.require(mo.initializer().isEmpty(), "a union alternative cannot have an initializer");
                alternatives.add(new ValueMember(mo.name(), mo.type(), Integer.toString(value)));
                mo.markForRemovalFromEnclosingType();
            }
            value++;
        }

        String discriminatorType;
        if (alternatives.size() < Byte.MAX_VALUE) {
            discriminatorType = "i8";
        } else if (alternatives.size() < Short.MAX_VALUE) {
            discriminatorType = "i16";
        } else {
            discriminatorType = "i32";
        }

        t.removeMarkedMembers();

        StringBuilder storage = new StringBuilder("_storage: cpp2::aligned_storage<cpp2::max( ");
        String comma = "";
        for (ValueMember a : alternatives) {
            storage.append(comma).append("sizeof(").append(a.type()).append(")");
            comma = ", ";
        }
        storage.append("), cpp2::max( ");
        comma = "";
        for (ValueMember a : alternatives) {
            storage.append(comma).append("alignof(").append(a.type()).append(")");
            comma = ", ";
        }
        storage.append(" )> = ();");
        t.addMember(storage.toString());

        t.addMember("_discriminator: " + discriminatorType + " = -1;");

        for (ValueMember a : alternatives) {
            String is = "is_" + a.name();
            String set = "set_" + a.name();
            String pointer = "reinterpret_cast<*" + a.type() + ">(_storage&)";
            t.addMember(is + ": (this) -> bool = _discriminator == " + a.value() + ";");
            t.addMember(a.name() + ": (this) -> forward " + a.type() + " pre(" + is + "()) = reinterpret_cast<* const "
                    + a.type() + ">(_storage&)*;");
            t.addMember(a.name() + ": (inout this) -> forward " + a.type() + " pre(" + is + "()) = "
                    + pointer + "*;");
            t.addMember(set + ": (inout this, _value: " + a.type() + ") = { if !" + is + "() { _destroy(); "
                    + "std::construct_at( " + pointer + ", _value); } else { " + pointer + "* = _value; } "
                    + "_discriminator = " + a.value() + "; }");
            t.addMember(set + ": (inout this, forward args...: _) = { if !" + is + "() { _destroy(); "
                    + "std::construct_at( " + pointer + ", args...); } else { " + pointer + "* = :" + a.type()
                    + " = (args...); } _discriminator = " + a.value() + "; }");
        }

        StringBuilder destroy = new StringBuilder("private _destroy: (inout this) = {\n");
        for (ValueMember a : alternatives) {
            destroy.append("    if _discriminator == ").append(a.value())
                    .append(" { std::destroy_at( reinterpret_cast<*").append(a.type()).append(">(_storage&) ); }\n");
        }
        destroy.append("    _discriminator = -1;\n}");
        t.addMember(destroy.toString());

        t.addMember("operator=: (move this) = { _destroy(); }");
        t.addMember("operator=: (out this) = { }");

        StringBuilder valueSet = new StringBuilder();
        for (ValueMember a : alternatives) {
            valueSet.append("    if that.is_").append(a.name()).append("() { set_").append(a.name())
                    .append("( that.").append(a.name()).append("() ); }\n");
        }
        valueSet.append("}");
        t.addMember("operator=: (out this, that) = {\n    _storage = ();\n    _discriminator = -1;\n" + valueSet);
        t.addMember("operator=: (inout this, that) = {\n    _storage = _;\n    _discriminator = _;\n" + valueSet);
    }

    // -----------------------------------------------------------------------
    // print

    /** Writes the type, as it stands, to the configured print sink. */
    public static void print(TypeView t) {
        t.emit(t.print());
    }
}
