package com.descant.meta;

import com.descant.ErrorEntry;
import com.descant.Frontend;
import com.descant.FrontendOptions;
import com.descant.FrontendResult;
import com.descant.ast.Accessibility;
import com.descant.ast.Declaration;
import com.descant.ast.TreePrinter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * The metafunctions that ship with the front end, applied through the full
 * pipeline.
 */
public class BuiltinMetafunctionsTest {

    private final List<String> printed = new ArrayList<>();

    private FrontendResult process(String... lines) {
        return new Frontend(FrontendOptions.defaults().withPrintSink(printed::add)).process(String.join("\n", lines));
    }

    private FrontendResult processClean(String... lines) {
        FrontendResult result = process(lines);
        assertFalse(result.hasErrors(), () -> "unexpected errors: " + result.errors());
        return result;
    }

    private static List<String> memberNames(Declaration type) {
        return type.scopeDeclarations().stream().map(Declaration::name).collect(Collectors.toList());
    }

    private static Declaration member(Declaration type, String name) {
        return type.scopeDeclarations().stream()
                .filter(d -> d.hasName(name))
                .findFirst()
                .orElseThrow(() -> new AssertionError("no member named " + name));
    }

    private static boolean hasError(FrontendResult result, String text) {
        return result.errors().stream().map(ErrorEntry::msg).anyMatch(m -> m.contains(text));
    }

    // ==================== interface, polymorphic_base ====================

    @Test
    @DisplayName("@interface makes functions public and virtual and adds a virtual destructor")
    void testInterface() {
        FrontendResult result = processClean(
                "Shape: @interface type = {",
                "    area: (this) -> f64;",
                "    name: (this) -> std::string;",
                "}");

        Declaration shape = result.unit().find("Shape");
        assertEquals(3, shape.scopeDeclarations().size());
        Declaration area = member(shape, "area");
        assertEquals(Accessibility.PUBLIC, area.access());
        assertTrue(area.isVirtualFunction());
        Declaration destructor = shape.scopeDeclarations().get(2);
        assertEquals("operator=: (virtual move this) = { }", TreePrinter.print(destructor));
        assertTrue(shape.isPolymorphic());
    }

    @Test
    @DisplayName("@interface rejects data members and bodies")
    void testInterfaceErrors() {
        FrontendResult result = process(
                "Shape: @interface type = {",
                "    x: int = 0;",
                "    area: (this) -> f64 = 1.0;",
                "}");

        assertTrue(hasError(result, "while applying @interface - interfaces may not contain data objects"));
        assertTrue(hasError(result, "interface functions must not have a function body"));
        assertFalse(result.unit().find("Shape").isEmittable());
    }

    @Test
    @DisplayName("@polymorphic_base defaults functions to public and adds a destructor")
    void testPolymorphicBase() {
        FrontendResult result = processClean(
                "Base: @polymorphic_base type = {",
                "    f: (this) = { }",
                "}");

        Declaration base = result.unit().find("Base");
        assertEquals(Accessibility.PUBLIC, member(base, "f").access());
        assertEquals(2, base.scopeDeclarations().size());
    }

    @Test
    @DisplayName("@polymorphic_base rejects a protected virtual destructor")
    void testPolymorphicBaseDestructor() {
        FrontendResult result = process(
                "Base: @polymorphic_base type = {",
                "    protected operator=: (virtual move this) = { }",
                "}");

        assertTrue(hasError(result, "must be public and virtual, or protected and nonvirtual"));
    }

    // ==================== ordering ====================

    @Test
    @DisplayName("@ordered adds a strong spaceship")
    void testOrdered() {
        FrontendResult result = processClean("P: @ordered type = {", "    x: int = 0;", "}");

        Declaration spaceship = member(result.unit().find("P"), "operator<=>");
        assertEquals("std::strong_ordering", TreePrinter.print(spaceship.function().returnType()));
    }

    @Test
    @DisplayName("An existing spaceship must have the requested ordering")
    void testOrderingMismatch() {
        FrontendResult result = process(
                "P: @ordered type = {",
                "    operator<=>: (this, that) -> std::weak_ordering;",
                "}");

        assertTrue(hasError(result, "operator<=> must return std::strong_ordering"));
    }

    @Test
    @DisplayName("@weakly_ordered accepts a weak spaceship")
    void testWeaklyOrdered() {
        FrontendResult result = processClean(
                "P: @weakly_ordered type = {",
                "    operator<=>: (this, that) -> std::weak_ordering;",
                "}");

        assertEquals(1, result.unit().find("P").scopeDeclarations().size());
    }

    // ==================== value types ====================

    @Test
    @DisplayName("@value adds comparison, copy and default construction")
    void testValue() {
        FrontendResult result = processClean(
                "Point: @value type = {",
                "    x: i32 = 0;",
                "    y: i32 = 0;",
                "}");

        Declaration point = result.unit().find("Point");
        assertEquals(List.of("x", "y", "operator<=>", "operator=", "operator="), memberNames(point));
        assertEquals("operator=: (out this, that) = { }", TreePrinter.print(point.scopeDeclarations().get(3)));
        assertEquals("operator=: (out this) = { }", TreePrinter.print(point.scopeDeclarations().get(4)));
    }

    @Test
    @DisplayName("A partially copyable type is rejected")
    void testPartiallyCopyable() {
        FrontendResult result = process(
                "V: @copyable type = {",
                "    operator=: (out this, move that) = { }",
                "}");

        assertTrue(hasError(result, "this type is partially copyable/movable"));
    }

    @Test
    @DisplayName("A value type may not have virtual functions")
    void testValueVirtual() {
        FrontendResult result = process(
                "V: @basic_value type = {",
                "    f: (virtual this) = { }",
                "}");

        assertTrue(hasError(result, "a value type may not have a protected or virtual function"));
    }

    // ==================== struct ====================

    @Test
    @DisplayName("@struct makes members public and turns off generated functions")
    void testStruct() {
        FrontendResult result = processClean("S: @struct type = {", "    x: int = 0;", "}");

        Declaration s = result.unit().find("S");
        assertEquals(Accessibility.PUBLIC, member(s, "x").access());
        assertFalse(s.memberFunctionGeneration());
    }

    @Test
    @DisplayName("@struct rejects private members")
    void testStructPrivate() {
        FrontendResult result = process("S: @struct type = {", "    private x: int = 0;", "}");

        assertTrue(hasError(result, "all struct members must be public"));
    }

    // ==================== enum, flag_enum ====================

    @Test
    @DisplayName("@enum numbers enumerators from zero and infers the smallest type")
    void testEnum() {
        FrontendResult result = processClean(
                "Color: @enum type = {",
                "    red;",
                "    green;",
                "    blue;",
                "}");

        Declaration color = result.unit().find("Color");
        assertEquals("0", TreePrinter.print(member(color, "red").alias().value()));
        assertEquals("1", TreePrinter.print(member(color, "green").alias().value()));
        assertEquals("2", TreePrinter.print(member(color, "blue").alias().value()));
        assertEquals("i8", TreePrinter.print(member(color, "_value").object().type()));
        assertEquals(List.of("_value", "operator=", "red", "green", "blue", "get_raw_value",
                "operator=", "operator=", "operator<=>", "to_string"), memberNames(color));
        assertEquals(Accessibility.PRIVATE, color.scopeDeclarations().get(1).access());
    }

    @Test
    @DisplayName("Written enumerator values restart the count")
    void testEnumExplicitValues() {
        FrontendResult result = processClean(
                "Level: @enum type = {",
                "    low;",
                "    high := 200;",
                "    higher;",
                "}");

        Declaration level = result.unit().find("Level");
        assertEquals("200", TreePrinter.print(member(level, "high").alias().value()));
        assertEquals("201", TreePrinter.print(member(level, "higher").alias().value()));
        assertEquals("i16", TreePrinter.print(member(level, "_value").object().type()));
    }

    @Test
    @DisplayName("An explicit underlying type is taken from the argument")
    void testEnumUnderlyingType() {
        FrontendResult result = processClean("E: @enum<u16> type = {", "    a;", "    b;", "}");

        assertEquals("u16", TreePrinter.print(member(result.unit().find("E"), "_value").object().type()));
    }

    @Test
    @DisplayName("@enum rejects typed enumerators and empty enumerations")
    void testEnumErrors() {
        FrontendResult typed = process("E: @enum type = {", "    a: int = 0;", "}");
        assertTrue(hasError(typed, "an explicit underlying type should be specified"));

        FrontendResult empty = process("F: @enum type = {", "}");
        assertTrue(hasError(empty, "an enumeration must contain at least one enumerator value"));
    }

    @Test
    @DisplayName("@flag_enum uses powers of two and adds none and the bitwise operators")
    void testFlagEnum() {
        FrontendResult result = processClean(
                "Perms: @flag_enum<u8> type = {",
                "    read;",
                "    write;",
                "    exec;",
                "}");

        Declaration perms = result.unit().find("Perms");
        assertEquals("1", TreePrinter.print(member(perms, "read").alias().value()));
        assertEquals("2", TreePrinter.print(member(perms, "write").alias().value()));
        assertEquals("4", TreePrinter.print(member(perms, "exec").alias().value()));
        assertEquals("0", TreePrinter.print(member(perms, "none").alias().value()));
        assertTrue(memberNames(perms).containsAll(List.of("operator|=", "operator&", "has", "set", "clear")));
        assertEquals(20, perms.scopeDeclarations().size());
    }

    @Test
    @DisplayName("@flag_enum infers an unsigned type from twice the largest value")
    void testFlagEnumInferredType() {
        FrontendResult result = processClean("F: @flag_enum type = {", "    a;", "    b;", "}");

        assertEquals("u8", TreePrinter.print(member(result.unit().find("F"), "_value").object().type()));
    }

    @Test
    @DisplayName("leadingLong reads the integer prefix of a value")
    void testLeadingLong() {
        assertEquals(42, BuiltinMetafunctions.leadingLong("42"));
        assertEquals(-7, BuiltinMetafunctions.leadingLong(" -7 "));
        assertEquals(0, BuiltinMetafunctions.leadingLong("red"));
    }

    // ==================== union ====================

    @Test
    @DisplayName("@union replaces alternatives with storage, a discriminator and accessors")
    void testUnion() {
        FrontendResult result = processClean(
                "Shape: @union type = {",
                "    circle: f64;",
                "    label: std::string;",
                "}");

        Declaration shape = result.unit().find("Shape");
        List<String> names = memberNames(shape);
        assertEquals(17, names.size());
        assertEquals("_storage", names.get(0));
        assertEquals("i8", TreePrinter.print(member(shape, "_discriminator").object().type()));
        assertTrue(names.containsAll(List.of("is_circle", "circle", "set_circle", "is_label", "set_label", "_destroy")));
        assertFalse(member(shape, "circle").isObject());
    }

    @Test
    @DisplayName("@union rejects alternatives named like generated functions")
    void testUnionReservedPrefix() {
        FrontendResult result = process("U: @union type = {", "    is_x: i32;", "}");

        assertTrue(hasError(result, "cannot start with 'is_' or 'set_'"));
    }

    // ==================== print ====================

    @Test
    @DisplayName("@print shows the type after earlier metafunctions ran")
    void testPrintAfterValue() {
        processClean("P: @ordered @print type = {", "    x: int = 0;", "}");

        assertEquals(1, printed.size());
        assertTrue(printed.get(0).contains("operator<=>: (this, that) -> std::strong_ordering;"), printed.get(0));
    }

    @Test
    @DisplayName("Registry lists the builtin names")
    void testNames() {
        assertTrue(BuiltinMetafunctions.INSTANCE.names().containsAll(
                List.of("interface", "value", "enum", "flag_enum", "union", "print")));
        assertTrue(BuiltinMetafunctions.INSTANCE.lookup("no_such_thing").isEmpty());
    }
}
