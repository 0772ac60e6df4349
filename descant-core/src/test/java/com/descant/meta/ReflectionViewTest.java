package com.descant.meta;

import com.descant.ErrorEntry;
import com.descant.Frontend;
import com.descant.FrontendOptions;
import com.descant.FrontendResult;
import com.descant.ast.Declaration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Queries and mutations through the declaration, function, object, alias
 * and type views.
 */
public class ReflectionViewTest {

    private List<ErrorEntry> errors;
    private FrontendResult result;
    private CompilerServices services;

    @BeforeEach
    void setUp() {
        result = new Frontend(FrontendOptions.defaults().withRunMetafunctions(false)).process(String.join("\n",
                "T: type = {",
                "    operator=: (out this) = { }",
                "    operator=: (out this, that) = { }",
                "    operator=: (inout this, move that) = { }",
                "    operator=: (move this) = { }",
                "    swap: (inout this, inout that) = { }",
                "    operator==: (this, that) -> bool;",
                "    f: (this, in a: int, out b: int) = { }",
                "    count: const int = 3;",
                "    name := \"t\";",
                "    Nested: type = { }",
                "    Alias: type == std::vector<int>;",
                "    limit: int == 10;",
                "}"));
        assertFalse(result.hasErrors(), () -> "unexpected errors: " + result.errors());
        errors = new ArrayList<>();
        services = new CompilerServices(errors, result.tokens().getGenerated(), text -> { });
    }

    private TypeView typeT() {
        return new TypeView(result.unit().find("T"), services);
    }

    @Test
    @DisplayName("Member lists are split by kind")
    void testMemberLists() {
        TypeView t = typeT();

        assertEquals(12, t.getMembers().size());
        assertEquals(7, t.getMemberFunctions().size());
        assertEquals(2, t.getMemberObjects().size());
        assertEquals(1, t.getMemberTypes().size());
        assertEquals(2, t.getMemberAliases().size());
    }

    @Test
    @DisplayName("Special member functions are recognized by shape")
    void testFunctionShapes() {
        List<FunctionView> fs = typeT().getMemberFunctions();

        assertTrue(fs.get(0).isDefaultConstructor());
        assertTrue(fs.get(1).isConstructorWithInThat());
        assertTrue(fs.get(1).isCopyOrMove());
        assertTrue(fs.get(2).isAssignmentWithMoveThat());
        assertTrue(fs.get(2).isMove());
        assertTrue(fs.get(3).isDestructor());
        assertFalse(fs.get(3).isCopyOrMove());
        assertTrue(fs.get(4).isSwap());
        assertTrue(fs.get(5).isDefaultable());
        assertTrue(fs.get(5).isBinaryComparisonFunction());
        assertTrue(fs.get(5).hasBoolReturnType());
        assertFalse(fs.get(6).hasDeclaredReturnType());
    }

    @Test
    @DisplayName("Parameters are found by name and passing style")
    void testParameters() {
        FunctionView f = typeT().getMemberFunctions().get(6);

        assertTrue(f.isFunctionWithThis());
        assertEquals(3, f.parameterCount());
        assertEquals(2, f.indexOfParameterNamed("b"));
        assertEquals(-1, f.indexOfParameterNamed("c"));
        assertTrue(f.hasInParameterNamed("a"));
        assertTrue(f.hasOutParameterNamed("b"));
        assertFalse(f.hasMoveParameterNamed("a"));
    }

    @Test
    @DisplayName("Declared copy and move functions are summarized")
    void testValueSetFunctions() {
        TypeView.ValueSetFunctions smfs = typeT().queryDeclaredValueSetFunctions();

        assertTrue(smfs.outThisInThat());
        assertFalse(smfs.outThisMoveThat());
        assertFalse(smfs.inoutThisInThat());
        assertTrue(smfs.inoutThisMoveThat());
        assertTrue(smfs.any());
        assertFalse(smfs.all());
    }

    @Test
    @DisplayName("Only bodiless, non-virtual, non-defaultable functions need an initializer")
    void testFunctionsNeedingInitializer() {
        TypeView t = typeT();
        t.addMember("g: (this) -> int;");

        List<FunctionView> needing = t.getMemberFunctionsNeedingInitializer();
        assertEquals(1, needing.size());
        assertEquals("g", needing.get(0).name());
    }

    @Test
    @DisplayName("Object views expose type and initializer text")
    void testObjectView() {
        List<ObjectView> objects = typeT().getMemberObjects();

        assertEquals("const int", objects.get(0).type());
        assertTrue(objects.get(0).isConst());
        assertEquals("3", objects.get(0).initializer());
        assertTrue(objects.get(1).hasWildcardType());
        assertEquals("_", objects.get(1).type());
        assertEquals("\"t\"", objects.get(1).initializer());
    }

    @Test
    @DisplayName("Alias views expose what they stand for")
    void testAliasView() {
        List<AliasView> aliases = typeT().getMemberAliases();

        assertTrue(aliases.get(0).isTypeAlias());
        assertEquals("std::vector<int>", aliases.get(0).aliasedText());
        assertTrue(aliases.get(1).isObjectAlias());
        assertEquals("10", aliases.get(1).aliasedText());
    }

    @Test
    @DisplayName("Casting to the wrong view kind fails")
    void testWrongCast() {
        DeclarationView count = typeT().getMembers().get(7);

        assertThrows(IllegalStateException.class, count::asFunction);
        assertThrows(IllegalStateException.class, count::asType);
        assertNotNull(count.asObject());
        assertTrue(count.parentIsType());
        assertEquals("T", count.parent().name());
        assertThrows(IllegalStateException.class, () -> typeT().parent());
    }

    @Test
    @DisplayName("Views cannot be made over null or mismatched declarations")
    void testViewConstruction() {
        Declaration f = result.unit().find("T").scopeDeclarations().get(6);

        assertThrows(IllegalArgumentException.class, () -> new DeclarationView(null, services));
        assertThrows(IllegalArgumentException.class, () -> new TypeView(f, services));
        assertThrows(IllegalArgumentException.class, () -> new ObjectView(f, services));
    }

    @Test
    @DisplayName("Member lists reflect members added and removed")
    void testLiveMembers() {
        TypeView t = typeT();
        t.addMember("extra: int = 0;");
        assertEquals(13, t.getMembers().size());

        t.getMemberObjects().forEach(DeclarationView::markForRemovalFromEnclosingType);
        t.removeMarkedMembers();
        assertEquals(0, t.getMemberObjects().size());
        assertEquals(10, t.getMembers().size());

        t.removeAllMembers();
        assertTrue(t.getMembers().isEmpty());
        assertTrue(errors.isEmpty(), () -> "unexpected errors: " + errors);
    }

    @Test
    @DisplayName("Reserved names are reported against the using member")
    void testReserveNames() {
        TypeView t = typeT();
        t.setMetafunctionName("demo", List.of());

        t.reserveNames("swap", "unused");

        assertEquals(1, errors.size());
        assertEquals("while applying @demo - in a 'demo' type, the name 'swap' is reserved for use by the 'demo' "
                + "implementation", errors.get(0).msg());
        assertEquals(result.unit().find("T").scopeDeclarations().get(4).position(), errors.get(0).where());
    }

    @Test
    @DisplayName("Virtual defaults only apply when nothing was written")
    void testMakeVirtual() {
        FunctionView f = typeT().getMemberFunctions().get(6);
        assertFalse(f.isVirtual());

        assertTrue(f.makeVirtual());
        assertTrue(f.isVirtual());
        assertTrue(typeT().isPolymorphic());
    }

    @Test
    @DisplayName("Access defaults do not override written access")
    void testAccess() {
        TypeView t = typeT();
        t.addMember("private hidden: int = 0;");
        DeclarationView hidden = t.getMembers().get(12);

        assertFalse(hidden.makePublic());
        assertTrue(hidden.isPrivate());
        DeclarationView swap = t.getMembers().get(4);
        assertTrue(swap.isDefaultAccess());
        assertTrue(swap.makeProtected());
        assertTrue(swap.isProtected());
    }

    @Test
    @DisplayName("Types can be made final and have generation turned off")
    void testTypeFlags() {
        TypeView t = typeT();
        assertFalse(t.isFinal());
        assertTrue(t.makeFinal());
        assertTrue(t.isFinal());

        assertFalse(t.memberFunctionGenerationDisabled());
        t.disableMemberFunctionGeneration();
        assertTrue(t.memberFunctionGenerationDisabled());
    }

    @Test
    @DisplayName("Arguments count as used only once read")
    void testArgumentsUsed() {
        TypeView t = typeT();
        t.setMetafunctionName("demo", List.of("x"));
        assertFalse(t.argumentsWereUsed());

        assertEquals("x", t.argument(0));
        assertTrue(t.argumentsWereUsed());
        assertEquals(List.of("x"), t.arguments());
    }
}
