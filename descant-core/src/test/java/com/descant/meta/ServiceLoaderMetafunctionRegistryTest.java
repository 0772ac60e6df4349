package com.descant.meta;

import com.descant.Frontend;
import com.descant.FrontendOptions;
import com.descant.FrontendResult;
import com.descant.ast.Declaration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class ServiceLoaderMetafunctionRegistryTest {

    @Test
    @DisplayName("Only prefixed symbols are exported, without their prefix")
    void testDiscovery() {
        ServiceLoaderMetafunctionRegistry registry = new ServiceLoaderMetafunctionRegistry();

        assertEquals(Set.of("add_id", "mark_final"), registry.names());
        assertTrue(registry.lookup("mark_final").isPresent());
        assertTrue(registry.lookup("helper").isEmpty());
        assertTrue(registry.lookup("short_prefix").isEmpty());
        assertEquals("cpp2_metafunction_", ServiceLoaderMetafunctionRegistry.SYMBOL_PREFIX);
    }

    @Test
    @DisplayName("Discovered metafunctions run alongside the builtins")
    void testCompositeWithBuiltins() {
        MetafunctionRegistry registry = CompositeMetafunctionRegistry.withBuiltins(new ServiceLoaderMetafunctionRegistry());
        Frontend frontend = new Frontend(FrontendOptions.defaults().withRegistry(registry));

        FrontendResult result = frontend.process("T: @mark_final @add_id @ordered type = { }");

        assertFalse(result.hasErrors(), () -> "unexpected errors: " + result.errors());
        Declaration t = result.unit().find("T");
        assertTrue(t.type().isFinal());
        assertEquals(2, t.scopeDeclarations().size());
        assertTrue(registry.names().containsAll(List.of("value", "mark_final")));
    }

    @Test
    @DisplayName("Builtins win over later registries")
    void testBuiltinsFirst() {
        MetafunctionRegistry registry = CompositeMetafunctionRegistry.withBuiltins(new ServiceLoaderMetafunctionRegistry());

        assertSame(BuiltinMetafunctions.INSTANCE.lookup("value").orElseThrow(), registry.lookup("value").orElseThrow());
    }
}
