package com.descant;

import com.descant.ast.Declaration;
import com.descant.ast.TranslationUnit;
import com.descant.json.TreeJsonProvider;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs a whole program through the front end and the JSON provider.
 */
public class EndToEndTest {

    private static String resource(String name) throws IOException {
        try (InputStream in = EndToEndTest.class.getResourceAsStream(name)) {
            assertNotNull(in, "missing test resource " + name);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    private static List<String> names(List<Declaration> declarations) {
        return declarations.stream().map(Declaration::name).collect(Collectors.toList());
    }

    @Test
    @DisplayName("A program using every kind of builtin metafunction processes cleanly")
    void testShapesProgram() throws Exception {
        FrontendResult result = new Frontend().process(resource("/programs/shapes.cpp2"));

        assertFalse(result.hasErrors(), () -> "unexpected errors: " + result.errors());
        TranslationUnit unit = result.unit();
        assertEquals(List.of("geometry", "describe", "main"), names(unit.declarations()));

        Declaration geometry = unit.find("geometry");
        assertEquals(List.of("Shape", "Color", "Point", "Value"), names(geometry.scopeDeclarations()));
        assertEquals(3, geometry.scopeDeclarations().get(0).scopeDeclarations().size());
        assertEquals(10, geometry.scopeDeclarations().get(1).scopeDeclarations().size());
        assertEquals(5, geometry.scopeDeclarations().get(2).scopeDeclarations().size());
        assertEquals(17, geometry.scopeDeclarations().get(3).scopeDeclarations().size());
    }

    @Test
    @DisplayName("Comments are kept apart and raw strings span lines")
    void testCommentsAndRawStrings() throws Exception {
        FrontendResult result = new Frontend().process(resource("/programs/shapes.cpp2"));

        assertEquals(1, result.tokens().getComments().size());
        assertTrue(result.tokens().allTokens().stream()
                .anyMatch(t -> t.is(Lexeme.STRING_LITERAL) && t.text().equals("R\"(a raw\nstring)\"")));
    }

    @Test
    @DisplayName("The processed tree serializes to JSON")
    void testJson() throws Exception {
        FrontendResult result = new Frontend().process(resource("/programs/shapes.cpp2"));
        TreeJsonProvider provider = TreeJsonProvider.getProvider();

        String json = provider.getSerializer().serialize(result.unit());

        assertTrue(json.startsWith("{\"node\":\"TranslationUnit\""), json.substring(0, Math.min(80, json.length())));
        assertTrue(json.contains("\"get_raw_value\""));
        assertTrue(json.contains("\"is_number\""));
    }

    @Test
    @DisplayName("Errors of a broken program read back from JSON in source order")
    void testErrorsThroughJson() {
        FrontendResult result = new Frontend().process(String.join("\n",
                "T: @enum type = {",
                "}",
                "a: int = ;",
                "b: int = 1 # 2;"));
        TreeJsonProvider provider = TreeJsonProvider.getProvider();

        List<ErrorEntry> back = provider.getDeserializer()
                .deserializeErrors(provider.getSerializer().serialize(result.errors()));

        assertEquals(result.errors(), back);
        assertEquals(4, back.size());
        for (int i = 1; i < back.size(); i++) {
            assertTrue(back.get(i - 1).where().compareTo(back.get(i).where()) <= 0);
        }
    }
}
