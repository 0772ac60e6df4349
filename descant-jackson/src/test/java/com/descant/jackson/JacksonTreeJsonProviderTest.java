package com.descant.jackson;

import com.descant.ErrorEntry;
import com.descant.Frontend;
import com.descant.FrontendResult;
import com.descant.SourcePosition;
import com.descant.Token;
import com.descant.Lexeme;
import com.descant.json.TreeJsonException;
import com.descant.json.TreeJsonProvider;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * JSON output of program trees and round trips of the value records.
 */
public class JacksonTreeJsonProviderTest {

    private final JacksonTreeJsonProvider provider = new JacksonTreeJsonProvider();

    @Test
    @DisplayName("Provider is discovered through the ServiceLoader")
    void testDiscovery() {
        assertEquals(1, TreeJsonProvider.providers(getClass().getClassLoader()).size());
        assertTrue(TreeJsonProvider.find("JACKSON").isPresent());
        assertTrue(TreeJsonProvider.find("gson").isEmpty());
        assertEquals("Jackson", TreeJsonProvider.getProvider().getName());
        assertEquals("Jackson", TreeJsonProvider.getProvider("jackson").getName());
        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> TreeJsonProvider.getProvider("gson"));
        assertTrue(e.getMessage().contains("[Jackson]"), e.getMessage());
    }

    @Test
    @DisplayName("A whole run serializes as unit, errors and comments")
    void testSerializeResult() throws Exception {
        FrontendResult result = new Frontend().process(String.join("\n",
                "// the answer",
                "x: int = 42;",
                "y: int = ;"));
        assertEquals(1, result.errors().size());

        JsonNode root = new ObjectMapper().readTree(provider.getSerializer().serializeResult(result));

        assertEquals("TranslationUnit", root.get("unit").get("node").asText());
        assertEquals("x", root.get("unit").get("declarations").get(0).get("identifier").get("text").asText());
        assertEquals(1, root.get("errors").size());
        assertEquals(3, root.get("errors").get(0).get("where").get("lineno").asInt());
        assertEquals(1, root.get("comments").size());
        assertTrue(root.get("comments").get(0).get("text").asText().contains("the answer"));
    }

    @Test
    @DisplayName("Tree nodes carry their kind and declarations omit back-links")
    void testSerializeTree() throws Exception {
        FrontendResult result = new Frontend().process("x: int = 1 + 2 * 3;");
        assertFalse(result.hasErrors());

        String json = provider.getSerializer().serialize(result.unit());
        JsonNode tree = new ObjectMapper().readTree(json);

        assertEquals("TranslationUnit", tree.get("node").asText());
        JsonNode x = tree.get("declarations").get(0);
        assertEquals("Declaration", x.get("node").asText());
        assertEquals("x", x.get("identifier").get("text").asText());
        assertFalse(x.has("parent"));
        assertFalse(x.has("statement"));
        assertEquals("ObjectType", x.get("body").get("node").asText());
        JsonNode init = x.get("initializer").get("expression");
        assertEquals("BinaryExpression", init.get("node").asText());
        assertEquals("ADDITIVE", init.get("level").asText());
    }

    @Test
    @DisplayName("Nested declarations serialize without cycles")
    void testSerializeNested() {
        FrontendResult result = new Frontend().process(String.join("\n",
                "Point: @value type = {",
                "    x: i32 = 0;",
                "    f: (this) = {",
                "        g := :() = x$ + 1;",
                "    }",
                "}"));
        assertFalse(result.hasErrors(), () -> "unexpected errors: " + result.errors());

        String json = provider.getSerializer().serializePretty(result.unit());

        assertTrue(json.contains("\"operator<=>\""));
        assertTrue(json.contains("\"_001_x\""), "capture symbols are listed");
    }

    @Test
    @DisplayName("Diagnostics survive a round trip")
    void testErrorRoundTrip() {
        FrontendResult result = new Frontend().process("a: int = ;\nc: int = 1 # 2;");
        assertEquals(3, result.errors().size());

        String json = provider.getSerializer().serialize(result.errors());
        List<ErrorEntry> back = provider.getDeserializer().deserializeErrors(json);

        assertEquals(result.errors(), back);
    }

    @Test
    @DisplayName("Tokens and positions read back as values")
    void testValueRecords() {
        Token token = new Token("x", new SourcePosition(3, 7), Lexeme.IDENTIFIER);

        String json = provider.getSerializer().serialize(token);
        Token back = provider.getDeserializer().deserialize(json, Token.class);

        assertEquals(token, back);
        assertEquals(new SourcePosition(1, 2),
                provider.getDeserializer().deserialize("{\"lineno\":1,\"colno\":2}", SourcePosition.class));
    }

    @Test
    @DisplayName("Malformed input is wrapped in TreeJsonException")
    void testMalformed() {
        TreeJsonException e = assertThrows(TreeJsonException.class,
                () -> provider.getDeserializer().deserializeErrors("{not json"));
        assertNotNull(e.getCause());
    }
}
