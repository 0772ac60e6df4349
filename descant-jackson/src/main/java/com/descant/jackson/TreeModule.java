package com.descant.jackson;

import com.descant.ErrorEntry;
import com.descant.SourcePosition;
import com.descant.Token;
import com.descant.Lexeme;
import com.descant.ast.CaptureGroup;
import com.descant.ast.Declaration;
import com.descant.ast.Node;
import com.descant.ast.PostfixExpression;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.module.SimpleModule;

import java.io.IOException;

/**
 * Jackson module for the program tree and its value records.
 *
 * This module handles:
 * - A "node" discriminator on every tree node
 * - Ignoring the parent and statement back-links of declarations
 * - Capture groups, written as the list of their capture symbols
 * - Creator mixins so diagnostics, tokens and positions can be read back
 */
public class TreeModule extends SimpleModule {

    public TreeModule() {
        super("TreeModule", new Version(1, 0, 0, null, "com.descant", "descant-jackson"));
        addSerializer(CaptureGroup.class, new CaptureGroupSerializer());
    }

    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        context.setMixInAnnotations(Node.class, NodeMixin.class);
        context.setMixInAnnotations(Declaration.class, DeclarationMixin.class);

        context.setMixInAnnotations(SourcePosition.class, SourcePositionMixin.class);
        context.setMixInAnnotations(Token.class, TokenMixin.class);
        context.setMixInAnnotations(ErrorEntry.class, ErrorEntryMixin.class);
    }

    // ==================== Tree mixins ====================

    @JsonTypeInfo(use = JsonTypeInfo.Id.SIMPLE_NAME, include = JsonTypeInfo.As.PROPERTY, property = "node")
    private interface NodeMixin {
    }

    // parent and statement point back up the tree
    @JsonIgnoreProperties({"parent", "statement"})
    private abstract static class DeclarationMixin {
    }

    // ==================== Value record mixins ====================

    private abstract static class SourcePositionMixin {
        @JsonCreator
        SourcePositionMixin(@JsonProperty("lineno") int lineno, @JsonProperty("colno") int colno) {
        }
    }

    private abstract static class TokenMixin {
        @JsonCreator
        TokenMixin(@JsonProperty("text") String text,
                   @JsonProperty("position") SourcePosition position,
                   @JsonProperty("type") Lexeme type) {
        }
    }

    private abstract static class ErrorEntryMixin {
        @JsonCreator
        ErrorEntryMixin(@JsonProperty("where") SourcePosition where,
                        @JsonProperty("msg") String msg,
                        @JsonProperty("internal") boolean internal,
                        @JsonProperty("fallback") boolean fallback) {
        }
    }

    // ==================== Serializers ====================

    private static class CaptureGroupSerializer extends JsonSerializer<CaptureGroup> {
        @Override
        public void serialize(CaptureGroup value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
            gen.writeStartArray();
            for (PostfixExpression capture : value.members()) {
                gen.writeString(capture.captureSymbol());
            }
            gen.writeEndArray();
        }
    }
}
