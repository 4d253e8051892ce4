package com.moonshift.jackson;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.moonshift.Parser;
import com.moonshift.ast.Chunk;
import com.moonshift.json.AstJsonProvider;
import com.moonshift.json.AstJsonSerializer;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class JacksonAstJsonProviderTest {

    private final ObjectMapper mapper = new JacksonAstJsonProvider().getObjectMapper();

    private static AstJsonSerializer serializer() {
        return AstJsonProvider.getProvider().getSerializer();
    }

    @Test
    void testProviderIsDiscovered() {
        assertTrue(AstJsonProvider.isProviderAvailable());
        assertInstanceOf(JacksonAstJsonProvider.class, AstJsonProvider.getProvider());
        assertEquals("Jackson", AstJsonProvider.getProvider("jackson").getName());
        assertTrue(AstJsonProvider.findProvider("gson").isEmpty());
        assertThrows(IllegalStateException.class, () -> AstJsonProvider.getProvider("gson"));
    }

    @Test
    void testSerializeTree() throws Exception {
        Chunk chunk = Parser.parse("local x = 1 + 2 -- note\nprint(x)");
        JsonNode json = mapper.readTree(serializer().serialize(chunk));
        assertEquals("Chunk", json.get("type").asText());
        assertTrue(json.has("loc"));
        assertFalse(json.has("symbols"));

        JsonNode statements = json.get("body").get("statements");
        assertEquals(3, statements.size());
        assertEquals("CommentStatement", statements.get(1).get("type").asText());

        JsonNode local = statements.get(0);
        assertEquals("LocalDeclaration", local.get("type").asText());
        JsonNode sum = local.get("values").get(0);
        assertEquals("+", sum.get("operator").asText());
        assertEquals(1, sum.get("left").get("value").asLong());
        assertTrue(sum.get("left").get("value").isIntegralNumber());

        // Declaration and use share one symbol id
        JsonNode declared = local.get("names").get(0).get("symbol");
        JsonNode used = statements.get(2).get("expression").get("arguments").get(0).get("symbol");
        assertTrue(declared.isNumber());
        assertEquals(declared, used);
    }

    @Test
    void testLiteralValues() throws Exception {
        Chunk chunk = Parser.parse("local a, b, c, d = nil, true, 0.5, \"caf\\u{E9}\"");
        JsonNode values = mapper.readTree(serializer().serialize(chunk))
            .get("body").get("statements").get(0).get("values");
        assertTrue(values.get(0).has("value"));
        assertTrue(values.get(0).get("value").isNull());
        assertTrue(values.get(1).get("value").asBoolean());
        assertEquals(0.5, values.get(2).get("value").asDouble());
        assertEquals("café", values.get(3).get("value").asText());
        assertEquals("\"caf\\u{E9}\"", values.get(3).get("raw").asText());
    }

    @Test
    void testSerializeStructureIgnoresFormatting() {
        String spaced = serializer().serializeStructure(Parser.parse("-- header\nlocal x = 0x10 + 2 -- note\nprint(x)"));
        String compact = serializer().serializeStructure(Parser.parse("local x=16+2 print(x)"));
        assertEquals(spaced, compact);
        assertFalse(spaced.contains("\"loc\""));
        assertFalse(spaced.contains("\"raw\""));
        assertFalse(spaced.contains("\"symbol\""));
        assertNotEquals(compact, serializer().serializeStructure(Parser.parse("local x=16+3 print(x)")));
    }

    @Test
    void testPrettyPrinting() {
        assertFalse(AstJsonProvider.getProvider().toJson(Parser.parse("x = 1")).contains("\n"));
        String pretty = serializer().serializePretty(Parser.parse("x = 1"));
        assertTrue(pretty.contains("\n"));
        assertTrue(pretty.contains("\"type\" : \"Assignment\""));
    }
}
