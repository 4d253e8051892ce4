package com.moonshift.jackson;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.moonshift.ast.Node;
import com.moonshift.json.AstJsonException;
import com.moonshift.json.AstJsonProvider;
import com.moonshift.json.AstJsonSerializer;

import java.util.Set;

/**
 * Jackson-based implementation of AstJsonProvider.
 */
public class JacksonAstJsonProvider implements AstJsonProvider {

    private final ObjectMapper mapper;
    private final AstJsonSerializer serializer;

    public JacksonAstJsonProvider() {
        this.mapper = MoonshiftJackson.createObjectMapper();
        this.serializer = new JacksonSerializer(mapper);
    }

    @Override
    public AstJsonSerializer getSerializer() {
        return serializer;
    }

    @Override
    public String getName() {
        return "Jackson";
    }

    /**
     * Returns the underlying ObjectMapper for advanced usage.
     */
    public ObjectMapper getObjectMapper() {
        return mapper;
    }

    // ==================== Inner Classes ====================

    private static class JacksonSerializer implements AstJsonSerializer {
        // Formatting-only properties
        private static final Set<String> NON_STRUCTURAL = Set.of("loc", "raw", "symbol");

        private final ObjectMapper mapper;

        JacksonSerializer(ObjectMapper mapper) {
            this.mapper = mapper;
        }

        @Override
        public String serialize(Node node) throws AstJsonException {
            try {
                return mapper.writeValueAsString(node);
            } catch (Exception e) {
                throw new AstJsonException("Failed to serialize AST node", node, e);
            }
        }

        @Override
        public String serializePretty(Node node) throws AstJsonException {
            try {
                return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(node);
            } catch (Exception e) {
                throw new AstJsonException("Failed to serialize AST node", node, e);
            }
        }

        @Override
        public String serializeStructure(Node node) throws AstJsonException {
            try {
                JsonNode tree = mapper.valueToTree(node);
                strip(tree);
                return mapper.writeValueAsString(tree);
            } catch (Exception e) {
                throw new AstJsonException("Failed to serialize AST structure", node, e);
            }
        }

        private static void strip(JsonNode json) {
            if (json instanceof ObjectNode object) {
                object.remove(NON_STRUCTURAL);
                object.elements().forEachRemaining(JacksonSerializer::strip);
            } else if (json instanceof ArrayNode array) {
                for (int i = array.size() - 1; i >= 0; i--) {
                    JsonNode element = array.get(i);
                    if ("CommentStatement".equals(element.path("type").asText())) {
                        array.remove(i);
                    } else {
                        strip(element);
                    }
                }
            }
        }
    }
}
