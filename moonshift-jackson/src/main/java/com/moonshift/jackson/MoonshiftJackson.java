package com.moonshift.jackson;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * Factory for creating properly configured ObjectMapper instances for AST serialization.
 *
 * Usage:
 * <pre>
 * ObjectMapper mapper = MoonshiftJackson.createObjectMapper();
 * String json = mapper.writeValueAsString(Parser.parse(source));
 * </pre>
 */
public final class MoonshiftJackson {

    private MoonshiftJackson() {
        // Utility class
    }

    /**
     * Creates a new ObjectMapper configured for AST serialization.
     *
     * The returned mapper:
     * - Writes a "type" property on every node
     * - Omits absent parts (an if without else, a for without step)
     * - Writes symbols as ids and Lua values as plain JSON values
     *
     * @return A new configured ObjectMapper instance
     */
    public static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();

        // Absent optional parts are left out rather than written as null
        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        mapper.disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);

        mapper.registerModule(new AstModule());

        return mapper;
    }
}
