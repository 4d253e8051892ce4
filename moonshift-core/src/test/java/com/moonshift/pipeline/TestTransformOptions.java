package com.moonshift.pipeline;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

public class TestTransformOptions {

    private static Properties properties(String key, String value) {
        Properties properties = new Properties();
        properties.setProperty(key, value);
        return properties;
    }

    @Test
    void testDefaults() {
        TransformOptions options = TransformOptions.defaults();
        assertEquals("    ", options.indent());
        assertNull(options.seed());
        assertEquals(3, options.loadstringDepth());
        assertEquals(40, options.maxPropagatedStringLength());
        assertEquals(8, options.obfuscatedNameLength());
        assertTrue(options.unwrapImmediateWrappers());
        assertTrue(options.verifyOutput());
    }

    @Test
    void testFromProperties() {
        Properties properties = new Properties();
        properties.setProperty(TransformOptions.SEED, "42");
        properties.setProperty(TransformOptions.LOADSTRING_DEPTH, " 1 ");
        properties.setProperty(TransformOptions.OBFUSCATED_NAME_LENGTH, "12");
        properties.setProperty(TransformOptions.UNWRAP_IMMEDIATE_WRAPPERS, "FALSE");
        TransformOptions options = TransformOptions.fromProperties(properties);
        assertEquals(42L, options.seed());
        assertEquals(1, options.loadstringDepth());
        assertEquals(12, options.obfuscatedNameLength());
        assertFalse(options.unwrapImmediateWrappers());
        assertEquals(40, options.maxPropagatedStringLength());
    }

    @Test
    void testIndentSpellings() {
        assertEquals("\t", TransformOptions.fromProperties(properties(TransformOptions.INDENT, "tab")).indent());
        assertEquals("  ", TransformOptions.fromProperties(properties(TransformOptions.INDENT, "2")).indent());
        assertEquals("   ", TransformOptions.fromProperties(properties(TransformOptions.INDENT, "   ")).indent());
    }

    @Test
    void testMalformedValuesNameTheKey() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
            () -> TransformOptions.fromProperties(properties(TransformOptions.SEED, "abc")));
        assertTrue(e.getMessage().startsWith(TransformOptions.SEED), e.getMessage());

        e = assertThrows(IllegalArgumentException.class,
            () -> TransformOptions.fromProperties(properties(TransformOptions.VERIFY_OUTPUT, "yes")));
        assertTrue(e.getMessage().startsWith(TransformOptions.VERIFY_OUTPUT));

        e = assertThrows(IllegalArgumentException.class,
            () -> TransformOptions.fromProperties(properties(TransformOptions.LOADSTRING_DEPTH, "-1")));
        assertTrue(e.getMessage().startsWith(TransformOptions.LOADSTRING_DEPTH));

        e = assertThrows(IllegalArgumentException.class,
            () -> TransformOptions.fromProperties(properties(TransformOptions.INDENT, "wide")));
        assertTrue(e.getMessage().startsWith(TransformOptions.INDENT));
    }

    @Test
    void testShortObfuscatedNamesRejected() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
            () -> TransformOptions.builder().obfuscatedNameLength(3).build());
        assertTrue(e.getMessage().contains(TransformOptions.OBFUSCATED_NAME_LENGTH));
    }

    @Test
    void testLoadAndToBuilder() throws IOException {
        String text = "moonshift.seed=7\nmoonshift.verify-output=false\n";
        TransformOptions loaded = TransformOptions.load(new ByteArrayInputStream(text.getBytes(StandardCharsets.ISO_8859_1)));
        assertEquals(7L, loaded.seed());
        assertFalse(loaded.verifyOutput());

        TransformOptions changed = loaded.toBuilder().indent("\t").build();
        assertEquals("\t", changed.indent());
        assertEquals(7L, changed.seed());
        assertFalse(changed.verifyOutput());
        assertEquals("    ", loaded.indent());
    }
}
