package com.moonshift.pass;

import com.moonshift.Parser;
import com.moonshift.ast.Chunk;
import com.moonshift.pipeline.TransformOptions;
import com.moonshift.pipeline.Warning;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TestObfuscationLinter {

    private static List<Warning> lint(String source) {
        PassContext context = new PassContext(TransformOptions.defaults());
        Chunk chunk = Parser.parse(source);
        assertSame(chunk, new ObfuscationLinter().apply(chunk, context));
        return context.warnings();
    }

    @Test
    void testStringNamingALocal() {
        List<Warning> warnings = lint("local secret = 1\nprint(\"the secret is here\", \"secretive\")");
        assertEquals(1, warnings.size());
        Warning warning = warnings.get(0);
        assertEquals(Warning.Category.LINT, warning.category());
        assertEquals("obfuscation-linter", warning.source());
        assertEquals("string mentions local 'secret', which will be renamed", warning.message());
        assertEquals(2, warning.line());
    }

    @Test
    void testShortLocalsAreIgnored() {
        assertTrue(lint("local x = 1\nprint(\"x marks the spot\")").isEmpty());
    }

    @Test
    void testComputedLookups() {
        List<Warning> warnings = lint("local name = 'Players'\nlocal a = game:GetService(name)\nlocal b = game:GetService('Players')\n"
            + "local part = Instance.new(kind)");
        assertEquals(2, warnings.size());
        assertEquals("GetService called with a computed name", warnings.get(0).message());
        assertEquals("Instance.new called with a computed name", warnings.get(1).message());
    }

    @Test
    void testEnvironmentAccess() {
        List<Warning> warnings = lint("local env = getfenv(1)");
        assertEquals(1, warnings.size());
        assertTrue(warnings.get(0).message().startsWith("getfenv exposes variables by name"));
        // A local of the same name is not the library function
        assertTrue(lint("local function getfenv() end\ngetfenv()").isEmpty());
    }
}
