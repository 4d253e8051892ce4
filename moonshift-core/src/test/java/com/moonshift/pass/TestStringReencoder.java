package com.moonshift.pass;

import com.moonshift.MiniLua;
import com.moonshift.Parser;
import com.moonshift.ast.Chunk;
import com.moonshift.pipeline.TransformOptions;
import com.moonshift.printer.Layout;
import com.moonshift.printer.LuaPrinter;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class TestStringReencoder {

    private static final String SCRIPT = String.join("\n",
        "local greeting = \"hello\"",
        "local t = {name = \"world\", [\"key\"] = \"value\"}",
        "print(greeting, t.name, t.key, \"\")",
        "print(greeting .. \", \" .. t.name .. \"!\")");

    private static String reencode(String source, long seed) {
        PassContext context = new PassContext(TransformOptions.builder().seed(seed).build());
        Chunk chunk = new StringReencoder().apply(Parser.parse(source), context);
        return LuaPrinter.print(chunk, Layout.READABLE);
    }

    @Test
    void testLiteralsAreHidden() {
        for (long seed = 1; seed <= 20; seed++) {
            String output = reencode(SCRIPT, seed);
            assertFalse(output.contains("hello"), output);
            assertFalse(output.contains("\"world\""), output);
        }
    }

    @Test
    void testBehaviourIsPreserved() {
        String expected = MiniLua.run(SCRIPT);
        assertEquals("hello\tworld\tvalue\t\nhello, world!\n", expected);
        for (long seed = 1; seed <= 20; seed++) {
            String output = reencode(SCRIPT, seed);
            assertEquals(expected, MiniLua.run(output), output);
        }
    }

    @Test
    void testSameSeedSameOutput() {
        assertEquals(reencode(SCRIPT, 99L), reencode(SCRIPT, 99L));
    }

    @Test
    void testDottedKeysAreNotLiterals() {
        String output = reencode("print(t.name)", 3L);
        assertTrue(output.contains("t.name"), output);
    }

    @Test
    void testShadowedStringLibraryOnlyEscapes() {
        for (long seed = 1; seed <= 10; seed++) {
            assertEquals("local string = 1\nprint(\"\\104\\105\")\n", reencode("local string = 1\nprint(\"hi\")", seed));
        }
    }
}
