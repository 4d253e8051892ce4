package com.moonshift.pass;

import com.moonshift.Parser;
import com.moonshift.ast.Chunk;
import com.moonshift.pipeline.TransformOptions;
import com.moonshift.pipeline.Warning;
import com.moonshift.printer.Layout;
import com.moonshift.printer.LuaPrinter;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class TestStructuralFixer {

    private PassContext context = new PassContext(TransformOptions.defaults());

    private String fix(String source) {
        Chunk chunk = new StructuralFixer().apply(Parser.parse(source), context);
        return LuaPrinter.print(chunk, Layout.READABLE);
    }

    @Test
    void testKeywordLocalsAreRenamed() {
        assertEquals("local continue_ = 1\nprint(continue_)\n", fix("local continue = 1\nprint(continue)"));
        assertEquals(Warning.Category.REPAIR, context.warnings().get(0).category());
        assertEquals("renamed local 'continue' to 'continue_'", context.warnings().get(0).message());
    }

    @Test
    void testRenamedLocalAvoidsTakenName() {
        assertEquals("local type_ = 1\nlocal type__ = 2\nprint(type_, type__)\n",
            fix("local type_ = 1\nlocal type = 2\nprint(type_, type)"));
    }

    @Test
    void testServiceTypos() {
        assertEquals("local players = game:GetService(\"Players\")\n", fix("local players = game:GetService(\"Player\")"));
        assertEquals("service 'Player' corrected to 'Players'", context.warnings().get(0).message());
        String unknown = "local x = game:GetService(\"SomethingElse\")\n";
        assertEquals(unknown, fix(unknown));
        assertEquals(1, context.warnings().size());
    }

    @Test
    void testCorrectService() {
        assertNull(StructuralFixer.correctService("Players"));
        assertEquals("ReplicatedStorage", StructuralFixer.correctService("ReplicatedStorag"));
        assertEquals("TweenService", StructuralFixer.correctService("TweenServce"));
        assertNull(StructuralFixer.correctService("Nonsense"));
        assertEquals(3, StructuralFixer.levenshtein("kitten", "sitting"));
    }

    @Test
    void testEventCalledDirectly() {
        assertEquals("RunService.Heartbeat:Connect(update)\n", fix("RunService.Heartbeat(update)"));
        assertEquals("Heartbeat called directly; connected instead", context.warnings().get(0).message());
    }
}
