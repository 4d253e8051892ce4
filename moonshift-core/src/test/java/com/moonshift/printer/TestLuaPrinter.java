package com.moonshift.printer;

import com.moonshift.Parser;
import com.moonshift.Scripts;
import com.moonshift.TestObjectMapper;
import com.moonshift.ast.*;
import com.moonshift.pass.ExpressionSimplifier;
import com.moonshift.pass.PassContext;
import com.moonshift.pipeline.TransformOptions;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class TestLuaPrinter {

    private static String readable(String source) {
        return LuaPrinter.print(Parser.parse(source), Layout.READABLE);
    }

    private static String compact(String source) {
        return LuaPrinter.print(Parser.parse(source), Layout.COMPACT);
    }

    // Parentheses are dropped first so the printer has to put back the ones that matter
    private static String unparenthesized(String expression) {
        Chunk chunk = new ExpressionSimplifier().apply(Parser.parse("x = " + expression),
            new PassContext(TransformOptions.defaults()));
        String printed = LuaPrinter.print(chunk, Layout.READABLE);
        return printed.substring("x = ".length(), printed.length() - 1);
    }

    @Test
    void testPrecedence() {
        assertEquals("(a + b) * c", unparenthesized("(a + b) * c"));
        assertEquals("a + b * c", unparenthesized("a + (b * c)"));
        assertEquals("a - b - c", unparenthesized("(a - b) - c"));
        assertEquals("a - (b - c)", unparenthesized("a - (b - c)"));
        assertEquals("(a ^ b) ^ c", unparenthesized("(a ^ b) ^ c"));
        assertEquals("a ^ b ^ c", unparenthesized("a ^ (b ^ c)"));
        assertEquals("(a .. b) .. c", unparenthesized("(a .. b) .. c"));
        assertEquals("-x ^ 2", unparenthesized("-(x ^ 2)"));
        assertEquals("(-x) ^ 2", unparenthesized("(-x) ^ 2"));
        assertEquals("not (a and b)", unparenthesized("not (a and b)"));
        assertEquals("2 ^ -1", unparenthesized("2 ^ -1"));
        assertEquals("#t + 1", unparenthesized("(#t) + 1"));
    }

    @Test
    void testPrefixExpressionsKeepParentheses() {
        assertEquals("(\"abc\"):rep(2)", unparenthesized("(\"abc\"):rep(2)"));
        assertEquals("(f or g)(1)", unparenthesized("(f or g)(1)"));
        assertEquals("({1, 2})[1]", unparenthesized("({1, 2})[1]"));
        // Parentheses truncate a call to one value
        assertEquals("(f())", unparenthesized("(f())"));
    }

    @Test
    void testSynthesizedNegativeNumbers() {
        LuaPrinter printer = new LuaPrinter(Layout.READABLE);
        assertEquals("2 - -1", printer.printExpression(
            new BinaryExpression(SourceLocation.SYNTHETIC, BinaryOperator.SUB, Literal.of(2), Literal.of(-1))));
        assertEquals("(-1) ^ 2", printer.printExpression(
            new BinaryExpression(SourceLocation.SYNTHETIC, BinaryOperator.POW, Literal.of(-1), Literal.of(2))));
        assertEquals("0.5", printer.printExpression(Literal.of(0.5)));
        assertEquals("\"a\\nb\"", printer.printExpression(Literal.ofBytes("a\nb")));
    }

    @Test
    void testReadableLayout() {
        assertEquals("local t = {1, 2, x = 3, [\"y z\"] = 4}\n", readable("local t={1,2;x=3,[\"y z\"]=4}"));
        assertEquals("local f = function() end\n", readable("local f = function() end"));
        assertEquals("if a then\n    b()\nelseif c then\n    d()\nelse\n    e()\nend\n",
            readable("if a then b() elseif c then d() else e() end"));
        assertEquals("local x = 1\n\nlocal function f()\n    return x\nend\n\nprint(f())\n",
            readable("local x = 1 local function f() return x end print(f())"));
    }

    @Test
    void testLongTablesBreak() {
        String source = "local t = {\"aaaaaaaaaa\", \"bbbbbbbbbb\", \"cccccccccc\", \"dddddddddd\", \"eeeeeeeeee\", \"ffffffffff\"}";
        assertEquals("local t = {\n    \"aaaaaaaaaa\",\n    \"bbbbbbbbbb\",\n    \"cccccccccc\",\n    \"dddddddddd\",\n"
            + "    \"eeeeeeeeee\",\n    \"ffffffffff\",\n}\n", readable(source));
    }

    @Test
    void testCustomIndent() {
        Chunk chunk = Parser.parse("while x do y() end");
        assertEquals("while x do\n\ty()\nend\n", new LuaPrinter(Layout.READABLE, "\t").print(chunk));
    }

    @Test
    void testCommentsOnlyInReadableLayout() {
        String source = "-- one\nlocal x = 1 --[[ two ]]\n";
        assertEquals("-- one\nlocal x = 1\n--[[ two ]]\n", readable(source));
        assertEquals("local x=1", compact(source));
    }

    @Test
    void testCompactSpacing() {
        assertEquals("local x=1+2 print(x)", compact("local x = 1 + 2\nprint(x)"));
        assertEquals("a=b- -c", compact("a = b - -c"));
        assertEquals("if not a then return end", compact("if not a then return end"));
        assertEquals("local function f(a,...)return a end", compact("local function f(a, ...) return a end"));
        assertEquals("t[ [[x]]]=1", compact("t[ [[x]] ] = 1"));
    }

    @Test
    void testCompactRespellsLineSpanningStrings() {
        assertEquals("x=\"abc\"", compact("x = \"\\z\n   abc\""));
        assertEquals("x=\"a\\nb\"", compact("x = \"a\\\nb\""));
        assertEquals("x='\\65'", compact("x = '\\65'"));
        assertEquals("x = \"\\z\n   abc\"\n", readable("x = \"\\z\n   abc\""));
    }

    @Test
    void testStatementStartingWithParenthesis() {
        assertEquals("local a=b;(f or g)()", compact("local a = b;(f or g)()"));
        assertEquals("local a = b;\n(f or g)()\n", readable("local a = b;(f or g)()"));
    }

    @Test
    void testNumberBeforeConcat() {
        String output = compact("print(1 .. 2)");
        assertEquals("print(1 ..2)", output);
        assertEquals(TestObjectMapper.structure(Parser.parse("print(1 .. 2)")), TestObjectMapper.structure(Parser.parse(output)));
    }

    @Test
    void testPrintingIsStable() {
        for (String name : Scripts.ALL) {
            String source = Scripts.load(name);
            Chunk original = Parser.parse(source);
            for (Layout layout : Layout.values()) {
                String once = LuaPrinter.print(original, layout);
                Chunk reparsed = Parser.parse(once);
                assertEquals(TestObjectMapper.structure(original), TestObjectMapper.structure(reparsed), name + " " + layout);
                assertEquals(once, LuaPrinter.print(reparsed, layout), name + " " + layout);
            }
        }
    }
}
