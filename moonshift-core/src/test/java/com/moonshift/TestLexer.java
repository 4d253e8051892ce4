package com.moonshift;

import com.moonshift.value.LuaValue;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TestLexer {

    private static List<TokenType> types(String source) {
        List<TokenType> types = new ArrayList<>();
        for (Token token : Lexer.tokenize(source)) {
            types.add(token.type());
        }
        return types;
    }

    private static Token first(String source) {
        return Lexer.tokenize(source).get(0);
    }

    @Test
    void testKeywordsAndNames() {
        assertEquals(List.of(TokenType.LOCAL, TokenType.IDENTIFIER, TokenType.ASSIGN, TokenType.NIL, TokenType.EOF),
            types("local continue = nil"));
        assertEquals("continue", Lexer.tokenize("local continue").get(1).lexeme());
    }

    @Test
    void testOperators() {
        assertEquals(List.of(TokenType.CONCAT, TokenType.ELLIPSIS, TokenType.CONCAT_ASSIGN, TokenType.DOUBLE_SLASH,
                TokenType.DOUBLE_SLASH_ASSIGN, TokenType.NE, TokenType.DOUBLE_COLON, TokenType.EOF),
            types(".. ... ..= // //= ~= ::"));
    }

    @Test
    void testNumbers() {
        assertEquals(LuaValue.of(255), first("0xff").value());
        assertEquals(LuaValue.of(0.5), first(".5").value());
        assertEquals(LuaValue.of(1000), first("1e3").value());
        assertEquals(LuaValue.of(5), first("0b101").value());
        assertEquals(LuaValue.of(1000000), first("1_000_000").value());
        assertEquals("0xff", first("0xff").lexeme());
    }

    @Test
    void testStringEscapes() {
        assertEquals(LuaValue.ofBytes("Hi"), first("\"\\72\\105\"").value());
        assertEquals(LuaValue.ofBytes("A\n"), first("'\\x41\\n'").value());
        assertEquals(LuaValue.ofBytes("ab"), first("\"a\\z   \n  b\"").value());
        // U+00E9 is two bytes in UTF-8
        assertEquals(LuaValue.ofBytes("\u00c3\u00a9"), first("\"\\u{E9}\"").value());
    }

    @Test
    void testLongStrings() {
        Token token = first("[==[\nline ]] still]==]");
        assertEquals(TokenType.STRING, token.type());
        assertEquals(LuaValue.ofBytes("line ]] still"), token.value());
    }

    @Test
    void testCommentsAreTokens() {
        List<Token> tokens = Lexer.tokenize("x = 1 -- trailing\n--[[ block\ncomment ]] y = 2");
        assertEquals(TokenType.COMMENT, tokens.get(3).type());
        assertEquals("-- trailing", tokens.get(3).lexeme());
        assertEquals(TokenType.COMMENT, tokens.get(4).type());
        assertEquals("--[[ block\ncomment ]]", tokens.get(4).lexeme());
        assertEquals(3, tokens.get(5).line());
    }

    @Test
    void testPositions() {
        List<Token> tokens = Lexer.tokenize("a\r\n  b");
        assertEquals(1, tokens.get(0).line());
        assertEquals(2, tokens.get(1).line());
        assertEquals(3, tokens.get(1).column());
    }

    @Test
    void testShebangSkipped() {
        assertEquals(List.of(TokenType.IDENTIFIER, TokenType.EOF), types("#!/usr/bin/lua\nx"));
    }

    @Test
    void testUnfinishedString() {
        LexException e = assertThrows(LexException.class, () -> Lexer.tokenize("local s = \"abc"));
        assertEquals("unfinished string", e.getReason());
        assertEquals(1, e.getLine());
        assertEquals(11, e.getColumn());
    }

    @Test
    void testMalformedInput() {
        assertThrows(LexException.class, () -> Lexer.tokenize("x = 3x"));
        assertThrows(LexException.class, () -> Lexer.tokenize("x = '\\q'"));
        assertThrows(LexException.class, () -> Lexer.tokenize("x = '\\300'"));
        assertThrows(LexException.class, () -> Lexer.tokenize("--[[ never closed"));
        LexException e = assertThrows(LexException.class, () -> Lexer.tokenize("x = @"));
        assertEquals("unexpected symbol near '@'", e.getReason());
    }
}
