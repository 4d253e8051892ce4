package com.moonshift;

import java.util.HashMap;
import java.util.Map;

public enum TokenType {
    // Names and literals
    IDENTIFIER(Kind.IDENTIFIER, null),
    NUMBER(Kind.NUMBER, null),
    STRING(Kind.STRING, null),
    COMMENT(Kind.COMMENT, null),

    // Keywords
    AND(Kind.KEYWORD, "and"),
    BREAK(Kind.KEYWORD, "break"),
    DO(Kind.KEYWORD, "do"),
    ELSE(Kind.KEYWORD, "else"),
    ELSEIF(Kind.KEYWORD, "elseif"),
    END(Kind.KEYWORD, "end"),
    FALSE(Kind.KEYWORD, "false"),
    FOR(Kind.KEYWORD, "for"),
    FUNCTION(Kind.KEYWORD, "function"),
    IF(Kind.KEYWORD, "if"),
    IN(Kind.KEYWORD, "in"),
    LOCAL(Kind.KEYWORD, "local"),
    NIL(Kind.KEYWORD, "nil"),
    NOT(Kind.KEYWORD, "not"),
    OR(Kind.KEYWORD, "or"),
    REPEAT(Kind.KEYWORD, "repeat"),
    RETURN(Kind.KEYWORD, "return"),
    THEN(Kind.KEYWORD, "then"),
    TRUE(Kind.KEYWORD, "true"),
    UNTIL(Kind.KEYWORD, "until"),
    WHILE(Kind.KEYWORD, "while"),

    // Arithmetic and comparison
    PLUS(Kind.OPERATOR, "+"),
    MINUS(Kind.OPERATOR, "-"),
    STAR(Kind.OPERATOR, "*"),
    SLASH(Kind.OPERATOR, "/"),
    DOUBLE_SLASH(Kind.OPERATOR, "//"),
    PERCENT(Kind.OPERATOR, "%"),
    CARET(Kind.OPERATOR, "^"),
    HASH(Kind.OPERATOR, "#"),
    CONCAT(Kind.OPERATOR, ".."),
    EQ(Kind.OPERATOR, "=="),
    NE(Kind.OPERATOR, "~="),
    LT(Kind.OPERATOR, "<"),
    LE(Kind.OPERATOR, "<="),
    GT(Kind.OPERATOR, ">"),
    GE(Kind.OPERATOR, ">="),

    // Assignment (Luau compound forms included)
    ASSIGN(Kind.OPERATOR, "="),
    PLUS_ASSIGN(Kind.OPERATOR, "+="),
    MINUS_ASSIGN(Kind.OPERATOR, "-="),
    STAR_ASSIGN(Kind.OPERATOR, "*="),
    SLASH_ASSIGN(Kind.OPERATOR, "/="),
    DOUBLE_SLASH_ASSIGN(Kind.OPERATOR, "//="),
    PERCENT_ASSIGN(Kind.OPERATOR, "%="),
    CARET_ASSIGN(Kind.OPERATOR, "^="),
    CONCAT_ASSIGN(Kind.OPERATOR, "..="),

    // Punctuation
    LPAREN(Kind.OPERATOR, "("),
    RPAREN(Kind.OPERATOR, ")"),
    LBRACE(Kind.OPERATOR, "{"),
    RBRACE(Kind.OPERATOR, "}"),
    LBRACKET(Kind.OPERATOR, "["),
    RBRACKET(Kind.OPERATOR, "]"),
    SEMICOLON(Kind.OPERATOR, ";"),
    COLON(Kind.OPERATOR, ":"),
    DOUBLE_COLON(Kind.OPERATOR, "::"),
    COMMA(Kind.OPERATOR, ","),
    DOT(Kind.OPERATOR, "."),
    ELLIPSIS(Kind.OPERATOR, "..."),

    EOF(Kind.END_OF_INPUT, null);

    /**
     * Coarse token classification.
     */
    public enum Kind {
        IDENTIFIER, KEYWORD, NUMBER, STRING, OPERATOR, COMMENT, END_OF_INPUT
    }

    private static final Map<String, TokenType> KEYWORDS = new HashMap<>();

    static {
        for (TokenType type : values()) {
            if (type.kind == Kind.KEYWORD) {
                KEYWORDS.put(type.text, type);
            }
        }
    }

    private final Kind kind;
    private final String text;

    TokenType(Kind kind, String text) {
        this.kind = kind;
        this.text = text;
    }

    public Kind kind() {
        return kind;
    }

    /**
     * Fixed spelling for keywords and operators, null for variable tokens.
     */
    public String text() {
        return text;
    }

    public boolean isCompoundAssignment() {
        return switch (this) {
            case PLUS_ASSIGN, MINUS_ASSIGN, STAR_ASSIGN, SLASH_ASSIGN, DOUBLE_SLASH_ASSIGN,
                 PERCENT_ASSIGN, CARET_ASSIGN, CONCAT_ASSIGN -> true;
            default -> false;
        };
    }

    /**
     * @return the keyword token type for {@code word}, or null if it is not a reserved word
     */
    public static TokenType keyword(String word) {
        return KEYWORDS.get(word);
    }
}
