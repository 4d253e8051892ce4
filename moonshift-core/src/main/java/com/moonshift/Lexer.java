package com.moonshift;

import com.moonshift.value.LuaValue;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns Lua/Luau source text into tokens. String literals are decoded into byte strings
 * (one byte per char) so later passes work on values, never on spellings.
 * Comments are kept as {@link TokenType#COMMENT} tokens; whitespace is dropped.
 */
public class Lexer {

    private final String source;
    private final char[] buf;
    private final int length;
    private int position = 0;
    private int line = 1;
    private int lineStart = 0;

    // Start of the token being scanned
    private int tokenStart;
    private int tokenLine;
    private int tokenColumn;

    public Lexer(String source) {
        this.source = source;
        this.buf = source.toCharArray();
        this.length = buf.length;
    }

    public static List<Token> tokenize(String source) {
        return new Lexer(source).tokenize();
    }

    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        skipShebang();
        while (true) {
            skipWhitespace();
            markStart();
            if (position >= length) {
                tokens.add(new Token(TokenType.EOF, "", null, line, column(), position, position));
                return tokens;
            }
            tokens.add(nextToken());
        }
    }

    private void skipShebang() {
        if (length >= 2 && buf[0] == '#' && buf[1] == '!') {
            while (position < length && buf[position] != '\n' && buf[position] != '\r') {
                position++;
            }
        }
    }

    private void skipWhitespace() {
        while (position < length) {
            char c = buf[position];
            if (c == '\n' || c == '\r') {
                consumeNewline();
            } else if (c == ' ' || c == '\t' || c == '\f' || c == '\u000B') {
                position++;
            } else {
                return;
            }
        }
    }

    // Consumes \n, \r, \r\n or \n\r as a single line break
    private void consumeNewline() {
        char first = buf[position++];
        if (position < length) {
            char second = buf[position];
            if ((second == '\n' || second == '\r') && second != first) {
                position++;
            }
        }
        line++;
        lineStart = position;
    }

    private void markStart() {
        tokenStart = position;
        tokenLine = line;
        tokenColumn = column();
    }

    private int column() {
        return position - lineStart + 1;
    }

    private Token nextToken() {
        char c = buf[position];

        if (c == '-' && peekChar(1) == '-') {
            return readComment();
        }
        if (c == '[' && (peekChar(1) == '[' || peekChar(1) == '=')) {
            int level = longBracketLevel(position);
            if (level >= 0) {
                String content = readLongBracket(level, "string");
                return makeToken(TokenType.STRING, LuaValue.ofBytes(encodeUtf8(content)));
            }
            if (peekChar(1) == '=') {
                throw error("invalid long string delimiter");
            }
        }
        if (c == '"' || c == '\'') {
            return readQuotedString(c);
        }
        if (isDigit(c) || (c == '.' && isDigit(peekChar(1)))) {
            return readNumber();
        }
        if (isIdentifierStart(c)) {
            return readName();
        }
        return readOperator();
    }

    // ========================================================================
    // Comments and long brackets
    // ========================================================================

    private Token readComment() {
        position += 2;
        if (position < length && buf[position] == '[') {
            int level = longBracketLevel(position);
            if (level >= 0) {
                readLongBracket(level, "comment");
                return makeToken(TokenType.COMMENT, null);
            }
        }
        while (position < length && buf[position] != '\n' && buf[position] != '\r') {
            position++;
        }
        return makeToken(TokenType.COMMENT, null);
    }

    /**
     * @return the number of '=' in an opening long bracket at {@code at}, or -1 if there is none
     */
    private int longBracketLevel(int at) {
        if (at >= length || buf[at] != '[') {
            return -1;
        }
        int p = at + 1;
        int level = 0;
        while (p < length && buf[p] == '=') {
            level++;
            p++;
        }
        return p < length && buf[p] == '[' ? level : -1;
    }

    // Reads [==[ ... ]==] starting at position; returns the content with line breaks normalized
    private String readLongBracket(int level, String what) {
        position += level + 2;
        // A line break directly after the opening bracket is not part of the content
        if (position < length && (buf[position] == '\n' || buf[position] == '\r')) {
            consumeNewline();
        }
        StringBuilder content = new StringBuilder();
        while (true) {
            if (position >= length) {
                throw error("unfinished long " + what);
            }
            char c = buf[position];
            if (c == ']' && closesLongBracket(level)) {
                position += level + 2;
                return content.toString();
            }
            if (c == '\n' || c == '\r') {
                consumeNewline();
                content.append('\n');
            } else {
                content.append(c);
                position++;
            }
        }
    }

    private boolean closesLongBracket(int level) {
        int p = position + 1;
        for (int i = 0; i < level; i++, p++) {
            if (p >= length || buf[p] != '=') {
                return false;
            }
        }
        return p < length && buf[p] == ']';
    }

    // ========================================================================
    // Quoted strings
    // ========================================================================

    private Token readQuotedString(char quote) {
        position++;
        StringBuilder bytes = new StringBuilder();
        while (true) {
            if (position >= length) {
                throw error("unfinished string");
            }
            char c = buf[position];
            if (c == quote) {
                position++;
                break;
            }
            if (c == '\n' || c == '\r') {
                throw error("unfinished string");
            }
            if (c == '\\') {
                readEscape(bytes);
                continue;
            }
            appendSourceChar(bytes);
        }
        return makeToken(TokenType.STRING, LuaValue.ofBytes(bytes.toString()));
    }

    // Appends the UTF-8 bytes of the source code point at position
    private void appendSourceChar(StringBuilder bytes) {
        int codePoint = source.codePointAt(position);
        position += Character.charCount(codePoint);
        if (codePoint < 0x80) {
            bytes.append((char) codePoint);
        } else {
            appendUtf8(bytes, codePoint);
        }
    }

    private void readEscape(StringBuilder bytes) {
        int escapeStart = position;
        position++; // backslash
        if (position >= length) {
            throw error("unfinished string");
        }
        char c = buf[position];
        switch (c) {
            case 'a' -> { bytes.append('\u0007'); position++; }
            case 'b' -> { bytes.append('\b'); position++; }
            case 'f' -> { bytes.append('\f'); position++; }
            case 'n' -> { bytes.append('\n'); position++; }
            case 'r' -> { bytes.append('\r'); position++; }
            case 't' -> { bytes.append('\t'); position++; }
            case 'v' -> { bytes.append('\u000B'); position++; }
            case '\\', '"', '\'' -> { bytes.append(c); position++; }
            case '\n', '\r' -> {
                consumeNewline();
                bytes.append('\n');
            }
            case 'x' -> {
                position++;
                int value = 0;
                for (int i = 0; i < 2; i++) {
                    int digit = position < length ? Character.digit(buf[position], 16) : -1;
                    if (digit < 0) {
                        throw errorAt("hexadecimal digit expected", escapeStart);
                    }
                    value = value * 16 + digit;
                    position++;
                }
                bytes.append((char) value);
            }
            case 'z' -> {
                position++;
                while (position < length && Character.isWhitespace(buf[position])) {
                    if (buf[position] == '\n' || buf[position] == '\r') {
                        consumeNewline();
                    } else {
                        position++;
                    }
                }
            }
            case 'u' -> readUnicodeEscape(bytes, escapeStart);
            default -> {
                if (!isDigit(c)) {
                    throw errorAt("invalid escape sequence '\\" + c + "'", escapeStart);
                }
                int value = 0;
                for (int i = 0; i < 3 && position < length && isDigit(buf[position]); i++) {
                    value = value * 10 + (buf[position] - '0');
                    position++;
                }
                if (value > 255) {
                    throw errorAt("decimal escape too large", escapeStart);
                }
                bytes.append((char) value);
            }
        }
    }

    private void readUnicodeEscape(StringBuilder bytes, int escapeStart) {
        position++; // u
        if (position >= length || buf[position] != '{') {
            throw errorAt("missing '{' in \\u{xxxx}", escapeStart);
        }
        position++;
        long codePoint = 0;
        int digits = 0;
        while (position < length && Character.digit(buf[position], 16) >= 0) {
            codePoint = codePoint * 16 + Character.digit(buf[position], 16);
            if (codePoint > 0x10FFFF) {
                throw errorAt("UTF-8 value too large", escapeStart);
            }
            digits++;
            position++;
        }
        if (digits == 0) {
            throw errorAt("hexadecimal digit expected", escapeStart);
        }
        if (position >= length || buf[position] != '}') {
            throw errorAt("missing '}' in \\u{xxxx}", escapeStart);
        }
        position++;
        appendUtf8(bytes, (int) codePoint);
    }

    private static void appendUtf8(StringBuilder bytes, int codePoint) {
        if (codePoint < 0x80) {
            bytes.append((char) codePoint);
        } else if (codePoint < 0x800) {
            bytes.append((char) (0xC0 | (codePoint >> 6)));
            bytes.append((char) (0x80 | (codePoint & 0x3F)));
        } else if (codePoint < 0x10000) {
            bytes.append((char) (0xE0 | (codePoint >> 12)));
            bytes.append((char) (0x80 | ((codePoint >> 6) & 0x3F)));
            bytes.append((char) (0x80 | (codePoint & 0x3F)));
        } else {
            bytes.append((char) (0xF0 | (codePoint >> 18)));
            bytes.append((char) (0x80 | ((codePoint >> 12) & 0x3F)));
            bytes.append((char) (0x80 | ((codePoint >> 6) & 0x3F)));
            bytes.append((char) (0x80 | (codePoint & 0x3F)));
        }
    }

    private static String encodeUtf8(String text) {
        StringBuilder bytes = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); ) {
            int codePoint = text.codePointAt(i);
            appendUtf8(bytes, codePoint);
            i += Character.charCount(codePoint);
        }
        return bytes.toString();
    }

    // ========================================================================
    // Numbers
    // ========================================================================

    private Token readNumber() {
        double value;
        if (buf[position] == '0' && (peekChar(1) == 'x' || peekChar(1) == 'X')) {
            position += 2;
            value = readHexNumber();
        } else if (buf[position] == '0' && (peekChar(1) == 'b' || peekChar(1) == 'B')) {
            position += 2;
            value = readBinaryNumber();
        } else {
            value = readDecimalNumber();
        }
        // Lua reads a numeral greedily; trailing name characters or dots make it malformed
        if (position < length && (isIdentifierPart(buf[position]) || buf[position] == '.')) {
            while (position < length && (isIdentifierPart(buf[position]) || buf[position] == '.')) {
                position++;
            }
            throw error("malformed number near '" + source.substring(tokenStart, position) + "'");
        }
        return makeToken(TokenType.NUMBER, LuaValue.of(value));
    }

    private double readHexNumber() {
        double mantissa = 0;
        int exponent = 0;
        boolean anyDigit = false;
        while (position < length && (Character.digit(buf[position], 16) >= 0 || buf[position] == '_')) {
            if (buf[position] != '_') {
                mantissa = mantissa * 16 + Character.digit(buf[position], 16);
                anyDigit = true;
            }
            position++;
        }
        if (position < length && buf[position] == '.') {
            position++;
            while (position < length && Character.digit(buf[position], 16) >= 0) {
                mantissa = mantissa * 16 + Character.digit(buf[position], 16);
                exponent -= 4;
                anyDigit = true;
                position++;
            }
        }
        if (!anyDigit) {
            throw error("malformed number near '" + source.substring(tokenStart, position) + "'");
        }
        if (position < length && (buf[position] == 'p' || buf[position] == 'P')) {
            position++;
            exponent += readExponentDigits();
        }
        return mantissa * Math.pow(2, exponent);
    }

    private double readBinaryNumber() {
        double value = 0;
        boolean anyDigit = false;
        while (position < length && (buf[position] == '0' || buf[position] == '1' || buf[position] == '_')) {
            if (buf[position] != '_') {
                value = value * 2 + (buf[position] - '0');
                anyDigit = true;
            }
            position++;
        }
        if (!anyDigit) {
            throw error("malformed number near '" + source.substring(tokenStart, position) + "'");
        }
        return value;
    }

    private double readDecimalNumber() {
        StringBuilder digits = new StringBuilder();
        while (position < length && (isDigit(buf[position]) || buf[position] == '_')) {
            if (buf[position] != '_') {
                digits.append(buf[position]);
            }
            position++;
        }
        if (position < length && buf[position] == '.') {
            digits.append('.');
            position++;
            while (position < length && (isDigit(buf[position]) || buf[position] == '_')) {
                if (buf[position] != '_') {
                    digits.append(buf[position]);
                }
                position++;
            }
        }
        if (position < length && (buf[position] == 'e' || buf[position] == 'E')) {
            position++;
            digits.append('e').append(readExponentDigits());
        }
        try {
            return Double.parseDouble(digits.toString());
        } catch (NumberFormatException e) {
            throw error("malformed number near '" + source.substring(tokenStart, position) + "'");
        }
    }

    private int readExponentDigits() {
        int sign = 1;
        if (position < length && (buf[position] == '+' || buf[position] == '-')) {
            sign = buf[position] == '-' ? -1 : 1;
            position++;
        }
        if (position >= length || !isDigit(buf[position])) {
            throw error("malformed number near '" + source.substring(tokenStart, Math.min(position + 1, length)) + "'");
        }
        int exponent = 0;
        while (position < length && isDigit(buf[position])) {
            exponent = Math.min(exponent * 10 + (buf[position] - '0'), 100_000);
            position++;
        }
        return sign * exponent;
    }

    // ========================================================================
    // Names and operators
    // ========================================================================

    private Token readName() {
        while (position < length && isIdentifierPart(buf[position])) {
            position++;
        }
        String word = source.substring(tokenStart, position);
        TokenType keyword = TokenType.keyword(word);
        return makeToken(keyword != null ? keyword : TokenType.IDENTIFIER, null);
    }

    private Token readOperator() {
        char c = buf[position];
        char next = peekChar(1);
        char third = peekChar(2);
        TokenType type;
        int width = 1;
        switch (c) {
            case '+' -> { type = next == '=' ? TokenType.PLUS_ASSIGN : TokenType.PLUS; width = next == '=' ? 2 : 1; }
            case '-' -> { type = next == '=' ? TokenType.MINUS_ASSIGN : TokenType.MINUS; width = next == '=' ? 2 : 1; }
            case '*' -> { type = next == '=' ? TokenType.STAR_ASSIGN : TokenType.STAR; width = next == '=' ? 2 : 1; }
            case '%' -> { type = next == '=' ? TokenType.PERCENT_ASSIGN : TokenType.PERCENT; width = next == '=' ? 2 : 1; }
            case '^' -> { type = next == '=' ? TokenType.CARET_ASSIGN : TokenType.CARET; width = next == '=' ? 2 : 1; }
            case '/' -> {
                if (next == '/') {
                    type = third == '=' ? TokenType.DOUBLE_SLASH_ASSIGN : TokenType.DOUBLE_SLASH;
                    width = third == '=' ? 3 : 2;
                } else {
                    type = next == '=' ? TokenType.SLASH_ASSIGN : TokenType.SLASH;
                    width = next == '=' ? 2 : 1;
                }
            }
            case '.' -> {
                if (next == '.') {
                    if (third == '.') {
                        type = TokenType.ELLIPSIS;
                        width = 3;
                    } else if (third == '=') {
                        type = TokenType.CONCAT_ASSIGN;
                        width = 3;
                    } else {
                        type = TokenType.CONCAT;
                        width = 2;
                    }
                } else {
                    type = TokenType.DOT;
                }
            }
            case '=' -> { type = next == '=' ? TokenType.EQ : TokenType.ASSIGN; width = next == '=' ? 2 : 1; }
            case '<' -> { type = next == '=' ? TokenType.LE : TokenType.LT; width = next == '=' ? 2 : 1; }
            case '>' -> { type = next == '=' ? TokenType.GE : TokenType.GT; width = next == '=' ? 2 : 1; }
            case '~' -> {
                if (next != '=') {
                    throw error("unexpected symbol near '~'");
                }
                type = TokenType.NE;
                width = 2;
            }
            case ':' -> { type = next == ':' ? TokenType.DOUBLE_COLON : TokenType.COLON; width = next == ':' ? 2 : 1; }
            case '#' -> type = TokenType.HASH;
            case '(' -> type = TokenType.LPAREN;
            case ')' -> type = TokenType.RPAREN;
            case '{' -> type = TokenType.LBRACE;
            case '}' -> type = TokenType.RBRACE;
            case '[' -> type = TokenType.LBRACKET;
            case ']' -> type = TokenType.RBRACKET;
            case ';' -> type = TokenType.SEMICOLON;
            case ',' -> type = TokenType.COMMA;
            default -> throw error("unexpected symbol near '" + describeChar(c) + "'");
        }
        position += width;
        return makeToken(type, null);
    }

    private static String describeChar(char c) {
        if (c < 0x20 || c >= 0x7F) {
            return "<\\" + (int) c + ">";
        }
        return String.valueOf(c);
    }

    // ========================================================================
    // Helpers
    // ========================================================================

    private Token makeToken(TokenType type, LuaValue value) {
        return new Token(type, source.substring(tokenStart, position), value, tokenLine, tokenColumn, tokenStart, position);
    }

    private char peekChar(int offset) {
        int p = position + offset;
        return p < length ? buf[p] : '\0';
    }

    private LexException error(String message) {
        return new LexException(message, tokenLine, tokenColumn, tokenStart);
    }

    private LexException errorAt(String message, int offset) {
        return new LexException(message, line, offset - lineStart + 1, offset);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || isDigit(c);
    }
}
