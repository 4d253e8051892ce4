package com.moonshift.value;

import com.moonshift.TokenType;

import java.nio.charset.StandardCharsets;

/**
 * Conversions between Java text and Lua byte strings, plus literal spelling.
 */
public final class LuaStrings {

    // 2^53: every integer up to here has an exact double
    private static final double MAX_EXACT_INTEGER = 9007199254740992.0;

    private LuaStrings() {
        // Utility class
    }

    /**
     * Encodes Java text as a Lua byte string (UTF-8, one byte per char).
     */
    public static String fromText(String text) {
        byte[] utf8 = text.getBytes(StandardCharsets.UTF_8);
        StringBuilder sb = new StringBuilder(utf8.length);
        for (byte b : utf8) {
            sb.append((char) (b & 0xFF));
        }
        return sb.toString();
    }

    /**
     * Decodes a Lua byte string as UTF-8 text. Invalid sequences become U+FFFD.
     */
    public static String toText(String bytes) {
        return new String(toByteArray(bytes), StandardCharsets.UTF_8);
    }

    public static byte[] toByteArray(String bytes) {
        byte[] out = new byte[bytes.length()];
        for (int i = 0; i < bytes.length(); i++) {
            out[i] = (byte) bytes.charAt(i);
        }
        return out;
    }

    public static boolean isIdentifier(String name) {
        if (name.isEmpty() || TokenType.keyword(name) != null) {
            return false;
        }
        char first = name.charAt(0);
        if (!(isAsciiLetter(first) || first == '_')) {
            return false;
        }
        for (int i = 1; i < name.length(); i++) {
            char c = name.charAt(i);
            if (!(isAsciiLetter(c) || c == '_' || (c >= '0' && c <= '9'))) {
                return false;
            }
        }
        return true;
    }

    private static boolean isAsciiLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    /**
     * Spells a byte string as a quoted Lua literal. Printable ASCII and well-formed
     * UTF-8 sequences are written as text; everything else is a decimal escape.
     */
    public static String quote(String bytes) {
        char q = '"';
        if (bytes.indexOf('"') >= 0 && bytes.indexOf('\'') < 0) {
            q = '\'';
        }
        StringBuilder sb = new StringBuilder(bytes.length() + 2);
        sb.append(q);
        int i = 0;
        while (i < bytes.length()) {
            int b = bytes.charAt(i);
            if (b >= 0x80) {
                int consumed = appendUtf8Sequence(bytes, i, sb);
                if (consumed > 0) {
                    i += consumed;
                    continue;
                }
                appendDecimalEscape(sb, b, bytes, i);
                i++;
                continue;
            }
            switch (b) {
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (b == q) {
                        sb.append('\\').append((char) b);
                    } else if (b < 0x20 || b == 0x7F) {
                        appendDecimalEscape(sb, b, bytes, i);
                    } else {
                        sb.append((char) b);
                    }
                }
            }
            i++;
        }
        sb.append(q);
        return sb.toString();
    }

    /**
     * Spells every byte as a decimal escape, e.g. {@code "\72\105"}.
     */
    public static String quoteAllEscaped(String bytes) {
        StringBuilder sb = new StringBuilder(bytes.length() * 4 + 2);
        sb.append('"');
        for (int i = 0; i < bytes.length(); i++) {
            appendDecimalEscape(sb, bytes.charAt(i), bytes, i);
        }
        sb.append('"');
        return sb.toString();
    }

    private static void appendDecimalEscape(StringBuilder sb, int b, String bytes, int index) {
        sb.append('\\');
        boolean nextIsDigit = index + 1 < bytes.length()
            && bytes.charAt(index + 1) >= '0' && bytes.charAt(index + 1) <= '9';
        String digits = Integer.toString(b);
        if (nextIsDigit) {
            digits = "000".substring(digits.length()) + digits;
        }
        sb.append(digits);
    }

    // Returns the number of bytes consumed, or 0 when the bytes at index are not printable UTF-8
    private static int appendUtf8Sequence(String bytes, int index, StringBuilder sb) {
        int lead = bytes.charAt(index);
        int length;
        int codePoint;
        if (lead >= 0xC2 && lead <= 0xDF) {
            length = 2;
            codePoint = lead & 0x1F;
        } else if (lead >= 0xE0 && lead <= 0xEF) {
            length = 3;
            codePoint = lead & 0x0F;
        } else if (lead >= 0xF0 && lead <= 0xF4) {
            length = 4;
            codePoint = lead & 0x07;
        } else {
            return 0;
        }
        if (index + length > bytes.length()) {
            return 0;
        }
        for (int k = 1; k < length; k++) {
            int c = bytes.charAt(index + k);
            if ((c & 0xC0) != 0x80) {
                return 0;
            }
            codePoint = (codePoint << 6) | (c & 0x3F);
        }
        boolean overlong = (length == 3 && codePoint < 0x800) || (length == 4 && codePoint < 0x10000);
        if (overlong || codePoint > 0x10FFFF || (codePoint >= 0xD800 && codePoint <= 0xDFFF)) {
            return 0;
        }
        if (Character.isISOControl(codePoint) || !Character.isDefined(codePoint)) {
            return 0;
        }
        sb.appendCodePoint(codePoint);
        return length;
    }

    /**
     * Spells a number the engine synthesized (no source spelling available).
     */
    public static String formatNumber(double value) {
        if (value == Math.rint(value) && Math.abs(value) <= MAX_EXACT_INTEGER) {
            return Long.toString((long) value);
        }
        String text = Double.toString(value);
        int exponent = text.indexOf('E');
        if (exponent < 0) {
            return text;
        }
        String mantissa = text.substring(0, exponent);
        if (mantissa.endsWith(".0")) {
            mantissa = mantissa.substring(0, mantissa.length() - 2);
        }
        return mantissa + "e" + text.substring(exponent + 1);
    }

    /**
     * Number-to-string conversion as used by concatenation. Only integral values
     * below 1e14 have one spelling across Lua dialects; anything else returns null.
     */
    public static String integralToString(double value) {
        if (value != Math.rint(value) || Math.abs(value) >= 1e14) {
            return null;
        }
        if (value == 0 && 1 / value < 0) {
            return null;
        }
        return Long.toString((long) value);
    }
}
