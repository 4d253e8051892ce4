package com.moonshift.pipeline;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Immutable knobs for one pipeline. Defaults suit all modes; {@link #fromProperties}
 * reads the {@code moonshift.*} keys of a properties file.
 */
public final class TransformOptions {

    public static final String INDENT = "moonshift.indent";
    public static final String SEED = "moonshift.seed";
    public static final String LOADSTRING_DEPTH = "moonshift.loadstring-depth";
    public static final String MAX_PROPAGATED_STRING_LENGTH = "moonshift.max-propagated-string-length";
    public static final String OBFUSCATED_NAME_LENGTH = "moonshift.obfuscated-name-length";
    public static final String UNWRAP_IMMEDIATE_WRAPPERS = "moonshift.unwrap-immediate-wrappers";
    public static final String VERIFY_OUTPUT = "moonshift.verify-output";

    private static final TransformOptions DEFAULTS = builder().build();

    private final String indent;
    private final Long seed;
    private final int loadstringDepth;
    private final int maxPropagatedStringLength;
    private final int obfuscatedNameLength;
    private final boolean unwrapImmediateWrappers;
    private final boolean verifyOutput;

    private TransformOptions(Builder builder) {
        this.indent = builder.indent;
        this.seed = builder.seed;
        this.loadstringDepth = builder.loadstringDepth;
        this.maxPropagatedStringLength = builder.maxPropagatedStringLength;
        this.obfuscatedNameLength = builder.obfuscatedNameLength;
        this.unwrapImmediateWrappers = builder.unwrapImmediateWrappers;
        this.verifyOutput = builder.verifyOutput;
    }

    public static TransformOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads options from {@code moonshift.*} properties; absent keys keep their defaults.
     *
     * @throws IllegalArgumentException naming the key of a malformed value
     */
    public static TransformOptions fromProperties(Properties properties) {
        Builder builder = builder();
        String indent = properties.getProperty(INDENT);
        if (indent != null) {
            builder.indent(parseIndent(indent));
        }
        String seed = properties.getProperty(SEED);
        if (seed != null && !seed.isBlank()) {
            builder.seed(parseLong(SEED, seed));
        }
        String depth = properties.getProperty(LOADSTRING_DEPTH);
        if (depth != null) {
            builder.loadstringDepth(parseInt(LOADSTRING_DEPTH, depth));
        }
        String maxLength = properties.getProperty(MAX_PROPAGATED_STRING_LENGTH);
        if (maxLength != null) {
            builder.maxPropagatedStringLength(parseInt(MAX_PROPAGATED_STRING_LENGTH, maxLength));
        }
        String nameLength = properties.getProperty(OBFUSCATED_NAME_LENGTH);
        if (nameLength != null) {
            builder.obfuscatedNameLength(parseInt(OBFUSCATED_NAME_LENGTH, nameLength));
        }
        String unwrap = properties.getProperty(UNWRAP_IMMEDIATE_WRAPPERS);
        if (unwrap != null) {
            builder.unwrapImmediateWrappers(parseBoolean(UNWRAP_IMMEDIATE_WRAPPERS, unwrap));
        }
        String verify = properties.getProperty(VERIFY_OUTPUT);
        if (verify != null) {
            builder.verifyOutput(parseBoolean(VERIFY_OUTPUT, verify));
        }
        return builder.build();
    }

    public static TransformOptions load(InputStream in) throws IOException {
        Properties properties = new Properties();
        properties.load(in);
        return fromProperties(properties);
    }

    // "tab", "2" (spaces) or the literal indent text
    private static String parseIndent(String value) {
        String trimmed = value.trim();
        if (trimmed.equalsIgnoreCase("tab")) {
            return "\t";
        }
        if (!trimmed.isEmpty() && trimmed.chars().allMatch(Character::isDigit)) {
            return " ".repeat(parseInt(INDENT, trimmed));
        }
        if (!value.isEmpty() && value.isBlank()) {
            return value;
        }
        throw new IllegalArgumentException(INDENT + ": expected 'tab', a number of spaces or whitespace, got '" + value + "'");
    }

    private static int parseInt(String key, String value) {
        try {
            int parsed = Integer.parseInt(value.trim());
            if (parsed < 0) {
                throw new IllegalArgumentException(key + ": must not be negative, got " + parsed);
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + ": not an integer: '" + value + "'", e);
        }
    }

    private static long parseLong(String key, String value) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + ": not an integer: '" + value + "'", e);
        }
    }

    private static boolean parseBoolean(String key, String value) {
        String trimmed = value.trim();
        if (trimmed.equalsIgnoreCase("true")) {
            return true;
        }
        if (trimmed.equalsIgnoreCase("false")) {
            return false;
        }
        throw new IllegalArgumentException(key + ": expected true or false, got '" + value + "'");
    }

    public String indent() {
        return indent;
    }

    /**
     * Seed for obfuscation choices; null means a fresh random seed per run.
     */
    public Long seed() {
        return seed;
    }

    public int loadstringDepth() {
        return loadstringDepth;
    }

    public int maxPropagatedStringLength() {
        return maxPropagatedStringLength;
    }

    public int obfuscatedNameLength() {
        return obfuscatedNameLength;
    }

    public boolean unwrapImmediateWrappers() {
        return unwrapImmediateWrappers;
    }

    /**
     * Re-parse printed output and fail with an internal error if it does not parse.
     */
    public boolean verifyOutput() {
        return verifyOutput;
    }

    public Builder toBuilder() {
        return new Builder()
            .indent(indent)
            .seed(seed)
            .loadstringDepth(loadstringDepth)
            .maxPropagatedStringLength(maxPropagatedStringLength)
            .obfuscatedNameLength(obfuscatedNameLength)
            .unwrapImmediateWrappers(unwrapImmediateWrappers)
            .verifyOutput(verifyOutput);
    }

    public static final class Builder {
        private String indent = "    ";
        private Long seed = null;
        private int loadstringDepth = 3;
        private int maxPropagatedStringLength = 40;
        private int obfuscatedNameLength = 8;
        private boolean unwrapImmediateWrappers = true;
        private boolean verifyOutput = true;

        private Builder() {
        }

        public Builder indent(String indent) {
            this.indent = indent;
            return this;
        }

        public Builder seed(Long seed) {
            this.seed = seed;
            return this;
        }

        public Builder loadstringDepth(int loadstringDepth) {
            this.loadstringDepth = loadstringDepth;
            return this;
        }

        public Builder maxPropagatedStringLength(int maxPropagatedStringLength) {
            this.maxPropagatedStringLength = maxPropagatedStringLength;
            return this;
        }

        public Builder obfuscatedNameLength(int obfuscatedNameLength) {
            this.obfuscatedNameLength = obfuscatedNameLength;
            return this;
        }

        public Builder unwrapImmediateWrappers(boolean unwrapImmediateWrappers) {
            this.unwrapImmediateWrappers = unwrapImmediateWrappers;
            return this;
        }

        public Builder verifyOutput(boolean verifyOutput) {
            this.verifyOutput = verifyOutput;
            return this;
        }

        public TransformOptions build() {
            if (obfuscatedNameLength < 4) {
                throw new IllegalArgumentException(OBFUSCATED_NAME_LENGTH + ": must be at least 4, got " + obfuscatedNameLength);
            }
            return new TransformOptions(this);
        }
    }
}
