package com.moonshift.pipeline;

import com.moonshift.printer.Layout;

import java.util.List;
import java.util.Locale;

import static com.moonshift.pipeline.PassId.*;

/**
 * The five transformations. Each is a fixed pass order plus a printer layout.
 */
public enum Mode {
    DEOBFUSCATE(List.of(STRING_NORMALIZER, CONSTANT_FOLDER, EXPRESSION_SIMPLIFIER, CANONICALIZE_IDENTIFIERS),
        Layout.READABLE, false, true),
    BEAUTIFY(List.of(), Layout.READABLE, false, false),
    MINIFY(List.of(), Layout.COMPACT, false, false),
    OBFUSCATE(List.of(OBFUSCATION_LINTER, OBFUSCATE_IDENTIFIERS, STRING_REENCODER),
        Layout.COMPACT, false, false),
    FIX(List.of(STRUCTURAL_FIXER), Layout.READABLE, true, true);

    private final List<PassId> passes;
    private final Layout layout;
    private final boolean repairMode;
    private final boolean unwrapWrappers;

    Mode(List<PassId> passes, Layout layout, boolean repairMode, boolean unwrapWrappers) {
        this.passes = passes;
        this.layout = layout;
        this.repairMode = repairMode;
        this.unwrapWrappers = unwrapWrappers;
    }

    public List<PassId> passes() {
        return passes;
    }

    public Layout layout() {
        return layout;
    }

    /**
     * Whether the parser may insert missing terminators instead of failing.
     */
    public boolean repairMode() {
        return repairMode;
    }

    /**
     * Whether a top-level run-immediately wrapper is flattened, subject to
     * {@link TransformOptions#unwrapImmediateWrappers()}.
     */
    public boolean unwrapWrappers() {
        return unwrapWrappers;
    }

    /**
     * Case-insensitive lookup by name, e.g. {@code "minify"}.
     */
    public static Mode fromName(String name) {
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown mode: " + name, e);
        }
    }
}
