package com.moonshift;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Sample scripts under {@code src/test/resources/scripts}.
 */
public final class Scripts {

    public static final List<String> ALL = List.of("inventory.lua", "obfuscated.lua", "closures.lua");

    private Scripts() {
    }

    public static String load(String name) {
        try (InputStream in = Scripts.class.getResourceAsStream("/scripts/" + name)) {
            if (in == null) {
                throw new IllegalArgumentException("No such script: " + name);
            }
            return new String(in.readAllBytes(), StandardCharsets.ISO_8859_1);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
