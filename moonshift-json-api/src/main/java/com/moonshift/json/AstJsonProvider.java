package com.moonshift.json;

import com.moonshift.ast.Node;

import java.util.Optional;
import java.util.ServiceLoader;

/**
 * Entry point for JSON export. Implementations register themselves in
 * {@code META-INF/services/com.moonshift.json.AstJsonProvider}; putting moonshift-jackson on
 * the classpath is enough.
 *
 * <pre>{@code
 * String json = AstJsonProvider.getProvider().toJson(Parser.parse(source));
 * }</pre>
 */
public interface AstJsonProvider {

    AstJsonSerializer getSerializer();

    /**
     * Short name used by {@link #getProvider(String)}, e.g. "Jackson".
     */
    String getName();

    default String toJson(Node node) throws AstJsonException {
        return getSerializer().serialize(node);
    }

    /**
     * @throws IllegalStateException when no implementation is registered
     */
    static AstJsonProvider getProvider() {
        return ServiceLoader.load(AstJsonProvider.class).findFirst()
            .orElseThrow(() -> new IllegalStateException(
                "No AstJsonProvider registered; add moonshift-jackson to the classpath"));
    }

    /**
     * @throws IllegalStateException when no registered implementation has that name
     */
    static AstJsonProvider getProvider(String name) {
        return findProvider(name).orElseThrow(() -> new IllegalStateException(
            "No AstJsonProvider named '" + name + "' is registered"));
    }

    /**
     * Case-insensitive lookup by {@link #getName()}.
     */
    static Optional<AstJsonProvider> findProvider(String name) {
        return ServiceLoader.load(AstJsonProvider.class).stream()
            .map(ServiceLoader.Provider::get)
            .filter(provider -> provider.getName().equalsIgnoreCase(name))
            .findFirst();
    }

    static boolean isProviderAvailable() {
        return ServiceLoader.load(AstJsonProvider.class).findFirst().isPresent();
    }
}
