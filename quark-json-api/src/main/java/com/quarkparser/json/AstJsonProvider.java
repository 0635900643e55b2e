package com.quarkparser.json;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.ServiceLoader;

/**
 * Entry point for handing Quark trees to later compiler stages as JSON.
 *
 * <p>Implementations are found with {@link ServiceLoader}; putting a provider module such as
 * quark-jackson on the classpath is enough to make it available:</p>
 *
 * <pre>{@code
 * CompilationUnit unit = Parser.parse(source);
 * AstJsonProvider provider = AstJsonProvider.getProvider();
 * String json = provider.getSerializer().serialize(unit);
 * CompilationUnit copy = provider.getDeserializer().deserializeCompilationUnit(json);
 * }</pre>
 */
public interface AstJsonProvider {

    AstJsonSerializer getSerializer();

    AstJsonDeserializer getDeserializer();

    /**
     * Short name used to select this provider, e.g. "Jackson".
     */
    String getName();

    /**
     * The first provider on the classpath.
     *
     * @throws IllegalStateException if there is none
     */
    static AstJsonProvider getProvider() {
        Iterator<AstJsonProvider> iterator = ServiceLoader.load(AstJsonProvider.class).iterator();
        if (iterator.hasNext()) {
            return iterator.next();
        }
        throw new IllegalStateException(
            "No AstJsonProvider found on the classpath. " +
            "Add quark-jackson (or another provider) to your dependencies."
        );
    }

    /**
     * The provider whose {@link #getName()} matches {@code name}, ignoring case.
     *
     * @throws IllegalStateException if no provider has that name
     */
    static AstJsonProvider getProvider(String name) {
        for (AstJsonProvider provider : ServiceLoader.load(AstJsonProvider.class)) {
            if (provider.getName().equalsIgnoreCase(name)) {
                return provider;
            }
        }
        throw new IllegalStateException(
            "No AstJsonProvider named '" + name + "' found. Available: " + availableProviders()
        );
    }

    static List<String> availableProviders() {
        List<String> names = new ArrayList<>();
        for (AstJsonProvider provider : ServiceLoader.load(AstJsonProvider.class)) {
            names.add(provider.getName());
        }
        return names;
    }

    static boolean isProviderAvailable() {
        return ServiceLoader.load(AstJsonProvider.class).iterator().hasNext();
    }
}
