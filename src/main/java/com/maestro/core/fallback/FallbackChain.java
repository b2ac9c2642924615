package com.maestro.core.fallback;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Priority-ordered list of providers for one value.
 * <p>
 * Providers are tried in order. A provider that returns an empty {@link Optional} or throws
 * passes control to the next one. The chain always ends in a terminal supplier that cannot
 * decline, so {@link #resolve()} never fails for recoverable provider errors.
 *
 * <pre>{@code
 * FallbackChain.<ResolvedModels>named("availability")
 *         .then("manifest", manifestSource::fetch)
 *         .orElse("builtin", ModelCatalog::builtin)
 *         .resolve();
 * }</pre>
 *
 * @param <T> resolved value type
 */
public final class FallbackChain<T> {

    private static final Logger log = LoggerFactory.getLogger(FallbackChain.class);

    private final String name;
    private final List<Provider<T>> providers;
    private final Provider<T> terminal;

    private FallbackChain(String name, List<Provider<T>> providers, Provider<T> terminal) {
        this.name = name;
        this.providers = List.copyOf(providers);
        this.terminal = terminal;
    }

    public static <T> Builder<T> named(String name) {
        return new Builder<>(name);
    }

    /**
     * Walks the providers in priority order and returns the first value produced,
     * tagged with the name of the provider that produced it.
     */
    public Resolution<T> resolve() {
        for (Provider<T> provider : providers) {
            try {
                Optional<T> value = provider.supplier().get();
                if (value != null && value.isPresent()) {
                    return new Resolution<>(value.get(), provider.name());
                }
                log.debug("Fallback chain '{}': provider '{}' declined", name, provider.name());
            } catch (RuntimeException e) {
                log.warn("Fallback chain '{}': provider '{}' failed: {}", name, provider.name(), e.getMessage());
            }
        }
        T value = Objects.requireNonNull(terminal.supplier().get().orElse(null),
                "terminal provider of chain '" + name + "' returned no value");
        return new Resolution<>(value, terminal.name());
    }

    public String name() {
        return name;
    }

    /** Names of all providers, terminal last. */
    public List<String> providerNames() {
        var names = new ArrayList<String>();
        providers.forEach(p -> names.add(p.name()));
        names.add(terminal.name());
        return names;
    }

    /**
     * A value together with the provider that produced it.
     */
    public record Resolution<T>(T value, String provider) {}

    private record Provider<T>(String name, Supplier<Optional<T>> supplier) {}

    public static final class Builder<T> {

        private final String name;
        private final List<Provider<T>> providers = new ArrayList<>();

        private Builder(String name) {
            this.name = name;
        }

        /** Adds a provider that may decline by returning empty or throwing. */
        public Builder<T> then(String providerName, Supplier<Optional<T>> supplier) {
            providers.add(new Provider<>(providerName, supplier));
            return this;
        }

        /** Adds a provider that declines when the condition does not hold. */
        public Builder<T> when(String providerName, boolean condition, Supplier<T> supplier) {
            providers.add(new Provider<>(providerName,
                    () -> condition ? Optional.ofNullable(supplier.get()) : Optional.empty()));
            return this;
        }

        /** Closes the chain with a provider that always produces a value. */
        public FallbackChain<T> orElse(String providerName, Supplier<T> terminal) {
            return new FallbackChain<>(name, providers,
                    new Provider<>(providerName, () -> Optional.ofNullable(terminal.get())));
        }
    }
}
