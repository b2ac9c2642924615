package com.maestro.core.fallback;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class FallbackChainTest {

    @Test
    @DisplayName("first provider with a value wins")
    void firstValueWins() {
        var resolution = FallbackChain.<String>named("test")
                .then("a", () -> Optional.of("A"))
                .then("b", () -> Optional.of("B"))
                .orElse("z", () -> "Z")
                .resolve();

        assertEquals("A", resolution.value());
        assertEquals("a", resolution.provider());
    }

    @Test
    @DisplayName("empty and throwing providers fall through to the next")
    void emptyAndThrowingFallThrough() {
        var resolution = FallbackChain.<String>named("test")
                .then("empty", Optional::empty)
                .then("boom", () -> { throw new IllegalStateException("down"); })
                .then("ok", () -> Optional.of("value"))
                .orElse("z", () -> "Z")
                .resolve();

        assertEquals("value", resolution.value());
        assertEquals("ok", resolution.provider());
    }

    @Test
    @DisplayName("terminal provider is used when everything declines")
    void terminalUsedLast() {
        var resolution = FallbackChain.<Integer>named("numbers")
                .then("none", Optional::empty)
                .when("disabled", false, () -> 1)
                .orElse("default", () -> 42)
                .resolve();

        assertEquals(42, resolution.value());
        assertEquals("default", resolution.provider());
    }

    @Test
    @DisplayName("conditional provider is not invoked when its condition is false")
    void conditionalNotInvoked() {
        var calls = new AtomicInteger();
        FallbackChain.<Integer>named("lazy")
                .when("guarded", false, calls::incrementAndGet)
                .orElse("default", () -> 0)
                .resolve();

        assertEquals(0, calls.get());
    }

    @Test
    @DisplayName("providerNames lists the terminal provider last")
    void providerNames() {
        var chain = FallbackChain.<String>named("names")
                .then("manifest", Optional::empty)
                .orElse("builtin", () -> "x");

        assertEquals(List.of("manifest", "builtin"), chain.providerNames());
        assertEquals("names", chain.name());
    }
}
