package com.quarkparser.json;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs without any provider module on the test classpath.
 */
public class AstJsonProviderTest {

    @Test
    void testNoProviderAvailable() {
        assertFalse(AstJsonProvider.isProviderAvailable());
        assertTrue(AstJsonProvider.availableProviders().isEmpty());
    }

    @Test
    void testGetProviderFailsWithoutImplementation() {
        IllegalStateException e = assertThrows(IllegalStateException.class, () -> AstJsonProvider.getProvider());
        assertTrue(e.getMessage().contains("quark-jackson"), e.getMessage());
    }

    @Test
    void testGetProviderByNameFails() {
        IllegalStateException e = assertThrows(IllegalStateException.class,
            () -> AstJsonProvider.getProvider("Jackson"));
        assertTrue(e.getMessage().contains("'Jackson'"), e.getMessage());
    }

    @Test
    void testExceptionKeepsCause() {
        IllegalArgumentException cause = new IllegalArgumentException("bad");
        AstJsonException e = new AstJsonException("Failed to read", cause);
        assertSame(cause, e.getCause());
        assertEquals("Failed to read", e.getMessage());
    }
}
