package io.paramfetch.retrieval;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class Sha256HashServiceTest {
    private final Sha256HashService hashes = new Sha256HashService();

    @Test
    void shortHashIsStableAndUrlSafe() {
        String sig = "{\"c\":\"abc\",\"x\":{\"channel\":\"h1\"}}";
        String h = hashes.shortHash(sig);
        assertEquals(22, h.length());
        assertTrue(h.matches("[A-Za-z0-9_-]+"));
        assertEquals(h, hashes.shortHash("  " + sig + "\n"));
        assertNotEquals(h, hashes.shortHash("{\"c\":\"abd\",\"x\":{\"channel\":\"h1\"}}"));
    }
}
