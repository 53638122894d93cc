package ru.tigran.stylistengine.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CacheKeyUtils unit тесты")
class CacheKeyUtilsTest {

    @Test
    @DisplayName("imageHash - SHA-256 в нижнем регистре")
    void imageHash() {
        assertEquals("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad",
                CacheKeyUtils.imageHash("abc".getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    @DisplayName("imageHash - одинаковые байты дают одинаковый ключ")
    void sameBytesSameKey() {
        byte[] first = {1, 2, 3};
        byte[] second = {1, 2, 3};

        assertEquals(CacheKeyUtils.consensusKey(CacheKeyUtils.imageHash(first)),
                CacheKeyUtils.consensusKey(CacheKeyUtils.imageHash(second)));
        assertNotEquals(CacheKeyUtils.imageHash(first), CacheKeyUtils.imageHash(new byte[]{3, 2, 1}));
    }

    @Test
    @DisplayName("consensusKey - префикс и нормализация hash")
    void consensusKey() {
        assertEquals("consensus:abc123", CacheKeyUtils.consensusKey("  ABC123 "));
    }

    @Test
    @DisplayName("normalizePrompt - схлопывает пробелы и переводы строк")
    void normalizePrompt() {
        assertEquals("Brunch with friends", CacheKeyUtils.normalizePrompt("  Brunch \n with   friends "));
        assertEquals("", CacheKeyUtils.normalizePrompt(null));
    }
}
