package io.irontrade.util;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EnvTest {

    private static final String KEY = "IRONTRADE_ENV_TEST_VALUE";

    @AfterEach
    void clear() {
        System.clearProperty(KEY);
    }

    @Test
    void testFallsBackToSystemPropertyThenDefault() {
        assertEquals("fallback", Env.get(KEY, "fallback"));

        System.setProperty(KEY, "from-property");
        assertEquals("from-property", Env.get(KEY, "fallback"));
        assertEquals("from-property", Env.require(KEY));
    }

    @Test
    void testEmptyValueUsesDefault() {
        System.setProperty(KEY, "");

        assertEquals("fallback", Env.get(KEY, "fallback"));
        assertThrows(IllegalStateException.class, () -> Env.require(KEY));
    }

    @Test
    void testTypedLookups() {
        System.setProperty(KEY, "42");
        assertEquals(42L, Env.getLong(KEY, 1));
        assertEquals(0, Env.getDecimal(KEY, BigDecimal.ONE).compareTo(new BigDecimal("42")));

        System.setProperty(KEY, "seven");
        assertEquals(7L, Env.getLong(KEY, 7));
        assertEquals(0, Env.getDecimal(KEY, BigDecimal.ONE).compareTo(BigDecimal.ONE));

        System.setProperty(KEY, " a, b ,, c ");
        assertEquals(List.of("a", "b", "c"), Env.getList(KEY, List.of()));
    }
}
