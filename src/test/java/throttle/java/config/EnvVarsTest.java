package throttle.java.config;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EnvVarsTest {

    @Test
    void blankValuesFallBackToDefault() {
        Map<String, String> env = Map.of("A", "  ", "B", "value ");

        assertEquals("dflt", EnvVars.getOrDefault(env, "A", "dflt"));
        assertEquals("dflt", EnvVars.getOrDefault(env, "MISSING", "dflt"));
        assertEquals("value", EnvVars.getOrDefault(env, "B", "dflt"));
    }

    @Test
    void numbersAreClamped() {
        Map<String, String> env = Map.of("LOW", "-5", "HIGH", "99999999", "OK", " 42 ");

        assertEquals(1, EnvVars.getIntClamped(env, "LOW", 10, 1, 100));
        assertEquals(100, EnvVars.getIntClamped(env, "HIGH", 10, 1, 100));
        assertEquals(42, EnvVars.getIntClamped(env, "OK", 10, 1, 100));
        assertEquals(42L, EnvVars.getLongClamped(env, "OK", 10L, 0L, Long.MAX_VALUE));
    }

    @Test
    void malformedNumbersFallBackToDefault() {
        Map<String, String> env = Map.of("BAD", "12abc");

        assertEquals(10, EnvVars.getIntClamped(env, "BAD", 10, 1, 100));
    }

    @Test
    void booleans() {
        Map<String, String> env = Map.of("ON", "TRUE", "OFF", "no");

        assertTrue(EnvVars.getBoolean(env, "ON", false));
        assertFalse(EnvVars.getBoolean(env, "OFF", true));
        assertTrue(EnvVars.getBoolean(env, "MISSING", true));
    }
}
