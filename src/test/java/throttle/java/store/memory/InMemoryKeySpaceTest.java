package throttle.java.store.memory;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryKeySpaceTest {

    private static final long NOW = 1_700_000_000_000_000L;

    @Test
    void expire_saturatesInsteadOfOverflowing() {
        InMemoryKeySpace keys = new InMemoryKeySpace(10);
        keys.putHashFields("k", Map.of("rps", "100"), NOW);

        assertTrue(keys.expire("k", 10_000_000_000_000L, NOW));
        assertTrue(keys.exists("k", NOW + 1));

        assertTrue(keys.expire("k", Long.MAX_VALUE, NOW));
        assertTrue(keys.exists("k", NOW + 1));
        assertTrue(keys.ttlSeconds("k", NOW) > 0);
    }

    @Test
    void expire_dropsKeyOnceDeadlinePasses() {
        InMemoryKeySpace keys = new InMemoryKeySpace(10);
        keys.putHashFields("k", Map.of("rps", "100"), NOW);

        keys.expire("k", 5, NOW);

        assertEquals(5, keys.ttlSeconds("k", NOW));
        assertTrue(keys.exists("k", NOW + 4_999_999L));
        assertFalse(keys.exists("k", NOW + 5_000_000L));
    }
}
