package throttle.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class KnobUpdateTest {

    @Test
    void nonFiniteValues_areRejected() {
        assertThrows(IllegalArgumentException.class, () -> new KnobUpdate(Double.NaN, 1.0, 5L, null));
        assertThrows(IllegalArgumentException.class, () -> new KnobUpdate(Double.POSITIVE_INFINITY, 1.0, 5L, null));
        assertThrows(IllegalArgumentException.class, () -> new KnobUpdate(5.0, Double.NaN, 5L, null));
        assertThrows(IllegalArgumentException.class, () -> new KnobUpdate(5.0, Double.POSITIVE_INFINITY, 5L, null));
    }

    @Test
    void sentinelRates_areAccepted() {
        assertEquals(-1.0, new KnobUpdate(-1.0, null, null, null).rps());
        assertEquals(0.0, new KnobUpdate(0.0, null, null, null).rps());
        assertThrows(IllegalArgumentException.class, () -> new KnobUpdate(-2.0, null, null, null));
    }

    @Test
    void ttl_isBoundedByTenYears() {
        long max = ThrottleRequest.MAX_KNOBS_TTL_SECONDS;

        assertTrue(new KnobUpdate(5.0, 1.0, 5L, max).hasTtl());
        assertThrows(IllegalArgumentException.class, () -> new KnobUpdate(5.0, 1.0, 5L, max + 1));
        assertThrows(IllegalArgumentException.class,
            () -> new ThrottleRequest("t", new Knobs(5, 1, 5), 1, max + 1));
    }
}
