package throttle.core.algorithms.token_bucket;

import org.junit.jupiter.api.Test;
import throttle.core.clock.ClockReading;
import throttle.core.model.Bucket;
import throttle.core.model.InvalidConfigurationException;
import throttle.core.model.ThrottleMode;

import java.math.BigDecimal;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class WindowedTokenBucketTest {

    private static WindowedTokenBucket bucket(double rps, double burst, long window) {
        return new WindowedTokenBucket(new ThrottleMode.RateLimited(rps, burst, window));
    }

    @Test
    void freshBucketStartsFull_andAnchorsWindowToFirstUse() {
        WindowedTokenBucket tb = bucket(5, 2, 8);

        WindowedTokenBucket.BucketCheck check = tb.check(Optional.empty(), 1000, 1);

        assertEquals(80, tb.capacity());
        assertTrue(check.allowed());
        assertEquals(80, check.filledTokens());
        assertEquals(79, check.newTokens());
        assertEquals(1000, check.refreshed());
    }

    @Test
    void rejectsWhenEmpty_withoutConsuming() {
        WindowedTokenBucket tb = bucket(5, 2, 8);

        WindowedTokenBucket.BucketCheck check = tb.check(Optional.of(new Bucket(0, 1000)), 1003, 1);

        assertFalse(check.allowed());
        assertEquals(0, check.newTokens());
        assertEquals(1000, check.refreshed());
    }

    @Test
    void partialWindowGrantsNothing() {
        WindowedTokenBucket tb = bucket(1, 1, 10);

        WindowedTokenBucket.BucketCheck check = tb.check(Optional.of(new Bucket(2, 1000)), 1009, 1);

        assertEquals(2, check.filledTokens());
        assertEquals(1000, check.refreshed());
    }

    @Test
    void refreshedAdvancesByWholeWindows() {
        WindowedTokenBucket tb = bucket(5, 2, 8);

        // 17s elapsed = 2 whole windows, the extra second does not move the phase
        WindowedTokenBucket.BucketCheck check = tb.check(Optional.of(new Bucket(10, 1000)), 1017, 1);

        assertEquals(1016, check.refreshed());
        assertEquals(80, check.filledTokens());
        assertEquals(79, check.newTokens());
    }

    @Test
    void refillIsCappedAtCapacity() {
        WindowedTokenBucket tb = bucket(2, 1.5, 4);

        WindowedTokenBucket.BucketCheck check = tb.check(Optional.of(new Bucket(11, 100)), 1_000_000, 1);

        assertEquals(12, tb.capacity());
        assertEquals(12, check.filledTokens());
    }

    @Test
    void requestLargerThanBalance_isRejectedWholesale() {
        WindowedTokenBucket tb = bucket(1, 1, 10);

        WindowedTokenBucket.BucketCheck check = tb.check(Optional.of(new Bucket(3, 1000)), 1001, 4);

        assertFalse(check.allowed());
        assertEquals(3, check.newTokens());
    }

    @Test
    void fractionalRate_roundsRefillUp() {
        WindowedTokenBucket tb = bucket(0.5, 1, 3);

        assertEquals(2, tb.capacity()); // ceil(1.5)
        WindowedTokenBucket.BucketCheck check = tb.check(Optional.of(new Bucket(0, 1000)), 1003, 1);
        assertTrue(check.allowed());
        assertEquals(1, check.newTokens());
    }

    @Test
    void secondsUntilCapacity_keepsMicrosecondPrecision() {
        WindowedTokenBucket tb = bucket(5, 2, 8);

        assertEquals(new BigDecimal("7.999999"), tb.secondsUntilCapacity(new ClockReading(1000, 1), 1000));
        assertEquals(new BigDecimal("5.500000"), tb.secondsUntilCapacity(new ClockReading(1002, 500_000), 1000));
    }

    @Test
    void ttlIsTwiceTheBurstHorizon_roundedUp() {
        assertEquals(32, bucket(5, 2, 8).ttlSeconds());
        assertEquals(8, bucket(1, 1.25, 3).ttlSeconds());
    }

    @Test
    void invalidSettings_areConfigurationErrors() {
        assertThrows(InvalidConfigurationException.class, () -> bucket(5, 1, 0));
        assertThrows(InvalidConfigurationException.class, () -> bucket(5, 0, 5));
        assertThrows(InvalidConfigurationException.class, () -> bucket(-3, 1, 5));
        assertThrows(IllegalArgumentException.class, () -> bucket(5, 1, 5).check(Optional.empty(), 1000, 0));
    }

    @Test
    void nonFiniteSettings_areConfigurationErrors() {
        assertThrows(InvalidConfigurationException.class, () -> bucket(5, Double.NaN, 5));
        assertThrows(InvalidConfigurationException.class, () -> bucket(5, Double.POSITIVE_INFINITY, 5));
        assertThrows(InvalidConfigurationException.class, () -> bucket(Double.NaN, 1, 5));
        assertThrows(InvalidConfigurationException.class, () -> bucket(Double.POSITIVE_INFINITY, 1, 5));
    }

    @Test
    void hugeRate_atEpochTime_fillsToCapacityWithoutOverflow() {
        WindowedTokenBucket tb = bucket(1e10, 1, 5);

        WindowedTokenBucket.BucketCheck check = tb.check(Optional.empty(), 1_700_000_000L, 1);

        assertTrue(check.allowed());
        assertEquals(50_000_000_000L, check.filledTokens());
        assertEquals(49_999_999_999L, check.newTokens());
        assertEquals(1_700_000_000L, check.refreshed());
    }

    @Test
    void capacityBeyondLongRange_staysAtCapacity() {
        WindowedTokenBucket tb = bucket(1e30, 1, 5);

        WindowedTokenBucket.BucketCheck check = tb.check(Optional.of(new Bucket(Long.MAX_VALUE, 1000)), 1_700_000_000L, 1);

        assertEquals(Long.MAX_VALUE, tb.capacity());
        assertEquals(Long.MAX_VALUE, check.filledTokens());
        assertEquals(Long.MAX_VALUE - 1, check.newTokens());
    }
}
