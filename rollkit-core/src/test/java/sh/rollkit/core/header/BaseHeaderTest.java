// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.rollkit.core.header;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Instant;

import org.junit.jupiter.api.Test;

import sh.rollkit.core.error.TimestampOutOfRangeException;

class BaseHeaderTest {

    @Test
    void timestampIsEpochPlusNanos() {
        BaseHeader base = new BaseHeader(1, 1_700_000_000_123_456_789L, "c");
        Instant expected = Instant.ofEpochSecond(1_700_000_000L, 123_456_789L);
        assertEquals(expected, base.timestamp());
        assertEquals(123_456_789, base.timestamp().getNano());
    }

    @Test
    void zeroTimeIsEpoch() {
        assertEquals(Instant.EPOCH, BaseHeader.ZERO.timestamp());
    }

    @Test
    void subSecondTimeKeepsNanosecondPrecision() {
        assertEquals(Instant.EPOCH.plusNanos(1), new BaseHeader(0, 1, "").timestamp());
    }

    @Test
    void largestSignedTimeIsSupported() {
        Instant max = new BaseHeader(0, Long.MAX_VALUE, "").timestamp();
        assertEquals(Instant.ofEpochSecond(9_223_372_036L, 854_775_807L), max);
    }

    @Test
    void timeBeyondSignedRangeIsRejected() {
        BaseHeader base = new BaseHeader(0, Long.MIN_VALUE, "");
        TimestampOutOfRangeException ex = assertThrows(TimestampOutOfRangeException.class, base::timestamp);
        assertEquals(Long.MIN_VALUE, ex.rawTime());
    }

    @Test
    void rejectsNullChainId() {
        assertThrows(NullPointerException.class, () -> new BaseHeader(0, 0, null));
    }

    @Test
    void toStringUsesUnsignedValues() {
        assertEquals("BaseHeader[height=18446744073709551615, time=0, chainId=x]",
                new BaseHeader(-1L, 0, "x").toString());
    }
}
