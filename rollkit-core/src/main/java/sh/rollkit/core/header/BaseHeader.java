// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.rollkit.core.header;

import java.time.Instant;
import java.util.Objects;

import sh.rollkit.core.error.TimestampOutOfRangeException;

/**
 * The most basic data of a header: its position in the chain and the chain it
 * belongs to.
 *
 * @param height  block height (block number), unsigned 64-bit
 * @param time    block time in nanoseconds since the Unix epoch, unsigned 64-bit
 * @param chainId identifier of the rollup chain
 * @since 0.1.0
 */
public record BaseHeader(long height, long time, String chainId) {

    public static final BaseHeader ZERO = new BaseHeader(0, 0, "");

    public BaseHeader {
        Objects.requireNonNull(chainId, "chainId");
    }

    /**
     * Returns the block time as an instant with nanosecond precision.
     *
     * <p>The stored value is unsigned; values above {@link Long#MAX_VALUE} cannot be
     * represented as a protobuf timestamp and are rejected rather than wrapped.
     *
     * @return {@code Instant.EPOCH} plus {@link #time()} nanoseconds
     * @throws TimestampOutOfRangeException if the time exceeds the signed 64-bit range
     */
    public Instant timestamp() {
        if (time < 0) {
            throw new TimestampOutOfRangeException(time);
        }
        return Instant.ofEpochSecond(0, time);
    }

    @Override
    public String toString() {
        return "BaseHeader[height=" + Long.toUnsignedString(height)
                + ", time=" + Long.toUnsignedString(time)
                + ", chainId=" + chainId + "]";
    }
}
