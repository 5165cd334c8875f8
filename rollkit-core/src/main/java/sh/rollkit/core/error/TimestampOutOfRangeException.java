// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.rollkit.core.error;

/**
 * Thrown when a header time does not fit the signed 64-bit nanosecond range of a
 * protobuf timestamp.
 *
 * @since 0.1.0
 */
public final class TimestampOutOfRangeException extends InvalidHeaderException {

    private final long rawTime;

    public TimestampOutOfRangeException(final long rawTime) {
        super("header time out of range: " + Long.toUnsignedString(rawTime) + "ns exceeds " + Long.MAX_VALUE + "ns");
        this.rawTime = rawTime;
    }

    /**
     * @return the offending time as stored in the header (unsigned nanoseconds)
     */
    public long rawTime() {
        return rawTime;
    }
}
