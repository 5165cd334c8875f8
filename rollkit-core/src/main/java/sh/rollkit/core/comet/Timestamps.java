// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.rollkit.core.comet;

import java.time.Instant;

import sh.rollkit.primitives.proto.ProtoWriter;

/**
 * {@code google.protobuf.Timestamp} encoding.
 */
final class Timestamps {

    private Timestamps() {
    }

    /**
     * Seconds are floored, so nanos are always in {@code [0, 999_999_999]}, the same
     * split Go's {@code time.Time.Unix()} and {@code Nanosecond()} produce.
     */
    static byte[] encode(final Instant instant) {
        return new ProtoWriter()
                .int64(1, instant.getEpochSecond())
                .int32(2, instant.getNano())
                .toByteArray();
    }
}
