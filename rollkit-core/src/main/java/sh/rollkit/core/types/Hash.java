// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.rollkit.core.types;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

import sh.rollkit.primitives.Hex;

/**
 * Hex-encoded 32-byte hash.
 * <p>
 * Used for header hashes, the predecessor link ({@code LastHeaderHash}) and the
 * content commitments a header carries.
 * <p>
 * <strong>Validation:</strong>
 * <ul>
 * <li>Must start with "0x"</li>
 * <li>Must be exactly 64 hex characters long (32 bytes), or empty</li>
 * </ul>
 * <p>
 * The empty value {@link #EMPTY} stands for a hash that is not set: it is omitted
 * from the wire and hashed as an empty leaf, the way a {@code nil} slice is in Go.
 * <p>
 * The value is stored in lowercase, so record equality is byte equality.
 *
 * @since 0.1.0
 */
public record Hash(@com.fasterxml.jackson.annotation.JsonValue String value) {
    public static final int BYTE_LENGTH = 32;
    private static final Pattern HEX = HexValidator.fixedLength(BYTE_LENGTH);

    /** The unset hash. */
    public static final Hash EMPTY = new Hash("0x");

    public Hash {
        Objects.requireNonNull(value, "hash");
        if (!"0x".equals(value) && !HEX.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid hash: " + value);
        }
        value = value.toLowerCase(Locale.ROOT);
    }

    public byte[] toBytes() {
        return Hex.decode(value);
    }

    public boolean isEmpty() {
        return value.length() == 2;
    }

    public static Hash fromBytes(final byte[] bytes) {
        if (bytes == null || bytes.length != BYTE_LENGTH) {
            throw new IllegalArgumentException("Hash must be exactly " + BYTE_LENGTH + " bytes");
        }
        return new Hash("0x" + Hex.encodeNoPrefix(bytes));
    }
}
