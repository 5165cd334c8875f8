// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.rollkit.core.types;

import java.util.Arrays;
import java.util.Objects;
import java.util.regex.Pattern;

import com.fasterxml.jackson.annotation.JsonValue;

import sh.rollkit.primitives.Hex;

/**
 * Immutable variable-length byte sequence.
 * <p>
 * Used for values whose length is not fixed by the protocol, most notably the
 * proposer (sequencer) address of a header and sequencer signatures.
 * <p>
 * <strong>Equality</strong> is byte-exact. {@link #toString()} follows the CometBFT
 * {@code HexBytes} convention (uppercase, no prefix) so that diagnostics line up
 * with CometBFT tooling; {@link #value()} returns the {@code 0x}-prefixed lowercase
 * form used for JSON.
 *
 * <pre>{@code
 * HexBytes address = HexBytes.fromBytes(pubKeyHash);
 * HexBytes parsed = new HexBytes("0xaaaaaaaa");
 * byte[] raw = address.toBytes();
 * }</pre>
 *
 * @since 0.1.0
 */
public final class HexBytes {
    private static final Pattern HEX = Pattern.compile("^0x([0-9a-fA-F]{2})*$");
    public static final HexBytes EMPTY = new HexBytes(new byte[0]);

    private final byte[] raw;

    /**
     * Creates a HexBytes from a hex string.
     *
     * @param value the hex-encoded string with "0x" prefix
     */
    public HexBytes(String value) {
        Objects.requireNonNull(value, "hex");
        if (!HEX.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid hex data: " + value);
        }
        this.raw = Hex.decode(value);
    }

    private HexBytes(byte[] raw) {
        this.raw = raw;
    }

    /**
     * Creates HexBytes from raw bytes. The array is copied.
     *
     * @param bytes the bytes, or null/empty for {@link #EMPTY}
     * @return the wrapped bytes
     */
    public static HexBytes fromBytes(final byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            return EMPTY;
        }
        return new HexBytes(bytes.clone());
    }

    /**
     * Returns the hex string representation with "0x" prefix.
     *
     * @return the lowercase hex string
     */
    @JsonValue
    public String value() {
        return Hex.encode(raw);
    }

    public int length() {
        return raw.length;
    }

    public boolean isEmpty() {
        return raw.length == 0;
    }

    /**
     * Returns a copy of the underlying bytes.
     *
     * @return the bytes
     */
    public byte[] toBytes() {
        return raw.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        return Arrays.equals(raw, ((HexBytes) o).raw);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(raw);
    }

    @Override
    public String toString() {
        return Hex.encodeUpper(raw);
    }
}
