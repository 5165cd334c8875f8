// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.rollkit.primitives.proto;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Objects;

import com.google.protobuf.CodedOutputStream;

/**
 * Deterministic writer for proto3 messages without generated classes.
 * <p>
 * Fields are written in call order. Scalar, string and bytes fields holding their
 * proto3 default (zero, empty) are omitted, matching the Go protobuf marshalers
 * that produce CometBFT and rollkit wire bytes. Embedded messages come in two
 * flavours:
 * <ul>
 * <li>{@link #message(int, byte[])} always writes the field, even when the nested
 * message is empty. This is how gogoproto {@code (nullable) = false} fields and
 * set pointer fields are marshalled.</li>
 * <li>{@link #optionalMessage(int, byte[])} skips the field when the nested message
 * is {@code null}.</li>
 * </ul>
 *
 * <pre>{@code
 * byte[] encoded = new ProtoWriter()
 *         .uint64(1, block)
 *         .uint64(2, app)
 *         .toByteArray();
 * }</pre>
 *
 * <p>Instances are not thread-safe and are meant to be used for a single message.
 *
 * @since 0.1.0
 */
public final class ProtoWriter {

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private final CodedOutputStream out = CodedOutputStream.newInstance(buffer);

    /** Writes an unsigned 64-bit varint field ({@code uint64}). */
    public ProtoWriter uint64(final int field, final long value) {
        if (value != 0) {
            write(() -> out.writeUInt64(field, value));
        }
        return this;
    }

    /** Writes a signed 64-bit varint field ({@code int64}); negatives take ten bytes. */
    public ProtoWriter int64(final int field, final long value) {
        if (value != 0) {
            write(() -> out.writeInt64(field, value));
        }
        return this;
    }

    /** Writes a signed 32-bit varint field ({@code int32}). */
    public ProtoWriter int32(final int field, final int value) {
        if (value != 0) {
            write(() -> out.writeInt32(field, value));
        }
        return this;
    }

    /** Writes an enum field by its numeric value. */
    public ProtoWriter enumValue(final int field, final int value) {
        if (value != 0) {
            write(() -> out.writeEnum(field, value));
        }
        return this;
    }

    /** Writes a little-endian fixed 64-bit field ({@code sfixed64}). */
    public ProtoWriter sfixed64(final int field, final long value) {
        if (value != 0) {
            write(() -> out.writeSFixed64(field, value));
        }
        return this;
    }

    /** Writes a length-delimited bytes field; empty arrays are omitted. */
    public ProtoWriter bytes(final int field, final byte[] value) {
        Objects.requireNonNull(value, "value");
        if (value.length != 0) {
            write(() -> out.writeByteArray(field, value));
        }
        return this;
    }

    /** Writes a UTF-8 string field; empty strings are omitted. */
    public ProtoWriter string(final int field, final String value) {
        Objects.requireNonNull(value, "value");
        if (!value.isEmpty()) {
            write(() -> out.writeString(field, value));
        }
        return this;
    }

    /** Writes an already-encoded embedded message, even if it is empty. */
    public ProtoWriter message(final int field, final byte[] encoded) {
        Objects.requireNonNull(encoded, "encoded");
        write(() -> out.writeByteArray(field, encoded));
        return this;
    }

    /** Writes an already-encoded embedded message unless it is {@code null}. */
    public ProtoWriter optionalMessage(final int field, final byte[] encoded) {
        if (encoded != null) {
            message(field, encoded);
        }
        return this;
    }

    /**
     * Returns the bytes written so far.
     *
     * @return the encoded message
     */
    public byte[] toByteArray() {
        write(out::flush);
        return buffer.toByteArray();
    }

    /**
     * Prefixes a message with its length as an unsigned varint, the framing produced
     * by Go's {@code protoio.MarshalDelimited}.
     *
     * @param message the encoded message
     * @return the length-delimited message
     */
    public static byte[] delimited(final byte[] message) {
        Objects.requireNonNull(message, "message");
        final int prefixSize = CodedOutputStream.computeUInt32SizeNoTag(message.length);
        final byte[] result = new byte[prefixSize + message.length];
        final CodedOutputStream framed = CodedOutputStream.newInstance(result);
        try {
            framed.writeUInt32NoTag(message.length);
            framed.writeRawBytes(message);
            framed.checkNoSpaceLeft();
        } catch (IOException e) {
            throw new UncheckedIOException("failed to frame message", e);
        }
        return result;
    }

    private static void write(final IoAction action) {
        try {
            action.run();
        } catch (IOException e) {
            // in-memory sink, only reachable on a programming error
            throw new UncheckedIOException("failed to write protobuf field", e);
        }
    }

    @FunctionalInterface
    private interface IoAction {
        void run() throws IOException;
    }
}
