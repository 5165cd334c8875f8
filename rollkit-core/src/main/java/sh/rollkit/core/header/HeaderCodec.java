// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.rollkit.core.header;

import java.io.IOException;
import java.util.Objects;

import com.google.protobuf.CodedInputStream;
import com.google.protobuf.WireFormat;

import sh.rollkit.core.error.HeaderCodecException;
import sh.rollkit.core.types.Hash;
import sh.rollkit.core.types.HexBytes;
import sh.rollkit.core.types.Version;
import sh.rollkit.primitives.proto.ProtoWriter;

/**
 * Binary codec for headers, wire-compatible with the rollkit {@code Header}
 * protobuf message.
 *
 * <pre>
 * message Version { uint64 block = 1; uint64 app = 2; }
 * message Header {
 *   Version version = 1;
 *   uint64 height = 2;
 *   uint64 time = 3;
 *   bytes last_header_hash = 4;
 *   bytes last_commit_hash = 5;
 *   bytes data_hash = 6;
 *   bytes consensus_hash = 7;
 *   bytes app_hash = 8;
 *   bytes last_results_hash = 9;
 *   bytes proposer_address = 10;
 *   bytes validator_hash = 11;
 *   string chain_id = 12;
 * }
 * </pre>
 *
 * <p>Hash fields absent on the wire decode to {@link Hash#EMPTY}, and an empty hash is
 * left out when encoding, so bytes from other implementations survive a round trip.
 * Unknown fields are skipped.
 *
 * @since 0.1.0
 */
public final class HeaderCodec {

    private static final int VERSION = 1;
    private static final int HEIGHT = 2;
    private static final int TIME = 3;
    private static final int LAST_HEADER_HASH = 4;
    private static final int LAST_COMMIT_HASH = 5;
    private static final int DATA_HASH = 6;
    private static final int CONSENSUS_HASH = 7;
    private static final int APP_HASH = 8;
    private static final int LAST_RESULTS_HASH = 9;
    private static final int PROPOSER_ADDRESS = 10;
    private static final int VALIDATOR_HASH = 11;
    private static final int CHAIN_ID = 12;

    private static final int VERSION_BLOCK = 1;
    private static final int VERSION_APP = 2;

    private HeaderCodec() {
        // Utility class
    }

    /**
     * Encodes a header.
     *
     * @param header the header
     * @return the protobuf encoding
     */
    public static byte[] encode(final Header header) {
        Objects.requireNonNull(header, "header");
        final byte[] version = new ProtoWriter()
                .uint64(VERSION_BLOCK, header.version().block())
                .uint64(VERSION_APP, header.version().app())
                .toByteArray();
        return new ProtoWriter()
                .message(VERSION, version)
                .uint64(HEIGHT, header.base().height())
                .uint64(TIME, header.base().time())
                .bytes(LAST_HEADER_HASH, header.lastHeaderHash().toBytes())
                .bytes(LAST_COMMIT_HASH, header.lastCommitHash().toBytes())
                .bytes(DATA_HASH, header.dataHash().toBytes())
                .bytes(CONSENSUS_HASH, header.consensusHash().toBytes())
                .bytes(APP_HASH, header.appHash().toBytes())
                .bytes(LAST_RESULTS_HASH, header.lastResultsHash().toBytes())
                .bytes(PROPOSER_ADDRESS, header.proposerAddress().toBytes())
                .bytes(VALIDATOR_HASH, header.validatorHash().toBytes())
                .string(CHAIN_ID, header.base().chainId())
                .toByteArray();
    }

    /**
     * Decodes a header.
     *
     * @param data the protobuf encoding
     * @return the header
     * @throws HeaderCodecException if the bytes are truncated, use the wrong wire type for
     *                              a known field, or carry a hash that is neither empty nor 32 bytes
     */
    public static Header decode(final byte[] data) {
        Objects.requireNonNull(data, "data");
        final HeaderBuilder builder = HeaderBuilder.create();
        long height = 0;
        long time = 0;
        String chainId = "";

        final CodedInputStream in = CodedInputStream.newInstance(data);
        try {
            int tag;
            while ((tag = in.readTag()) != 0) {
                final int field = WireFormat.getTagFieldNumber(tag);
                switch (field) {
                    case VERSION -> builder.version(decodeVersion(readBytes(in, tag, "version")));
                    case HEIGHT -> height = readVarint(in, tag, "height");
                    case TIME -> time = readVarint(in, tag, "time");
                    case LAST_HEADER_HASH -> builder.lastHeaderHash(readHash(in, tag, "last_header_hash"));
                    case LAST_COMMIT_HASH -> builder.lastCommitHash(readHash(in, tag, "last_commit_hash"));
                    case DATA_HASH -> builder.dataHash(readHash(in, tag, "data_hash"));
                    case CONSENSUS_HASH -> builder.consensusHash(readHash(in, tag, "consensus_hash"));
                    case APP_HASH -> builder.appHash(readHash(in, tag, "app_hash"));
                    case LAST_RESULTS_HASH -> builder.lastResultsHash(readHash(in, tag, "last_results_hash"));
                    case PROPOSER_ADDRESS -> builder.proposerAddress(readBytes(in, tag, "proposer_address"));
                    case VALIDATOR_HASH -> builder.validatorHash(readHash(in, tag, "validator_hash"));
                    case CHAIN_ID -> {
                        requireWireType(tag, WireFormat.WIRETYPE_LENGTH_DELIMITED, "chain_id");
                        chainId = in.readStringRequireUtf8();
                    }
                    default -> in.skipField(tag);
                }
            }
        } catch (IOException e) {
            throw new HeaderCodecException("malformed header encoding", e);
        }

        return builder
                .height(height)
                .time(time)
                .chainId(chainId)
                .build();
    }

    private static Version decodeVersion(final byte[] data) throws IOException {
        long block = 0;
        long app = 0;
        final CodedInputStream in = CodedInputStream.newInstance(data);
        int tag;
        while ((tag = in.readTag()) != 0) {
            switch (WireFormat.getTagFieldNumber(tag)) {
                case VERSION_BLOCK -> block = readVarint(in, tag, "version.block");
                case VERSION_APP -> app = readVarint(in, tag, "version.app");
                default -> in.skipField(tag);
            }
        }
        return new Version(block, app);
    }

    private static long readVarint(final CodedInputStream in, final int tag, final String name) throws IOException {
        requireWireType(tag, WireFormat.WIRETYPE_VARINT, name);
        return in.readUInt64();
    }

    private static byte[] readBytes(final CodedInputStream in, final int tag, final String name) throws IOException {
        requireWireType(tag, WireFormat.WIRETYPE_LENGTH_DELIMITED, name);
        return in.readByteArray();
    }

    private static Hash readHash(final CodedInputStream in, final int tag, final String name) throws IOException {
        final byte[] bytes = readBytes(in, tag, name);
        if (bytes.length == 0) {
            return Hash.EMPTY;
        }
        if (bytes.length != Hash.BYTE_LENGTH) {
            throw new HeaderCodecException(
                    name + " must be " + Hash.BYTE_LENGTH + " bytes, got " + bytes.length);
        }
        return Hash.fromBytes(bytes);
    }

    private static void requireWireType(final int tag, final int expected, final String name) {
        final int actual = WireFormat.getTagWireType(tag);
        if (actual != expected) {
            throw new HeaderCodecException("unexpected wire type " + actual + " for field " + name);
        }
    }
}
