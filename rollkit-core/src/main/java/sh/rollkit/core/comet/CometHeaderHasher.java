// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.rollkit.core.comet;

import java.util.List;
import java.util.Objects;

import sh.rollkit.core.crypto.MerkleTree;
import sh.rollkit.core.header.Header;
import sh.rollkit.core.types.Hash;
import sh.rollkit.primitives.proto.ProtoWriter;

/**
 * Computes a rollkit header hash as the hash of the equivalent CometBFT header
 * ({@code types.Header.Hash()}).
 *
 * <p>
 * The CometBFT header is filled from the rollkit header with an empty part set
 * header in {@code LastBlockID}, {@code NextValidatorsHash} equal to
 * {@code ValidatorsHash} and the hash of an empty evidence list. Its fields are
 * encoded individually and combined with {@link MerkleTree}, so a CometBFT light
 * client computes the same block hash for the header. Unset hashes encode to empty
 * leaves, and a header without a validator hash has no hash at all
 * ({@link Hash#EMPTY}).
 *
 * @since 0.1.0
 */
public final class CometHeaderHasher {

    private static final byte[] EMPTY_EVIDENCE_HASH = MerkleTree.emptyHash();

    private CometHeaderHasher() {
        // Utility class
    }

    public static Hash hash(final Header header) {
        Objects.requireNonNull(header, "header");
        if (header.validatorHash().isEmpty()) {
            return Hash.EMPTY;
        }

        final byte[] version = new ProtoWriter()
                .uint64(1, header.version().block())
                .uint64(2, header.version().app())
                .toByteArray();
        final byte[] lastBlockId = new ProtoWriter()
                .bytes(1, header.lastHeaderHash().toBytes())
                .message(2, new byte[0])
                .toByteArray();
        final byte[] validatorsHash = header.validatorHash().toBytes();

        final List<byte[]> leaves = List.of(
                version,
                stringValue(header.chainId()),
                int64Value(header.height()),
                Timestamps.encode(header.time()),
                lastBlockId,
                bytesValue(header.lastCommitHash().toBytes()),
                bytesValue(header.dataHash().toBytes()),
                bytesValue(validatorsHash),
                bytesValue(validatorsHash),
                bytesValue(header.consensusHash().toBytes()),
                bytesValue(header.appHash().toBytes()),
                bytesValue(header.lastResultsHash().toBytes()),
                bytesValue(EMPTY_EVIDENCE_HASH),
                bytesValue(header.proposerAddress().toBytes()));
        return Hash.fromBytes(MerkleTree.hashFromByteSlices(leaves));
    }

    // gogoproto well-known wrappers; empty values encode to zero bytes

    private static byte[] stringValue(final String value) {
        return new ProtoWriter().string(1, value).toByteArray();
    }

    private static byte[] int64Value(final long value) {
        return new ProtoWriter().int64(1, value).toByteArray();
    }

    private static byte[] bytesValue(final byte[] value) {
        return new ProtoWriter().bytes(1, value).toByteArray();
    }
}
