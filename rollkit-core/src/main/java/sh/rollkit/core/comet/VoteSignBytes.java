// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.rollkit.core.comet;

import java.util.Objects;

import sh.rollkit.primitives.proto.ProtoWriter;

/**
 * CometBFT vote sign-bytes ({@code types.VoteSignBytes}).
 *
 * <p>
 * The vote is canonicalized and serialized as
 * <pre>
 * message CanonicalVote {
 *   SignedMsgType          type      = 1;
 *   sfixed64               height    = 2;
 *   sfixed64               round     = 3;
 *   CanonicalBlockID       block_id  = 4;  // omitted for a zero block ID
 *   google.protobuf.Timestamp timestamp = 5;  // always present
 *   string                 chain_id  = 6;
 * }
 * message CanonicalBlockID {
 *   bytes                  hash            = 1;
 *   CanonicalPartSetHeader part_set_header = 2;  // always present
 * }
 * message CanonicalPartSetHeader { uint32 total = 1; bytes hash = 2; }
 * </pre>
 * then prefixed with its length as an unsigned varint. Validator address and index
 * are not part of the signed payload.
 *
 * <p>
 * The output must match CometBFT byte for byte: it is what CometBFT light clients
 * and signature tooling verify.
 *
 * @since 0.1.0
 */
public final class VoteSignBytes {

    private VoteSignBytes() {
        // Utility class
    }

    /**
     * Encodes the sign-bytes of a vote.
     *
     * @param chainId the chain the vote is for
     * @param vote    the vote
     * @return the length-delimited canonical vote
     */
    public static byte[] encode(final String chainId, final Vote vote) {
        Objects.requireNonNull(chainId, "chainId");
        Objects.requireNonNull(vote, "vote");

        final byte[] canonical = new ProtoWriter()
                .enumValue(1, vote.type().code())
                .sfixed64(2, vote.height())
                .sfixed64(3, vote.round())
                .optionalMessage(4, canonicalBlockId(vote.blockId()))
                .message(5, Timestamps.encode(vote.timestamp()))
                .string(6, chainId)
                .toByteArray();
        return ProtoWriter.delimited(canonical);
    }

    private static byte[] canonicalBlockId(final BlockId blockId) {
        if (blockId.isZero()) {
            return null;
        }
        final PartSetHeader psh = blockId.partSetHeader();
        final byte[] partSetHeader = new ProtoWriter()
                .uint64(1, Integer.toUnsignedLong(psh.total()))
                .bytes(2, psh.hash().toBytes())
                .toByteArray();
        return new ProtoWriter()
                .bytes(1, blockId.hash().toBytes())
                .message(2, partSetHeader)
                .toByteArray();
    }
}
