// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.rollkit.core.comet;

import java.time.Instant;
import java.util.Objects;

import sh.rollkit.core.header.Header;
import sh.rollkit.core.types.HexBytes;

/**
 * CometBFT consensus vote, restricted to the fields that exist before signing.
 *
 * @param type             the message type
 * @param height           block height (CometBFT {@code int64})
 * @param round            consensus round
 * @param blockId          the block voted for
 * @param timestamp        vote time
 * @param validatorAddress address of the voting validator
 * @param validatorIndex   index of the validator in the validator set
 * @since 0.1.0
 */
public record Vote(
        SignedMsgType type,
        long height,
        int round,
        BlockId blockId,
        Instant timestamp,
        HexBytes validatorAddress,
        int validatorIndex) {

    public Vote {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(blockId, "blockId");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(validatorAddress, "validatorAddress");
    }

    /**
     * Builds the precommit vote a sequencer casts for its own header.
     *
     * <p>The sequencer is the whole validator set and never changes rounds, so round
     * and validator index are always 0. The height is reinterpreted as CometBFT's
     * signed {@code int64}.
     *
     * @param header the header
     * @return the vote
     */
    public static Vote precommit(final Header header) {
        Objects.requireNonNull(header, "header");
        return new Vote(
                SignedMsgType.PRECOMMIT,
                header.height(),
                0,
                new BlockId(HexBytes.fromBytes(header.hash().toBytes()), PartSetHeader.EMPTY),
                header.time(),
                header.proposerAddress(),
                0);
    }
}
