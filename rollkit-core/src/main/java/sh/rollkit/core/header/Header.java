// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.rollkit.core.header;

import java.time.Instant;
import java.util.Objects;

import sh.rollkit.core.DebugLogger;
import sh.rollkit.core.comet.CometHeaderHasher;
import sh.rollkit.core.comet.Vote;
import sh.rollkit.core.comet.VoteSignBytes;
import sh.rollkit.core.error.MissingProposerAddressException;
import sh.rollkit.core.error.ProposerMismatchException;
import sh.rollkit.core.types.Hash;
import sh.rollkit.core.types.HexBytes;
import sh.rollkit.core.types.Version;

/**
 * Rollkit block header.
 *
 * <p>
 * An immutable value committing to the block's content, its predecessor and the
 * sequencer that produced it. Headers are created by block production (see
 * {@link HeaderBuilder}) or decoded from the wire ({@link #unmarshalBinary(byte[])}),
 * and from then on are only read, hashed, validated and verified. No component is
 * ever {@code null}: unset hashes are {@link Hash#EMPTY} and an unset proposer is
 * {@link HexBytes#EMPTY}.
 *
 * <h2>Acceptance</h2>
 * <ul>
 * <li>{@link #validateBasic()} rejects a header without a proposer address.</li>
 * <li>{@link #verify(Header)} accepts a candidate iff it names the same proposer as
 * this trusted header. Height progression, hash linkage and time ordering are not
 * checked here; {@link HeaderVerifier} adds them on top.</li>
 * </ul>
 *
 * <p>
 * Header hashes are CometBFT header hashes ({@link CometHeaderHasher}) and
 * {@link #makeCometBftVote()} produces the precommit vote sign-bytes a CometBFT
 * client expects, so a sequencer signature can be checked by CometBFT tooling.
 *
 * @param base            height, time and chain ID
 * @param version         block and app version
 * @param lastHeaderHash  hash of the previous header
 * @param lastCommitHash  commit from the aggregator of the previous block
 * @param dataHash        root of the block data (transactions)
 * @param consensusHash   consensus parameters for the current block
 * @param appHash         state after applying the transactions of the current block
 * @param validatorHash   validator set, kept for light client compatibility
 * @param lastResultsHash root of the transaction results of the previous block
 * @param proposerAddress address of the sequencer that produced this header
 * @since 0.1.0
 */
public record Header(
        BaseHeader base,
        Version version,
        Hash lastHeaderHash,
        Hash lastCommitHash,
        Hash dataHash,
        Hash consensusHash,
        Hash appHash,
        Hash validatorHash,
        Hash lastResultsHash,
        HexBytes proposerAddress) implements VerifiableHeader<Header> {

    /** Type-level operations for generic header services. */
    public static final HeaderFactory<Header> FACTORY = new HeaderFactory<>() {
        @Override
        public Header zero() {
            return Header.empty();
        }

        @Override
        public Header unmarshalBinary(final byte[] data) {
            return Header.unmarshalBinary(data);
        }
    };

    public Header {
        Objects.requireNonNull(base, "base");
        Objects.requireNonNull(version, "version");
        Objects.requireNonNull(lastHeaderHash, "lastHeaderHash");
        Objects.requireNonNull(lastCommitHash, "lastCommitHash");
        Objects.requireNonNull(dataHash, "dataHash");
        Objects.requireNonNull(consensusHash, "consensusHash");
        Objects.requireNonNull(appHash, "appHash");
        Objects.requireNonNull(validatorHash, "validatorHash");
        Objects.requireNonNull(lastResultsHash, "lastResultsHash");
        Objects.requireNonNull(proposerAddress, "proposerAddress");
    }

    /**
     * @return a new header with every field at its zero value
     */
    public static Header empty() {
        return HeaderBuilder.create().build();
    }

    public static HeaderBuilder builder() {
        return HeaderBuilder.create();
    }

    /**
     * Decodes a header from its protobuf encoding.
     *
     * @param data bytes produced by {@link #marshalBinary()}
     * @return the header
     * @throws sh.rollkit.core.error.HeaderCodecException if the bytes are malformed
     */
    public static Header unmarshalBinary(final byte[] data) {
        return HeaderCodec.decode(data);
    }

    @Override
    public String chainId() {
        return base.chainId();
    }

    @Override
    public long height() {
        return base.height();
    }

    /**
     * @throws sh.rollkit.core.error.TimestampOutOfRangeException if the stored time does
     *         not fit the signed 64-bit nanosecond range
     */
    @Override
    public Instant time() {
        return base.timestamp();
    }

    @Override
    public Hash lastHeader() {
        return lastHeaderHash;
    }

    @Override
    public Hash hash() {
        return CometHeaderHasher.hash(this);
    }

    @Override
    public void validate() {
        validateBasic();
    }

    /**
     * Performs basic validation of a header.
     *
     * @throws MissingProposerAddressException if the proposer address is empty
     */
    public void validateBasic() {
        if (proposerAddress.isEmpty()) {
            DebugLogger.logHeader("[VALIDATE] height=%s rejected: no proposer address",
                    Long.toUnsignedString(height()));
            throw new MissingProposerAddressException();
        }
    }

    /**
     * Verifies that {@code untrusted} was proposed by the same sequencer as this header.
     *
     * @param untrusted the candidate header
     * @throws ProposerMismatchException if the proposer addresses differ
     */
    @Override
    public void verify(final Header untrusted) {
        Objects.requireNonNull(untrusted, "untrusted");
        if (!untrusted.proposerAddress.equals(proposerAddress)) {
            DebugLogger.logHeader("[VERIFY] trusted=%s candidate=%s rejected: proposer mismatch",
                    Long.toUnsignedString(height()), Long.toUnsignedString(untrusted.height()));
            throw new ProposerMismatchException(proposerAddress, untrusted.proposerAddress);
        }
    }

    /**
     * Builds the CometBFT precommit vote for this header and returns its sign-bytes.
     *
     * <p>The sequencer is the only validator and signs each height once, so the vote
     * always has round 0 and validator index 0.
     *
     * @return the length-delimited canonical vote
     */
    public byte[] makeCometBftVote() {
        final byte[] signBytes = VoteSignBytes.encode(chainId(), Vote.precommit(this));
        DebugLogger.logVote("[VOTE] chainId=%s height=%s signBytes=%d bytes",
                chainId(), Long.toUnsignedString(height()), signBytes.length);
        return signBytes;
    }

    @Override
    public byte[] marshalBinary() {
        return HeaderCodec.encode(this);
    }
}
