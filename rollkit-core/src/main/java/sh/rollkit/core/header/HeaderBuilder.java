// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.rollkit.core.header;

import java.time.Instant;
import java.util.Objects;

import sh.rollkit.core.types.Hash;
import sh.rollkit.core.types.HexBytes;
import sh.rollkit.core.types.Version;

/**
 * Builder for {@link Header}.
 *
 * <p>Every field defaults to its zero value, so the result of {@code build()} on a
 * fresh builder equals {@link Header#empty()}.
 *
 * <pre>{@code
 * Header header = Header.builder()
 *     .height(5)
 *     .time(Instant.parse("2024-01-01T00:00:00Z"))
 *     .chainId("rollkit-test")
 *     .lastHeaderHash(parent.hash())
 *     .proposerAddress(sequencer.address())
 *     .build();
 * }</pre>
 *
 * <p><strong>Thread Safety:</strong> This builder is <em>not</em> thread-safe. The
 * headers it builds are immutable.
 *
 * @since 0.1.0
 */
public final class HeaderBuilder {

    private long height;
    private long time;
    private String chainId = "";
    private Version version = Version.ZERO;
    private Hash lastHeaderHash = Hash.EMPTY;
    private Hash lastCommitHash = Hash.EMPTY;
    private Hash dataHash = Hash.EMPTY;
    private Hash consensusHash = Hash.EMPTY;
    private Hash appHash = Hash.EMPTY;
    private Hash validatorHash = Hash.EMPTY;
    private Hash lastResultsHash = Hash.EMPTY;
    private HexBytes proposerAddress = HexBytes.EMPTY;

    private HeaderBuilder() {
        // Private constructor - use create()
    }

    public static HeaderBuilder create() {
        return new HeaderBuilder();
    }

    /**
     * Creates a builder pre-populated with the fields of an existing header.
     *
     * @param header the header to copy
     * @return a new builder instance
     */
    public static HeaderBuilder from(final Header header) {
        Objects.requireNonNull(header, "header");
        return new HeaderBuilder()
                .base(header.base())
                .version(header.version())
                .lastHeaderHash(header.lastHeaderHash())
                .lastCommitHash(header.lastCommitHash())
                .dataHash(header.dataHash())
                .consensusHash(header.consensusHash())
                .appHash(header.appHash())
                .validatorHash(header.validatorHash())
                .lastResultsHash(header.lastResultsHash())
                .proposerAddress(header.proposerAddress());
    }

    public HeaderBuilder base(final BaseHeader base) {
        Objects.requireNonNull(base, "base");
        this.height = base.height();
        this.time = base.time();
        this.chainId = base.chainId();
        return this;
    }

    /**
     * Sets the height.
     *
     * @param height block height, interpreted as unsigned
     * @return this builder for chaining
     */
    public HeaderBuilder height(final long height) {
        this.height = height;
        return this;
    }

    /**
     * Sets the raw block time.
     *
     * @param timeNanos nanoseconds since the Unix epoch, interpreted as unsigned
     * @return this builder for chaining
     */
    public HeaderBuilder time(final long timeNanos) {
        this.time = timeNanos;
        return this;
    }

    /**
     * Sets the block time from an instant.
     *
     * @param time an instant at or after the Unix epoch
     * @return this builder for chaining
     * @throws IllegalArgumentException if the instant precedes the Unix epoch
     * @throws ArithmeticException if the instant does not fit in 64-bit nanoseconds
     */
    public HeaderBuilder time(final Instant time) {
        Objects.requireNonNull(time, "time");
        if (time.isBefore(Instant.EPOCH)) {
            throw new IllegalArgumentException("header time must not precede the Unix epoch: " + time);
        }
        this.time = Math.addExact(Math.multiplyExact(time.getEpochSecond(), 1_000_000_000L), time.getNano());
        return this;
    }

    public HeaderBuilder chainId(final String chainId) {
        this.chainId = Objects.requireNonNull(chainId, "chainId");
        return this;
    }

    public HeaderBuilder version(final Version version) {
        this.version = Objects.requireNonNull(version, "version");
        return this;
    }

    public HeaderBuilder lastHeaderHash(final Hash hash) {
        this.lastHeaderHash = Objects.requireNonNull(hash, "lastHeaderHash");
        return this;
    }

    public HeaderBuilder lastCommitHash(final Hash hash) {
        this.lastCommitHash = Objects.requireNonNull(hash, "lastCommitHash");
        return this;
    }

    public HeaderBuilder dataHash(final Hash hash) {
        this.dataHash = Objects.requireNonNull(hash, "dataHash");
        return this;
    }

    public HeaderBuilder consensusHash(final Hash hash) {
        this.consensusHash = Objects.requireNonNull(hash, "consensusHash");
        return this;
    }

    public HeaderBuilder appHash(final Hash hash) {
        this.appHash = Objects.requireNonNull(hash, "appHash");
        return this;
    }

    public HeaderBuilder validatorHash(final Hash hash) {
        this.validatorHash = Objects.requireNonNull(hash, "validatorHash");
        return this;
    }

    public HeaderBuilder lastResultsHash(final Hash hash) {
        this.lastResultsHash = Objects.requireNonNull(hash, "lastResultsHash");
        return this;
    }

    public HeaderBuilder proposerAddress(final HexBytes address) {
        this.proposerAddress = Objects.requireNonNull(address, "proposerAddress");
        return this;
    }

    public HeaderBuilder proposerAddress(final byte[] address) {
        this.proposerAddress = HexBytes.fromBytes(address);
        return this;
    }

    public Header build() {
        return new Header(
                new BaseHeader(height, time, chainId),
                version,
                lastHeaderHash,
                lastCommitHash,
                dataHash,
                consensusHash,
                appHash,
                validatorHash,
                lastResultsHash,
                proposerAddress);
    }
}
