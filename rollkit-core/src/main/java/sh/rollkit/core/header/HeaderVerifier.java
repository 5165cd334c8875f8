// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.rollkit.core.header;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.rollkit.core.error.ChainContinuityException;
import sh.rollkit.core.error.ChainContinuityException.Reason;
import sh.rollkit.core.error.HeaderVerificationException;
import sh.rollkit.core.error.InvalidHeaderException;
import sh.rollkit.core.error.RollkitException;

/**
 * Chain continuity checks a header sync service runs before handing a candidate to
 * {@link VerifiableHeader#verify(VerifiableHeader)}.
 *
 * <p>
 * The header's own {@code verify} only anchors trust on the proposer identity. This
 * class adds the ordering rules that belong to the sync side, in this order:
 * <ol>
 * <li>the candidate is on the same chain;</li>
 * <li>its height is strictly above the trusted height;</li>
 * <li>its time does not precede the trusted time;</li>
 * <li>its time is not further ahead of the local clock than {@code maxClockDrift};</li>
 * <li>if it is the direct successor, its {@code lastHeader} is the trusted hash.</li>
 * </ol>
 * Non-adjacent candidates cannot be linked by hash and are accepted on the remaining
 * checks, as the sync service fills the gap later.
 *
 * <p>Instances are immutable and thread-safe.
 *
 * @param <H> the header type
 * @since 0.1.0
 */
public final class HeaderVerifier<H extends VerifiableHeader<H>> {

    private static final Logger log = LoggerFactory.getLogger(HeaderVerifier.class);

    /** Default tolerated clock drift between a sequencer and this node. */
    public static final Duration DEFAULT_MAX_CLOCK_DRIFT = Duration.ofSeconds(10);

    private final Clock clock;
    private final Duration maxClockDrift;

    public HeaderVerifier() {
        this(Clock.systemUTC(), DEFAULT_MAX_CLOCK_DRIFT);
    }

    public HeaderVerifier(final Clock clock, final Duration maxClockDrift) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.maxClockDrift = Objects.requireNonNull(maxClockDrift, "maxClockDrift");
        if (maxClockDrift.isNegative()) {
            throw new IllegalArgumentException("maxClockDrift must not be negative: " + maxClockDrift);
        }
    }

    /**
     * Verifies that {@code candidate} may extend the chain ending at {@code trusted}.
     *
     * @param trusted   the current trusted head
     * @param candidate the untrusted header
     * @throws ChainContinuityException    if a continuity rule is broken
     * @throws HeaderVerificationException if the trusted header rejects the candidate
     * @throws InvalidHeaderException      if either header's time cannot be represented
     */
    public void verify(final H trusted, final H candidate) {
        Objects.requireNonNull(trusted, "trusted");
        Objects.requireNonNull(candidate, "candidate");
        try {
            checkContinuity(trusted, candidate);
            trusted.verify(candidate);
        } catch (RollkitException e) {
            log.debug("Rejected header at height {}: {}", Long.toUnsignedString(candidate.height()), e.getMessage());
            throw e;
        }
    }

    private void checkContinuity(final H trusted, final H candidate) {
        if (!trusted.chainId().equals(candidate.chainId())) {
            throw new ChainContinuityException(Reason.CHAIN_ID_MISMATCH,
                    "expected chain ID " + trusted.chainId() + " got " + candidate.chainId());
        }
        if (Long.compareUnsigned(candidate.height(), trusted.height()) <= 0) {
            throw new ChainContinuityException(Reason.KNOWN_HEIGHT,
                    "known header: height " + Long.toUnsignedString(candidate.height())
                            + " is not above trusted height " + Long.toUnsignedString(trusted.height()));
        }

        final Instant trustedTime = trusted.time();
        final Instant candidateTime = candidate.time();
        if (candidateTime.isBefore(trustedTime)) {
            throw new ChainContinuityException(Reason.TIME_REGRESSION,
                    "header time " + candidateTime + " precedes trusted time " + trustedTime);
        }
        final Instant latest = clock.instant().plus(maxClockDrift);
        if (candidateTime.isAfter(latest)) {
            throw new ChainContinuityException(Reason.FROM_FUTURE,
                    "header time " + candidateTime + " is ahead of local time by more than " + maxClockDrift);
        }

        if (candidate.height() - trusted.height() == 1 && !candidate.lastHeader().equals(trusted.hash())) {
            throw new ChainContinuityException(Reason.LAST_HEADER_MISMATCH,
                    "expected last header " + trusted.hash().value() + " got " + candidate.lastHeader().value());
        }
    }
}
