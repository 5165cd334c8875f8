// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.rollkit.core.error;

import java.util.Objects;

/**
 * Thrown when a candidate header cannot extend the trusted chain.
 *
 * @since 0.1.0
 */
public final class ChainContinuityException extends HeaderVerificationException {

    /**
     * Which continuity rule the candidate broke.
     */
    public enum Reason {
        CHAIN_ID_MISMATCH,
        /** Candidate height is at or below the trusted height. */
        KNOWN_HEIGHT,
        TIME_REGRESSION,
        /** Candidate time is ahead of the local clock by more than the tolerated drift. */
        FROM_FUTURE,
        /** Adjacent candidate does not link to the trusted header hash. */
        LAST_HEADER_MISMATCH
    }

    private final Reason reason;

    public ChainContinuityException(final Reason reason, final String message) {
        super(message);
        this.reason = Objects.requireNonNull(reason, "reason");
    }

    public Reason reason() {
        return reason;
    }
}
