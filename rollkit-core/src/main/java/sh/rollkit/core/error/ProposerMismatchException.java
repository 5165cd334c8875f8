// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.rollkit.core.error;

import java.util.Objects;

import sh.rollkit.core.types.HexBytes;

/**
 * Thrown when a candidate header was proposed by a different sequencer than the
 * trusted header.
 *
 * @since 0.1.0
 */
public final class ProposerMismatchException extends HeaderVerificationException {

    private final HexBytes trusted;
    private final HexBytes candidate;

    public ProposerMismatchException(final HexBytes trusted, final HexBytes candidate) {
        super("expected proposer (" + Objects.requireNonNull(trusted, "trusted")
                + ") got (" + Objects.requireNonNull(candidate, "candidate") + ")");
        this.trusted = trusted;
        this.candidate = candidate;
    }

    public HexBytes trusted() {
        return trusted;
    }

    public HexBytes candidate() {
        return candidate;
    }
}
