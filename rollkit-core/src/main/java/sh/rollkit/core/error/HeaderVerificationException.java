// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.rollkit.core.error;

/**
 * Base class for failures of a candidate header against a trusted one.
 *
 * @since 0.1.0
 */
public sealed class HeaderVerificationException extends RollkitException
        permits ProposerMismatchException,
        ChainContinuityException,
        InvalidSignatureException {

    public HeaderVerificationException(final String message) {
        super(message);
    }

    public HeaderVerificationException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
