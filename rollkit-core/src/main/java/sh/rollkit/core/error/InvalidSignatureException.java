// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.rollkit.core.error;

/**
 * Thrown when a sequencer signature over a header does not check out.
 *
 * @since 0.1.0
 */
public final class InvalidSignatureException extends HeaderVerificationException {

    public InvalidSignatureException(final String message) {
        super(message);
    }

    public InvalidSignatureException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
