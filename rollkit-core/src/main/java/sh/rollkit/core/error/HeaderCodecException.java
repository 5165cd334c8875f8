// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.rollkit.core.error;

/**
 * Thrown when header bytes cannot be decoded.
 *
 * @since 0.1.0
 */
public final class HeaderCodecException extends RollkitException {

    public HeaderCodecException(final String message) {
        super(message);
    }

    public HeaderCodecException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
