// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.rollkit.core.error;

/**
 * Base class for structurally invalid headers.
 *
 * @since 0.1.0
 */
public sealed class InvalidHeaderException extends RollkitException
        permits MissingProposerAddressException,
        TimestampOutOfRangeException {

    public InvalidHeaderException(final String message) {
        super(message);
    }
}
