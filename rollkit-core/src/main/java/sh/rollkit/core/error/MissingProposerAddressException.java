// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.rollkit.core.error;

/**
 * Thrown by basic validation when a header has no proposer address.
 *
 * @since 0.1.0
 */
public final class MissingProposerAddressException extends InvalidHeaderException {

    public MissingProposerAddressException() {
        super("no proposer address");
    }
}
