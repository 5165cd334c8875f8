// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.rollkit.core.error;

/**
 * Base runtime exception for all header model failures.
 *
 * <p>
 * This sealed class forms the root of the exception hierarchy, so every error
 * raised by header validation, verification or decoding can be caught with a
 * single catch clause while keeping the concrete types exhaustive.
 *
 * <p>
 * <strong>Exception Hierarchy:</strong>
 * <pre>
 * RollkitException
 * ├── {@link InvalidHeaderException} - malformed header, reject outright
 * │   ├── {@link MissingProposerAddressException}
 * │   └── {@link TimestampOutOfRangeException}
 * ├── {@link HeaderVerificationException} - untrusted or unauthorized header
 * │   ├── {@link ProposerMismatchException}
 * │   ├── {@link ChainContinuityException}
 * │   └── {@link InvalidSignatureException}
 * └── {@link HeaderCodecException} - binary decoding failures
 * </pre>
 *
 * <p>
 * None of these are retried internally: every check is a deterministic predicate
 * over immutable input. The caller (typically a header sync service) decides
 * whether to drop the candidate, penalize its source or halt.
 *
 * <pre>{@code
 * try {
 *     candidate.validate();
 *     trusted.verify(candidate);
 * } catch (InvalidHeaderException e) {
 *     // drop the candidate
 * } catch (HeaderVerificationException e) {
 *     // consensus violation, penalize the peer
 * }
 * }</pre>
 *
 * @since 0.1.0
 */
public sealed class RollkitException extends RuntimeException
        permits InvalidHeaderException,
        HeaderVerificationException,
        HeaderCodecException {

    public RollkitException(final String message) {
        super(message);
    }

    public RollkitException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
