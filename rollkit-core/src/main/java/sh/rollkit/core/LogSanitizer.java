// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.rollkit.core;

/**
 * Bounds the size of debug log lines.
 *
 * <p>
 * Chain IDs in traced headers come straight off the wire, so a line is truncated
 * once it exceeds {@value #MAX_LOG_LENGTH} characters.
 */
public final class LogSanitizer {

    static final int MAX_LOG_LENGTH = 2000;

    private static final String TRUNCATION_SUFFIX = "...(truncated)";

    private LogSanitizer() {}

    public static String sanitize(final String input) {
        if (input == null) {
            return "null";
        }
        if (input.length() <= MAX_LOG_LENGTH) {
            return input;
        }
        return input.substring(0, MAX_LOG_LENGTH - TRUNCATION_SUFFIX.length()) + TRUNCATION_SUFFIX;
    }
}
