// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.rollkit.core;

/**
 * Global toggles for verbose debug logging of header operations.
 *
 * <p>Thread safety: the flags are volatile and independent of each other.
 */
public final class RollkitDebug {

    private static volatile boolean headerLogging = false;
    private static volatile boolean voteLogging = false;

    private RollkitDebug() {
    }

    public static void setHeaderLogging(final boolean enabled) {
        headerLogging = enabled;
    }

    public static boolean isHeaderLoggingEnabled() {
        return headerLogging;
    }

    public static void setVoteLogging(final boolean enabled) {
        voteLogging = enabled;
    }

    public static boolean isVoteLoggingEnabled() {
        return voteLogging;
    }
}
