// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.rollkit.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Centralized debug logger for header validation, verification and vote encoding.
 */
public final class DebugLogger {

    private static final Logger LOG = LoggerFactory.getLogger("sh.rollkit.debug");

    private DebugLogger() {
    }

    public static void logHeader(final String message, final Object... args) {
        if (!RollkitDebug.isHeaderLoggingEnabled()) {
            return;
        }
        logDirect(message, args);
    }

    public static void logVote(final String message, final Object... args) {
        if (!RollkitDebug.isVoteLoggingEnabled()) {
            return;
        }
        logDirect(message, args);
    }

    /**
     * Always sanitizes, so an oversized chain ID cannot flood the log.
     */
    private static void logDirect(final String message, final Object... args) {
        final String formatted = (args == null || args.length == 0) ? message : message.formatted(args);
        LOG.info(LogSanitizer.sanitize(formatted));
    }
}
