// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.txtracker.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tracing for ingestion and query events, gated by {@link TrackerDebug}.
 * Output goes to the {@code sh.txtracker.debug} logger at INFO so it can be
 * routed separately from operational logs.
 */
public final class DebugLogger {

    private static final Logger LOG = LoggerFactory.getLogger("sh.txtracker.debug");

    private DebugLogger() {
    }

    public static void logIngest(final String message, final Object... args) {
        if (!TrackerDebug.isIngestLoggingEnabled()) {
            return;
        }
        logDirect(message, args);
    }

    public static void logQuery(final String message, final Object... args) {
        if (!TrackerDebug.isQueryLoggingEnabled()) {
            return;
        }
        logDirect(message, args);
    }

    /**
     * Logs if any tracing is enabled.
     */
    public static void log(final String message, final Object... args) {
        if (!TrackerDebug.isEnabled()) {
            return;
        }
        logDirect(message, args);
    }

    private static void logDirect(final String message, final Object... args) {
        final String formatted = (args == null || args.length == 0) ? message : message.formatted(args);
        LOG.info(formatted);
    }
}
